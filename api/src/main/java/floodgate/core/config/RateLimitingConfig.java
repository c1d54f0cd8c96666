package floodgate.core.config;

import java.time.Duration;
import java.util.Map;
import java.util.Optional;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

import floodgate.core.model.ratelimit.FailureMode;
import floodgate.core.model.ratelimit.RuleCategory;

/**
 * Configuration mapping for rate limiting.
 *
 * <p>Configuration prefix: {@code floodgate.rate-limiting}
 *
 * <p>Static rules are declared under {@code floodgate.rate-limiting.rules.<name>}:
 * <pre>
 * floodgate.rate-limiting.rules.user-rps.scope=user
 * floodgate.rate-limiting.rules.user-rps.limit-type=per-second
 * floodgate.rate-limiting.rules.user-rps.limit=10
 * </pre>
 *
 * <h2>Environment Variables</h2>
 * <ul>
 *   <li>{@code FLOODGATE_RATE_LIMITING_ENABLED} - Enable/disable rate limiting</li>
 *   <li>{@code FLOODGATE_RATE_LIMITING_REDIS_ENABLED} - Use Redis as the counter store</li>
 * </ul>
 */
@ConfigMapping(prefix = "floodgate.rate-limiting")
public interface RateLimitingConfig {

    /**
     * Enable or disable rate limiting globally.
     *
     * <p>When disabled every check is allowed with unbounded remaining quota.
     *
     * @return true if rate limiting is enabled (default: true)
     */
    @WithDefault("true")
    boolean enabled();

    /**
     * Include X-RateLimit-* headers in responses.
     *
     * @return true to include headers (default: true)
     */
    @WithDefault("true")
    boolean includeHeaders();

    /**
     * Slot timeout for concurrency rules that do not declare one.
     *
     * @return timeout (default: 5 minutes)
     */
    @WithDefault("PT5M")
    Duration defaultConcurrencyTimeout();

    /**
     * Retry-After advertised when a rule fails closed on a store error.
     *
     * @return seconds (default: 5)
     */
    @WithDefault("5")
    long failClosedRetryAfterSeconds();

    /**
     * Interval of the in-memory store's expired entry sweep.
     *
     * @return interval (default: 1 minute)
     */
    @WithDefault("PT1M")
    Duration cleanupInterval();

    /**
     * Behavior per rule category when the counter store fails.
     */
    FailureModeConfig failureMode();

    /**
     * Static rules keyed by rule name.
     */
    Map<String, RuleConfig> rules();

    /**
     * Redis backend configuration.
     */
    RedisConfig redis();

    /**
     * Failure policy per rule category.
     */
    interface FailureModeConfig {

        /**
         * @return mode for throughput rules (default: FAIL_OPEN)
         */
        @WithDefault("FAIL_OPEN")
        FailureMode throughput();

        /**
         * @return mode for security rules (default: FAIL_CLOSED)
         */
        @WithDefault("FAIL_CLOSED")
        FailureMode security();
    }

    /**
     * A statically configured rule.
     */
    interface RuleConfig {

        /**
         * Scope key: {@code global}, {@code user}, {@code api_key},
         * {@code endpoint:<glob>} or {@code provider:<name>}.
         *
         * @return scope key (default: global)
         */
        @WithDefault("global")
        String scope();

        /**
         * @return limit type, e.g. {@code per-minute} or {@code concurrent-requests}
         */
        String limitType();

        long limit();

        @WithDefault("0")
        long burst();

        @WithDefault("0")
        int priority();

        @WithDefault("THROUGHPUT")
        RuleCategory category();

        @WithDefault("0")
        long penaltySeconds();

        /**
         * Explicit window, or timeout for concurrency rules. Derived from the limit type when absent.
         *
         * @return window in seconds
         */
        Optional<Long> windowSeconds();
    }

    /**
     * Redis-specific configuration.
     */
    interface RedisConfig {

        /**
         * Enable Redis as the counter store.
         *
         * <p>When enabled and Redis is available, counters are shared across
         * instances. When disabled or unavailable, falls back to in-memory.
         *
         * @return true to use Redis (default: false)
         */
        @WithDefault("false")
        boolean enabled();

        /**
         * Key prefix for counter entries in Redis.
         *
         * @return key prefix (default: "floodgate:ratelimit:")
         */
        @WithDefault("floodgate:ratelimit:")
        String keyPrefix();
    }
}
