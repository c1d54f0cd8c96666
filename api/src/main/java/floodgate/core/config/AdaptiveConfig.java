package floodgate.core.config;

import java.time.Duration;
import java.util.Map;
import java.util.Optional;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

/**
 * Configuration mapping for the adaptive controller.
 *
 * <p>Configuration prefix: {@code floodgate.adaptive}
 */
@ConfigMapping(prefix = "floodgate.adaptive")
public interface AdaptiveConfig {

    /**
     * @return true if limits may be adjusted automatically (default: true)
     */
    @WithDefault("true")
    boolean enabled();

    /**
     * How often the latest metrics are re-evaluated.
     *
     * @return interval (default: 30 seconds)
     */
    @WithDefault("PT30S")
    Duration evaluationInterval();

    /**
     * Metrics older than this are considered stale and skipped.
     *
     * @return maximum age (default: 2 minutes)
     */
    @WithDefault("PT2M")
    Duration metricsMaxAge();

    /**
     * @return number of adjustment records kept (default: 1000)
     */
    @WithDefault("1000")
    int historySize();

    /**
     * @return cooldown for adaptive rules that do not declare one (default: 5 minutes)
     */
    @WithDefault("PT5M")
    Duration defaultCooldown();

    /**
     * Adaptive bounds attached to static rules, keyed by rule name.
     */
    Map<String, AdaptiveRuleConfig> rules();

    /**
     * Adaptive bounds of one rule.
     */
    interface AdaptiveRuleConfig {

        @WithDefault("global")
        String scope();

        long minLimit();

        long maxLimit();

        @WithDefault("0.2")
        double adjustmentFactor();

        @WithDefault("0.8")
        double cpuThreshold();

        @WithDefault("0.85")
        double memoryThreshold();

        @WithDefault("0.05")
        double errorRateThreshold();

        @WithDefault("2.0")
        double p95LatencyThreshold();

        Optional<Duration> cooldown();
    }
}
