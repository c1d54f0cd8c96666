package floodgate.adapter.in.bootstrap;

import java.time.Duration;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.event.Observes;
import jakarta.inject.Inject;

import io.quarkus.runtime.StartupEvent;
import org.jboss.logging.Logger;

import floodgate.core.config.AdaptiveConfig;
import floodgate.core.config.PolicyConfig;
import floodgate.core.config.RateLimitingConfig;
import floodgate.core.model.adaptive.AdaptiveRule;
import floodgate.core.model.adaptive.MetricThresholds;
import floodgate.core.model.policy.DuplicatePolicyException;
import floodgate.core.model.ratelimit.LimitType;
import floodgate.core.model.ratelimit.RateLimitRule;
import floodgate.core.model.ratelimit.RateLimitScope;
import floodgate.core.model.ratelimit.RuleConfigurationException;
import floodgate.core.port.in.AdaptiveControl;
import floodgate.core.port.in.PolicyManagement;
import floodgate.core.service.policy.DefaultPolicies;
import floodgate.core.service.ratelimit.RuleRegistry;

/**
 * Loads configured rules and built-in policies on application startup.
 *
 * <p>Order matters: static rules are registered first so that adaptive bounds
 * configured for them can be attached.
 *
 * <h2>Failure Behavior</h2>
 * <ul>
 *   <li>An invalid static rule or adaptive bound: startup FAILS</li>
 *   <li>A built-in policy that already exists: skipped</li>
 * </ul>
 */
@ApplicationScoped
public class RateLimitBootstrap {

    private static final Logger LOG = Logger.getLogger(RateLimitBootstrap.class);
    private static final Duration STARTUP_TIMEOUT = Duration.ofSeconds(30);

    private final RateLimitingConfig rateLimitingConfig;
    private final AdaptiveConfig adaptiveConfig;
    private final PolicyConfig policyConfig;
    private final RuleRegistry ruleRegistry;
    private final PolicyManagement policies;
    private final AdaptiveControl adaptive;

    @Inject
    public RateLimitBootstrap(
            RateLimitingConfig rateLimitingConfig,
            AdaptiveConfig adaptiveConfig,
            PolicyConfig policyConfig,
            RuleRegistry ruleRegistry,
            PolicyManagement policies,
            AdaptiveControl adaptive) {
        this.rateLimitingConfig = rateLimitingConfig;
        this.adaptiveConfig = adaptiveConfig;
        this.policyConfig = policyConfig;
        this.ruleRegistry = ruleRegistry;
        this.policies = policies;
        this.adaptive = adaptive;
    }

    void onStart(@Observes StartupEvent event) {
        registerStaticRules();
        if (policyConfig.seedDefaults()) {
            seedDefaultPolicies();
        }
        registerAdaptiveRules();
    }

    void registerStaticRules() {
        for (final var entry : rateLimitingConfig.rules().entrySet()) {
            final var scope = RateLimitScope.parse(entry.getValue().scope());
            final var rule = toRule(entry.getKey(), entry.getValue());
            ruleRegistry.register(scope, rule);
            LOG.infov("Rule {0}/{1}: {2} {3} (burst {4}, priority {5})",
                    scope.key(), rule.name(), rule.limit(), rule.limitType(), rule.burst(), rule.priority());
        }
    }

    void seedDefaultPolicies() {
        var seeded = 0;
        for (final var policy : DefaultPolicies.all()) {
            try {
                policies.create(policy).await().atMost(STARTUP_TIMEOUT);
                seeded++;
            } catch (DuplicatePolicyException e) {
                LOG.debugv("Built-in policy {0} already exists", policy.name());
            }
        }
        LOG.infov("Seeded {0} built-in policies", seeded);
    }

    void registerAdaptiveRules() {
        if (!adaptiveConfig.enabled()) {
            LOG.debug("Adaptive rate limiting is disabled");
            return;
        }
        for (final var entry : adaptiveConfig.rules().entrySet()) {
            final var config = entry.getValue();
            final AdaptiveRule rule;
            try {
                rule = new AdaptiveRule(
                        RateLimitScope.parse(config.scope()),
                        entry.getKey(),
                        config.minLimit(),
                        config.maxLimit(),
                        config.adjustmentFactor(),
                        new MetricThresholds(
                                config.cpuThreshold(),
                                config.memoryThreshold(),
                                config.errorRateThreshold(),
                                config.p95LatencyThreshold()),
                        config.cooldown().orElse(adaptiveConfig.defaultCooldown()));
            } catch (IllegalArgumentException e) {
                throw new RuleConfigurationException(
                        "Invalid adaptive bounds for " + entry.getKey() + ": " + e.getMessage(), e);
            }
            adaptive.registerAdaptiveRule(rule).await().atMost(STARTUP_TIMEOUT);
        }
    }

    private RateLimitRule toRule(String name, RateLimitingConfig.RuleConfig config) {
        final var type = LimitType.parse(config.limitType());
        final var builder = RateLimitRule.builder(name, type)
                .limit(config.limit())
                .burst(config.burst())
                .priority(config.priority())
                .category(config.category())
                .penaltySeconds(config.penaltySeconds());
        if (config.windowSeconds().isPresent()) {
            builder.windowSeconds(config.windowSeconds().get());
        } else if (type == LimitType.CONCURRENT_REQUESTS) {
            builder.windowSeconds(rateLimitingConfig.defaultConcurrencyTimeout().toSeconds());
        }
        return builder.build();
    }
}
