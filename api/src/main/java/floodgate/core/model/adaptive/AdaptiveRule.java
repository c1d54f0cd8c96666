package floodgate.core.model.adaptive;

import java.time.Duration;

import floodgate.core.model.ratelimit.RateLimitScope;

/**
 * Adaptive bounds attached to a registered rule.
 *
 * <p>The rule's limit lives in the rule registry; this record only holds what
 * the controller needs to move it.
 *
 * @param scope            scope of the adapted rule
 * @param ruleName         name of the adapted rule
 * @param minLimit         lower bound of the limit
 * @param maxLimit         upper bound of the limit
 * @param adjustmentFactor proportional gain (0..1]
 * @param thresholds       metric thresholds
 * @param cooldownPeriod   minimum time between two adjustments
 */
public record AdaptiveRule(
        RateLimitScope scope,
        String ruleName,
        long minLimit,
        long maxLimit,
        double adjustmentFactor,
        MetricThresholds thresholds,
        Duration cooldownPeriod) {

    public static final Duration DEFAULT_COOLDOWN = Duration.ofSeconds(300);

    public AdaptiveRule {
        if (scope == null) {
            throw new IllegalArgumentException("scope cannot be null");
        }
        if (ruleName == null || ruleName.isBlank()) {
            throw new IllegalArgumentException("ruleName cannot be null or blank");
        }
        if (minLimit <= 0 || maxLimit < minLimit) {
            throw new IllegalArgumentException(
                    "Adaptive bounds must satisfy 0 < minLimit <= maxLimit, got [" + minLimit + ", " + maxLimit + "]");
        }
        if (adjustmentFactor <= 0 || adjustmentFactor > 1) {
            throw new IllegalArgumentException("adjustmentFactor must be in (0, 1], got " + adjustmentFactor);
        }
        if (thresholds == null) {
            thresholds = MetricThresholds.DEFAULTS;
        }
        if (cooldownPeriod == null) {
            cooldownPeriod = DEFAULT_COOLDOWN;
        }
        if (cooldownPeriod.isNegative()) {
            throw new IllegalArgumentException("cooldownPeriod cannot be negative");
        }
    }

    /**
     * Registry key of the adapted rule: {@code scopeKey/ruleName}.
     */
    public String reference() {
        return scope.key() + "/" + ruleName;
    }
}
