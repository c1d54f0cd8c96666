package floodgate.adapter.in.dto;

import java.time.Duration;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

import floodgate.core.model.adaptive.AdaptiveRule;
import floodgate.core.model.adaptive.MetricThresholds;
import floodgate.core.model.ratelimit.RateLimitScope;

/**
 * DTO for adaptive bounds attached to a rule.
 *
 * @param scope            scope key of the rule, e.g. {@code global} or {@code endpoint:/api/**}
 * @param ruleName         the rule name
 * @param minLimit         lower bound
 * @param maxLimit         upper bound
 * @param adjustmentFactor proportional gain (default 0.2)
 * @param thresholds       optional metric thresholds
 * @param cooldownSeconds  optional cooldown (default 300)
 */
public record AdaptiveRuleDto(
        String scope,
        @NotBlank(message = "ruleName is required") String ruleName,
        @NotNull(message = "minLimit is required") Long minLimit,
        @NotNull(message = "maxLimit is required") Long maxLimit,
        Double adjustmentFactor,
        ThresholdsDto thresholds,
        Long cooldownSeconds) {

    public AdaptiveRule toModel() {
        return new AdaptiveRule(
                RateLimitScope.parse(scope == null || scope.isBlank() ? RateLimitScope.GLOBAL_KEY : scope),
                ruleName,
                minLimit,
                maxLimit,
                adjustmentFactor != null ? adjustmentFactor : 0.2,
                thresholds != null ? thresholds.toModel() : null,
                cooldownSeconds != null ? Duration.ofSeconds(cooldownSeconds) : null);
    }

    public static AdaptiveRuleDto fromModel(AdaptiveRule rule) {
        return new AdaptiveRuleDto(
                rule.scope().key(),
                rule.ruleName(),
                rule.minLimit(),
                rule.maxLimit(),
                rule.adjustmentFactor(),
                ThresholdsDto.fromModel(rule.thresholds()),
                rule.cooldownPeriod().toSeconds());
    }

    /**
     * Metric thresholds; missing values take the defaults.
     */
    public record ThresholdsDto(Double cpu, Double memory, Double errorRate, Double p95Latency) {

        public MetricThresholds toModel() {
            final var defaults = MetricThresholds.DEFAULTS;
            return new MetricThresholds(
                    cpu != null ? cpu : defaults.cpu(),
                    memory != null ? memory : defaults.memory(),
                    errorRate != null ? errorRate : defaults.errorRate(),
                    p95Latency != null ? p95Latency : defaults.p95Latency());
        }

        public static ThresholdsDto fromModel(MetricThresholds model) {
            return new ThresholdsDto(model.cpu(), model.memory(), model.errorRate(), model.p95Latency());
        }
    }
}
