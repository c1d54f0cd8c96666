package floodgate.adapter.in.dto;

import java.util.Locale;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

import floodgate.core.model.ratelimit.LimitType;
import floodgate.core.model.ratelimit.RateLimitRule;
import floodgate.core.model.ratelimit.RuleCategory;

/**
 * DTO for a rate limit rule.
 *
 * @param name           rule name, unique within its scope
 * @param limitType      {@code per-second}, {@code per-minute}, {@code per-hour}, {@code per-day}
 *                       or {@code concurrent-requests}
 * @param limit          requests per window, or concurrent slots
 * @param windowSeconds  optional window or slot timeout override
 * @param burst          optional extra allowance (default 0)
 * @param priority       optional priority (default 0)
 * @param category       optional {@code THROUGHPUT} or {@code SECURITY}
 * @param penaltySeconds optional lock-out after a denial (default 0)
 */
public record RateLimitRuleDto(
        @NotBlank(message = "name is required") String name,
        @NotBlank(message = "limitType is required") String limitType,
        @NotNull(message = "limit is required") Long limit,
        Long windowSeconds,
        Long burst,
        Integer priority,
        String category,
        Long penaltySeconds) {

    /**
     * Converts this DTO to a RateLimitRule model.
     */
    public RateLimitRule toModel() {
        final var builder = RateLimitRule.builder(name, LimitType.parse(limitType))
                .limit(limit != null ? limit : 0)
                .burst(burst != null ? burst : 0)
                .priority(priority != null ? priority : 0)
                .penaltySeconds(penaltySeconds != null ? penaltySeconds : 0);
        if (windowSeconds != null) {
            builder.windowSeconds(windowSeconds);
        }
        if (category != null && !category.isBlank()) {
            builder.category(RuleCategory.valueOf(category.trim().toUpperCase(Locale.ROOT)));
        }
        return builder.build();
    }

    /**
     * Creates a DTO from a RateLimitRule model.
     */
    public static RateLimitRuleDto fromModel(RateLimitRule rule) {
        return new RateLimitRuleDto(
                rule.name(),
                rule.limitType().wireName(),
                rule.limit(),
                rule.windowSeconds(),
                rule.burst(),
                rule.priority(),
                rule.category().name(),
                rule.penaltySeconds());
    }
}
