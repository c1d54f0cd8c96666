package floodgate.adapter.in.dto;

import java.time.Instant;
import java.util.List;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;

import floodgate.core.model.policy.RateLimitPolicy;
import floodgate.core.model.ratelimit.RateLimitRule;

/**
 * DTO for rate limit policies.
 *
 * <p>Timestamps and {@code createdBy} are ignored on input except
 * {@code createdBy} at creation.
 */
public record PolicyDto(
        @NotBlank(message = "name is required") String name,
        String description,
        @Valid List<RateLimitRuleDto> rules,
        Boolean enabled,
        Integer priority,
        Instant createdAt,
        Instant updatedAt,
        String createdBy) {

    /**
     * Converts this DTO to a RateLimitPolicy model.
     *
     * @param nameOverride name from the request path, if any
     */
    public RateLimitPolicy toModel(String nameOverride) {
        final var ruleModels = rules == null
                ? List.<RateLimitRule>of()
                : rules.stream().map(RateLimitRuleDto::toModel).toList();
        return RateLimitPolicy.builder(nameOverride != null ? nameOverride : name)
                .description(description)
                .rules(ruleModels)
                .enabled(enabled == null || enabled)
                .priority(priority != null ? priority : 0)
                .createdBy(createdBy)
                .build();
    }

    /**
     * Creates a DTO from a RateLimitPolicy model.
     */
    public static PolicyDto fromModel(RateLimitPolicy policy) {
        return new PolicyDto(
                policy.name(),
                policy.description(),
                policy.rules().stream().map(RateLimitRuleDto::fromModel).toList(),
                policy.enabled(),
                policy.priority(),
                policy.createdAt(),
                policy.updatedAt(),
                policy.createdBy());
    }
}
