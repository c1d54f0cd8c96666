package floodgate.core.model.policy;

import java.time.Instant;
import java.util.List;

import floodgate.core.model.ratelimit.RateLimitRule;

/**
 * A named bundle of rules that can be assigned to identifiers.
 *
 * <p>The rules of an enabled policy apply, in addition to the static scopes,
 * to every identifier assigned to it.
 *
 * @param name        unique policy name (e.g., "premium")
 * @param description optional description
 * @param rules       the rules of this policy
 * @param enabled     disabled policies contribute no rules
 * @param priority    ordering among policies when listing
 * @param createdAt   when the policy was created
 * @param updatedAt   when the policy was last modified
 * @param createdBy   who created the policy
 */
public record RateLimitPolicy(
        String name,
        String description,
        List<RateLimitRule> rules,
        boolean enabled,
        int priority,
        Instant createdAt,
        Instant updatedAt,
        String createdBy) {

    public RateLimitPolicy {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Policy name cannot be null or blank");
        }
        if (description == null) {
            description = "";
        }
        rules = rules == null ? List.of() : List.copyOf(rules);
        if (createdAt == null) {
            createdAt = Instant.now();
        }
        if (updatedAt == null) {
            updatedAt = createdAt;
        }
        if (createdBy == null || createdBy.isBlank()) {
            createdBy = "system";
        }
    }

    /**
     * Copy of this policy carrying the given content and the original creation metadata.
     *
     * @param replacement the new content
     * @param now         the update time
     * @return the updated policy
     */
    public RateLimitPolicy updatedFrom(RateLimitPolicy replacement, Instant now) {
        return new RateLimitPolicy(
                name,
                replacement.description(),
                replacement.rules(),
                replacement.enabled(),
                replacement.priority(),
                createdAt,
                now,
                createdBy);
    }

    public static Builder builder(String name) {
        return new Builder(name);
    }

    public static class Builder {
        private final String name;
        private String description;
        private List<RateLimitRule> rules = List.of();
        private boolean enabled = true;
        private int priority;
        private Instant createdAt;
        private Instant updatedAt;
        private String createdBy;

        private Builder(String name) {
            this.name = name;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder rules(List<RateLimitRule> rules) {
            this.rules = rules;
            return this;
        }

        public Builder enabled(boolean enabled) {
            this.enabled = enabled;
            return this;
        }

        public Builder priority(int priority) {
            this.priority = priority;
            return this;
        }

        public Builder createdAt(Instant createdAt) {
            this.createdAt = createdAt;
            return this;
        }

        public Builder updatedAt(Instant updatedAt) {
            this.updatedAt = updatedAt;
            return this;
        }

        public Builder createdBy(String createdBy) {
            this.createdBy = createdBy;
            return this;
        }

        public RateLimitPolicy build() {
            return new RateLimitPolicy(name, description, rules, enabled, priority, createdAt, updatedAt, createdBy);
        }
    }
}
