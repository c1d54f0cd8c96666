package floodgate.core.model.ratelimit;

/**
 * A named quota constraint.
 *
 * <p>For windowed limit types {@code windowSeconds} is the sliding window
 * length. For {@link LimitType#CONCURRENT_REQUESTS} it is the slot timeout
 * after which an unreleased slot expires.
 *
 * <p>A limit of {@code 0} is representable so that evaluators can treat it as
 * "always deny", but such a rule is rejected by {@link #validate()} and can never
 * be registered.
 *
 * @param name           rule name, unique within its scope
 * @param limitType      counting semantics
 * @param limit          maximum count within the window
 * @param windowSeconds  window length or concurrency timeout in seconds
 * @param burst          extra allowance above the limit, 0 disables
 * @param priority       higher priority rules are evaluated and reported first
 * @param category       selects the behavior when the counter store fails
 * @param penaltySeconds lock-out after a denial, 0 disables
 */
public record RateLimitRule(
        String name,
        LimitType limitType,
        long limit,
        long windowSeconds,
        long burst,
        int priority,
        RuleCategory category,
        long penaltySeconds) {

    public RateLimitRule {
        if (name == null || name.isBlank()) {
            throw new RuleConfigurationException("Rule name is required");
        }
        if (limitType == null) {
            throw new RuleConfigurationException("Rule " + name + " requires a limitType");
        }
        if (limit < 0) {
            throw new RuleConfigurationException("Rule " + name + " has a negative limit: " + limit);
        }
        if (burst < 0) {
            throw new RuleConfigurationException("Rule " + name + " has a negative burst: " + burst);
        }
        if (penaltySeconds < 0) {
            throw new RuleConfigurationException("Rule " + name + " has a negative penalty: " + penaltySeconds);
        }
        if (windowSeconds <= 0) {
            throw new RuleConfigurationException("Rule " + name + " requires a positive window or timeout");
        }
        if (category == null) {
            category = RuleCategory.THROUGHPUT;
        }
    }

    /**
     * Create a throughput rule with the window derived from its limit type.
     */
    public static RateLimitRule of(String name, LimitType limitType, long limit) {
        return builder(name, limitType).limit(limit).build();
    }

    public static Builder builder(String name, LimitType limitType) {
        return new Builder(name, limitType);
    }

    /**
     * Check the registration constraints that evaluation does not enforce.
     *
     * @return this rule
     * @throws RuleConfigurationException if the limit is not positive
     */
    public RateLimitRule validate() {
        if (limit <= 0) {
            throw new RuleConfigurationException("Rule " + name + " must have a positive limit, got " + limit);
        }
        return this;
    }

    public RateLimitRule withLimit(long newLimit) {
        return new RateLimitRule(name, limitType, newLimit, windowSeconds, burst, priority, category, penaltySeconds);
    }

    /**
     * Total admissions per window, including burst.
     */
    public long capacity() {
        return limit + burst;
    }

    public boolean isConcurrency() {
        return limitType == LimitType.CONCURRENT_REQUESTS;
    }

    public static final class Builder {
        private final String name;
        private final LimitType limitType;
        private long limit;
        private Long windowSeconds;
        private long burst;
        private int priority;
        private RuleCategory category = RuleCategory.THROUGHPUT;
        private long penaltySeconds;

        private Builder(String name, LimitType limitType) {
            this.name = name;
            this.limitType = limitType;
        }

        public Builder limit(long limit) {
            this.limit = limit;
            return this;
        }

        public Builder windowSeconds(long windowSeconds) {
            this.windowSeconds = windowSeconds;
            return this;
        }

        public Builder burst(long burst) {
            this.burst = burst;
            return this;
        }

        public Builder priority(int priority) {
            this.priority = priority;
            return this;
        }

        public Builder category(RuleCategory category) {
            this.category = category;
            return this;
        }

        public Builder penaltySeconds(long penaltySeconds) {
            this.penaltySeconds = penaltySeconds;
            return this;
        }

        public RateLimitRule build() {
            if (limitType == null) {
                throw new RuleConfigurationException("Rule " + name + " requires a limitType");
            }
            final long window = windowSeconds != null ? windowSeconds : limitType.defaultWindowSeconds();
            return new RateLimitRule(name, limitType, limit, window, burst, priority, category, penaltySeconds);
        }
    }
}
