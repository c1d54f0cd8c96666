package floodgate.core.model.ratelimit;

/**
 * A rule together with the scope it was registered under.
 *
 * @param scope the scope
 * @param rule  the rule
 */
public record ScopedRule(RateLimitScope scope, RateLimitRule rule) {

    public ScopedRule {
        if (scope == null) {
            throw new IllegalArgumentException("scope cannot be null");
        }
        if (rule == null) {
            throw new IllegalArgumentException("rule cannot be null");
        }
    }

    /**
     * Reference used to release a held concurrency slot: {@code scopeKey/ruleName}.
     */
    public String reference() {
        return scope.key() + "/" + rule.name();
    }

    public String ruleName() {
        return rule.name();
    }
}
