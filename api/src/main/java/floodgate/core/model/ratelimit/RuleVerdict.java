package floodgate.core.model.ratelimit;

/**
 * Outcome of evaluating a single rule.
 *
 * @param rule       the evaluated rule
 * @param decision   the per-rule decision
 * @param slotHeld   true when a concurrency slot was acquired and must be released
 * @param storeError true when the decision came from the failure policy rather than the store
 */
public record RuleVerdict(ScopedRule rule, RateLimitDecision decision, boolean slotHeld, boolean storeError) {

    public static RuleVerdict of(ScopedRule rule, RateLimitDecision decision) {
        return new RuleVerdict(rule, decision, false, false);
    }

    public static RuleVerdict holding(ScopedRule rule, RateLimitDecision decision) {
        return new RuleVerdict(rule, decision, true, false);
    }

    public static RuleVerdict storeFailure(ScopedRule rule, RateLimitDecision decision) {
        return new RuleVerdict(rule, decision, false, true);
    }

    public boolean allowed() {
        return decision.allowed();
    }
}
