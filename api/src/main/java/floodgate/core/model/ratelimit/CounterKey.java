package floodgate.core.model.ratelimit;

/**
 * Key of one counter entry: the identifier, the rule's scope and the rule name.
 *
 * <p>The identifier is wrapped in braces so that all of an identifier's keys
 * share a prefix and, in Redis Cluster, a hash slot.
 *
 * @param identifier the client identifier
 * @param scopeKey   the scope key of the rule
 * @param ruleName   the rule name
 */
public record CounterKey(String identifier, String scopeKey, String ruleName) {

    public CounterKey {
        if (identifier == null || identifier.isBlank()) {
            throw new IllegalArgumentException("identifier cannot be null or blank");
        }
    }

    public static CounterKey of(String identifier, ScopedRule rule) {
        return new CounterKey(identifier, rule.scope().key(), rule.ruleName());
    }

    /**
     * Prefix shared by every key of an identifier.
     */
    public static String identifierPrefix(String identifier) {
        return "{" + identifier + "}:";
    }

    public String value() {
        return identifierPrefix(identifier) + scopeKey + ":" + ruleName;
    }

    /**
     * Key of the penalty marker for this counter.
     */
    public String penaltyValue() {
        return value() + ":penalty";
    }

    @Override
    public String toString() {
        return value();
    }
}
