package floodgate.core.model.ratelimit;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Immutable snapshot of every registered rule, grouped by scope.
 *
 * <p>Mutators return a new snapshot; a published snapshot is never modified.
 *
 * @param rules   rules per scope, in registration order
 * @param version incremented on every mutation
 */
public record RuleSet(Map<RateLimitScope, List<RateLimitRule>> rules, long version) {

    private static final RuleSet EMPTY = new RuleSet(Map.of(), 0);

    public RuleSet {
        final var copy = new LinkedHashMap<RateLimitScope, List<RateLimitRule>>();
        rules.forEach((scope, list) -> copy.put(scope, List.copyOf(list)));
        rules = Collections.unmodifiableMap(copy);
    }

    public static RuleSet empty() {
        return EMPTY;
    }

    /**
     * Add a rule, replacing any rule of the same name in the scope.
     */
    public RuleSet with(RateLimitScope scope, RateLimitRule rule) {
        final var list = new ArrayList<>(rulesFor(scope));
        list.removeIf(existing -> existing.name().equals(rule.name()));
        list.add(rule);
        return withScope(scope, list);
    }

    public RuleSet without(RateLimitScope scope, String ruleName) {
        final var list = new ArrayList<>(rulesFor(scope));
        if (!list.removeIf(existing -> existing.name().equals(ruleName))) {
            return this;
        }
        return withScope(scope, list);
    }

    /**
     * Replace all rules of a scope. An empty list removes the scope.
     */
    public RuleSet withScope(RateLimitScope scope, List<RateLimitRule> scopeRules) {
        final var copy = new LinkedHashMap<>(rules);
        if (scopeRules.isEmpty()) {
            copy.remove(scope);
        } else {
            copy.put(scope, scopeRules);
        }
        return new RuleSet(copy, version + 1);
    }

    public List<RateLimitRule> rulesFor(RateLimitScope scope) {
        return rules.getOrDefault(scope, List.of());
    }

    public Optional<RateLimitRule> find(RateLimitScope scope, String ruleName) {
        return rulesFor(scope).stream()
                .filter(rule -> rule.name().equals(ruleName))
                .findFirst();
    }

    public Set<RateLimitScope> scopes() {
        return rules.keySet();
    }

    public List<ScopedRule> all() {
        final var result = new ArrayList<ScopedRule>();
        rules.forEach((scope, list) -> list.forEach(rule -> result.add(new ScopedRule(scope, rule))));
        return result;
    }

    public int size() {
        return rules.values().stream().mapToInt(List::size).sum();
    }
}
