package floodgate.core.service.ratelimit;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.UnaryOperator;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import org.jboss.logging.Logger;

import floodgate.core.model.ratelimit.RateLimitRule;
import floodgate.core.model.ratelimit.RateLimitScope;
import floodgate.core.model.ratelimit.RequestContext;
import floodgate.core.model.ratelimit.RuleConfigurationException;
import floodgate.core.model.ratelimit.RuleSet;
import floodgate.core.model.ratelimit.ScopedRule;

/**
 * Registry of every active rule, grouped by scope.
 *
 * <p>The registry holds an immutable {@link RuleSet} behind an atomic
 * reference. Writers build a new snapshot and publish it with a CAS loop, so
 * readers always see a fully formed rule set and a limit change made by the
 * adaptive controller is visible to the very next resolution.
 */
@ApplicationScoped
public class RuleRegistry {

    private static final Logger LOG = Logger.getLogger(RuleRegistry.class);

    private static final Comparator<ScopedRule> BY_PRIORITY_DESC =
            Comparator.comparingInt((ScopedRule sr) -> sr.rule().priority()).reversed();

    private final AtomicReference<RuleSet> snapshot = new AtomicReference<>(RuleSet.empty());
    private final EndpointPatternMatcher endpointMatcher;

    @Inject
    public RuleRegistry(EndpointPatternMatcher endpointMatcher) {
        this.endpointMatcher = endpointMatcher;
    }

    /**
     * Resolve the rules that apply to a request, highest priority first.
     *
     * <p>Global rules always apply. The user and API key scopes apply when the
     * context's rule type names them, endpoint scopes when their pattern matches
     * the endpoint, the provider scope when the provider matches, and the policy
     * scope when the identifier has a policy.
     *
     * @param context    the request context
     * @param policyName the identifier's assigned policy, if any
     * @return applicable rules sorted by priority descending, registration order within a priority
     */
    public List<ScopedRule> resolveRules(RequestContext context, Optional<String> policyName) {
        final var rules = snapshot.get();
        final var result = new ArrayList<ScopedRule>();

        addScope(result, rules, RateLimitScope.global());

        final var ruleType = context.ruleType().replace('-', '_');
        if (RateLimitScope.USER_KEY.equals(ruleType)) {
            addScope(result, rules, RateLimitScope.user());
        } else if (RateLimitScope.API_KEY_KEY.equals(ruleType)) {
            addScope(result, rules, RateLimitScope.apiKey());
        }

        context.endpoint().ifPresent(endpoint -> {
            for (final var scope : rules.scopes()) {
                if (scope instanceof RateLimitScope.Endpoint e && endpointMatcher.matches(e.pattern(), endpoint)) {
                    addScope(result, rules, scope);
                }
            }
        });

        context.apiProvider().ifPresent(provider -> addScope(result, rules, RateLimitScope.provider(provider)));
        policyName.ifPresent(name -> addScope(result, rules, RateLimitScope.policy(name)));

        result.sort(BY_PRIORITY_DESC);
        return result;
    }

    /**
     * Register a rule, replacing a rule of the same name in the scope.
     *
     * @throws RuleConfigurationException if the rule is invalid
     */
    public void register(RateLimitScope scope, RateLimitRule rule) {
        rule.validate();
        publish(rules -> rules.with(scope, rule));
        LOG.debugv("Registered rule {0} in scope {1} (limit={2}, type={3})",
                rule.name(), scope.key(), rule.limit(), rule.limitType());
    }

    /**
     * Replace every rule of a scope atomically. An empty list clears the scope.
     *
     * @throws RuleConfigurationException if any rule is invalid or names repeat
     */
    public void replaceScope(RateLimitScope scope, List<RateLimitRule> rules) {
        final var names = new HashSet<String>();
        for (final var rule : rules) {
            rule.validate();
            if (!names.add(rule.name())) {
                throw new RuleConfigurationException("Duplicate rule " + rule.name() + " in scope " + scope.key());
            }
        }
        publish(current -> current.withScope(scope, rules));
    }

    public boolean remove(RateLimitScope scope, String ruleName) {
        final var before = snapshot.get().find(scope, ruleName).isPresent();
        publish(rules -> rules.without(scope, ruleName));
        return before;
    }

    /**
     * Swap a rule's limit.
     *
     * @param scope    the rule's scope
     * @param ruleName the rule name
     * @param newLimit the new limit, must be positive
     * @return the rule as it was before the change, empty if no such rule
     */
    public Optional<RateLimitRule> updateLimit(RateLimitScope scope, String ruleName, long newLimit) {
        while (true) {
            final var current = snapshot.get();
            final var existing = current.find(scope, ruleName);
            if (existing.isEmpty()) {
                return Optional.empty();
            }
            final var updated = existing.get().withLimit(newLimit).validate();
            if (snapshot.compareAndSet(current, current.with(scope, updated))) {
                return existing;
            }
        }
    }

    public Optional<RateLimitRule> find(RateLimitScope scope, String ruleName) {
        return snapshot.get().find(scope, ruleName);
    }

    /**
     * Every registered rule with the given name, highest priority first.
     */
    public List<ScopedRule> findByName(String ruleName) {
        final var matches = new ArrayList<ScopedRule>();
        for (final var scoped : snapshot.get().all()) {
            if (scoped.ruleName().equals(ruleName)) {
                matches.add(scoped);
            }
        }
        matches.sort(BY_PRIORITY_DESC);
        return matches;
    }

    public RuleSet snapshot() {
        return snapshot.get();
    }

    private void addScope(List<ScopedRule> target, RuleSet rules, RateLimitScope scope) {
        for (final var rule : rules.rulesFor(scope)) {
            target.add(new ScopedRule(scope, rule));
        }
    }

    private void publish(UnaryOperator<RuleSet> change) {
        snapshot.updateAndGet(change);
    }
}
