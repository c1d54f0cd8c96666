package floodgate.core.service.ratelimit;

import io.smallrye.mutiny.Uni;

import floodgate.core.model.ratelimit.CounterKey;
import floodgate.core.model.ratelimit.EvaluationStrategy;
import floodgate.core.model.ratelimit.RuleStatus;
import floodgate.core.model.ratelimit.RuleVerdict;
import floodgate.core.model.ratelimit.ScopedRule;

/**
 * Evaluates one rule against the counter store.
 *
 * <p>Implementations let {@link floodgate.core.model.ratelimit.StoreUnavailableException}
 * propagate; the failure policy is applied by the caller.
 */
public interface RuleEvaluator {

    EvaluationStrategy strategy();

    /**
     * Consume quota for one request.
     *
     * @param rule the rule
     * @param key  the counter key of the rule and identifier
     * @return Uni with the per-rule verdict
     */
    Uni<RuleVerdict> evaluate(ScopedRule rule, CounterKey key);

    /**
     * Report quota without consuming any.
     *
     * @param rule the rule
     * @param key  the counter key of the rule and identifier
     * @return Uni with the rule status
     */
    Uni<RuleStatus> status(ScopedRule rule, CounterKey key);
}
