package floodgate.core.service.ratelimit;

import java.time.Clock;
import java.util.EnumMap;
import java.util.Map;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import org.jboss.logging.Logger;

import floodgate.core.model.ratelimit.EvaluationStrategy;
import floodgate.core.model.ratelimit.RateLimitRule;
import floodgate.core.port.out.CounterStore;

/**
 * Registry of rule evaluators by strategy.
 *
 * <p>Supported strategies:
 * <ul>
 *   <li>{@link EvaluationStrategy#SLIDING_WINDOW} - windowed limit types</li>
 *   <li>{@link EvaluationStrategy#CONCURRENCY} - concurrent request slots</li>
 * </ul>
 */
@ApplicationScoped
public class EvaluatorRegistry {

    private static final Logger LOG = Logger.getLogger(EvaluatorRegistry.class);

    private final Map<EvaluationStrategy, RuleEvaluator> evaluators = new EnumMap<>(EvaluationStrategy.class);

    @Inject
    public EvaluatorRegistry(CounterStore store, Clock clock) {
        register(new SlidingWindowEvaluator(store, clock));
        register(new ConcurrencyEvaluator(store, clock));
        LOG.infov("Initialized evaluator registry with {0} evaluator(s) on store {1}", evaluators.size(), store.name());
    }

    /**
     * Get the evaluator for a rule's limit type.
     *
     * @param rule the rule
     * @return the evaluator
     * @throws IllegalStateException if no evaluator handles the rule's strategy
     */
    public RuleEvaluator evaluatorFor(RateLimitRule rule) {
        final var evaluator = evaluators.get(rule.limitType().strategy());
        if (evaluator == null) {
            throw new IllegalStateException("No evaluator for strategy " + rule.limitType().strategy());
        }
        return evaluator;
    }

    private void register(RuleEvaluator evaluator) {
        evaluators.put(evaluator.strategy(), evaluator);
        LOG.debugv("Registered evaluator: {0}", evaluator.strategy());
    }
}
