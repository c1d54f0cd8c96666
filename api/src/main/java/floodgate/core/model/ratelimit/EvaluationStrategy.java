package floodgate.core.model.ratelimit;

/**
 * Algorithms available to evaluate a rule against the counter store.
 */
public enum EvaluationStrategy {
    SLIDING_WINDOW,
    CONCURRENCY
}
