package floodgate.core.model.ratelimit;

/**
 * Category of a rule, used to pick the behavior when the counter store is unavailable.
 *
 * <ul>
 *   <li>{@link #THROUGHPUT} - protects capacity; by default fails open</li>
 *   <li>{@link #SECURITY} - protects against abuse; by default fails closed</li>
 * </ul>
 */
public enum RuleCategory {
    THROUGHPUT,
    SECURITY
}
