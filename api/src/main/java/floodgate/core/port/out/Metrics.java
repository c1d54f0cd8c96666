package floodgate.core.port.out;

/**
 * Port interface for recording rate limiter metrics.
 *
 * <p>Implementations handle the actual metric recording (e.g., Micrometer).
 */
public interface Metrics {

    /**
     * Check if metrics collection is enabled.
     *
     * @return true if enabled
     */
    boolean isEnabled();

    /**
     * Record the outcome of a rule evaluation.
     *
     * @param scope    scope key of the rule
     * @param ruleName the rule name
     * @param allowed  the verdict
     */
    void recordDecision(String scope, String ruleName, boolean allowed);

    /**
     * Record a counter store failure.
     *
     * @param ruleName     the rule being evaluated
     * @param failedClosed whether the request was denied because of it
     */
    void recordStoreFailure(String ruleName, boolean failedClosed);

    /**
     * Record an adaptive limit adjustment.
     *
     * @param ruleName  the adjusted rule
     * @param direction {@code tighten} or {@code loosen}
     */
    void recordAdjustment(String ruleName, String direction);

    /**
     * Track a concurrency slot acquisition or release.
     *
     * @param delta +1 on acquire, -1 on release
     */
    void recordSlotChange(int delta);
}
