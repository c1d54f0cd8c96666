package floodgate.core.model.ratelimit;

/**
 * Outcome applied to a rule when its counter store operation fails.
 */
public enum FailureMode {
    /** Treat the rule as passed and report unbounded remaining. */
    FAIL_OPEN,
    /** Deny the request. */
    FAIL_CLOSED
}
