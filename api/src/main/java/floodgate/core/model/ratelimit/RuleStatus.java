package floodgate.core.model.ratelimit;

/**
 * Read-only view of one rule's quota for an identifier.
 *
 * @param limit     the rule limit
 * @param remaining remaining requests, -1 when unknown
 * @param resetTime epoch seconds when the window resets
 * @param window    window length or concurrency timeout in seconds
 */
public record RuleStatus(long limit, long remaining, long resetTime, long window) {}
