package floodgate.core.model.ratelimit;

import java.util.List;
import java.util.Optional;

/**
 * Result of a rate limit check. Never persisted.
 *
 * @param allowed       whether the request may proceed
 * @param remaining     requests left in the reported window, -1 when unbounded
 * @param resetTime     epoch seconds when the reported window resets
 * @param retryAfter    seconds to wait before retrying, present on denial
 * @param limitApplied  the limit of the reported rule
 * @param windowApplied the window of the reported rule in seconds
 * @param ruleName      the rule that produced the reported result
 * @param heldSlots     concurrency slots acquired by this admission that must be released
 */
public record RateLimitDecision(
        boolean allowed,
        long remaining,
        long resetTime,
        Optional<Long> retryAfter,
        Optional<Long> limitApplied,
        Optional<Long> windowApplied,
        Optional<String> ruleName,
        List<String> heldSlots) {

    public static final long UNBOUNDED = -1;

    public RateLimitDecision {
        retryAfter = retryAfter != null ? retryAfter : Optional.empty();
        limitApplied = limitApplied != null ? limitApplied : Optional.empty();
        windowApplied = windowApplied != null ? windowApplied : Optional.empty();
        ruleName = ruleName != null ? ruleName : Optional.empty();
        heldSlots = heldSlots != null ? List.copyOf(heldSlots) : List.of();
    }

    /**
     * Decision for a request that no rule constrains.
     */
    public static RateLimitDecision unlimited(long nowEpochSeconds) {
        return new RateLimitDecision(
                true,
                UNBOUNDED,
                nowEpochSeconds,
                Optional.empty(),
                Optional.empty(),
                Optional.empty(),
                Optional.empty(),
                List.of());
    }

    public static RateLimitDecision allow(RateLimitRule rule, long remaining, long resetTime) {
        return new RateLimitDecision(
                true,
                remaining,
                resetTime,
                Optional.empty(),
                Optional.of(rule.limit()),
                Optional.of(rule.windowSeconds()),
                Optional.of(rule.name()),
                List.of());
    }

    public static RateLimitDecision deny(RateLimitRule rule, long retryAfterSeconds, long resetTime) {
        return new RateLimitDecision(
                false,
                0,
                resetTime,
                Optional.of(retryAfterSeconds),
                Optional.of(rule.limit()),
                Optional.of(rule.windowSeconds()),
                Optional.of(rule.name()),
                List.of());
    }

    /**
     * Decision for a rule whose store failed under the fail-open policy.
     */
    public static RateLimitDecision failOpen(RateLimitRule rule, long nowEpochSeconds) {
        return new RateLimitDecision(
                true,
                UNBOUNDED,
                nowEpochSeconds,
                Optional.empty(),
                Optional.of(rule.limit()),
                Optional.of(rule.windowSeconds()),
                Optional.of(rule.name()),
                List.of());
    }

    public RateLimitDecision withHeldSlots(List<String> slots) {
        return new RateLimitDecision(
                allowed, remaining, resetTime, retryAfter, limitApplied, windowApplied, ruleName, slots);
    }

    public boolean isUnbounded() {
        return remaining == UNBOUNDED;
    }
}
