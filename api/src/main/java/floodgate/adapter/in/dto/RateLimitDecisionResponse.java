package floodgate.adapter.in.dto;

import java.util.List;

import floodgate.core.model.ratelimit.RateLimitDecision;

/**
 * DTO for rate limit decisions.
 *
 * @param allowed    whether the request may proceed
 * @param remaining  remaining quota of the tightest rule, -1 when unbounded
 * @param resetTime  epoch seconds when the reported rule resets
 * @param retryAfter seconds to wait on denial
 * @param limit      limit of the reported rule
 * @param window     window of the reported rule in seconds
 * @param rule       name of the reported rule
 * @param heldSlots  concurrency slots that must be released when the request completes
 */
public record RateLimitDecisionResponse(
        boolean allowed,
        long remaining,
        long resetTime,
        Long retryAfter,
        Long limit,
        Long window,
        String rule,
        List<String> heldSlots) {

    public static RateLimitDecisionResponse fromModel(RateLimitDecision decision) {
        return new RateLimitDecisionResponse(
                decision.allowed(),
                decision.remaining(),
                decision.resetTime(),
                decision.retryAfter().orElse(null),
                decision.limitApplied().orElse(null),
                decision.windowApplied().orElse(null),
                decision.ruleName().orElse(null),
                decision.heldSlots());
    }
}
