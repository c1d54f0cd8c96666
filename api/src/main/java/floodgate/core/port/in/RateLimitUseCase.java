package floodgate.core.port.in;

import java.util.Map;
import java.util.Optional;

import io.smallrye.mutiny.Uni;

import floodgate.core.model.ratelimit.RateLimitDecision;
import floodgate.core.model.ratelimit.RequestContext;
import floodgate.core.model.ratelimit.RuleStatus;

/**
 * Port for admission checks.
 */
public interface RateLimitUseCase {

    /**
     * Evaluate every rule that applies to the request.
     *
     * <p>Concurrency slots acquired by an allowed check are listed in
     * {@link RateLimitDecision#heldSlots()} and must each be released exactly once
     * with {@link #releaseConcurrentSlot(String, String)}.
     *
     * @param context the request context
     * @return Uni with the decision
     */
    Uni<RateLimitDecision> checkRateLimit(RequestContext context);

    /**
     * Release a concurrency slot acquired by an earlier check.
     *
     * @param identifier the client identifier
     * @param ruleRef    a held slot reference ({@code scope/rule}) or a bare rule name
     * @return Uni completing when released
     */
    Uni<Void> releaseConcurrentSlot(String identifier, String ruleRef);

    /**
     * Report quota per applicable rule without consuming any.
     *
     * @param context the request context
     * @return Uni with the status of each rule keyed by rule name
     */
    Uni<Map<String, RuleStatus>> getRateLimitStatus(RequestContext context);

    /**
     * Clear counters of an identifier.
     *
     * @param identifier the client identifier
     * @param ruleName   restrict the reset to one rule, or empty for all
     * @return Uni with the number of cleared entries
     */
    Uni<Long> resetRateLimit(String identifier, Optional<String> ruleName);
}
