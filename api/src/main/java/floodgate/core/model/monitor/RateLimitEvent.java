package floodgate.core.model.monitor;

import java.time.Instant;
import java.util.Optional;

/**
 * One recorded rule evaluation.
 *
 * @param timestamp   when the rule was evaluated
 * @param identifier  the client identifier
 * @param scope       scope key of the rule
 * @param ruleName    the rule name
 * @param endpoint    request endpoint, if known
 * @param apiProvider external provider, if known
 * @param allowed     the rule's verdict
 * @param limit       the rule limit
 * @param remaining   remaining quota, -1 when unbounded
 * @param retryAfter  retry delay on denial
 */
public record RateLimitEvent(
        Instant timestamp,
        String identifier,
        String scope,
        String ruleName,
        Optional<String> endpoint,
        Optional<String> apiProvider,
        boolean allowed,
        long limit,
        long remaining,
        Optional<Long> retryAfter) {

    public RateLimitEvent {
        endpoint = endpoint != null ? endpoint : Optional.empty();
        apiProvider = apiProvider != null ? apiProvider : Optional.empty();
        retryAfter = retryAfter != null ? retryAfter : Optional.empty();
    }
}
