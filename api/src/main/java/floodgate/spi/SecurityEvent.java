package floodgate.spi;

import java.time.Instant;

/**
 * Sealed interface representing security-relevant events raised by the rate limiter.
 *
 * <p>Events are dispatched to registered {@link SecurityEventHandler}
 * implementations for alerting, logging and metrics recording.
 *
 * <p>Event types:
 * <ul>
 *   <li>{@link RateLimitExceeded} - A client was denied by a rule</li>
 *   <li>{@link PenaltyApplied} - A client was locked out after a denial</li>
 *   <li>{@link CounterStoreFailure} - The counter store failed during a check</li>
 *   <li>{@link LimitAdjusted} - The adaptive controller changed a limit</li>
 * </ul>
 */
public sealed interface SecurityEvent {

    /**
     * Return the timestamp when this event occurred.
     *
     * @return event timestamp
     */
    Instant timestamp();

    /**
     * Return the client identifier, or {@code "system"} for events not tied to a client.
     *
     * @return client identifier
     */
    String clientIdentifier();

    /**
     * Return the severity level of this event.
     *
     * @return severity level
     */
    Severity severity();

    /**
     * Severity levels for security events.
     */
    enum Severity {
        /** Informational events. */
        INFO,
        /** Events requiring attention. */
        WARNING,
        /** Events requiring immediate action. */
        CRITICAL
    }

    /**
     * Rate limit exceeded event.
     *
     * @param timestamp        when the limit was exceeded
     * @param clientIdentifier the denied identifier
     * @param scope            scope key of the denying rule
     * @param ruleName         the denying rule
     * @param endpoint         request endpoint, may be null
     * @param limit            the rule limit
     * @param retryAfterSeconds advertised retry delay
     */
    record RateLimitExceeded(
            Instant timestamp,
            String clientIdentifier,
            String scope,
            String ruleName,
            String endpoint,
            long limit,
            long retryAfterSeconds)
            implements SecurityEvent {

        @Override
        public Severity severity() {
            return retryAfterSeconds > 3600 ? Severity.WARNING : Severity.INFO;
        }
    }

    /**
     * Penalty lock-out event.
     *
     * @param timestamp        when the penalty started
     * @param clientIdentifier the penalized identifier
     * @param ruleName         the rule that imposed the penalty
     * @param penaltySeconds   lock-out duration
     */
    record PenaltyApplied(Instant timestamp, String clientIdentifier, String ruleName, long penaltySeconds)
            implements SecurityEvent {

        @Override
        public Severity severity() {
            return Severity.WARNING;
        }
    }

    /**
     * Counter store failure event.
     *
     * @param timestamp        when the failure was observed
     * @param clientIdentifier the identifier being checked
     * @param ruleName         the rule being evaluated
     * @param failedClosed     whether the request was denied because of the failure
     * @param reason           failure message
     */
    record CounterStoreFailure(
            Instant timestamp, String clientIdentifier, String ruleName, boolean failedClosed, String reason)
            implements SecurityEvent {

        @Override
        public Severity severity() {
            return Severity.CRITICAL;
        }
    }

    /**
     * Adaptive limit adjustment event.
     *
     * @param timestamp  when the adjustment was applied
     * @param scope      scope key of the rule
     * @param ruleName   the adjusted rule
     * @param oldLimit   limit before
     * @param newLimit   limit after
     * @param loadFactor the load that triggered it
     */
    record LimitAdjusted(
            Instant timestamp, String scope, String ruleName, long oldLimit, long newLimit, double loadFactor)
            implements SecurityEvent {

        @Override
        public String clientIdentifier() {
            return "system";
        }

        @Override
        public Severity severity() {
            return newLimit < oldLimit ? Severity.WARNING : Severity.INFO;
        }
    }
}
