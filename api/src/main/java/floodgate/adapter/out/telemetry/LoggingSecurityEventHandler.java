package floodgate.adapter.out.telemetry;

import org.jboss.logging.Logger;

import floodgate.spi.SecurityEvent;
import floodgate.spi.SecurityEventHandler;

/**
 * Security event handler that logs events using JBoss Logging.
 *
 * <p>Log levels follow event severity: INFO events at DEBUG, WARNING at WARN,
 * CRITICAL at ERROR.
 */
public class LoggingSecurityEventHandler implements SecurityEventHandler {

    private static final Logger LOG = Logger.getLogger("floodgate.security");

    @Override
    public String name() {
        return "logging";
    }

    @Override
    public int priority() {
        return 0;
    }

    @Override
    public void handle(SecurityEvent event) {
        final var message = formatEvent(event);

        switch (event.severity()) {
            case INFO -> LOG.debug(message);
            case WARNING -> LOG.warn(message);
            case CRITICAL -> LOG.error(message);
        }
    }

    String formatEvent(SecurityEvent event) {
        if (event instanceof SecurityEvent.RateLimitExceeded e) {
            return String.format(
                    "RATE_LIMIT: client=%s scope=%s rule=%s endpoint=%s limit=%d retryAfter=%ds",
                    e.clientIdentifier(), e.scope(), e.ruleName(), e.endpoint(), e.limit(), e.retryAfterSeconds());
        }
        if (event instanceof SecurityEvent.PenaltyApplied e) {
            return String.format(
                    "PENALTY: client=%s rule=%s duration=%ds", e.clientIdentifier(), e.ruleName(), e.penaltySeconds());
        }
        if (event instanceof SecurityEvent.CounterStoreFailure e) {
            return String.format(
                    "STORE_FAILURE: client=%s rule=%s failedClosed=%s reason=%s",
                    e.clientIdentifier(), e.ruleName(), e.failedClosed(), e.reason());
        }
        if (event instanceof SecurityEvent.LimitAdjusted e) {
            return String.format(
                    "LIMIT_ADJUSTED: scope=%s rule=%s %d -> %d load=%.2f",
                    e.scope(), e.ruleName(), e.oldLimit(), e.newLimit(), e.loadFactor());
        }
        return event.toString();
    }
}
