package floodgate.core.port.out;

import floodgate.spi.SecurityEvent;

/**
 * Port interface for publishing security events to registered handlers.
 *
 * <p>Publishing never blocks the caller and never fails it.
 */
public interface SecurityEventPublisher {

    void publish(SecurityEvent event);
}
