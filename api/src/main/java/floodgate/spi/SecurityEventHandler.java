package floodgate.spi;

/**
 * SPI for handling security events raised by the rate limiter.
 *
 * <p>Handlers are loaded through {@link java.util.ServiceLoader} and called one
 * event at a time from a single dispatch thread, so implementations need not be
 * thread-safe. A slow handler delays the others and, once the dispatch queue is
 * full, causes events to be dropped.
 *
 * <p>Built-in handlers:
 * <ul>
 *   <li>{@code logging} - Logs events using JBoss Logging (priority 0)</li>
 *   <li>{@code metrics} - Records events as Micrometer metrics (priority 10)</li>
 * </ul>
 *
 * <p>Register implementations in:
 * {@code META-INF/services/floodgate.spi.SecurityEventHandler}
 */
public interface SecurityEventHandler {

    /**
     * @return handler name used in logs, e.g. {@code logging}
     */
    String name();

    /**
     * Higher priority handlers see each event first.
     */
    default int priority() {
        return 0;
    }

    /**
     * Unavailable handlers are skipped when the dispatcher starts.
     */
    default boolean isAvailable() {
        return true;
    }

    /**
     * A runtime exception is logged by the dispatcher and does not stop delivery
     * to the remaining handlers.
     */
    void handle(SecurityEvent event);

    /**
     * Called once at shutdown, after queued events have drained.
     */
    default void close() {}
}
