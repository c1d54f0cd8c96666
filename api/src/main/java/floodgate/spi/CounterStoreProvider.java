package floodgate.spi;

import floodgate.core.port.out.CounterStore;

/**
 * Service Provider Interface for counter store implementations.
 *
 * <p>Implementations are discovered via {@link java.util.ServiceLoader} and
 * selected based on priority. Higher priority providers are preferred.
 *
 * <p>Built-in stores:
 * <ul>
 *   <li>In-memory (priority 0) - Default, single-instance only</li>
 *   <li>Redis (priority 10) - Distributed, recommended for production</li>
 * </ul>
 *
 * <p>To contribute a custom store, implement this interface and register it in
 * {@code META-INF/services/floodgate.spi.CounterStoreProvider}.
 *
 * @see CounterStore
 */
public interface CounterStoreProvider {

    /**
     * Return the priority of this provider. Custom implementations should use 100 or above.
     *
     * @return the provider priority
     */
    int priority();

    /**
     * Return the name of this provider for logging and configuration.
     *
     * @return the provider name (e.g., "memory", "redis")
     */
    String name();

    /**
     * Check if this provider can be used in the current environment.
     *
     * @return true if the provider can be used
     */
    boolean isAvailable();

    /**
     * Create a counter store instance. Called once during startup; the store must be thread-safe.
     *
     * @return the counter store
     */
    CounterStore createCounterStore();
}
