package floodgate.core.config;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

/**
 * Configuration mapping for the decision event log.
 *
 * <p>Configuration prefix: {@code floodgate.monitoring}
 */
@ConfigMapping(prefix = "floodgate.monitoring")
public interface MonitoringConfig {

    /**
     * Capacity of the event ring buffer; the oldest events are evicted beyond it.
     *
     * @return max events (default: 10000)
     */
    @WithDefault("10000")
    int maxEvents();

    /**
     * @return number of identifiers listed as top violators (default: 10)
     */
    @WithDefault("10")
    int topViolators();
}
