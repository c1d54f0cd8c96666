package floodgate.core.config;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

/**
 * Configuration mapping for metrics and security event dispatch.
 *
 * <p>Configuration prefix: {@code floodgate.telemetry}
 */
@ConfigMapping(prefix = "floodgate.telemetry")
public interface TelemetryConfig {

    /**
     * @return true to record Micrometer metrics (default: true)
     */
    @WithDefault("true")
    boolean enabled();

    /**
     * @return true to dispatch security events to handlers (default: true)
     */
    @WithDefault("true")
    boolean securityEvents();

    /**
     * Events waiting for dispatch beyond this bound are dropped and counted.
     *
     * @return capacity of the security event queue (default: 10000)
     */
    @WithDefault("10000")
    int eventQueueSize();
}
