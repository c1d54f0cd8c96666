package floodgate.adapter.out.telemetry;

import java.util.Locale;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;

import floodgate.spi.SecurityEvent;
import floodgate.spi.SecurityEventHandler;

/**
 * Security event handler that records events as Micrometer metrics.
 *
 * <p>Metrics recorded:
 * <ul>
 *   <li>{@code floodgate.security.events.total} - Events by type and severity</li>
 *   <li>{@code floodgate.security.rate_limit.exceeded} - Denials by scope and rule</li>
 *   <li>{@code floodgate.security.penalties} - Penalty lock-outs by rule</li>
 * </ul>
 */
public class MetricsSecurityEventHandler implements SecurityEventHandler {

    private MeterRegistry registry;

    public MetricsSecurityEventHandler() {
        // Default constructor for ServiceLoader
    }

    public MetricsSecurityEventHandler(MeterRegistry registry) {
        this.registry = registry;
    }

    /**
     * Called by the dispatcher after ServiceLoader instantiation.
     *
     * @param registry the Micrometer registry
     */
    public void setMeterRegistry(MeterRegistry registry) {
        this.registry = registry;
    }

    @Override
    public String name() {
        return "metrics";
    }

    @Override
    public int priority() {
        return 10;
    }

    @Override
    public boolean isAvailable() {
        return registry != null;
    }

    @Override
    public void handle(SecurityEvent event) {
        if (registry == null) {
            return;
        }

        Counter.builder("floodgate.security.events.total")
                .description("Total security events")
                .tag("event_type", event.getClass().getSimpleName())
                .tag("severity", event.severity().name().toLowerCase(Locale.ROOT))
                .register(registry)
                .increment();

        if (event instanceof SecurityEvent.RateLimitExceeded e) {
            Counter.builder("floodgate.security.rate_limit.exceeded")
                    .description("Rate limit violations")
                    .tag("scope", e.scope())
                    .tag("rule", e.ruleName())
                    .register(registry)
                    .increment();
        } else if (event instanceof SecurityEvent.PenaltyApplied e) {
            Counter.builder("floodgate.security.penalties")
                    .description("Penalty lock-outs")
                    .tag("rule", e.ruleName())
                    .register(registry)
                    .increment();
        }
    }
}
