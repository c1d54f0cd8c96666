package floodgate.adapter.out.telemetry;

import java.util.concurrent.atomic.AtomicLong;

import jakarta.annotation.PostConstruct;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;

import floodgate.core.config.TelemetryConfig;
import floodgate.core.port.out.Metrics;

/**
 * Records rate limiter metrics using Micrometer.
 *
 * <p>All methods are no-ops when telemetry is disabled.
 *
 * <p>Metrics recorded:
 * <ul>
 *   <li>{@code floodgate.ratelimit.decisions} - Rule evaluations by scope, rule and outcome</li>
 *   <li>{@code floodgate.ratelimit.store.failures} - Counter store failures by rule and outcome</li>
 *   <li>{@code floodgate.adaptive.adjustments} - Adaptive limit changes by rule and direction</li>
 *   <li>{@code floodgate.concurrency.slots.held} - Concurrency slots currently held</li>
 * </ul>
 */
@ApplicationScoped
public class RateLimitMetrics implements Metrics {

    private final MeterRegistry registry;
    private final boolean enabled;
    private final AtomicLong heldSlots = new AtomicLong(0);

    @Inject
    public RateLimitMetrics(MeterRegistry registry, TelemetryConfig config) {
        this.registry = registry;
        this.enabled = config != null && config.enabled();
    }

    @PostConstruct
    void init() {
        if (!enabled) {
            return;
        }

        Gauge.builder("floodgate.concurrency.slots.held", heldSlots, AtomicLong::get)
                .description("Concurrency slots acquired and not yet released")
                .register(registry);
    }

    @Override
    public boolean isEnabled() {
        return enabled;
    }

    @Override
    public void recordDecision(String scope, String ruleName, boolean allowed) {
        if (!enabled) {
            return;
        }

        Counter.builder("floodgate.ratelimit.decisions")
                .description("Rule evaluations")
                .tag("scope", scope)
                .tag("rule", ruleName)
                .tag("outcome", allowed ? "allowed" : "denied")
                .register(registry)
                .increment();
    }

    @Override
    public void recordStoreFailure(String ruleName, boolean failedClosed) {
        if (!enabled) {
            return;
        }

        Counter.builder("floodgate.ratelimit.store.failures")
                .description("Counter store failures during evaluation")
                .tag("rule", ruleName)
                .tag("outcome", failedClosed ? "fail_closed" : "fail_open")
                .register(registry)
                .increment();
    }

    @Override
    public void recordAdjustment(String ruleName, String direction) {
        if (!enabled) {
            return;
        }

        Counter.builder("floodgate.adaptive.adjustments")
                .description("Adaptive limit adjustments")
                .tag("rule", ruleName)
                .tag("direction", direction)
                .register(registry)
                .increment();
    }

    @Override
    public void recordSlotChange(int delta) {
        if (!enabled) {
            return;
        }
        heldSlots.updateAndGet(current -> Math.max(0, current + delta));
    }

    long heldSlots() {
        return heldSlots.get();
    }
}
