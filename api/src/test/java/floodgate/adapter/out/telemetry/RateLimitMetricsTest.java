package floodgate.adapter.out.telemetry;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import floodgate.core.config.TelemetryConfig;

@DisplayName("RateLimitMetrics")
class RateLimitMetricsTest {

    private SimpleMeterRegistry registry;
    private RateLimitMetrics metrics;

    private static TelemetryConfig config(boolean enabled) {
        var config = mock(TelemetryConfig.class);
        when(config.enabled()).thenReturn(enabled);
        return config;
    }

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        metrics = new RateLimitMetrics(registry, config(true));
        metrics.init();
    }

    @Nested
    @DisplayName("When enabled")
    class EnabledTests {

        @Test
        @DisplayName("should count decisions by outcome")
        void shouldCountDecisions() {
            metrics.recordDecision("global", "rps", true);
            metrics.recordDecision("global", "rps", true);
            metrics.recordDecision("global", "rps", false);

            assertEquals(2.0, registry.get("floodgate.ratelimit.decisions")
                    .tag("outcome", "allowed")
                    .counter()
                    .count());
            assertEquals(1.0, registry.get("floodgate.ratelimit.decisions")
                    .tag("outcome", "denied")
                    .counter()
                    .count());
        }

        @Test
        @DisplayName("should tag store failures with the applied failure mode")
        void shouldTagStoreFailures() {
            metrics.recordStoreFailure("auth-attempts", true);

            assertEquals(1.0, registry.get("floodgate.ratelimit.store.failures")
                    .tags("rule", "auth-attempts", "outcome", "fail_closed")
                    .counter()
                    .count());
        }

        @Test
        @DisplayName("should count adjustments by direction")
        void shouldCountAdjustments() {
            metrics.recordAdjustment("rps", "tighten");

            assertEquals(1.0, registry.get("floodgate.adaptive.adjustments")
                    .tag("direction", "tighten")
                    .counter()
                    .count());
        }

        @Test
        @DisplayName("should gauge held slots and never go negative")
        void shouldGaugeHeldSlots() {
            metrics.recordSlotChange(1);
            metrics.recordSlotChange(1);
            metrics.recordSlotChange(-1);

            assertEquals(1.0, registry.get("floodgate.concurrency.slots.held").gauge().value());

            metrics.recordSlotChange(-5);
            assertEquals(0, metrics.heldSlots());
        }
    }

    @Test
    @DisplayName("should record nothing when disabled")
    void shouldRecordNothingWhenDisabled() {
        var quiet = new SimpleMeterRegistry();
        var disabled = new RateLimitMetrics(quiet, config(false));
        disabled.init();

        disabled.recordDecision("global", "rps", false);
        disabled.recordSlotChange(1);

        assertNull(quiet.find("floodgate.ratelimit.decisions").counter());
        assertNull(quiet.find("floodgate.concurrency.slots.held").gauge());
        assertEquals(0, disabled.heldSlots());
    }
}
