package floodgate.core.service.adaptive;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;

import java.time.Duration;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import floodgate.core.model.adaptive.AdaptiveRule;
import floodgate.core.model.adaptive.AdjustmentDirection;
import floodgate.core.model.adaptive.MetricThresholds;
import floodgate.core.model.adaptive.SystemMetrics;
import floodgate.core.model.ratelimit.LimitType;
import floodgate.core.model.ratelimit.RateLimitRule;
import floodgate.core.model.ratelimit.RateLimitScope;
import floodgate.core.model.ratelimit.RuleConfigurationException;
import floodgate.core.port.out.Metrics;
import floodgate.core.port.out.SecurityEventPublisher;
import floodgate.core.service.ratelimit.EndpointPatternMatcher;
import floodgate.core.service.ratelimit.RuleRegistry;
import floodgate.mock.MutableClock;
import floodgate.spi.SecurityEvent;

@DisplayName("AdaptiveService")
class AdaptiveServiceTest {

    private static final Duration TIMEOUT = Duration.ofSeconds(1);

    private MutableClock clock;
    private RuleRegistry ruleRegistry;
    private Metrics metrics;
    private SecurityEventPublisher securityEvents;
    private AdaptiveService service;

    @BeforeEach
    void setUp() {
        clock = MutableClock.startingAt("2024-05-01T12:00:00Z");
        ruleRegistry = new RuleRegistry(new EndpointPatternMatcher());
        metrics = mock(Metrics.class);
        securityEvents = mock(SecurityEventPublisher.class);
        service = new AdaptiveService(true, Duration.ofMinutes(2), 3, ruleRegistry, metrics, securityEvents, clock);

        ruleRegistry.register(RateLimitScope.global(), RateLimitRule.of("rps", LimitType.PER_SECOND, 1000));
        service.registerAdaptiveRule(new AdaptiveRule(
                        RateLimitScope.global(), "rps", 100, 5000, 0.2, MetricThresholds.DEFAULTS,
                        Duration.ofMinutes(5)))
                .await()
                .atMost(TIMEOUT);
    }

    private SystemMetrics cpu(double usage) {
        return new SystemMetrics(usage, 0.0, 50.0, 0.0, 0.0, clock.instant());
    }

    private long currentLimit() {
        return ruleRegistry.find(RateLimitScope.global(), "rps").orElseThrow().limit();
    }

    @Nested
    @DisplayName("Adjustments")
    class AdjustmentTests {

        @Test
        @DisplayName("should tighten under load and then hold during cooldown")
        void shouldTightenThenHoldDuringCooldown() {
            var applied = service.updateSystemMetrics(cpu(0.95)).await().atMost(TIMEOUT);

            assertEquals(1, applied.size());
            assertEquals(1000, applied.get(0).oldLimit());
            assertEquals(810, applied.get(0).newLimit());
            assertEquals(AdjustmentDirection.TIGHTEN, applied.get(0).direction());
            assertEquals(810, currentLimit());

            clock.advance(Duration.ofMinutes(1));
            var second = service.updateSystemMetrics(cpu(0.95)).await().atMost(TIMEOUT);

            assertTrue(second.isEmpty());
            assertEquals(810, currentLimit());
        }

        @Test
        @DisplayName("should compound from the current limit after the cooldown")
        void shouldCompoundAfterCooldown() {
            service.updateSystemMetrics(cpu(0.95)).await().atMost(TIMEOUT);
            clock.advance(Duration.ofMinutes(5));

            service.updateSystemMetrics(cpu(0.95)).await().atMost(TIMEOUT);

            assertEquals(Math.round(810 - 810 * 0.95 * 0.2), currentLimit());
        }

        @Test
        @DisplayName("should publish metrics and a security event per adjustment")
        void shouldPublishAdjustment() {
            service.updateSystemMetrics(cpu(0.95)).await().atMost(TIMEOUT);

            verify(metrics).recordAdjustment("rps", "tighten");
            verify(securityEvents).publish(any(SecurityEvent.LimitAdjusted.class));
        }

        @Test
        @DisplayName("should ignore stale metrics")
        void shouldIgnoreStaleMetrics() {
            var stale = new SystemMetrics(0.95, 0.0, 50.0, 0.0, 0.0, clock.instant().minus(Duration.ofMinutes(3)));

            assertTrue(service.updateSystemMetrics(stale).await().atMost(TIMEOUT).isEmpty());
            assertEquals(1000, currentLimit());
        }

        @Test
        @DisplayName("should skip a sample without load metrics")
        void shouldSkipSampleWithoutLoadMetrics() {
            var empty = new SystemMetrics(null, null, null, null, null, clock.instant());

            assertTrue(service.updateSystemMetrics(empty).await().atMost(TIMEOUT).isEmpty());
            assertTrue(service.evaluateLatest().isEmpty());
            assertEquals(1000, currentLimit());
        }

        @Test
        @DisplayName("should re-evaluate the latest sample on demand")
        void shouldReevaluateLatestSample() {
            service.registerAdaptiveRule(new AdaptiveRule(
                            RateLimitScope.global(), "rps", 100, 5000, 0.2, null, Duration.ofSeconds(30)))
                    .await()
                    .atMost(TIMEOUT);
            assertTrue(service.evaluateLatest().isEmpty());
            service.updateSystemMetrics(cpu(0.1)).await().atMost(TIMEOUT);
            clock.advance(Duration.ofMinutes(1));

            var applied = service.evaluateLatest();

            assertEquals(1, applied.size());
            assertEquals(AdjustmentDirection.LOOSEN, applied.get(0).direction());
        }

        @Test
        @DisplayName("should keep a bounded history")
        void shouldKeepBoundedHistory() {
            for (int i = 0; i < 5; i++) {
                service.updateSystemMetrics(cpu(0.0)).await().atMost(TIMEOUT);
                clock.advance(Duration.ofMinutes(5));
            }

            var history = service.adjustmentHistory().await().atMost(TIMEOUT);

            assertEquals(3, history.size());
            assertEquals(currentLimit(), history.get(2).newLimit());
            assertEquals(1, service.recentAdjustments(1).size());
        }

        @Test
        @DisplayName("should do nothing when disabled")
        void shouldDoNothingWhenDisabled() {
            var disabled = new AdaptiveService(
                    false, Duration.ofMinutes(2), 10, ruleRegistry, metrics, securityEvents, clock);
            disabled.registerAdaptiveRule(new AdaptiveRule(
                            RateLimitScope.global(), "rps", 100, 5000, 0.2, null, null))
                    .await()
                    .atMost(TIMEOUT);

            assertTrue(disabled.updateSystemMetrics(cpu(0.95)).await().atMost(TIMEOUT).isEmpty());
            assertEquals(1000, currentLimit());
        }
    }

    @Nested
    @DisplayName("Registration")
    class RegistrationTests {

        @Test
        @DisplayName("should reject bounds for an unknown rule")
        void shouldRejectUnknownRule() {
            var unknown = new AdaptiveRule(RateLimitScope.user(), "missing", 1, 10, 0.2, null, null);

            assertThrows(RuleConfigurationException.class,
                    () -> service.registerAdaptiveRule(unknown).await().atMost(TIMEOUT));
        }

        @Test
        @DisplayName("should reject inverted bounds")
        void shouldRejectInvertedBounds() {
            assertThrows(IllegalArgumentException.class,
                    () -> new AdaptiveRule(RateLimitScope.global(), "rps", 500, 100, 0.2, null, null));
        }

        @Test
        @DisplayName("should unregister by scope key and rule name")
        void shouldUnregister() {
            assertTrue(service.unregisterAdaptiveRule("global", "rps").await().atMost(TIMEOUT));
            assertFalse(service.unregisterAdaptiveRule("global", "rps").await().atMost(TIMEOUT));
            assertTrue(service.listAdaptiveRules().await().atMost(TIMEOUT).isEmpty());
        }

        @Test
        @DisplayName("should skip rules removed from the registry")
        void shouldSkipRemovedRules() {
            ruleRegistry.remove(RateLimitScope.global(), "rps");

            assertTrue(service.updateSystemMetrics(cpu(0.95)).await().atMost(TIMEOUT).isEmpty());
        }
    }
}
