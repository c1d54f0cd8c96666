package floodgate.core.service.monitor;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.mock;

import java.time.Duration;
import java.util.Optional;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import floodgate.adapter.out.serialization.JsonCsvEventExporter;
import floodgate.core.model.adaptive.AdaptiveRule;
import floodgate.core.model.adaptive.SystemMetrics;
import floodgate.core.model.monitor.ExportFormat;
import floodgate.core.model.monitor.RateLimitEvent;
import floodgate.core.model.monitor.TimeRange;
import floodgate.core.model.ratelimit.LimitType;
import floodgate.core.model.ratelimit.RateLimitRule;
import floodgate.core.model.ratelimit.RateLimitScope;
import floodgate.core.port.out.Metrics;
import floodgate.core.port.out.SecurityEventPublisher;
import floodgate.core.service.adaptive.AdaptiveService;
import floodgate.core.service.ratelimit.EndpointPatternMatcher;
import floodgate.core.service.ratelimit.RuleRegistry;
import floodgate.mock.MutableClock;

@DisplayName("MonitoringService")
class MonitoringServiceTest {

    private static final Duration TIMEOUT = Duration.ofSeconds(1);

    private MutableClock clock;
    private RateLimitEventLog eventLog;
    private AdaptiveService adaptiveService;
    private MonitoringService service;

    @BeforeEach
    void setUp() {
        clock = MutableClock.startingAt("2024-05-01T12:00:00Z");
        eventLog = new RateLimitEventLog(100);
        var registry = new RuleRegistry(new EndpointPatternMatcher());
        registry.register(RateLimitScope.global(), RateLimitRule.of("rps", LimitType.PER_SECOND, 1000));
        adaptiveService = new AdaptiveService(
                true, Duration.ofMinutes(2), 10, registry, mock(Metrics.class),
                mock(SecurityEventPublisher.class), clock);
        service = new MonitoringService(
                eventLog, new JsonCsvEventExporter(new ObjectMapper()), adaptiveService, 10, clock);
    }

    private void record(Duration ago, String identifier, boolean allowed) {
        eventLog.record(new RateLimitEvent(
                clock.instant().minus(ago), identifier, "global", "rps", Optional.of("/api/x"), Optional.empty(),
                allowed, 10, allowed ? 3 : 0, allowed ? Optional.empty() : Optional.of(1L)));
    }

    @Test
    @DisplayName("violation summary should only cover the requested range")
    void violationSummaryShouldCoverRange() {
        record(Duration.ofMinutes(5), "user:a", false);
        record(Duration.ofMinutes(90), "user:b", false);

        var lastHour = service.violationSummary(TimeRange.parse("1h")).await().atMost(TIMEOUT);
        var lastDay = service.violationSummary(TimeRange.parse("24h")).await().atMost(TIMEOUT);

        assertEquals(1, lastHour.violations());
        assertEquals(2, lastDay.violations());
    }

    @Test
    @DisplayName("hourly pattern should reject non-positive days")
    void hourlyPatternShouldRejectNonPositiveDays() {
        assertThrows(IllegalArgumentException.class, () -> service.hourlyPattern(0).await().atMost(TIMEOUT));
        assertEquals(24, service.hourlyPattern(7).await().atMost(TIMEOUT).size());
    }

    @Test
    @DisplayName("export should write every buffered event")
    void exportShouldWriteEveryEvent() {
        record(Duration.ofMinutes(1), "user:a", true);
        record(Duration.ofMinutes(2), "user:b", false);

        var csv = service.export(ExportFormat.CSV).await().atMost(TIMEOUT);

        assertEquals(3, csv.strip().split("\n").length);
    }

    @Test
    @DisplayName("security summary should include adjustments in range")
    void securitySummaryShouldIncludeAdjustments() {
        adaptiveService.registerAdaptiveRule(new AdaptiveRule(RateLimitScope.global(), "rps", 100, 5000, 0.2, null, null))
                .await()
                .atMost(TIMEOUT);
        adaptiveService.updateSystemMetrics(new SystemMetrics(0.95, 0.0, 10.0, 0.0, 0.0, clock.instant()))
                .await()
                .atMost(TIMEOUT);
        record(Duration.ofMinutes(1), "user:a", false);

        var summary = service.getSecuritySummary(TimeRange.LAST_HOUR).await().atMost(TIMEOUT);

        assertEquals(1, summary.recentAdjustments().size());
        assertEquals(1, summary.violations().violations());
        assertEquals(1, summary.bufferedEvents());
        assertEquals(clock.instant(), summary.generatedAt());

        clock.advance(Duration.ofHours(2));
        assertTrue(service.getSecuritySummary(TimeRange.LAST_HOUR).await().atMost(TIMEOUT)
                .recentAdjustments().isEmpty());
    }
}
