package floodgate.core.service.monitor;

import java.time.Clock;
import java.time.Duration;
import java.util.List;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.smallrye.mutiny.Uni;

import floodgate.core.config.MonitoringConfig;
import floodgate.core.model.monitor.ExportFormat;
import floodgate.core.model.monitor.HourlyBucket;
import floodgate.core.model.monitor.SecuritySummary;
import floodgate.core.model.monitor.TimeRange;
import floodgate.core.model.monitor.UsageSummary;
import floodgate.core.model.monitor.ViolationSummary;
import floodgate.core.port.in.RateLimitMonitoring;
import floodgate.core.port.out.EventExporter;
import floodgate.core.service.adaptive.AdaptiveService;

/**
 * Read-side reports over the decision event log.
 */
@ApplicationScoped
public class MonitoringService implements RateLimitMonitoring {

    private final RateLimitEventLog eventLog;
    private final EventExporter exporter;
    private final AdaptiveService adaptiveService;
    private final int topViolators;
    private final Clock clock;

    @Inject
    public MonitoringService(
            RateLimitEventLog eventLog,
            EventExporter exporter,
            AdaptiveService adaptiveService,
            MonitoringConfig config,
            Clock clock) {
        this(eventLog, exporter, adaptiveService, config.topViolators(), clock);
    }

    public MonitoringService(
            RateLimitEventLog eventLog,
            EventExporter exporter,
            AdaptiveService adaptiveService,
            int topViolators,
            Clock clock) {
        this.eventLog = eventLog;
        this.exporter = exporter;
        this.adaptiveService = adaptiveService;
        this.topViolators = topViolators;
        this.clock = clock;
    }

    @Override
    public Uni<ViolationSummary> violationSummary(TimeRange range) {
        return Uni.createFrom().item(() -> buildViolations(range));
    }

    @Override
    public Uni<UsageSummary> apiUsageSummary(TimeRange range) {
        return Uni.createFrom().item(() -> buildUsage(range));
    }

    @Override
    public Uni<List<HourlyBucket>> hourlyPattern(int days) {
        if (days <= 0) {
            return Uni.createFrom().failure(new IllegalArgumentException("days must be positive, got " + days));
        }
        return Uni.createFrom().item(() -> {
            final var since = clock.instant().minus(Duration.ofDays(days));
            return RateLimitAnalytics.hourly(eventLog.since(since));
        });
    }

    @Override
    public Uni<String> export(ExportFormat format) {
        return Uni.createFrom().item(() -> exporter.export(eventLog.snapshot(), format));
    }

    @Override
    public Uni<SecuritySummary> getSecuritySummary(TimeRange range) {
        return Uni.createFrom().item(() -> {
            final var now = clock.instant();
            final var since = range.since(now);
            final var adjustments = adaptiveService.recentAdjustments(Integer.MAX_VALUE).stream()
                    .filter(record -> !record.timestamp().isBefore(since))
                    .toList();
            return new SecuritySummary(now, buildViolations(range), buildUsage(range), adjustments, eventLog.size());
        });
    }

    private ViolationSummary buildViolations(TimeRange range) {
        final var events = eventLog.since(range.since(clock.instant()));
        return RateLimitAnalytics.violations(range.label(), events, topViolators);
    }

    private UsageSummary buildUsage(TimeRange range) {
        final var events = eventLog.since(range.since(clock.instant()));
        return RateLimitAnalytics.usage(range.label(), events);
    }
}
