package floodgate.core.port.in;

import java.util.List;

import io.smallrye.mutiny.Uni;

import floodgate.core.model.monitor.ExportFormat;
import floodgate.core.model.monitor.HourlyBucket;
import floodgate.core.model.monitor.SecuritySummary;
import floodgate.core.model.monitor.TimeRange;
import floodgate.core.model.monitor.UsageSummary;
import floodgate.core.model.monitor.ViolationSummary;

/**
 * Port for read-side analytics over recorded decisions.
 */
public interface RateLimitMonitoring {

    Uni<ViolationSummary> violationSummary(TimeRange range);

    Uni<UsageSummary> apiUsageSummary(TimeRange range);

    /**
     * @param days number of past days to aggregate
     * @return Uni with 24 buckets, hour 0 first
     */
    Uni<List<HourlyBucket>> hourlyPattern(int days);

    /**
     * @param format export format
     * @return Uni with every buffered event serialized
     */
    Uni<String> export(ExportFormat format);

    Uni<SecuritySummary> getSecuritySummary(TimeRange range);
}
