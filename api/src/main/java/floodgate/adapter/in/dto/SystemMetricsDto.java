package floodgate.adapter.in.dto;

import java.time.Instant;

import floodgate.core.model.adaptive.SystemMetrics;

/**
 * DTO for system load samples. Omitted metrics stay absent.
 *
 * @param cpuUsage        cpu usage ratio (0..1)
 * @param memoryUsage     memory usage ratio (0..1)
 * @param requestRate     requests per second
 * @param errorRate       error ratio (0..1)
 * @param p95ResponseTime p95 latency in seconds
 * @param timestamp       sample time, defaults to the time of receipt
 */
public record SystemMetricsDto(
        Double cpuUsage,
        Double memoryUsage,
        Double requestRate,
        Double errorRate,
        Double p95ResponseTime,
        Instant timestamp) {

    public SystemMetrics toModel(Instant receivedAt) {
        return new SystemMetrics(
                cpuUsage,
                memoryUsage,
                requestRate,
                errorRate,
                p95ResponseTime,
                timestamp != null ? timestamp : receivedAt);
    }
}
