package floodgate.core.model.adaptive;

import java.time.Instant;

/**
 * A system load sample pushed by an external collector.
 *
 * <p>Any metric may be absent ({@code null}). An absent metric is not read as
 * zero: it simply does not take part in load evaluation.
 *
 * @param cpuUsage        cpu usage ratio (0..1)
 * @param memoryUsage     memory usage ratio (0..1)
 * @param requestRate     requests per second
 * @param errorRate       error ratio (0..1)
 * @param p95ResponseTime 95th percentile response time in seconds
 * @param timestamp       when the sample was taken
 */
public record SystemMetrics(
        Double cpuUsage,
        Double memoryUsage,
        Double requestRate,
        Double errorRate,
        Double p95ResponseTime,
        Instant timestamp) {

    public SystemMetrics {
        if (timestamp == null) {
            throw new IllegalArgumentException("Metrics timestamp is required");
        }
        if (negative(cpuUsage)
                || negative(memoryUsage)
                || negative(requestRate)
                || negative(errorRate)
                || negative(p95ResponseTime)) {
            throw new IllegalArgumentException("Metrics cannot be negative");
        }
    }

    /**
     * @return true if at least one of the metrics that drive adjustments (cpu,
     *         memory, error rate, p95 latency) is present
     */
    public boolean hasLoadSignal() {
        return cpuUsage != null || memoryUsage != null || errorRate != null || p95ResponseTime != null;
    }

    private static boolean negative(Double value) {
        return value != null && value < 0;
    }
}
