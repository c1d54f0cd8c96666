package floodgate.core.model.adaptive;

/**
 * Load thresholds above which a metric contributes to the load factor.
 *
 * @param cpu        cpu usage ratio (0..1)
 * @param memory     memory usage ratio (0..1)
 * @param errorRate  error ratio (0..1)
 * @param p95Latency 95th percentile response time in seconds
 */
public record MetricThresholds(double cpu, double memory, double errorRate, double p95Latency) {

    public static final MetricThresholds DEFAULTS = new MetricThresholds(0.8, 0.85, 0.05, 2.0);

    public MetricThresholds {
        if (cpu <= 0 || memory <= 0 || errorRate <= 0 || p95Latency <= 0) {
            throw new IllegalArgumentException("Metric thresholds must be positive");
        }
    }
}
