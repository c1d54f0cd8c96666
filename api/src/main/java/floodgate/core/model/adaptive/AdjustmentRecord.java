package floodgate.core.model.adaptive;

import java.time.Instant;

/**
 * Audit entry of one applied limit adjustment.
 *
 * @param ruleName        adapted rule
 * @param scope           scope key of the rule
 * @param oldLimit        limit before the adjustment
 * @param newLimit        limit after the adjustment
 * @param direction       tighten or loosen
 * @param loadFactor      the average load that triggered the adjustment
 * @param timestamp       when it was applied
 * @param metricsSnapshot the metrics it was computed from
 */
public record AdjustmentRecord(
        String ruleName,
        String scope,
        long oldLimit,
        long newLimit,
        AdjustmentDirection direction,
        double loadFactor,
        Instant timestamp,
        SystemMetrics metricsSnapshot) {}
