package floodgate.core.model.monitor;

import java.time.Instant;
import java.util.List;

import floodgate.core.model.adaptive.AdjustmentRecord;

/**
 * Combined monitoring report.
 *
 * @param generatedAt       when the report was built
 * @param violations        denials in range
 * @param usage             traffic in range
 * @param recentAdjustments adaptive adjustments applied in range
 * @param bufferedEvents    events currently held in the log
 */
public record SecuritySummary(
        Instant generatedAt,
        ViolationSummary violations,
        UsageSummary usage,
        List<AdjustmentRecord> recentAdjustments,
        int bufferedEvents) {}
