package floodgate.core.model.monitor;

import java.util.List;
import java.util.Map;

/**
 * Denials over a time range.
 *
 * @param range            the analyzed range
 * @param totalEvents      all recorded evaluations in range
 * @param violations       denied evaluations in range
 * @param violationRate    violations / totalEvents
 * @param topViolators     identifiers with the most denials
 * @param violationsByRule denial histogram per rule name
 * @param violationsByEndpoint denial histogram per endpoint
 */
public record ViolationSummary(
        String range,
        long totalEvents,
        long violations,
        double violationRate,
        List<ViolatorCount> topViolators,
        Map<String, Long> violationsByRule,
        Map<String, Long> violationsByEndpoint) {

    /**
     * Denial count of one identifier.
     */
    public record ViolatorCount(String identifier, long violations) {}
}
