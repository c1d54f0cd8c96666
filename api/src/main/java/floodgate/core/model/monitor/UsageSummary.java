package floodgate.core.model.monitor;

import java.util.Map;

/**
 * Traffic distribution over a time range.
 *
 * @param range          the analyzed range
 * @param totalRequests  recorded evaluations in range
 * @param byProvider     evaluations per external provider
 * @param byEndpoint     evaluations per endpoint
 * @param deniedByProvider denials per external provider
 * @param uniqueIdentifiers distinct identifiers seen
 */
public record UsageSummary(
        String range,
        long totalRequests,
        Map<String, Long> byProvider,
        Map<String, Long> byEndpoint,
        Map<String, Long> deniedByProvider,
        long uniqueIdentifiers) {}
