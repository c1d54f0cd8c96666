package floodgate.core.model.policy;

import java.util.List;
import java.util.Map;

/**
 * How a policy's rules behaved over a time range.
 *
 * @param policyName        the analyzed policy
 * @param totalRequests     events recorded under the policy's rules
 * @param blockedRequests   denials among them
 * @param blockRate         blocked / total, 0 when there were no requests
 * @param violationsByRule  denials per rule name
 * @param topViolators      identifiers with the most denials, most first
 * @param assignedIdentifiers number of identifiers assigned to the policy
 * @param recommendations   human-readable tuning hints
 */
public record PolicyEffectiveness(
        String policyName,
        long totalRequests,
        long blockedRequests,
        double blockRate,
        Map<String, Long> violationsByRule,
        List<String> topViolators,
        int assignedIdentifiers,
        List<String> recommendations) {}
