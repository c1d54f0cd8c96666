package floodgate.core.port.in;

import java.util.List;
import java.util.Optional;

import io.smallrye.mutiny.Uni;

import floodgate.core.model.monitor.TimeRange;
import floodgate.core.model.policy.PolicyEffectiveness;
import floodgate.core.model.policy.RateLimitPolicy;

/**
 * Port for managing rate limit policies.
 *
 * <p>Policies are named bundles of rules assigned to identifiers. Every write
 * republishes the policy's rules to the rule registry.
 */
public interface PolicyManagement {

    /**
     * Create a new policy.
     *
     * @param policy the policy
     * @return Uni with the created policy
     * @throws floodgate.core.model.policy.DuplicatePolicyException if the name is taken
     */
    Uni<RateLimitPolicy> create(RateLimitPolicy policy);

    /**
     * Replace the content of an existing policy, keeping its creation metadata.
     *
     * @param name   the policy name
     * @param policy the new content
     * @return Uni with the updated policy
     * @throws floodgate.core.model.policy.PolicyNotFoundException if unknown
     */
    Uni<RateLimitPolicy> update(String name, RateLimitPolicy policy);

    /**
     * Delete a policy and its assignments.
     *
     * @param name the policy name
     * @return Uni completing when deleted
     * @throws floodgate.core.model.policy.PolicyNotFoundException if unknown
     */
    Uni<Void> delete(String name);

    Uni<Optional<RateLimitPolicy>> get(String name);

    /**
     * @param enabledOnly only list enabled policies
     * @return Uni with policies sorted by priority descending, then name
     */
    Uni<List<RateLimitPolicy>> list(boolean enabledOnly);

    /**
     * Assign an identifier to a policy.
     *
     * @param identifier the client identifier
     * @param policyName the policy name
     * @return Uni completing when assigned
     * @throws floodgate.core.model.policy.PolicyNotFoundException if the policy is unknown
     */
    Uni<Void> assignToIdentifier(String identifier, String policyName);

    /**
     * @param identifier the client identifier
     * @return Uni with the name of the identifier's policy, if one is assigned
     */
    Uni<Optional<String>> getPolicyForIdentifier(String identifier);

    /**
     * @param format bundle format, e.g. {@code json}
     * @return Uni with all policies serialized
     */
    Uni<String> exportAll(String format);

    /**
     * Import a serialized bundle.
     *
     * <p>Malformed entries are skipped. Existing policies are skipped unless
     * {@code overwrite} is set.
     *
     * @param serialized the bundle
     * @param overwrite  replace existing policies with the same name
     * @return Uni with the number of imported policies
     * @throws floodgate.core.model.policy.InvalidImportDataException if the bundle is unreadable
     */
    Uni<Integer> importAll(String serialized, boolean overwrite);

    /**
     * Summarize how a policy's rules behaved.
     *
     * @param name  the policy name
     * @param range lookback window
     * @return Uni with the analysis
     */
    Uni<PolicyEffectiveness> analyzeEffectiveness(String name, TimeRange range);
}
