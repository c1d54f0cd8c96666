package floodgate.core.port.out;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import io.smallrye.mutiny.Uni;

import floodgate.core.model.policy.RateLimitPolicy;

/**
 * Port interface for storage of rate limit policies and their assignments.
 */
public interface PolicyRepository {

    /**
     * Save or update a policy.
     *
     * @param policy the policy to persist
     * @return Uni completing when saved
     */
    Uni<Void> save(RateLimitPolicy policy);

    /**
     * Save a policy only if none with the same name exists.
     *
     * @param policy the policy to persist
     * @return Uni with true if saved, false if the name was taken
     */
    Uni<Boolean> saveIfAbsent(RateLimitPolicy policy);

    Uni<Optional<RateLimitPolicy>> findByName(String name);

    /**
     * Delete a policy and every assignment to it.
     *
     * @param name the policy name
     * @return Uni with true if deleted, false if not found
     */
    Uni<Boolean> delete(String name);

    Uni<List<RateLimitPolicy>> findAll();

    Uni<Boolean> exists(String name);

    /**
     * Assign an identifier to a policy, replacing any previous assignment.
     *
     * @param identifier the client identifier
     * @param policyName the policy name
     * @return Uni completing when saved
     */
    Uni<Void> assign(String identifier, String policyName);

    /**
     * @param identifier the client identifier
     * @return Uni with the assigned policy name, if any
     */
    Uni<Optional<String>> findAssignment(String identifier);

    /**
     * @return Uni with every identifier to policy assignment
     */
    Uni<Map<String, String>> findAllAssignments();
}
