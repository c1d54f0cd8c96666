package floodgate.adapter.out.storage.memory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

import jakarta.enterprise.context.ApplicationScoped;

import io.smallrye.mutiny.Uni;

import floodgate.core.model.policy.RateLimitPolicy;
import floodgate.core.port.out.PolicyRepository;

/**
 * In-memory implementation of PolicyRepository.
 *
 * <p>Data is NOT persisted across restarts. Policies and assignments are held in
 * concurrent maps; deleting a policy drops its assignments.
 */
@ApplicationScoped
public class InMemoryPolicyRepository implements PolicyRepository {

    private final ConcurrentHashMap<String, RateLimitPolicy> policies = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, String> assignments = new ConcurrentHashMap<>();

    @Override
    public Uni<Void> save(RateLimitPolicy policy) {
        return Uni.createFrom().item(() -> {
            policies.put(policy.name(), policy);
            return null;
        });
    }

    @Override
    public Uni<Boolean> saveIfAbsent(RateLimitPolicy policy) {
        return Uni.createFrom().item(() -> policies.putIfAbsent(policy.name(), policy) == null);
    }

    @Override
    public Uni<Optional<RateLimitPolicy>> findByName(String name) {
        return Uni.createFrom().item(() -> Optional.ofNullable(policies.get(name)));
    }

    @Override
    public Uni<Boolean> delete(String name) {
        return Uni.createFrom().item(() -> {
            final var removed = policies.remove(name) != null;
            if (removed) {
                assignments.values().removeIf(name::equals);
            }
            return removed;
        });
    }

    @Override
    public Uni<List<RateLimitPolicy>> findAll() {
        return Uni.createFrom().item(() -> new ArrayList<>(policies.values()));
    }

    @Override
    public Uni<Boolean> exists(String name) {
        return Uni.createFrom().item(() -> policies.containsKey(name));
    }

    @Override
    public Uni<Void> assign(String identifier, String policyName) {
        return Uni.createFrom().item(() -> {
            assignments.put(identifier, policyName);
            return null;
        });
    }

    @Override
    public Uni<Optional<String>> findAssignment(String identifier) {
        return Uni.createFrom().item(() -> Optional.ofNullable(assignments.get(identifier)));
    }

    @Override
    public Uni<Map<String, String>> findAllAssignments() {
        return Uni.createFrom().item(() -> Map.copyOf(assignments));
    }
}
