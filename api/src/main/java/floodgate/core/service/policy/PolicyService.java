package floodgate.core.service.policy;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Instance;
import jakarta.inject.Inject;

import io.smallrye.mutiny.Multi;
import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import floodgate.core.config.MonitoringConfig;
import floodgate.core.model.monitor.RateLimitEvent;
import floodgate.core.model.monitor.TimeRange;
import floodgate.core.model.policy.DuplicatePolicyException;
import floodgate.core.model.policy.PolicyEffectiveness;
import floodgate.core.model.policy.PolicyImportEntry;
import floodgate.core.model.policy.PolicyNotFoundException;
import floodgate.core.model.policy.RateLimitPolicy;
import floodgate.core.model.ratelimit.RateLimitScope;
import floodgate.core.model.ratelimit.RuleConfigurationException;
import floodgate.core.port.in.PolicyManagement;
import floodgate.core.port.out.PolicyCodec;
import floodgate.core.port.out.PolicyRepository;
import floodgate.core.service.monitor.RateLimitEventLog;
import floodgate.core.service.ratelimit.RuleRegistry;

/**
 * Manages rate limit policies and keeps the rule registry in step with them.
 *
 * <p>Each write publishes the policy's rules under its {@code policy:{name}}
 * scope. A disabled or deleted policy publishes an empty scope, so identifiers
 * assigned to it fall back to the static scopes.
 */
@ApplicationScoped
public class PolicyService implements PolicyManagement {

    private static final Logger LOG = Logger.getLogger(PolicyService.class);

    private static final Comparator<RateLimitPolicy> LISTING_ORDER = Comparator.comparingInt(
                    RateLimitPolicy::priority)
            .reversed()
            .thenComparing(RateLimitPolicy::name);

    static final double HIGH_BLOCK_RATE = 0.2;
    static final double LOW_BLOCK_RATE = 0.01;
    static final long MIN_SAMPLE = 100;

    private final PolicyRepository repository;
    private final RuleRegistry ruleRegistry;
    private final RateLimitEventLog eventLog;
    private final List<PolicyCodec> codecs;
    private final int topViolators;
    private final Clock clock;

    @Inject
    public PolicyService(
            PolicyRepository repository,
            RuleRegistry ruleRegistry,
            RateLimitEventLog eventLog,
            Instance<PolicyCodec> codecs,
            MonitoringConfig monitoringConfig,
            Clock clock) {
        this(repository, ruleRegistry, eventLog, codecs.stream().toList(), monitoringConfig.topViolators(), clock);
    }

    public PolicyService(
            PolicyRepository repository,
            RuleRegistry ruleRegistry,
            RateLimitEventLog eventLog,
            List<PolicyCodec> codecs,
            int topViolators,
            Clock clock) {
        this.repository = repository;
        this.ruleRegistry = ruleRegistry;
        this.eventLog = eventLog;
        this.codecs = List.copyOf(codecs);
        this.topViolators = topViolators;
        this.clock = clock;
    }

    @Override
    public Uni<RateLimitPolicy> create(RateLimitPolicy policy) {
        final var now = clock.instant();
        return Uni.createFrom()
                .item(() -> validated(stamped(policy, now)))
                .flatMap(toSave -> repository.saveIfAbsent(toSave).map(saved -> {
                    if (!saved) {
                        throw new DuplicatePolicyException(toSave.name());
                    }
                    publish(toSave);
                    LOG.infov("Created policy {0} with {1} rule(s)", toSave.name(), toSave.rules().size());
                    return toSave;
                }));
    }

    @Override
    public Uni<RateLimitPolicy> update(String name, RateLimitPolicy policy) {
        return Uni.createFrom()
                .item(() -> validated(policy))
                .flatMap(valid -> repository.findByName(name).flatMap(existing -> {
                    if (existing.isEmpty()) {
                        return Uni.createFrom().failure(new PolicyNotFoundException(name));
                    }
                    final var updated = existing.get().updatedFrom(valid, clock.instant());
                    return repository.save(updated).map(ignored -> {
                        publish(updated);
                        LOG.infov("Updated policy {0}", name);
                        return updated;
                    });
                }));
    }

    @Override
    public Uni<Void> delete(String name) {
        return repository
                .delete(name)
                .invoke(deleted -> {
                    if (!deleted) {
                        throw new PolicyNotFoundException(name);
                    }
                    ruleRegistry.replaceScope(RateLimitScope.policy(name), List.of());
                    LOG.infov("Deleted policy {0}", name);
                })
                .replaceWithVoid();
    }

    @Override
    public Uni<Optional<RateLimitPolicy>> get(String name) {
        return repository.findByName(name);
    }

    @Override
    public Uni<List<RateLimitPolicy>> list(boolean enabledOnly) {
        return repository.findAll().map(policies -> policies.stream()
                .filter(policy -> !enabledOnly || policy.enabled())
                .sorted(LISTING_ORDER)
                .toList());
    }

    @Override
    public Uni<Void> assignToIdentifier(String identifier, String policyName) {
        if (identifier == null || identifier.isBlank()) {
            return Uni.createFrom().failure(new IllegalArgumentException("Identifier cannot be blank"));
        }
        return repository.exists(policyName).flatMap(exists -> {
            if (!exists) {
                return Uni.createFrom().failure(new PolicyNotFoundException(policyName));
            }
            return repository.assign(identifier, policyName)
                    .invoke(() -> LOG.debugv("Assigned {0} to policy {1}", identifier, policyName));
        });
    }

    @Override
    public Uni<Optional<String>> getPolicyForIdentifier(String identifier) {
        return repository.findAssignment(identifier);
    }

    @Override
    public Uni<String> exportAll(String format) {
        return Uni.createFrom()
                .item(() -> codecFor(format))
                .flatMap(codec -> list(false).map(codec::encode));
    }

    @Override
    public Uni<Integer> importAll(String serialized, boolean overwrite) {
        return Uni.createFrom()
                .item(() -> codecFor("json").decode(serialized))
                .flatMap(entries -> Multi.createFrom()
                        .iterable(entries)
                        .onItem()
                        .transformToUniAndConcatenate(entry -> importEntry(entry, overwrite))
                        .collect()
                        .asList())
                .map(results -> {
                    final var imported = (int) results.stream().filter(Boolean::booleanValue).count();
                    LOG.infov("Imported {0} of {1} policies", imported, results.size());
                    return imported;
                });
    }

    @Override
    public Uni<PolicyEffectiveness> analyzeEffectiveness(String name, TimeRange range) {
        return repository.findByName(name).flatMap(policy -> {
            if (policy.isEmpty()) {
                return Uni.createFrom().failure(new PolicyNotFoundException(name));
            }
            return repository.findAllAssignments().map(assignments -> {
                final var assigned = (int) assignments.values().stream()
                        .filter(name::equals)
                        .count();
                return analyze(name, range, assigned);
            });
        });
    }

    /**
     * Publish the rules of every stored policy. Used after startup when the
     * repository already holds policies.
     *
     * @return Uni with the number of published policies
     */
    public Uni<Integer> publishAll() {
        return repository.findAll().map(policies -> {
            policies.forEach(this::publish);
            return policies.size();
        });
    }

    private Uni<Boolean> importEntry(PolicyImportEntry entry, boolean overwrite) {
        if (!entry.isValid()) {
            LOG.warnv("Skipping malformed policy {0}: {1}", entry.name(), entry.error().orElse("unknown error"));
            return Uni.createFrom().item(false);
        }
        final var policy = entry.policy().orElseThrow();
        final Uni<Boolean> stored;
        if (overwrite) {
            stored = repository.findByName(policy.name()).flatMap(existing -> {
                if (existing.isPresent()) {
                    return update(policy.name(), policy).map(updated -> true);
                }
                return create(policy).map(created -> true);
            });
        } else {
            stored = create(policy)
                    .map(created -> true)
                    .onFailure(DuplicatePolicyException.class)
                    .recoverWithItem(error -> {
                        LOG.infov("Skipping existing policy {0}", policy.name());
                        return false;
                    });
        }
        return stored.onFailure(RuleConfigurationException.class).recoverWithItem(error -> {
            LOG.warnv("Skipping invalid policy {0}: {1}", policy.name(), error.getMessage());
            return false;
        });
    }

    private PolicyEffectiveness analyze(String name, TimeRange range, int assignedIdentifiers) {
        final var scopeKey = RateLimitScope.policy(name).key();
        final var events = eventLog.since(range.since(clock.instant())).stream()
                .filter(event -> scopeKey.equals(event.scope()))
                .toList();

        final var total = events.size();
        final var blocked = events.stream().filter(event -> !event.allowed()).toList();
        final var blockRate = total == 0 ? 0.0 : (double) blocked.size() / total;

        final Map<String, Long> byRule = blocked.stream()
                .collect(Collectors.groupingBy(RateLimitEvent::ruleName, LinkedHashMap::new, Collectors.counting()));

        final var byIdentifier = new HashMap<String, Long>();
        for (final var event : blocked) {
            byIdentifier.merge(event.identifier(), 1L, Long::sum);
        }
        final var violators = byIdentifier.entrySet().stream()
                .sorted(Map.Entry.<String, Long>comparingByValue()
                        .reversed()
                        .thenComparing(Map.Entry.comparingByKey()))
                .limit(topViolators)
                .map(Map.Entry::getKey)
                .toList();

        return new PolicyEffectiveness(
                name,
                total,
                blocked.size(),
                blockRate,
                byRule,
                violators,
                assignedIdentifiers,
                recommendations(total, blockRate, byRule));
    }

    static List<String> recommendations(long total, double blockRate, Map<String, Long> violationsByRule) {
        final var result = new ArrayList<String>();
        if (total == 0) {
            result.add("No traffic recorded for this policy in the selected range");
            return result;
        }
        if (blockRate > HIGH_BLOCK_RATE) {
            result.add(String.format(
                    Locale.ROOT,
                    "Block rate of %.1f%% is high; consider raising limits or adding burst allowance",
                    blockRate * 100));
        } else if (blockRate < LOW_BLOCK_RATE && total >= MIN_SAMPLE) {
            result.add("Almost no requests are blocked; limits may be looser than needed");
        }
        violationsByRule.entrySet().stream()
                .max(Map.Entry.comparingByValue())
                .ifPresent(worst -> result.add(
                        "Rule " + worst.getKey() + " accounts for the most violations (" + worst.getValue() + ")"));
        if (result.isEmpty()) {
            result.add("Policy limits look balanced");
        }
        return result;
    }

    private PolicyCodec codecFor(String format) {
        final var wanted = format == null || format.isBlank() ? "json" : format.trim().toLowerCase(Locale.ROOT);
        return codecs.stream()
                .filter(codec -> codec.format().equals(wanted))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unsupported policy format: " + format));
    }

    private RateLimitPolicy stamped(RateLimitPolicy policy, Instant now) {
        return RateLimitPolicy.builder(policy.name())
                .description(policy.description())
                .rules(policy.rules())
                .enabled(policy.enabled())
                .priority(policy.priority())
                .createdAt(now)
                .updatedAt(now)
                .createdBy(policy.createdBy())
                .build();
    }

    private RateLimitPolicy validated(RateLimitPolicy policy) {
        final var names = new HashSet<String>();
        for (final var rule : policy.rules()) {
            rule.validate();
            if (!names.add(rule.name())) {
                throw new RuleConfigurationException(
                        "Duplicate rule " + rule.name() + " in policy " + policy.name());
            }
        }
        return policy;
    }

    private void publish(RateLimitPolicy policy) {
        ruleRegistry.replaceScope(RateLimitScope.policy(policy.name()), policy.enabled() ? policy.rules() : List.of());
    }
}
