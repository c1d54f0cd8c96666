package floodgate.core.service.ratelimit;

import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import floodgate.core.config.RateLimitingConfig;
import floodgate.core.model.monitor.RateLimitEvent;
import floodgate.core.model.ratelimit.CounterKey;
import floodgate.core.model.ratelimit.FailureMode;
import floodgate.core.model.ratelimit.RateLimitDecision;
import floodgate.core.model.ratelimit.RateLimitScope;
import floodgate.core.model.ratelimit.RequestContext;
import floodgate.core.model.ratelimit.RuleCategory;
import floodgate.core.model.ratelimit.RuleStatus;
import floodgate.core.model.ratelimit.RuleVerdict;
import floodgate.core.model.ratelimit.ScopedRule;
import floodgate.core.model.ratelimit.StoreUnavailableException;
import floodgate.core.port.in.RateLimitUseCase;
import floodgate.core.port.out.CounterStore;
import floodgate.core.port.out.Metrics;
import floodgate.core.port.out.PolicyRepository;
import floodgate.core.port.out.SecurityEventPublisher;
import floodgate.core.service.monitor.RateLimitEventLog;
import floodgate.spi.SecurityEvent;

/**
 * Evaluates the applicable rules of a request against the counter store.
 *
 * <p>Rules are evaluated one after another in priority order. The first
 * denial ends the evaluation and is returned; concurrency slots taken by
 * earlier rules of the same evaluation are given back first. When every rule
 * allows, the decision with the least remaining quota is reported.
 *
 * <p>A counter store failure is resolved per rule category: throughput rules
 * fail open and security rules fail closed unless configured otherwise.
 */
@ApplicationScoped
public class RateLimitService implements RateLimitUseCase {

    private static final Logger LOG = Logger.getLogger(RateLimitService.class);

    private final RateLimitingConfig config;
    private final RuleRegistry ruleRegistry;
    private final EvaluatorRegistry evaluators;
    private final CounterStore store;
    private final PolicyRepository policyRepository;
    private final RateLimitEventLog eventLog;
    private final Metrics metrics;
    private final SecurityEventPublisher securityEvents;
    private final Clock clock;

    @Inject
    public RateLimitService(
            RateLimitingConfig config,
            RuleRegistry ruleRegistry,
            EvaluatorRegistry evaluators,
            CounterStore store,
            PolicyRepository policyRepository,
            RateLimitEventLog eventLog,
            Metrics metrics,
            SecurityEventPublisher securityEvents,
            Clock clock) {
        this.config = config;
        this.ruleRegistry = ruleRegistry;
        this.evaluators = evaluators;
        this.store = store;
        this.policyRepository = policyRepository;
        this.eventLog = eventLog;
        this.metrics = metrics;
        this.securityEvents = securityEvents;
        this.clock = clock;
    }

    @Override
    public Uni<RateLimitDecision> checkRateLimit(RequestContext context) {
        if (!config.enabled()) {
            return Uni.createFrom().item(RateLimitDecision.unlimited(nowSeconds()));
        }

        return policyRepository
                .findAssignment(context.identifier())
                .map(policy -> ruleRegistry.resolveRules(context, policy))
                .flatMap(rules -> {
                    if (rules.isEmpty()) {
                        return Uni.createFrom().item(RateLimitDecision.unlimited(nowSeconds()));
                    }
                    return evaluateFrom(context, rules, 0, new ArrayList<>());
                });
    }

    @Override
    public Uni<Void> releaseConcurrentSlot(String identifier, String ruleRef) {
        return Uni.createFrom().item(() -> resolveSlotKey(identifier, ruleRef)).flatMap(key -> {
            if (key.isEmpty()) {
                LOG.debugv("No concurrency rule {0} to release for {1}", ruleRef, identifier);
                return Uni.createFrom().voidItem();
            }
            return store.decrementConcurrent(key.get())
                    .invoke(count -> metrics.recordSlotChange(-1))
                    .replaceWithVoid();
        });
    }

    @Override
    public Uni<Map<String, RuleStatus>> getRateLimitStatus(RequestContext context) {
        return policyRepository
                .findAssignment(context.identifier())
                .map(policy -> ruleRegistry.resolveRules(context, policy))
                .flatMap(rules -> {
                    if (rules.isEmpty()) {
                        return Uni.createFrom().item(Map.<String, RuleStatus>of());
                    }
                    final var unis = rules.stream()
                            .map(rule -> statusOf(context.identifier(), rule))
                            .toList();
                    return Uni.join().all(unis).andFailFast().map(statuses -> {
                        final var result = new LinkedHashMap<String, RuleStatus>();
                        for (var i = 0; i < rules.size(); i++) {
                            final var rule = rules.get(i);
                            final var name =
                                    result.containsKey(rule.ruleName()) ? rule.reference() : rule.ruleName();
                            result.put(name, statuses.get(i));
                        }
                        return result;
                    });
                });
    }

    @Override
    public Uni<Long> resetRateLimit(String identifier, Optional<String> ruleName) {
        if (ruleName.isEmpty()) {
            return store.resetMatching(CounterKey.identifierPrefix(identifier))
                    .invoke(count -> LOG.infov("Reset {0} counter(s) of {1}", count, identifier));
        }

        final var rules = ruleRegistry.findByName(ruleName.get());
        if (rules.isEmpty()) {
            return Uni.createFrom().item(0L);
        }
        final var unis = rules.stream()
                .map(rule -> store.reset(CounterKey.of(identifier, rule)))
                .toList();
        return Uni.join().all(unis).andFailFast().map(done -> (long) rules.size())
                .invoke(count -> LOG.infov("Reset rule {0} for {1}", ruleName.get(), identifier));
    }

    private Uni<RateLimitDecision> evaluateFrom(
            RequestContext context, List<ScopedRule> rules, int index, List<RuleVerdict> passed) {
        if (index == rules.size()) {
            return Uni.createFrom().item(aggregate(passed));
        }

        final var rule = rules.get(index);
        return evaluateRule(context, rule).flatMap(verdict -> {
            record(context, verdict);
            if (verdict.slotHeld()) {
                metrics.recordSlotChange(1);
            }
            if (verdict.allowed()) {
                passed.add(verdict);
                return evaluateFrom(context, rules, index + 1, passed);
            }
            return onDenied(context, verdict, passed);
        });
    }

    private Uni<RuleVerdict> evaluateRule(RequestContext context, ScopedRule rule) {
        final var key = CounterKey.of(context.identifier(), rule);
        final Uni<RuleVerdict> verdict;
        if (rule.rule().penaltySeconds() > 0) {
            verdict = store.penaltyRemaining(key).flatMap(remaining -> {
                if (remaining > 0) {
                    final var decision = RateLimitDecision.deny(rule.rule(), remaining, nowSeconds() + remaining);
                    return Uni.createFrom().item(RuleVerdict.of(rule, decision));
                }
                return evaluators.evaluatorFor(rule.rule()).evaluate(rule, key);
            });
        } else {
            verdict = evaluators.evaluatorFor(rule.rule()).evaluate(rule, key);
        }

        return verdict.onFailure(StoreUnavailableException.class)
                .recoverWithItem(error -> applyFailureMode(context, rule, error));
    }

    private RuleVerdict applyFailureMode(RequestContext context, ScopedRule rule, Throwable error) {
        final var mode = failureModeFor(rule.rule().category());
        final var failClosed = mode == FailureMode.FAIL_CLOSED;
        LOG.warnv(
                "Counter store {0} unavailable for identifier={1} rule={2}/{3}, {4}: {5}",
                store.name(),
                context.identifier(),
                rule.scope().key(),
                rule.ruleName(),
                failClosed ? "denying" : "allowing",
                error.getMessage());
        metrics.recordStoreFailure(rule.ruleName(), failClosed);
        securityEvents.publish(new SecurityEvent.CounterStoreFailure(
                clock.instant(), context.identifier(), rule.ruleName(), failClosed, error.getMessage()));

        final var now = nowSeconds();
        if (failClosed) {
            final var retryAfter = config.failClosedRetryAfterSeconds();
            return RuleVerdict.storeFailure(rule, RateLimitDecision.deny(rule.rule(), retryAfter, now + retryAfter));
        }
        return RuleVerdict.storeFailure(rule, RateLimitDecision.failOpen(rule.rule(), now));
    }

    private FailureMode failureModeFor(RuleCategory category) {
        return category == RuleCategory.SECURITY
                ? config.failureMode().security()
                : config.failureMode().throughput();
    }

    private Uni<RateLimitDecision> onDenied(RequestContext context, RuleVerdict denied, List<RuleVerdict> passed) {
        final var rule = denied.rule();
        final var decision = denied.decision();
        final var retryAfter = decision.retryAfter().orElse(1L);

        securityEvents.publish(new SecurityEvent.RateLimitExceeded(
                clock.instant(),
                context.identifier(),
                rule.scope().key(),
                rule.ruleName(),
                context.endpoint().orElse(null),
                rule.rule().limit(),
                retryAfter));

        final var cleanup = new ArrayList<Uni<Void>>();
        for (final var verdict : passed) {
            if (verdict.slotHeld()) {
                cleanup.add(giveBack(context.identifier(), verdict.rule()));
            }
        }
        if (rule.rule().penaltySeconds() > 0 && !denied.storeError()) {
            cleanup.add(startPenalty(context.identifier(), rule));
        }

        if (cleanup.isEmpty()) {
            return Uni.createFrom().item(decision);
        }
        return Uni.join().all(cleanup).andCollectFailures().replaceWith(decision);
    }

    private Uni<Void> giveBack(String identifier, ScopedRule rule) {
        return store.decrementConcurrent(CounterKey.of(identifier, rule))
                .invoke(count -> metrics.recordSlotChange(-1))
                .replaceWithVoid()
                .onFailure()
                .recoverWithUni(error -> {
                    LOG.warnv(
                            "Failed to release slot {0} of {1} after denial; it expires after {2}s: {3}",
                            rule.reference(),
                            identifier,
                            rule.rule().windowSeconds(),
                            error.getMessage());
                    return Uni.createFrom().voidItem();
                });
    }

    private Uni<Void> startPenalty(String identifier, ScopedRule rule) {
        final var key = CounterKey.of(identifier, rule);
        final var seconds = rule.rule().penaltySeconds();
        return store.penaltyRemaining(key)
                .flatMap(remaining -> {
                    if (remaining > 0) {
                        return Uni.createFrom().voidItem();
                    }
                    return store.startPenalty(key, seconds).invoke(() -> {
                        LOG.infov("Penalty of {0}s started for {1} on rule {2}", seconds, identifier, rule.ruleName());
                        securityEvents.publish(
                                new SecurityEvent.PenaltyApplied(clock.instant(), identifier, rule.ruleName(), seconds));
                    });
                })
                .onFailure()
                .recoverWithUni(error -> {
                    LOG.warnv("Failed to start penalty for {0} on rule {1}: {2}",
                            identifier, rule.ruleName(), error.getMessage());
                    return Uni.createFrom().voidItem();
                });
    }

    /**
     * Report the tightest of the passed rules: least remaining, unbounded counting
     * as infinite, earlier (higher priority) rule on ties.
     */
    private RateLimitDecision aggregate(List<RuleVerdict> passed) {
        RuleVerdict tightest = null;
        final var held = new ArrayList<String>();
        for (final var verdict : passed) {
            if (verdict.slotHeld()) {
                held.add(verdict.rule().reference());
            }
            if (tightest == null || effectiveRemaining(verdict) < effectiveRemaining(tightest)) {
                tightest = verdict;
            }
        }
        return tightest.decision().withHeldSlots(held);
    }

    private long effectiveRemaining(RuleVerdict verdict) {
        final var remaining = verdict.decision().remaining();
        return remaining == RateLimitDecision.UNBOUNDED ? Long.MAX_VALUE : remaining;
    }

    private Uni<RuleStatus> statusOf(String identifier, ScopedRule rule) {
        final var key = CounterKey.of(identifier, rule);
        return evaluators.evaluatorFor(rule.rule())
                .status(rule, key)
                .onFailure(StoreUnavailableException.class)
                .recoverWithItem(error -> {
                    LOG.warnv("Counter store unavailable reading status of {0} for {1}: {2}",
                            rule.reference(), identifier, error.getMessage());
                    return new RuleStatus(
                            rule.rule().limit(),
                            RateLimitDecision.UNBOUNDED,
                            nowSeconds(),
                            rule.rule().windowSeconds());
                });
    }

    private Optional<CounterKey> resolveSlotKey(String identifier, String ruleRef) {
        final var separator = ruleRef.lastIndexOf('/');
        if (separator > 0) {
            final var scope = RateLimitScope.parse(ruleRef.substring(0, separator));
            return Optional.of(new CounterKey(identifier, scope.key(), ruleRef.substring(separator + 1)));
        }
        return ruleRegistry.findByName(ruleRef).stream()
                .filter(rule -> rule.rule().isConcurrency())
                .findFirst()
                .map(rule -> CounterKey.of(identifier, rule));
    }

    private void record(RequestContext context, RuleVerdict verdict) {
        final var rule = verdict.rule();
        final var decision = verdict.decision();
        metrics.recordDecision(rule.scope().key(), rule.ruleName(), decision.allowed());
        eventLog.record(new RateLimitEvent(
                clock.instant(),
                context.identifier(),
                rule.scope().key(),
                rule.ruleName(),
                context.endpoint(),
                context.apiProvider(),
                decision.allowed(),
                rule.rule().limit(),
                decision.remaining(),
                decision.retryAfter()));
    }

    private long nowSeconds() {
        return clock.instant().getEpochSecond();
    }
}
