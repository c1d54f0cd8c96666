package floodgate.core.service.adaptive;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicReference;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import floodgate.core.config.AdaptiveConfig;
import floodgate.core.model.adaptive.AdaptiveRule;
import floodgate.core.model.adaptive.AdjustmentRecord;
import floodgate.core.model.adaptive.SystemMetrics;
import floodgate.core.model.ratelimit.RateLimitScope;
import floodgate.core.model.ratelimit.RuleConfigurationException;
import floodgate.core.port.in.AdaptiveControl;
import floodgate.core.port.out.Metrics;
import floodgate.core.port.out.SecurityEventPublisher;
import floodgate.core.service.ratelimit.RuleRegistry;
import floodgate.spi.SecurityEvent;

/**
 * Applies the adaptive controller to the rule registry.
 *
 * <p>Every metrics sample is evaluated immediately and kept as the latest
 * sample for the periodic re-evaluation. New limits are published through
 * {@link RuleRegistry#updateLimit}, so they apply from the next request on.
 */
@ApplicationScoped
public class AdaptiveService implements AdaptiveControl {

    private static final Logger LOG = Logger.getLogger(AdaptiveService.class);

    private final boolean enabled;
    private final Duration metricsMaxAge;
    private final int historySize;
    private final RuleRegistry ruleRegistry;
    private final Metrics metrics;
    private final SecurityEventPublisher securityEvents;
    private final Clock clock;
    private final AdaptiveController controller = new AdaptiveController();

    private final Map<String, AdaptiveRule> rules = new ConcurrentHashMap<>();
    private final AtomicReference<SystemMetrics> latest = new AtomicReference<>();
    private final Deque<AdjustmentRecord> history = new ArrayDeque<>();

    @Inject
    public AdaptiveService(
            AdaptiveConfig config,
            RuleRegistry ruleRegistry,
            Metrics metrics,
            SecurityEventPublisher securityEvents,
            Clock clock) {
        this(config.enabled(), config.metricsMaxAge(), config.historySize(), ruleRegistry, metrics, securityEvents, clock);
    }

    public AdaptiveService(
            boolean enabled,
            Duration metricsMaxAge,
            int historySize,
            RuleRegistry ruleRegistry,
            Metrics metrics,
            SecurityEventPublisher securityEvents,
            Clock clock) {
        this.enabled = enabled;
        this.metricsMaxAge = metricsMaxAge;
        this.historySize = historySize;
        this.ruleRegistry = ruleRegistry;
        this.metrics = metrics;
        this.securityEvents = securityEvents;
        this.clock = clock;
    }

    @Override
    public Uni<List<AdjustmentRecord>> updateSystemMetrics(SystemMetrics sample) {
        return Uni.createFrom().item(() -> {
            latest.set(sample);
            return evaluate(sample);
        });
    }

    /**
     * Re-evaluate the latest sample, if it is still fresh.
     *
     * @return the adjustments applied
     */
    public List<AdjustmentRecord> evaluateLatest() {
        final var sample = latest.get();
        if (sample == null) {
            LOG.debug("No metrics received yet, skipping adaptive evaluation");
            return List.of();
        }
        return evaluate(sample);
    }

    @Override
    public Uni<AdaptiveRule> registerAdaptiveRule(AdaptiveRule rule) {
        return Uni.createFrom().item(() -> {
            if (ruleRegistry.find(rule.scope(), rule.ruleName()).isEmpty()) {
                throw new RuleConfigurationException(
                        "Cannot adapt unknown rule " + rule.ruleName() + " in scope " + rule.scope().key());
            }
            final var previous = rules.put(rule.reference(), rule);
            if (previous != null) {
                controller.forget(previous);
            }
            LOG.infov("Adaptive bounds [{0}, {1}] attached to {2}", rule.minLimit(), rule.maxLimit(), rule.reference());
            return rule;
        });
    }

    @Override
    public Uni<Boolean> unregisterAdaptiveRule(String scope, String ruleName) {
        return Uni.createFrom().item(() -> {
            final var reference = RateLimitScope.parse(scope).key() + "/" + ruleName;
            final var removed = rules.remove(reference);
            if (removed == null) {
                return false;
            }
            controller.forget(removed);
            LOG.infov("Adaptive bounds removed from {0}", reference);
            return true;
        });
    }

    @Override
    public Uni<List<AdaptiveRule>> listAdaptiveRules() {
        return Uni.createFrom().item(() -> rules.values().stream()
                .sorted(Comparator.comparing(AdaptiveRule::reference))
                .toList());
    }

    @Override
    public Uni<List<AdjustmentRecord>> adjustmentHistory() {
        return Uni.createFrom().item(this::historySnapshot);
    }

    /**
     * @param limit maximum number of records
     * @return the most recent adjustments, oldest first
     */
    public List<AdjustmentRecord> recentAdjustments(int limit) {
        final var all = historySnapshot();
        return all.subList(Math.max(0, all.size() - limit), all.size());
    }

    private List<AdjustmentRecord> evaluate(SystemMetrics sample) {
        if (!enabled || rules.isEmpty()) {
            return List.of();
        }
        final var now = clock.instant();
        if (sample.timestamp().isBefore(now.minus(metricsMaxAge))) {
            LOG.debugv("Skipping adaptive evaluation, metrics from {0} are stale", sample.timestamp());
            return List.of();
        }
        if (!sample.hasLoadSignal()) {
            LOG.debugv("Skipping adaptive evaluation, metrics from {0} carry no load metric", sample.timestamp());
            return List.of();
        }

        final var applied = new ArrayList<AdjustmentRecord>();
        for (final var rule : rules.values()) {
            if (controller.inCooldown(rule, now)) {
                continue;
            }
            adjust(rule, sample, now).ifPresent(applied::add);
        }
        return applied;
    }

    private Optional<AdjustmentRecord> adjust(AdaptiveRule rule, SystemMetrics sample, Instant now) {
        final var current = ruleRegistry.find(rule.scope(), rule.ruleName());
        if (current.isEmpty()) {
            LOG.warnv("Adaptive rule {0} no longer exists in the registry", rule.reference());
            return Optional.empty();
        }

        final var proposal = controller.propose(rule, current.get().limit(), sample);
        if (proposal.isEmpty() || !controller.tryStartCooldown(rule, now)) {
            return Optional.empty();
        }

        final var change = proposal.get();
        final var previous = ruleRegistry.updateLimit(rule.scope(), rule.ruleName(), change.newLimit());
        if (previous.isEmpty()) {
            controller.cancelCooldown(rule, now);
            return Optional.empty();
        }

        final var record = new AdjustmentRecord(
                rule.ruleName(),
                rule.scope().key(),
                previous.get().limit(),
                change.newLimit(),
                change.direction(),
                change.loadFactor(),
                now,
                sample);
        remember(record);

        LOG.infov(
                "Adjusted {0} from {1} to {2} ({3}, load {4})",
                rule.reference(),
                record.oldLimit(),
                record.newLimit(),
                record.direction(),
                String.format("%.2f", record.loadFactor()));
        metrics.recordAdjustment(rule.ruleName(), change.direction().name().toLowerCase(Locale.ROOT));
        securityEvents.publish(new SecurityEvent.LimitAdjusted(
                now, rule.scope().key(), rule.ruleName(), record.oldLimit(), record.newLimit(), record.loadFactor()));
        return Optional.of(record);
    }

    private void remember(AdjustmentRecord record) {
        synchronized (history) {
            history.addLast(record);
            while (history.size() > historySize) {
                history.removeFirst();
            }
        }
    }

    private List<AdjustmentRecord> historySnapshot() {
        synchronized (history) {
            return List.copyOf(history);
        }
    }
}
