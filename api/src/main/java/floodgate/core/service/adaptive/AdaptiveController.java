package floodgate.core.service.adaptive;

import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

import floodgate.core.model.adaptive.AdaptiveRule;
import floodgate.core.model.adaptive.AdjustmentDirection;
import floodgate.core.model.adaptive.MetricThresholds;
import floodgate.core.model.adaptive.SystemMetrics;

/**
 * Proportional controller that moves a rule's limit against system load.
 *
 * <p>Each metric above its threshold contributes a load factor in [0, 1]:
 * cpu and memory usage as-is, error rate times 10 and p95 latency divided by 2.
 * The average of the contributing factors decides the direction: above
 * {@value #TIGHTEN_ABOVE} the limit shrinks, below {@value #LOOSEN_BELOW} it
 * grows, in between it stays. A rule moved once is left alone for its
 * cooldown period.
 */
public class AdaptiveController {

    static final double TIGHTEN_ABOVE = 0.7;
    static final double LOOSEN_BELOW = 0.3;

    private final ConcurrentMap<String, Instant> lastAdjusted = new ConcurrentHashMap<>();

    /**
     * A limit change computed for one rule.
     *
     * @param oldLimit   current limit
     * @param newLimit   proposed limit, within the rule's bounds
     * @param direction  tighten or loosen
     * @param loadFactor the average load behind the change
     */
    public record Proposal(long oldLimit, long newLimit, AdjustmentDirection direction, double loadFactor) {}

    /**
     * Average of the load factors of every present metric above its threshold.
     *
     * @return the average in [0, 1], 0 when nothing exceeds its threshold
     */
    public static double averageLoad(SystemMetrics metrics, MetricThresholds thresholds) {
        var sum = 0.0;
        var exceeding = 0;
        if (exceeds(metrics.cpuUsage(), thresholds.cpu())) {
            sum += clamp(metrics.cpuUsage());
            exceeding++;
        }
        if (exceeds(metrics.memoryUsage(), thresholds.memory())) {
            sum += clamp(metrics.memoryUsage());
            exceeding++;
        }
        if (exceeds(metrics.errorRate(), thresholds.errorRate())) {
            sum += clamp(metrics.errorRate() * 10);
            exceeding++;
        }
        if (exceeds(metrics.p95ResponseTime(), thresholds.p95Latency())) {
            sum += clamp(metrics.p95ResponseTime() / 2);
            exceeding++;
        }
        return exceeding == 0 ? 0.0 : sum / exceeding;
    }

    /**
     * Compute the limit a rule should move to. Does not look at the cooldown.
     *
     * @param rule         adaptive bounds
     * @param currentLimit the rule's current limit
     * @param metrics      the load sample
     * @return the change, empty when the limit should stay or the sample
     *         carries no load metric
     */
    public Optional<Proposal> propose(AdaptiveRule rule, long currentLimit, SystemMetrics metrics) {
        if (!metrics.hasLoadSignal()) {
            return Optional.empty();
        }
        final var load = averageLoad(metrics, rule.thresholds());
        final var factor = rule.adjustmentFactor();

        final long target;
        final AdjustmentDirection direction;
        if (load > TIGHTEN_ABOVE) {
            target = Math.max(Math.round(currentLimit - currentLimit * load * factor), rule.minLimit());
            direction = AdjustmentDirection.TIGHTEN;
        } else if (load < LOOSEN_BELOW) {
            target = Math.min(Math.round(currentLimit + currentLimit * (1 - load) * factor), rule.maxLimit());
            direction = AdjustmentDirection.LOOSEN;
        } else {
            return Optional.empty();
        }

        if (target == currentLimit) {
            return Optional.empty();
        }
        return Optional.of(new Proposal(currentLimit, target, direction, load));
    }

    /**
     * @return true if the rule was adjusted less than its cooldown period ago
     */
    public boolean inCooldown(AdaptiveRule rule, Instant now) {
        final var last = lastAdjusted.get(rule.reference());
        return last != null && now.isBefore(last.plus(rule.cooldownPeriod()));
    }

    /**
     * Claim the right to adjust a rule now.
     *
     * <p>Succeeds for exactly one caller per cooldown period, even when several
     * evaluations race on the same rule.
     *
     * @return true if the caller may apply its adjustment
     */
    public boolean tryStartCooldown(AdaptiveRule rule, Instant now) {
        final var key = rule.reference();
        while (true) {
            final var last = lastAdjusted.get(key);
            if (last == null) {
                if (lastAdjusted.putIfAbsent(key, now) == null) {
                    return true;
                }
                continue;
            }
            if (now.isBefore(last.plus(rule.cooldownPeriod()))) {
                return false;
            }
            if (lastAdjusted.replace(key, last, now)) {
                return true;
            }
        }
    }

    /**
     * Undo a claim whose adjustment could not be applied.
     */
    public void cancelCooldown(AdaptiveRule rule, Instant claimedAt) {
        lastAdjusted.remove(rule.reference(), claimedAt);
    }

    public void forget(AdaptiveRule rule) {
        lastAdjusted.remove(rule.reference());
    }

    private static boolean exceeds(Double value, double threshold) {
        return value != null && value > threshold;
    }

    private static double clamp(double value) {
        return Math.max(0.0, Math.min(1.0, value));
    }
}
