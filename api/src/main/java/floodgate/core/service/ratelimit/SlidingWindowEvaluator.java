package floodgate.core.service.ratelimit;

import java.time.Clock;

import io.smallrye.mutiny.Uni;

import floodgate.core.model.ratelimit.CounterKey;
import floodgate.core.model.ratelimit.EvaluationStrategy;
import floodgate.core.model.ratelimit.RateLimitDecision;
import floodgate.core.model.ratelimit.RuleStatus;
import floodgate.core.model.ratelimit.RuleVerdict;
import floodgate.core.model.ratelimit.ScopedRule;
import floodgate.core.port.out.CounterStore;

/**
 * Sliding window log evaluation for per-second, per-minute, per-hour and per-day rules.
 *
 * <p>A request is admitted while the window holds at most {@code limit + burst}
 * entries. A denied request waits until the oldest entry leaves the window.
 */
public final class SlidingWindowEvaluator implements RuleEvaluator {

    private final CounterStore store;
    private final Clock clock;

    public SlidingWindowEvaluator(CounterStore store, Clock clock) {
        this.store = store;
        this.clock = clock;
    }

    @Override
    public EvaluationStrategy strategy() {
        return EvaluationStrategy.SLIDING_WINDOW;
    }

    @Override
    public Uni<RuleVerdict> evaluate(ScopedRule scoped, CounterKey key) {
        final var rule = scoped.rule();
        final var window = rule.windowSeconds();
        if (rule.limit() == 0) {
            final var reset = clock.instant().getEpochSecond() + window;
            return Uni.createFrom().item(RuleVerdict.of(scoped, RateLimitDecision.deny(rule, window, reset)));
        }

        final var capacity = rule.capacity();
        return store.incrementSlidingWindow(key, window, capacity).map(snapshot -> {
            final var reset = snapshot.resetEpochSeconds(window);
            if (!snapshot.admitted() || snapshot.count() > capacity) {
                final var retryAfter = snapshot.secondsUntilOldestExpires(window);
                return RuleVerdict.of(scoped, RateLimitDecision.deny(rule, retryAfter, reset));
            }
            final var remaining = Math.max(0, capacity - snapshot.count());
            return RuleVerdict.of(scoped, RateLimitDecision.allow(rule, remaining, reset));
        });
    }

    @Override
    public Uni<RuleStatus> status(ScopedRule scoped, CounterKey key) {
        final var rule = scoped.rule();
        final var window = rule.windowSeconds();
        return store.peekSlidingWindow(key, window)
                .map(snapshot -> new RuleStatus(
                        rule.limit(),
                        Math.max(0, rule.capacity() - snapshot.count()),
                        snapshot.resetEpochSeconds(window),
                        window));
    }
}
