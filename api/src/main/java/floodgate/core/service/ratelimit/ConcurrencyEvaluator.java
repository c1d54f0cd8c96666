package floodgate.core.service.ratelimit;

import java.time.Clock;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import floodgate.core.model.ratelimit.CounterKey;
import floodgate.core.model.ratelimit.EvaluationStrategy;
import floodgate.core.model.ratelimit.RateLimitDecision;
import floodgate.core.model.ratelimit.RuleStatus;
import floodgate.core.model.ratelimit.RuleVerdict;
import floodgate.core.model.ratelimit.ScopedRule;
import floodgate.core.port.out.CounterStore;

/**
 * In-flight request limiting for {@code CONCURRENT_REQUESTS} rules.
 *
 * <p>An admitted request holds a slot until it is released. The slot counter
 * expires after the rule's timeout so that slots of crashed callers are
 * eventually reclaimed.
 */
public final class ConcurrencyEvaluator implements RuleEvaluator {

    private static final Logger LOG = Logger.getLogger(ConcurrencyEvaluator.class);

    private static final long RETRY_AFTER_SECONDS = 1;

    private final CounterStore store;
    private final Clock clock;

    public ConcurrencyEvaluator(CounterStore store, Clock clock) {
        this.store = store;
        this.clock = clock;
    }

    @Override
    public EvaluationStrategy strategy() {
        return EvaluationStrategy.CONCURRENCY;
    }

    @Override
    public Uni<RuleVerdict> evaluate(ScopedRule scoped, CounterKey key) {
        final var rule = scoped.rule();
        final var now = clock.instant().getEpochSecond();
        if (rule.limit() == 0) {
            return Uni.createFrom()
                    .item(RuleVerdict.of(scoped, RateLimitDecision.deny(rule, RETRY_AFTER_SECONDS, now + 1)));
        }

        return store.incrementConcurrent(key, rule.windowSeconds()).flatMap(count -> {
            if (count > rule.limit()) {
                final var denied = RuleVerdict.of(scoped, RateLimitDecision.deny(rule, RETRY_AFTER_SECONDS, now + 1));
                return store.decrementConcurrent(key)
                        .onFailure()
                        .recoverWithItem(error -> {
                            LOG.warnv(
                                    error,
                                    "Failed to give back rejected slot for {0}; it expires after {1}s",
                                    key,
                                    rule.windowSeconds());
                            return 0L;
                        })
                        .replaceWith(denied);
            }
            final var remaining = rule.limit() - count;
            return Uni.createFrom()
                    .item(RuleVerdict.holding(
                            scoped, RateLimitDecision.allow(rule, remaining, now + rule.windowSeconds())));
        });
    }

    @Override
    public Uni<RuleStatus> status(ScopedRule scoped, CounterKey key) {
        final var rule = scoped.rule();
        final var now = clock.instant().getEpochSecond();
        return store.peekConcurrent(key)
                .map(count -> new RuleStatus(
                        rule.limit(), Math.max(0, rule.limit() - count), now + rule.windowSeconds(), rule.windowSeconds()));
    }
}
