package floodgate.adapter.out.store.memory;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import floodgate.core.model.ratelimit.CounterKey;
import floodgate.core.model.ratelimit.WindowSnapshot;
import floodgate.core.port.out.CounterStore;

/**
 * In-memory counter store.
 *
 * <p>Each key's state is only touched inside {@link ConcurrentMap#compute}, which
 * serializes concurrent callers on the same key. Suitable for single-instance
 * deployments, development and tests; state is not shared across instances and
 * is lost on restart.
 *
 * <p>Expired windows, slots and penalties are dropped lazily on access and by a
 * periodic sweep.
 */
public final class InMemoryCounterStore implements CounterStore {

    private static final Logger LOG = Logger.getLogger(InMemoryCounterStore.class);

    private final ConcurrentMap<String, WindowLog> windows = new ConcurrentHashMap<>();
    private final ConcurrentMap<String, SlotCounter> slots = new ConcurrentHashMap<>();
    private final ConcurrentMap<String, Long> penalties = new ConcurrentHashMap<>();
    private final Clock clock;
    private final ScheduledExecutorService cleanupExecutor;

    /**
     * Creates a store that sweeps expired entries at the given interval.
     *
     * @param clock           clock used for every timestamp
     * @param cleanupInterval sweep interval
     */
    public InMemoryCounterStore(Clock clock, Duration cleanupInterval) {
        this.clock = clock;
        this.cleanupExecutor = Executors.newSingleThreadScheduledExecutor(r -> {
            var t = new Thread(r, "counter-store-cleanup");
            t.setDaemon(true);
            return t;
        });
        final var millis = Math.max(1000L, cleanupInterval.toMillis());
        cleanupExecutor.scheduleAtFixedRate(this::cleanupExpired, millis, millis, TimeUnit.MILLISECONDS);
        LOG.info("Initialized in-memory counter store");
    }

    @Override
    public Uni<WindowSnapshot> incrementSlidingWindow(CounterKey key, long windowSeconds, long capacity) {
        return Uni.createFrom().item(() -> {
            final var now = clock.millis();
            final var windowMillis = windowSeconds * 1000L;
            final var result = new WindowSnapshot[1];

            windows.compute(key.value(), (k, log) -> {
                final var current = log != null ? log : new WindowLog();
                current.trim(now - windowMillis);
                final var admitted = current.size() < capacity;
                if (admitted) {
                    current.add(now);
                }
                final var count = admitted ? current.size() : current.size() + 1;
                result[0] = new WindowSnapshot(count, admitted, current.oldest(now), now);
                current.expiresAt = now + windowMillis;
                return current.isEmpty() ? null : current;
            });

            return result[0];
        });
    }

    @Override
    public Uni<WindowSnapshot> peekSlidingWindow(CounterKey key, long windowSeconds) {
        return Uni.createFrom().item(() -> {
            final var now = clock.millis();
            final var result = new WindowSnapshot[] {new WindowSnapshot(0, false, now, now)};

            windows.computeIfPresent(key.value(), (k, log) -> {
                log.trim(now - windowSeconds * 1000L);
                result[0] = new WindowSnapshot(log.size(), false, log.oldest(now), now);
                return log.isEmpty() ? null : log;
            });

            return result[0];
        });
    }

    @Override
    public Uni<Long> incrementConcurrent(CounterKey key, long timeoutSeconds) {
        return Uni.createFrom().item(() -> {
            final var now = clock.millis();
            final var entry = slots.compute(key.value(), (k, existing) -> {
                if (existing == null || existing.isExpired(now)) {
                    return new SlotCounter(1, now + timeoutSeconds * 1000L);
                }
                return new SlotCounter(existing.count() + 1, existing.expiresAt());
            });
            return entry.count();
        });
    }

    @Override
    public Uni<Long> decrementConcurrent(CounterKey key) {
        return Uni.createFrom().item(() -> {
            final var now = clock.millis();
            final var entry = slots.computeIfPresent(key.value(), (k, existing) -> {
                if (existing.isExpired(now) || existing.count() <= 1) {
                    return null;
                }
                return new SlotCounter(existing.count() - 1, existing.expiresAt());
            });
            return entry == null ? 0L : entry.count();
        });
    }

    @Override
    public Uni<Long> peekConcurrent(CounterKey key) {
        return Uni.createFrom().item(() -> {
            final var entry = slots.get(key.value());
            if (entry == null || entry.isExpired(clock.millis())) {
                return 0L;
            }
            return entry.count();
        });
    }

    @Override
    public Uni<Void> startPenalty(CounterKey key, long seconds) {
        return Uni.createFrom().item(() -> {
            penalties.put(key.penaltyValue(), clock.millis() + seconds * 1000L);
            return null;
        });
    }

    @Override
    public Uni<Long> penaltyRemaining(CounterKey key) {
        return Uni.createFrom().item(() -> {
            final var expiresAt = penalties.get(key.penaltyValue());
            if (expiresAt == null) {
                return 0L;
            }
            final var millis = expiresAt - clock.millis();
            if (millis <= 0) {
                penalties.remove(key.penaltyValue(), expiresAt);
                return 0L;
            }
            return (millis + 999L) / 1000L;
        });
    }

    @Override
    public Uni<Void> reset(CounterKey key) {
        return Uni.createFrom().item(() -> {
            windows.remove(key.value());
            slots.remove(key.value());
            penalties.remove(key.penaltyValue());
            LOG.debugf("Reset counters of %s", key);
            return null;
        });
    }

    @Override
    public Uni<Long> resetMatching(String prefix) {
        return Uni.createFrom().item(() -> {
            long removed = 0;
            removed += removeByPrefix(windows, prefix);
            removed += removeByPrefix(slots, prefix);
            removed += removeByPrefix(penalties, prefix);
            return removed;
        });
    }

    @Override
    public String name() {
        return "memory";
    }

    @Override
    public Uni<Boolean> isHealthy() {
        return Uni.createFrom().item(!cleanupExecutor.isShutdown());
    }

    /**
     * Returns the number of tracked keys across windows, slots and penalties.
     *
     * @return tracked key count
     */
    public int trackedKeys() {
        return windows.size() + slots.size() + penalties.size();
    }

    /**
     * Drops every expired window, slot counter and penalty.
     */
    void cleanupExpired() {
        final var now = clock.millis();
        final var before = trackedKeys();
        // expiry is re-checked under the key's lock so a concurrent admission is never dropped
        for (final var key : windows.keySet()) {
            windows.computeIfPresent(key, (k, log) -> log.expiresAt < now ? null : log);
        }
        for (final var key : slots.keySet()) {
            slots.computeIfPresent(key, (k, counter) -> counter.isExpired(now) ? null : counter);
        }
        penalties.entrySet().removeIf(e -> e.getValue() <= now);
        final var removed = before - trackedKeys();
        if (removed > 0) {
            LOG.debugf("Removed %d expired counter entries", removed);
        }
    }

    /**
     * Stops the cleanup executor.
     */
    public void shutdown() {
        cleanupExecutor.shutdownNow();
    }

    private static long removeByPrefix(ConcurrentMap<String, ?> map, String prefix) {
        final var before = map.size();
        map.keySet().removeIf(k -> k.startsWith(prefix));
        return Math.max(0, before - map.size());
    }

    /**
     * Timestamps of recorded requests, oldest first. Only mutated inside {@code compute}.
     */
    private static final class WindowLog {
        private final Deque<Long> timestamps = new ArrayDeque<>();
        private long expiresAt;

        void trim(long cutoff) {
            while (!timestamps.isEmpty() && timestamps.peekFirst() <= cutoff) {
                timestamps.pollFirst();
            }
        }

        void add(long timestamp) {
            timestamps.addLast(timestamp);
        }

        long oldest(long fallback) {
            final var first = timestamps.peekFirst();
            return first != null ? first : fallback;
        }

        int size() {
            return timestamps.size();
        }

        boolean isEmpty() {
            return timestamps.isEmpty();
        }
    }

    private record SlotCounter(long count, long expiresAt) {
        boolean isExpired(long now) {
            return now >= expiresAt;
        }
    }
}
