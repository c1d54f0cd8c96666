package floodgate.core.port.out;

import io.smallrye.mutiny.Uni;

import floodgate.core.model.ratelimit.CounterKey;
import floodgate.core.model.ratelimit.WindowSnapshot;

/**
 * Port interface for the shared counter store.
 *
 * <p>The store owns every sliding-window log and concurrency counter. Each
 * mutating operation is atomic for its key: two concurrent increments on the
 * same key can never both observe room for the last slot.
 *
 * <p>Timestamps come from the store's own clock. Every failure is surfaced as a
 * {@link floodgate.core.model.ratelimit.StoreUnavailableException}.
 */
public interface CounterStore {

    /**
     * Trim entries older than the window and record the current time if the window still has room.
     *
     * <p>Denied attempts are not recorded.
     *
     * @param key           the counter key
     * @param windowSeconds window length
     * @param capacity      maximum entries the window may hold
     * @return the window state, with {@code count} including the current attempt
     */
    Uni<WindowSnapshot> incrementSlidingWindow(CounterKey key, long windowSeconds, long capacity);

    /**
     * Count entries in the window without recording anything.
     *
     * @param key           the counter key
     * @param windowSeconds window length
     * @return the window state, with {@code admitted} false
     */
    Uni<WindowSnapshot> peekSlidingWindow(CounterKey key, long windowSeconds);

    /**
     * Increment a concurrency counter, setting its expiry if it has none.
     *
     * @param key            the counter key
     * @param timeoutSeconds expiry of the counter
     * @return the count after the increment
     */
    Uni<Long> incrementConcurrent(CounterKey key, long timeoutSeconds);

    /**
     * Decrement a concurrency counter, never below zero.
     *
     * @param key the counter key
     * @return the count after the decrement
     */
    Uni<Long> decrementConcurrent(CounterKey key);

    /**
     * @param key the counter key
     * @return the current concurrency count, 0 when absent
     */
    Uni<Long> peekConcurrent(CounterKey key);

    /**
     * Lock out a key for a number of seconds.
     *
     * @param key     the counter key
     * @param seconds lock-out duration
     * @return completion signal
     */
    Uni<Void> startPenalty(CounterKey key, long seconds);

    /**
     * @param key the counter key
     * @return seconds left on the key's penalty, 0 when none
     */
    Uni<Long> penaltyRemaining(CounterKey key);

    /**
     * Delete every entry of one key, including its penalty.
     *
     * @param key the counter key
     * @return completion signal
     */
    Uni<Void> reset(CounterKey key);

    /**
     * Delete every entry whose key starts with a prefix.
     *
     * @param prefix key prefix
     * @return number of deleted entries
     */
    Uni<Long> resetMatching(String prefix);

    /**
     * @return the store name for logging and health reporting
     */
    String name();

    /**
     * Check if the store can currently serve requests.
     *
     * @return Uni with true if reachable
     */
    Uni<Boolean> isHealthy();
}
