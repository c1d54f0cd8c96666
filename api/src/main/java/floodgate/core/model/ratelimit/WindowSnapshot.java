package floodgate.core.model.ratelimit;

/**
 * State of a sliding window after an increment attempt.
 *
 * @param count        entries in the window including the current attempt
 * @param admitted     whether the attempt was recorded
 * @param oldestMillis timestamp of the oldest retained entry, or {@code nowMillis} when empty
 * @param nowMillis    the store's clock at the time of the attempt
 */
public record WindowSnapshot(long count, boolean admitted, long oldestMillis, long nowMillis) {

    /**
     * Seconds until the oldest entry leaves a window of the given length, at least 1.
     */
    public long secondsUntilOldestExpires(long windowSeconds) {
        final var expiresAt = oldestMillis + windowSeconds * 1000L;
        final var millis = Math.max(0L, expiresAt - nowMillis);
        return Math.max(1L, (millis + 999L) / 1000L);
    }

    /**
     * Epoch seconds at which the window fully resets.
     */
    public long resetEpochSeconds(long windowSeconds) {
        return (oldestMillis + windowSeconds * 1000L + 999L) / 1000L;
    }
}
