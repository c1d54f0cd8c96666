package floodgate.core.model.ratelimit;

import java.util.Locale;

/**
 * Counting semantics of a {@link RateLimitRule}.
 *
 * <p>Window-based types count admitted requests inside a sliding window of
 * fixed length. {@link #CONCURRENT_REQUESTS} counts in-flight requests, and the
 * rule's window is reinterpreted as the slot timeout.
 */
public enum LimitType {
    PER_SECOND(1),
    PER_MINUTE(60),
    PER_HOUR(3_600),
    PER_DAY(86_400),
    CONCURRENT_REQUESTS(300);

    private final long defaultWindowSeconds;

    LimitType(long defaultWindowSeconds) {
        this.defaultWindowSeconds = defaultWindowSeconds;
    }

    /**
     * Window length in seconds, or the default slot timeout for concurrency rules.
     *
     * @return seconds
     */
    public long defaultWindowSeconds() {
        return defaultWindowSeconds;
    }

    /**
     * @return the hyphenated lower-case form, e.g. {@code per-minute}
     */
    public String wireName() {
        return name().toLowerCase(Locale.ROOT).replace('_', '-');
    }

    public boolean isWindowed() {
        return this != CONCURRENT_REQUESTS;
    }

    public EvaluationStrategy strategy() {
        return isWindowed() ? EvaluationStrategy.SLIDING_WINDOW : EvaluationStrategy.CONCURRENCY;
    }

    /**
     * Parse a limit type from configuration or wire formats.
     *
     * <p>Accepts enum names as well as the hyphenated forms used in policy
     * bundles ({@code per-second}, {@code concurrent-requests}).
     *
     * @param value the raw value
     * @return the limit type
     * @throws RuleConfigurationException if the value is not a known type
     */
    public static LimitType parse(String value) {
        if (value == null || value.isBlank()) {
            throw new RuleConfigurationException("limitType is required");
        }
        final var normalized = value.trim().toUpperCase(Locale.ROOT).replace('-', '_');
        try {
            return LimitType.valueOf(normalized);
        } catch (IllegalArgumentException e) {
            throw new RuleConfigurationException("Unknown limitType: " + value);
        }
    }
}
