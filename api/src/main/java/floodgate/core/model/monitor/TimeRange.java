package floodgate.core.model.monitor;

import java.time.Duration;
import java.time.Instant;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * A lookback window such as {@code 15m}, {@code 1h}, {@code 24h} or {@code 7d}.
 *
 * @param label    the textual form
 * @param duration the window length
 */
public record TimeRange(String label, Duration duration) {

    private static final Pattern FORMAT = Pattern.compile("(\\d+)([smhd])");
    private static final Duration MAX = Duration.ofDays(365);

    public static final TimeRange LAST_HOUR = new TimeRange("1h", Duration.ofHours(1));
    public static final TimeRange LAST_DAY = new TimeRange("24h", Duration.ofHours(24));

    public TimeRange {
        if (duration == null || duration.isZero() || duration.isNegative()) {
            throw new IllegalArgumentException("Time range must be positive");
        }
    }

    /**
     * Parse a time range.
     *
     * @param value the textual form, null or blank for {@link #LAST_HOUR}
     * @return the range
     * @throws IllegalArgumentException if the value is malformed or longer than a year
     */
    public static TimeRange parse(String value) {
        if (value == null || value.isBlank()) {
            return LAST_HOUR;
        }
        final var trimmed = value.trim().toLowerCase(Locale.ROOT);
        final var matcher = FORMAT.matcher(trimmed);
        if (!matcher.matches()) {
            throw new IllegalArgumentException("Invalid time range: " + value + " (expected e.g. 15m, 1h, 7d)");
        }
        final Duration duration;
        try {
            final var amount = Long.parseLong(matcher.group(1));
            duration = switch (matcher.group(2)) {
                case "s" -> Duration.ofSeconds(amount);
                case "m" -> Duration.ofMinutes(amount);
                case "h" -> Duration.ofHours(amount);
                default -> Duration.ofDays(amount);
            };
        } catch (ArithmeticException | NumberFormatException e) {
            throw new IllegalArgumentException("Time range too large: " + value, e);
        }
        if (duration.compareTo(MAX) > 0) {
            throw new IllegalArgumentException("Time range too large: " + value + " (at most 365d)");
        }
        return new TimeRange(trimmed, duration);
    }

    public Instant since(Instant now) {
        return now.minus(duration);
    }
}
