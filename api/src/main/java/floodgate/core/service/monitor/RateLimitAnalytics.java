package floodgate.core.service.monitor;

import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

import floodgate.core.model.monitor.HourlyBucket;
import floodgate.core.model.monitor.RateLimitEvent;
import floodgate.core.model.monitor.UsageSummary;
import floodgate.core.model.monitor.ViolationSummary;

/**
 * Aggregations over recorded events.
 *
 * <p>Histograms are ordered by count descending, then key.
 */
public final class RateLimitAnalytics {

    static final String UNKNOWN = "unknown";

    private RateLimitAnalytics() {}

    public static ViolationSummary violations(String range, List<RateLimitEvent> events, int topViolators) {
        final var denied = events.stream().filter(event -> !event.allowed()).toList();

        final var perIdentifier = histogram(denied, RateLimitEvent::identifier);
        final var top = new ArrayList<ViolationSummary.ViolatorCount>();
        for (final var entry : perIdentifier.entrySet()) {
            if (top.size() == topViolators) {
                break;
            }
            top.add(new ViolationSummary.ViolatorCount(entry.getKey(), entry.getValue()));
        }

        return new ViolationSummary(
                range,
                events.size(),
                denied.size(),
                ratio(denied.size(), events.size()),
                top,
                histogram(denied, RateLimitEvent::ruleName),
                histogram(denied, event -> event.endpoint().orElse(UNKNOWN)));
    }

    public static UsageSummary usage(String range, List<RateLimitEvent> events) {
        final var identifiers = new HashSet<String>();
        for (final var event : events) {
            identifiers.add(event.identifier());
        }
        final var denied = events.stream().filter(event -> !event.allowed()).toList();
        return new UsageSummary(
                range,
                events.size(),
                histogram(events, event -> event.apiProvider().orElse(UNKNOWN)),
                histogram(events, event -> event.endpoint().orElse(UNKNOWN)),
                histogram(denied, event -> event.apiProvider().orElse(UNKNOWN)),
                identifiers.size());
    }

    /**
     * Bucket events by hour of day in UTC.
     *
     * @return 24 buckets, hour 0 first
     */
    public static List<HourlyBucket> hourly(List<RateLimitEvent> events) {
        final var totals = new long[24];
        final var denials = new long[24];
        for (final var event : events) {
            final var hour = event.timestamp().atZone(ZoneOffset.UTC).getHour();
            totals[hour]++;
            if (!event.allowed()) {
                denials[hour]++;
            }
        }
        final var buckets = new ArrayList<HourlyBucket>(24);
        for (var hour = 0; hour < 24; hour++) {
            buckets.add(new HourlyBucket(hour, totals[hour], denials[hour], ratio(denials[hour], totals[hour])));
        }
        return buckets;
    }

    static Map<String, Long> histogram(List<RateLimitEvent> events, Function<RateLimitEvent, String> key) {
        final var counts = new HashMap<String, Long>();
        for (final var event : events) {
            counts.merge(key.apply(event), 1L, Long::sum);
        }
        final var sorted = new LinkedHashMap<String, Long>();
        counts.entrySet().stream()
                .sorted(Map.Entry.<String, Long>comparingByValue()
                        .reversed()
                        .thenComparing(Map.Entry.comparingByKey()))
                .forEach(entry -> sorted.put(entry.getKey(), entry.getValue()));
        return sorted;
    }

    private static double ratio(long part, long whole) {
        return whole == 0 ? 0.0 : (double) part / whole;
    }
}
