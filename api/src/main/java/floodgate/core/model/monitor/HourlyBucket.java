package floodgate.core.model.monitor;

/**
 * Traffic of one hour of the day, aggregated over several days (UTC).
 *
 * @param hour       0..23
 * @param total      evaluations recorded in that hour
 * @param denied     denials recorded in that hour
 * @param denialRate denied / total, 0 when empty
 */
public record HourlyBucket(int hour, long total, long denied, double denialRate) {}
