package floodgate.core.service.monitor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import floodgate.core.config.MonitoringConfig;
import floodgate.core.model.monitor.RateLimitEvent;

/**
 * Bounded, append-only log of rule evaluations.
 *
 * <p>A fixed-size ring buffer: once full, each new event evicts the oldest.
 * The log is only read for analytics and never consulted when deciding.
 */
@ApplicationScoped
public class RateLimitEventLog {

    private final RateLimitEvent[] buffer;
    private int next;
    private int size;
    private long totalRecorded;

    @Inject
    public RateLimitEventLog(MonitoringConfig config) {
        this(config.maxEvents());
    }

    public RateLimitEventLog(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("Event log capacity must be positive, got " + capacity);
        }
        this.buffer = new RateLimitEvent[capacity];
    }

    public synchronized void record(RateLimitEvent event) {
        buffer[next] = event;
        next = (next + 1) % buffer.length;
        if (size < buffer.length) {
            size++;
        }
        totalRecorded++;
    }

    /**
     * @return buffered events, oldest first
     */
    public synchronized List<RateLimitEvent> snapshot() {
        final var result = new ArrayList<RateLimitEvent>(size);
        final var start = (next - size + buffer.length) % buffer.length;
        for (var i = 0; i < size; i++) {
            result.add(buffer[(start + i) % buffer.length]);
        }
        return result;
    }

    /**
     * @param since inclusive lower bound
     * @return buffered events at or after {@code since}, oldest first
     */
    public List<RateLimitEvent> since(Instant since) {
        return snapshot().stream()
                .filter(event -> !event.timestamp().isBefore(since))
                .toList();
    }

    public synchronized int size() {
        return size;
    }

    public int capacity() {
        return buffer.length;
    }

    /**
     * @return events recorded since startup, including evicted ones
     */
    public synchronized long totalRecorded() {
        return totalRecorded;
    }

    public synchronized void clear() {
        Arrays.fill(buffer, null);
        next = 0;
        size = 0;
    }
}
