package floodgate.adapter.out.store.memory;

import java.time.Clock;
import java.time.Duration;

import floodgate.core.port.out.CounterStore;
import floodgate.spi.CounterStoreProvider;

/**
 * In-memory counter store provider.
 *
 * <p>Always available, with the lowest priority (0), so other stores are
 * preferred when they can be used.
 */
public final class InMemoryCounterStoreProvider implements CounterStoreProvider {

    private static final int PRIORITY = 0;
    private static final String NAME = "memory";

    private final Clock clock;
    private final Duration cleanupInterval;

    public InMemoryCounterStoreProvider(Clock clock, Duration cleanupInterval) {
        this.clock = clock;
        this.cleanupInterval = cleanupInterval;
    }

    @Override
    public int priority() {
        return PRIORITY;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public boolean isAvailable() {
        return true;
    }

    @Override
    public CounterStore createCounterStore() {
        return new InMemoryCounterStore(clock, cleanupInterval);
    }
}
