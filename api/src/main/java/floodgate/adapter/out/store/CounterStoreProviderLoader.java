package floodgate.adapter.out.store;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.ServiceLoader;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Disposes;
import jakarta.enterprise.inject.Instance;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Inject;

import io.quarkus.redis.datasource.ReactiveRedisDataSource;
import org.jboss.logging.Logger;

import floodgate.adapter.out.store.memory.InMemoryCounterStore;
import floodgate.adapter.out.store.memory.InMemoryCounterStoreProvider;
import floodgate.adapter.out.store.redis.RedisCounterStoreProvider;
import floodgate.core.config.RateLimitingConfig;
import floodgate.core.port.out.CounterStore;
import floodgate.spi.CounterStoreProvider;

/**
 * CDI producer for the counter store.
 *
 * <p>Candidates, highest priority first:
 * <ul>
 *   <li>Custom providers registered through {@link ServiceLoader}</li>
 *   <li>Redis (priority 10) - when enabled and a data source is resolvable</li>
 *   <li>In-memory (priority 0) - fallback, always available</li>
 * </ul>
 */
@ApplicationScoped
public class CounterStoreProviderLoader {

    private static final Logger LOG = Logger.getLogger(CounterStoreProviderLoader.class);

    private final RateLimitingConfig config;
    private final Instance<ReactiveRedisDataSource> redisDataSource;
    private final Clock clock;

    @Inject
    public CounterStoreProviderLoader(
            RateLimitingConfig config, Instance<ReactiveRedisDataSource> redisDataSource, Clock clock) {
        this.config = config;
        this.redisDataSource = redisDataSource;
        this.clock = clock;
    }

    /**
     * Produces the counter store instance for CDI injection.
     *
     * @return the selected counter store
     */
    @Produces
    @ApplicationScoped
    public CounterStore produceCounterStore() {
        final var candidates = new ArrayList<CounterStoreProvider>();
        ServiceLoader.load(CounterStoreProvider.class).forEach(candidates::add);
        createRedisProvider(candidates);
        candidates.add(new InMemoryCounterStoreProvider(clock, config.cleanupInterval()));
        candidates.sort(Comparator.comparingInt(CounterStoreProvider::priority).reversed());

        return select(candidates);
    }

    /**
     * Disposes the counter store, shutting down any cleanup executors.
     */
    void disposeCounterStore(@Disposes CounterStore store) {
        if (store instanceof InMemoryCounterStore inMemory) {
            inMemory.shutdown();
        }
    }

    private CounterStore select(List<CounterStoreProvider> candidates) {
        for (final var provider : candidates) {
            if (!provider.isAvailable()) {
                LOG.debugv("Counter store provider {0} not available", provider.name());
                continue;
            }
            try {
                final var store = provider.createCounterStore();
                LOG.infov("Using counter store provider: {0} (priority {1})", provider.name(), provider.priority());
                return store;
            } catch (RuntimeException e) {
                LOG.warnv(e, "Failed to initialize counter store provider {0}, trying next", provider.name());
            }
        }
        throw new IllegalStateException("No counter store provider available");
    }

    private void createRedisProvider(List<CounterStoreProvider> candidates) {
        if (!config.redis().enabled()) {
            LOG.debug("Redis counter store not enabled in configuration");
            return;
        }

        if (!redisDataSource.isResolvable()) {
            LOG.warn("Redis counter store enabled but ReactiveRedisDataSource not available");
            return;
        }

        try {
            candidates.add(new RedisCounterStoreProvider(redisDataSource.get(), config.redis().keyPrefix()));
        } catch (RuntimeException e) {
            LOG.warnv(e, "Failed to obtain Redis data source, falling back to in-memory");
        }
    }
}
