package floodgate.adapter.out.store.redis;

import io.quarkus.redis.datasource.ReactiveRedisDataSource;

import floodgate.core.port.out.CounterStore;
import floodgate.spi.CounterStoreProvider;

/**
 * Redis counter store provider for distributed deployments.
 *
 * <p>Has higher priority than in-memory (10 vs 0) and is selected when Redis is
 * enabled for rate limiting and a data source is configured.
 */
public final class RedisCounterStoreProvider implements CounterStoreProvider {

    private static final int PRIORITY = 10;
    private static final String NAME = "redis";

    private final ReactiveRedisDataSource redisDataSource;
    private final String keyPrefix;

    public RedisCounterStoreProvider(ReactiveRedisDataSource redisDataSource, String keyPrefix) {
        this.redisDataSource = redisDataSource;
        this.keyPrefix = keyPrefix;
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
        return redisDataSource != null;
    }

    @Override
    public CounterStore createCounterStore() {
        if (redisDataSource == null) {
            throw new IllegalStateException("Redis data source is not configured");
        }
        return new RedisCounterStore(redisDataSource, keyPrefix);
    }
}
