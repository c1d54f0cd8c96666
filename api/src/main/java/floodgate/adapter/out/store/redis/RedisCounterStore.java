package floodgate.adapter.out.store.redis;

import java.util.UUID;

import io.quarkus.redis.datasource.ReactiveRedisDataSource;
import io.quarkus.redis.datasource.keys.ReactiveKeyCommands;
import io.smallrye.mutiny.Uni;
import io.vertx.mutiny.redis.client.Response;
import org.jboss.logging.Logger;

import floodgate.core.model.ratelimit.CounterKey;
import floodgate.core.model.ratelimit.StoreUnavailableException;
import floodgate.core.model.ratelimit.WindowSnapshot;
import floodgate.core.port.out.CounterStore;

/**
 * Redis-based counter store for distributed deployments.
 *
 * <p>Every mutating operation is a single Lua script, so trimming, counting and
 * recording a request happen atomically on the server. Timestamps come from
 * Redis {@code TIME}, which keeps all instances on one clock.
 *
 * <p>Key format: {@code <prefix>{identifier}:<scope>:<rule>}. Sliding windows
 * are sorted sets scored by timestamp, concurrency counters are integers with a
 * TTL and penalties are plain keys with a TTL.
 */
public final class RedisCounterStore implements CounterStore {

    private static final Logger LOG = Logger.getLogger(RedisCounterStore.class);

    /**
     * Lua script for the sliding window log.
     *
     * <p>Arguments:
     * <ol>
     *   <li>KEYS[1] - the window key</li>
     *   <li>ARGV[1] - window length in milliseconds</li>
     *   <li>ARGV[2] - capacity (limit + burst)</li>
     *   <li>ARGV[3] - unique member suffix</li>
     * </ol>
     *
     * <p>Returns array: [count, admitted (0/1), oldest_ms, now_ms]
     */
    private static final String SLIDING_WINDOW_SCRIPT =
            """
            local key = KEYS[1]
            local window_ms = tonumber(ARGV[1])
            local capacity = tonumber(ARGV[2])

            local t = redis.call('TIME')
            local now_ms = tonumber(t[1]) * 1000 + math.floor(tonumber(t[2]) / 1000)

            redis.call('ZREMRANGEBYSCORE', key, '-inf', now_ms - window_ms)
            local count = redis.call('ZCARD', key)

            local admitted = 0
            if count < capacity then
                redis.call('ZADD', key, now_ms, now_ms .. '-' .. ARGV[3])
                admitted = 1
            end
            count = count + 1

            redis.call('PEXPIRE', key, window_ms)

            local oldest_ms = now_ms
            local oldest = redis.call('ZRANGE', key, 0, 0, 'WITHSCORES')
            if oldest[2] then
                oldest_ms = tonumber(oldest[2])
            end

            return {count, admitted, oldest_ms, now_ms}
            """;

    /**
     * Lua script for counting a window without recording.
     *
     * <p>Returns array: [count, 0, oldest_ms, now_ms]
     */
    private static final String PEEK_WINDOW_SCRIPT =
            """
            local key = KEYS[1]
            local window_ms = tonumber(ARGV[1])

            local t = redis.call('TIME')
            local now_ms = tonumber(t[1]) * 1000 + math.floor(tonumber(t[2]) / 1000)

            local count = redis.call('ZCOUNT', key, '(' .. (now_ms - window_ms), '+inf')
            local oldest_ms = now_ms
            local oldest = redis.call('ZRANGEBYSCORE', key, '(' .. (now_ms - window_ms), '+inf', 'WITHSCORES', 'LIMIT', 0, 1)
            if oldest[2] then
                oldest_ms = tonumber(oldest[2])
            end

            return {count, 0, oldest_ms, now_ms}
            """;

    /**
     * Lua script for acquiring a concurrency slot; sets the TTL only if the key has none.
     */
    private static final String INCREMENT_CONCURRENT_SCRIPT =
            """
            local count = redis.call('INCR', KEYS[1])
            if redis.call('TTL', KEYS[1]) < 0 then
                redis.call('EXPIRE', KEYS[1], tonumber(ARGV[1]))
            end
            return count
            """;

    /**
     * Lua script for releasing a concurrency slot, floored at zero.
     */
    private static final String DECREMENT_CONCURRENT_SCRIPT =
            """
            local count = tonumber(redis.call('GET', KEYS[1]) or '0')
            if count <= 1 then
                redis.call('DEL', KEYS[1])
                return 0
            end
            return redis.call('DECR', KEYS[1])
            """;

    private final ReactiveRedisDataSource redisDataSource;
    private final ReactiveKeyCommands<String> keyCommands;
    private final String keyPrefix;

    public RedisCounterStore(ReactiveRedisDataSource redisDataSource, String keyPrefix) {
        this.redisDataSource = redisDataSource;
        this.keyCommands = redisDataSource.key(String.class);
        this.keyPrefix = keyPrefix;
    }

    @Override
    public Uni<WindowSnapshot> incrementSlidingWindow(CounterKey key, long windowSeconds, long capacity) {
        return redisDataSource
                .execute(
                        "EVAL",
                        SLIDING_WINDOW_SCRIPT,
                        "1", // numkeys
                        redisKey(key), // KEYS[1]
                        String.valueOf(windowSeconds * 1000L), // ARGV[1]
                        String.valueOf(capacity), // ARGV[2]
                        UUID.randomUUID().toString() // ARGV[3]
                        )
                .map(this::parseWindowSnapshot)
                .onFailure()
                .transform(error -> unavailable("sliding window increment", key, error));
    }

    @Override
    public Uni<WindowSnapshot> peekSlidingWindow(CounterKey key, long windowSeconds) {
        return redisDataSource
                .execute("EVAL", PEEK_WINDOW_SCRIPT, "1", redisKey(key), String.valueOf(windowSeconds * 1000L))
                .map(this::parseWindowSnapshot)
                .onFailure()
                .transform(error -> unavailable("sliding window peek", key, error));
    }

    @Override
    public Uni<Long> incrementConcurrent(CounterKey key, long timeoutSeconds) {
        return redisDataSource
                .execute("EVAL", INCREMENT_CONCURRENT_SCRIPT, "1", redisKey(key), String.valueOf(timeoutSeconds))
                .map(this::toLong)
                .onFailure()
                .transform(error -> unavailable("concurrency increment", key, error));
    }

    @Override
    public Uni<Long> decrementConcurrent(CounterKey key) {
        return redisDataSource
                .execute("EVAL", DECREMENT_CONCURRENT_SCRIPT, "1", redisKey(key))
                .map(this::toLong)
                .onFailure()
                .transform(error -> unavailable("concurrency decrement", key, error));
    }

    @Override
    public Uni<Long> peekConcurrent(CounterKey key) {
        return redisDataSource
                .execute("GET", redisKey(key))
                .map(this::toLong)
                .onFailure()
                .transform(error -> unavailable("concurrency peek", key, error));
    }

    @Override
    public Uni<Void> startPenalty(CounterKey key, long seconds) {
        return redisDataSource
                .execute("SET", redisPenaltyKey(key), "1", "EX", String.valueOf(seconds))
                .replaceWithVoid()
                .onFailure()
                .transform(error -> unavailable("penalty start", key, error));
    }

    @Override
    public Uni<Long> penaltyRemaining(CounterKey key) {
        return redisDataSource
                .execute("TTL", redisPenaltyKey(key))
                .map(response -> Math.max(0L, toLong(response)))
                .onFailure()
                .transform(error -> unavailable("penalty lookup", key, error));
    }

    @Override
    public Uni<Void> reset(CounterKey key) {
        return keyCommands
                .del(redisKey(key), redisPenaltyKey(key))
                .replaceWithVoid()
                .onFailure()
                .transform(error -> unavailable("reset", key, error));
    }

    @Override
    public Uni<Long> resetMatching(String prefix) {
        final var pattern = escapeGlob(keyPrefix + prefix) + "*";

        return keyCommands
                .keys(pattern)
                .flatMap(keys -> {
                    if (keys.isEmpty()) {
                        return Uni.createFrom().item(0);
                    }
                    return keyCommands.del(keys.toArray(new String[0]));
                })
                .map(Integer::longValue)
                .onFailure()
                .transform(error -> {
                    LOG.warnv(error, "Failed to remove keys matching prefix: {0}", prefix);
                    return new StoreUnavailableException("Redis reset of " + prefix + " failed", error);
                });
    }

    @Override
    public String name() {
        return "redis";
    }

    @Override
    public Uni<Boolean> isHealthy() {
        return redisDataSource
                .execute("PING")
                .map(response -> response != null)
                .onFailure()
                .recoverWithItem(error -> {
                    LOG.debugv("Redis ping failed: {0}", error.getMessage());
                    return false;
                });
    }

    private String redisKey(CounterKey key) {
        return keyPrefix + key.value();
    }

    private String redisPenaltyKey(CounterKey key) {
        return keyPrefix + key.penaltyValue();
    }

    private WindowSnapshot parseWindowSnapshot(Response response) {
        if (response == null || response.size() < 4) {
            throw new IllegalStateException("Unexpected response from Redis: " + response);
        }
        return new WindowSnapshot(
                response.get(0).toLong(),
                response.get(1).toLong() == 1,
                response.get(2).toLong(),
                response.get(3).toLong());
    }

    private long toLong(Response response) {
        if (response == null) {
            return 0L;
        }
        return response.toLong();
    }

    private StoreUnavailableException unavailable(String operation, CounterKey key, Throwable error) {
        if (error instanceof StoreUnavailableException sue) {
            return sue;
        }
        return new StoreUnavailableException("Redis " + operation + " failed for " + key, error);
    }

    static String escapeGlob(String value) {
        final var escaped = new StringBuilder(value.length());
        for (final var c : value.toCharArray()) {
            if (c == '*' || c == '?' || c == '[' || c == ']' || c == '\\') {
                escaped.append('\\');
            }
            escaped.append(c);
        }
        return escaped.toString();
    }
}
