package broker.adapter.out.storage.redis;

import java.time.Duration;
import java.util.Optional;

import io.quarkus.redis.datasource.ReactiveRedisDataSource;
import io.quarkus.redis.datasource.keys.ReactiveKeyCommands;
import io.quarkus.redis.datasource.value.ReactiveValueCommands;
import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import broker.core.port.out.KeyValueStore;

/**
 * Redis implementation of the key-value store.
 *
 * <p>Values are plain strings with millisecond TTLs. {@link #getAndDelete} uses GETDEL
 * (Redis 6.2+), {@link #putIfAbsent} uses SET NX and {@link #replaceIfPresent} uses SET XX,
 * all atomic on the server.
 * {@link #deleteIfEquals} runs a compare-and-delete script so that a lease is only ever
 * released by its owner.
 *
 * <p>Instances are created by {@link RedisStorageProvider}.
 */
public class RedisKeyValueStore implements KeyValueStore {

    private static final Logger LOG = Logger.getLogger(RedisKeyValueStore.class);

    private static final String COMPARE_AND_DELETE_SCRIPT =
            """
            if redis.call('GET', KEYS[1]) == ARGV[1] then
                return redis.call('DEL', KEYS[1])
            end
            return 0
            """;

    private final ReactiveRedisDataSource redisDataSource;
    private final ReactiveValueCommands<String, String> valueCommands;
    private final ReactiveKeyCommands<String> keyCommands;
    private final RedisTimeoutHelper timeoutHelper;

    public RedisKeyValueStore(ReactiveRedisDataSource redisDataSource, RedisTimeoutHelper timeoutHelper) {
        this.redisDataSource = redisDataSource;
        this.valueCommands = redisDataSource.value(String.class, String.class);
        this.keyCommands = redisDataSource.key(String.class);
        this.timeoutHelper = timeoutHelper;
    }

    @Override
    public Uni<Void> put(String key, String value, Duration ttl) {
        var operation = valueCommands.psetex(key, ttlMillis(ttl), value);
        return timeoutHelper.withTimeout(operation, "put");
    }

    @Override
    public Uni<Boolean> putIfAbsent(String key, String value, Duration ttl) {
        return conditionalSet(key, value, ttl, "NX", "putIfAbsent");
    }

    @Override
    public Uni<Boolean> replaceIfPresent(String key, String value, Duration ttl) {
        return conditionalSet(key, value, ttl, "XX", "replaceIfPresent");
    }

    @Override
    public Uni<Optional<String>> get(String key) {
        var operation = valueCommands.get(key).map(Optional::ofNullable);
        return timeoutHelper.withTimeout(operation, "get");
    }

    @Override
    public Uni<Optional<String>> getAndDelete(String key) {
        var operation = valueCommands.getdel(key).map(Optional::ofNullable);
        return timeoutHelper.withTimeout(operation, "getAndDelete");
    }

    @Override
    public Uni<Void> delete(String key) {
        var operation = keyCommands.del(key).replaceWithVoid();
        return timeoutHelper.withTimeout(operation, "delete");
    }

    @Override
    public Uni<Boolean> deleteIfEquals(String key, String expected) {
        // EVAL script numkeys key arg
        var operation = redisDataSource
                .execute("EVAL", COMPARE_AND_DELETE_SCRIPT, "1", key, expected)
                .map(response -> response != null && response.toLong() == 1L);
        return timeoutHelper.withTimeout(operation, "deleteIfEquals");
    }

    // SET key value NX|XX PX ttl, replies nil when the condition does not hold
    private Uni<Boolean> conditionalSet(String key, String value, Duration ttl, String condition, String operationName) {
        var operation = redisDataSource
                .execute("SET", key, value, condition, "PX", String.valueOf(ttlMillis(ttl)))
                .map(response -> {
                    if (response != null) {
                        return true;
                    }
                    LOG.debugf("SET %s not applied in Redis: %s", condition, key);
                    return false;
                });
        return timeoutHelper.withTimeout(operation, operationName);
    }

    private static long ttlMillis(Duration ttl) {
        return Math.max(1L, ttl.toMillis());
    }
}
