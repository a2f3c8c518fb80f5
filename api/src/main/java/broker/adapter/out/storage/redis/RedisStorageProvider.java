package broker.adapter.out.storage.redis;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import jakarta.annotation.PostConstruct;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.quarkus.redis.datasource.ReactiveRedisDataSource;
import org.eclipse.microprofile.health.HealthCheckResponse;
import org.jboss.logging.Logger;

import broker.core.config.SessionConfig;
import broker.core.port.out.BrokerMetrics;
import broker.core.port.out.KeyValueStore;
import broker.spi.StorageProvider;

/**
 * Redis-based storage provider.
 *
 * <p>This is the provider for production deployments. Sessions, PKCE bindings and refresh
 * leases are shared by every broker instance and expire through Redis TTLs.
 */
@ApplicationScoped
public class RedisStorageProvider implements StorageProvider {

    private static final Logger LOG = Logger.getLogger(RedisStorageProvider.class);
    private static final int PRIORITY = 100;
    private static final Duration AVAILABILITY_CHECK_TIMEOUT = Duration.ofSeconds(5);

    private final ReactiveRedisDataSource redisDataSource;
    private final SessionConfig sessionConfig;
    private final BrokerMetrics metrics;

    private RedisKeyValueStore store;
    private final AtomicBoolean available = new AtomicBoolean(false);
    private final CountDownLatch checkLatch = new CountDownLatch(1);

    @Inject
    public RedisStorageProvider(
            ReactiveRedisDataSource redisDataSource, SessionConfig sessionConfig, BrokerMetrics metrics) {
        this.redisDataSource = redisDataSource;
        this.sessionConfig = sessionConfig;
        this.metrics = metrics;
    }

    @PostConstruct
    void checkAvailability() {
        redisDataSource
                .execute("PING")
                .ifNoItem()
                .after(AVAILABILITY_CHECK_TIMEOUT)
                .fail()
                .subscribe()
                .with(
                        result -> {
                            available.set(true);
                            checkLatch.countDown();
                            LOG.info("Redis storage is available");
                        },
                        error -> {
                            available.set(false);
                            checkLatch.countDown();
                            LOG.warnf("Redis storage is not available: %s", error.getMessage());
                        });
    }

    @Override
    public String name() {
        return "redis";
    }

    @Override
    public int priority() {
        return PRIORITY;
    }

    @Override
    public boolean isAvailable() {
        try {
            if (!checkLatch.await(AVAILABILITY_CHECK_TIMEOUT.toSeconds() + 1, TimeUnit.SECONDS)) {
                LOG.warn("Redis availability check timed out");
                return false;
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
        return available.get();
    }

    @Override
    public synchronized KeyValueStore createStore() {
        if (store == null) {
            final var timeoutHelper = new RedisTimeoutHelper(sessionConfig.storage().timeout(), metrics, name());
            store = new RedisKeyValueStore(redisDataSource, timeoutHelper);
            LOG.infof("Created Redis key-value store with operation timeout %s", sessionConfig.storage().timeout());
        }
        return store;
    }

    @Override
    public Optional<HealthCheckResponse> healthCheck() {
        // Cached state, health checks must not block
        if (available.get()) {
            return Optional.of(HealthCheckResponse.named("session-storage-redis")
                    .up()
                    .withData("type", "redis")
                    .withData("keyPrefix", sessionConfig.storage().sessionKeyPrefix())
                    .build());
        }
        return Optional.of(HealthCheckResponse.named("session-storage-redis")
                .down()
                .withData("type", "redis")
                .withData("error", "Redis not available or check not completed")
                .build());
    }
}
