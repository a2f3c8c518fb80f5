package broker.adapter.out.storage.memory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import broker.core.port.out.KeyValueStore;

/**
 * In-memory implementation of the key-value store.
 *
 * <p>This implementation is intended for development and testing only.
 * Entries are lost on restart and not shared across instances.
 *
 * <p>Expired entries are invisible to every operation and swept by a background task.
 * Atomicity of the conditional operations comes from {@link ConcurrentMap#compute},
 * {@link ConcurrentMap#computeIfPresent} and {@link ConcurrentMap#remove}.
 *
 * <p><strong>Warning:</strong> Do not use in production with multiple instances.
 */
public class InMemoryKeyValueStore implements KeyValueStore {

    private static final Logger LOG = Logger.getLogger(InMemoryKeyValueStore.class);

    private final ConcurrentMap<String, Entry> entries = new ConcurrentHashMap<>();
    private final Clock clock;
    private final ScheduledExecutorService cleanupExecutor;

    public InMemoryKeyValueStore(Clock clock) {
        this.clock = clock;
        this.cleanupExecutor = Executors.newSingleThreadScheduledExecutor(r -> {
            var t = new Thread(r, "kv-store-cleanup");
            t.setDaemon(true);
            return t;
        });

        // Run cleanup every minute
        cleanupExecutor.scheduleAtFixedRate(this::cleanupExpired, 1, 1, TimeUnit.MINUTES);
        LOG.info("Initialized in-memory key-value store");
    }

    @Override
    public Uni<Void> put(String key, String value, Duration ttl) {
        return Uni.createFrom().item(() -> {
            entries.put(key, new Entry(value, expiry(ttl)));
            return null;
        });
    }

    @Override
    public Uni<Boolean> putIfAbsent(String key, String value, Duration ttl) {
        return Uni.createFrom().item(() -> {
            final var now = clock.instant();
            final var stored = new AtomicBoolean(false);
            entries.compute(key, (k, existing) -> {
                if (existing != null && !existing.isExpired(now)) {
                    return existing;
                }
                stored.set(true);
                return new Entry(value, expiry(ttl));
            });
            return stored.get();
        });
    }

    @Override
    public Uni<Boolean> replaceIfPresent(String key, String value, Duration ttl) {
        return Uni.createFrom().item(() -> {
            final var now = clock.instant();
            final var replaced = new AtomicBoolean(false);
            entries.computeIfPresent(key, (k, existing) -> {
                if (existing.isExpired(now)) {
                    return null;
                }
                replaced.set(true);
                return new Entry(value, expiry(ttl));
            });
            return replaced.get();
        });
    }

    @Override
    public Uni<Optional<String>> get(String key) {
        return Uni.createFrom().item(() -> {
            final var entry = entries.get(key);
            if (entry == null || entry.isExpired(clock.instant())) {
                return Optional.<String>empty();
            }
            return Optional.of(entry.value());
        });
    }

    @Override
    public Uni<Optional<String>> getAndDelete(String key) {
        return Uni.createFrom().item(() -> {
            final var entry = entries.remove(key);
            if (entry == null || entry.isExpired(clock.instant())) {
                return Optional.<String>empty();
            }
            return Optional.of(entry.value());
        });
    }

    @Override
    public Uni<Void> delete(String key) {
        return Uni.createFrom().item(() -> {
            entries.remove(key);
            return null;
        });
    }

    @Override
    public Uni<Boolean> deleteIfEquals(String key, String expected) {
        return Uni.createFrom().item(() -> {
            final var now = clock.instant();
            final var deleted = new AtomicBoolean(false);
            entries.computeIfPresent(key, (k, existing) -> {
                if (existing.isExpired(now)) {
                    return null;
                }
                if (existing.value().equals(expected)) {
                    deleted.set(true);
                    return null;
                }
                return existing;
            });
            return deleted.get();
        });
    }

    private Instant expiry(Duration ttl) {
        return clock.instant().plus(ttl);
    }

    private void cleanupExpired() {
        final var now = clock.instant();
        final var before = entries.size();

        entries.entrySet().removeIf(entry -> entry.getValue().isExpired(now));

        final var removed = before - entries.size();
        if (removed > 0) {
            LOG.debugf("Cleaned up %d expired key-value entries", removed);
        }
    }

    /**
     * Shuts down the cleanup executor.
     */
    public void shutdown() {
        cleanupExecutor.shutdown();
        try {
            if (!cleanupExecutor.awaitTermination(5, TimeUnit.SECONDS)) {
                cleanupExecutor.shutdownNow();
            }
        } catch (InterruptedException e) {
            cleanupExecutor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    /**
     * Get the current count of stored entries, including expired ones not yet swept.
     */
    public int size() {
        return entries.size();
    }

    private record Entry(String value, Instant expiresAt) {

        boolean isExpired(Instant now) {
            return !now.isBefore(expiresAt);
        }
    }
}
