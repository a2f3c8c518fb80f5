package broker.adapter.out.storage.memory;

import java.time.Clock;
import java.util.Optional;

import jakarta.annotation.PreDestroy;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import org.eclipse.microprofile.health.HealthCheckResponse;
import org.jboss.logging.Logger;

import broker.core.port.out.KeyValueStore;
import broker.spi.StorageProvider;

/**
 * In-memory storage provider.
 *
 * <p>This provider is always available and serves as a fallback when
 * Redis or other storage backends are unavailable.
 *
 * <p><strong>Warning:</strong> Refresh leases and sessions are local to one process, so a
 * multi-instance deployment on this provider loses the single-refresh guarantee.
 */
@ApplicationScoped
public class InMemoryStorageProvider implements StorageProvider {

    private static final Logger LOG = Logger.getLogger(InMemoryStorageProvider.class);
    private static final int PRIORITY = 0;

    private final Clock clock;
    private InMemoryKeyValueStore store;

    @Inject
    public InMemoryStorageProvider(Clock clock) {
        this.clock = clock;
    }

    @Override
    public String name() {
        return "memory";
    }

    @Override
    public int priority() {
        return PRIORITY;
    }

    @Override
    public boolean isAvailable() {
        return true;
    }

    @Override
    public synchronized KeyValueStore createStore() {
        if (store == null) {
            LOG.warn("========================================================================");
            LOG.warn("  WARNING: Session storage is in-memory only!");
            LOG.warn("  Sessions are lost on restart and not shared between broker instances.");
            LOG.warn("  Configure Redis or a custom StorageProvider for production.");
            LOG.warn("========================================================================");
            store = new InMemoryKeyValueStore(clock);
        }
        return store;
    }

    @Override
    public Optional<HealthCheckResponse> healthCheck() {
        return Optional.of(HealthCheckResponse.named("session-storage-memory")
                .up()
                .withData("type", "in-memory")
                .withData("entries", store != null ? store.size() : 0)
                .build());
    }

    @PreDestroy
    void shutdown() {
        if (store != null) {
            store.shutdown();
        }
    }
}
