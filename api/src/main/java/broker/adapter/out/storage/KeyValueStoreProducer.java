package broker.adapter.out.storage;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Inject;

import broker.core.port.out.KeyValueStore;
import broker.core.service.storage.StorageProviderRegistry;

/**
 * CDI producer for the key-value store.
 *
 * <p>Delegates to the {@link StorageProviderRegistry} which discovers and
 * selects the appropriate storage provider based on configuration and availability.
 *
 * @see broker.spi.StorageProvider
 */
@ApplicationScoped
public class KeyValueStoreProducer {

    private final StorageProviderRegistry registry;

    @Inject
    public KeyValueStoreProducer(StorageProviderRegistry registry) {
        this.registry = registry;
    }

    @Produces
    @ApplicationScoped
    public KeyValueStore keyValueStore() {
        return registry.getStore();
    }
}
