package broker.core.service.storage;

import java.util.Comparator;
import java.util.List;
import java.util.Optional;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.event.Observes;
import jakarta.enterprise.inject.Instance;
import jakarta.inject.Inject;

import io.quarkus.runtime.StartupEvent;
import org.jboss.logging.Logger;

import broker.core.config.SessionConfig;
import broker.core.port.out.KeyValueStore;
import broker.spi.StorageProvider;

/**
 * Registry for key-value storage providers.
 *
 * <p>Discovers available providers via CDI and selects the appropriate one
 * based on configuration and availability.
 *
 * <p>Selection order:
 * <ol>
 *   <li>Configured provider (broker.session.storage.provider), if available</li>
 *   <li>Highest priority available provider</li>
 *   <li>Memory fallback (always available)</li>
 * </ol>
 */
@ApplicationScoped
public class StorageProviderRegistry {

    private static final Logger LOG = Logger.getLogger(StorageProviderRegistry.class);

    private final Instance<StorageProvider> providers;
    private final SessionConfig config;

    private StorageProvider selectedProvider;
    private KeyValueStore store;

    @Inject
    public StorageProviderRegistry(Instance<StorageProvider> providers, SessionConfig config) {
        this.providers = providers;
        this.config = config;
    }

    /**
     * Select the provider during startup, on a worker thread, so that availability checks
     * never block the event loop on the first request.
     */
    void onStart(@Observes StartupEvent event) {
        getSelectedProvider();
        LOG.infof("Storage provider initialized: %s", selectedProvider.name());
    }

    /**
     * Get the key-value store from the selected provider.
     *
     * @return Key-value store instance
     */
    public synchronized KeyValueStore getStore() {
        if (store == null) {
            store = getSelectedProvider().createStore();
        }
        return store;
    }

    /**
     * Get the selected storage provider.
     *
     * @return Selected provider
     */
    public synchronized StorageProvider getSelectedProvider() {
        if (selectedProvider == null) {
            selectedProvider = selectProvider();
        }
        return selectedProvider;
    }

    private StorageProvider selectProvider() {
        final String configuredProvider = config.storage().provider();

        // The configured provider is checked on its own so that selecting it never waits on
        // availability checks of the others
        final Optional<StorageProvider> configured = providers.stream()
                .filter(p -> p.name().equals(configuredProvider))
                .findFirst();
        if (configured.isPresent() && configured.get().isAvailable()) {
            LOG.infof("Using configured storage provider: %s", configuredProvider);
            return configured.get();
        }

        LOG.warnf("Configured storage provider '%s' is not available, falling back", configuredProvider);

        final List<StorageProvider> availableProviders = getAvailableProviders().stream()
                .sorted(Comparator.comparingInt(StorageProvider::priority).reversed())
                .toList();
        LOG.debugf(
                "Available storage providers: %s",
                availableProviders.stream().map(StorageProvider::name).toList());

        if (!availableProviders.isEmpty()) {
            final StorageProvider provider = availableProviders.get(0);
            LOG.infof("Using storage provider: %s (priority: %d)", provider.name(), provider.priority());
            return provider;
        }

        throw new IllegalStateException("No storage providers available");
    }

    /**
     * Get all available providers.
     *
     * @return List of available providers
     */
    public List<StorageProvider> getAvailableProviders() {
        return providers.stream().filter(StorageProvider::isAvailable).toList();
    }
}
