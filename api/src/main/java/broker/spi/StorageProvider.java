package broker.spi;

import java.util.Optional;

import org.eclipse.microprofile.health.HealthCheckResponse;

import broker.core.port.out.KeyValueStore;

/**
 * SPI for custom key-value storage backends.
 *
 * <p>Sessions, PKCE bindings and refresh leases all live in the store produced by the selected
 * provider. Platform teams can implement this interface to plug in another backend.
 *
 * <p>Built-in providers:
 * <ul>
 *   <li>redis (priority: 100) - Redis-based storage</li>
 *   <li>memory (priority: 0) - In-memory storage (development and tests only)</li>
 * </ul>
 *
 * <p>Provider selection order:
 * <ol>
 *   <li>Configured provider (broker.session.storage.provider)</li>
 *   <li>Highest priority available provider</li>
 *   <li>Memory fallback (always available)</li>
 * </ol>
 */
public interface StorageProvider {

    /**
     * Return the provider name used in {@code broker.session.storage.provider}.
     *
     * @return Provider name (e.g., "redis", "memory")
     */
    String name();

    /**
     * Return the provider priority for automatic selection.
     *
     * @return Priority value (higher = more preferred)
     */
    int priority();

    /**
     * Check if this provider is available and ready to use.
     *
     * @return true if the provider can be used
     */
    boolean isAvailable();

    /**
     * Create the key-value store implementation.
     *
     * @return Key-value store instance
     */
    KeyValueStore createStore();

    /**
     * Report the health of this storage backend for {@code /q/health}.
     *
     * @return Health check response, or empty if not supported
     */
    Optional<HealthCheckResponse> healthCheck();
}
