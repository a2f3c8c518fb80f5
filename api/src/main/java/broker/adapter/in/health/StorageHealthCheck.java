package broker.adapter.in.health;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import org.eclipse.microprofile.health.HealthCheck;
import org.eclipse.microprofile.health.HealthCheckResponse;
import org.eclipse.microprofile.health.Readiness;

import broker.core.service.storage.StorageProviderRegistry;

/**
 * Readiness check for the selected key-value storage backend.
 *
 * <p>Delegates to the provider's own health report, which uses cached state and never blocks.
 */
@Readiness
@ApplicationScoped
public class StorageHealthCheck implements HealthCheck {

    private final StorageProviderRegistry registry;

    @Inject
    public StorageHealthCheck(StorageProviderRegistry registry) {
        this.registry = registry;
    }

    @Override
    public HealthCheckResponse call() {
        final var provider = registry.getSelectedProvider();
        return provider.healthCheck()
                .orElseGet(() -> HealthCheckResponse.named("session-storage-" + provider.name())
                        .up()
                        .withData("type", provider.name())
                        .build());
    }
}
