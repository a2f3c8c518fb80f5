package broker.adapter.out.telemetry;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.eclipse.microprofile.config.inject.ConfigProperty;

import broker.core.port.out.BrokerMetrics;

/**
 * Records session broker metrics using Micrometer.
 *
 * <p>All methods are no-ops when metrics are disabled, making it safe
 * to inject and call without checking configuration at each call site.
 *
 * <p>Metrics recorded:
 * <ul>
 *   <li>{@code broker.session.refresh} - Refresh attempts by outcome</li>
 *   <li>{@code broker.session.rotations} - Session identifier rotations</li>
 *   <li>{@code broker.session.logouts} - Logouts by provider revocation result</li>
 *   <li>{@code broker.store.timeouts} - Key-value store timeouts by backend and operation</li>
 *   <li>{@code broker.store.failures} - Key-value store failures by backend and operation</li>
 * </ul>
 */
@ApplicationScoped
public class MicrometerBrokerMetrics implements BrokerMetrics {

    private final MeterRegistry registry;
    private final boolean enabled;

    @Inject
    public MicrometerBrokerMetrics(
            MeterRegistry registry, @ConfigProperty(name = "broker.metrics.enabled", defaultValue = "true") boolean enabled) {
        this.registry = registry;
        this.enabled = enabled;
    }

    @Override
    public void recordRefresh(String outcome) {
        if (!enabled) {
            return;
        }

        Counter.builder("broker.session.refresh")
                .description("Access token refresh attempts")
                .tag("outcome", outcome)
                .register(registry)
                .increment();
    }

    @Override
    public void recordRotation() {
        if (!enabled) {
            return;
        }

        Counter.builder("broker.session.rotations")
                .description("Session identifier rotations")
                .register(registry)
                .increment();
    }

    @Override
    public void recordLogout(boolean revoked) {
        if (!enabled) {
            return;
        }

        Counter.builder("broker.session.logouts")
                .description("Logouts, tagged with whether the provider revoked the refresh token")
                .tag("revoked", String.valueOf(revoked))
                .register(registry)
                .increment();
    }

    @Override
    public void recordStoreTimeout(String backend, String operation) {
        if (!enabled) {
            return;
        }

        Counter.builder("broker.store.timeouts")
                .description("Key-value store operations that timed out")
                .tag("backend", backend)
                .tag("operation", operation)
                .register(registry)
                .increment();
    }

    @Override
    public void recordStoreFailure(String backend, String operation) {
        if (!enabled) {
            return;
        }

        Counter.builder("broker.store.failures")
                .description("Key-value store operations that failed")
                .tag("backend", backend)
                .tag("operation", operation)
                .register(registry)
                .increment();
    }
}
