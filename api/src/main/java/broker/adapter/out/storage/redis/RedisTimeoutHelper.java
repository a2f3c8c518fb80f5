package broker.adapter.out.storage.redis;

import java.time.Duration;

import io.smallrye.mutiny.TimeoutException;
import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import broker.core.port.out.BrokerMetrics;
import broker.core.port.out.KeyValueStore.StoreUnavailableException;

/**
 * Helper for applying timeouts and failure handling to Redis operations.
 *
 * <p>The broker never degrades on store errors: a missing record and an unreachable backend
 * must stay distinguishable. Both timeouts and failures (connection errors, server errors)
 * therefore surface as {@link StoreUnavailableException}.
 *
 * <h2>Metrics</h2>
 * Records separate metrics for timeouts ({@code broker.store.timeouts}) and
 * non-timeout failures ({@code broker.store.failures}).
 */
public class RedisTimeoutHelper {

    private static final Logger LOG = Logger.getLogger(RedisTimeoutHelper.class);

    private final Duration timeout;
    private final BrokerMetrics metrics;
    private final String backendName;

    /**
     * Create a new timeout helper.
     *
     * @param timeout the timeout duration for Redis operations
     * @param metrics the metrics instance for recording timeouts (may be null)
     * @param backendName the backend name for metrics tagging
     */
    public RedisTimeoutHelper(Duration timeout, BrokerMetrics metrics, String backendName) {
        this.timeout = timeout;
        this.metrics = metrics;
        this.backendName = backendName;
    }

    /**
     * Apply timeout and failure mapping to an operation.
     *
     * @param operation the Redis operation
     * @param operationName name for logging and metrics
     * @param <T> the result type
     * @return a Uni that fails with {@link StoreUnavailableException} on timeout or failure
     */
    public <T> Uni<T> withTimeout(Uni<T> operation, String operationName) {
        return operation
                .ifNoItem()
                .after(timeout)
                .failWith(() -> {
                    LOG.warnv("Redis operation timeout: {0} in {1} after {2}", operationName, backendName, timeout);
                    recordTimeout(operationName);
                    return new StoreUnavailableException(operationName, new TimeoutException());
                })
                .onFailure(error -> !(error instanceof StoreUnavailableException))
                .transform(error -> {
                    LOG.warnv("Redis operation failure: {0} in {1}: {2}", operationName, backendName, error.getMessage());
                    recordFailure(operationName);
                    return new StoreUnavailableException(operationName, error);
                });
    }

    private void recordTimeout(String operationName) {
        if (metrics != null) {
            metrics.recordStoreTimeout(backendName, operationName);
        }
    }

    private void recordFailure(String operationName) {
        if (metrics != null) {
            metrics.recordStoreFailure(backendName, operationName);
        }
    }
}
