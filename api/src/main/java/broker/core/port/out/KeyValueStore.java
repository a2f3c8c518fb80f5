package broker.core.port.out;

import java.time.Duration;
import java.util.Optional;

import io.smallrye.mutiny.Uni;

/**
 * Outbound port for the TTL-bound key-value backend holding sessions, PKCE bindings and
 * refresh leases.
 *
 * <h2>Implementation Requirements</h2>
 * <ul>
 *   <li>Entries MUST expire automatically once their TTL has elapsed; callers never sweep</li>
 *   <li>{@link #getAndDelete}, {@link #putIfAbsent} and {@link #replaceIfPresent} MUST be atomic</li>
 *   <li>Backend failures and timeouts MUST surface as {@link StoreUnavailableException},
 *       never as an empty result</li>
 *   <li>All operations MUST be non-blocking (return Uni)</li>
 * </ul>
 */
public interface KeyValueStore {

    /**
     * Store or replace a value.
     *
     * @param key the key
     * @param value the value
     * @param ttl time-to-live, must be positive
     * @return Uni completing when stored
     */
    Uni<Void> put(String key, String value, Duration ttl);

    /**
     * Store a value only if the key does not exist yet.
     *
     * @param key the key
     * @param value the value
     * @param ttl time-to-live, must be positive
     * @return true if stored, false if the key was already present
     */
    Uni<Boolean> putIfAbsent(String key, String value, Duration ttl);

    /**
     * Replace a value only if the key still exists. An expired key counts as absent.
     *
     * @param key the key
     * @param value the new value
     * @param ttl time-to-live, must be positive
     * @return true if replaced, false if the key was absent
     */
    Uni<Boolean> replaceIfPresent(String key, String value, Duration ttl);

    /**
     * Retrieve a value.
     *
     * @param key the key
     * @return the value, or empty if absent or expired
     */
    Uni<Optional<String>> get(String key);

    /**
     * Retrieve and delete a value in one atomic step.
     *
     * <p>Of two concurrent calls for the same key at most one observes the value.
     *
     * @param key the key
     * @return the value, or empty if absent or expired
     */
    Uni<Optional<String>> getAndDelete(String key);

    /**
     * Delete a key. Deleting an absent key is not an error.
     *
     * @param key the key
     * @return Uni completing when deleted
     */
    Uni<Void> delete(String key);

    /**
     * Delete a key only while it still holds the expected value.
     *
     * @param key the key
     * @param expected the value the caller believes is stored
     * @return true if the key was deleted
     */
    Uni<Boolean> deleteIfEquals(String key, String expected);

    /**
     * Raised when the backend cannot be reached or does not answer in time.
     */
    class StoreUnavailableException extends RuntimeException {

        private final String operation;

        public StoreUnavailableException(String operation, Throwable cause) {
            super("Session store unavailable during " + operation, cause);
            this.operation = operation;
        }

        /** Returns the store operation that failed. */
        public String getOperation() {
            return operation;
        }
    }
}
