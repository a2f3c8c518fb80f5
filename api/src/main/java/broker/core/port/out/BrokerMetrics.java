package broker.core.port.out;

/**
 * Port interface for recording session broker metrics.
 *
 * <p>Implementations handle the actual metric recording (e.g., Micrometer).
 */
public interface BrokerMetrics {

    /**
     * Record the outcome of a token refresh attempt.
     *
     * @param outcome one of {@code refreshed}, {@code rejected}, {@code unavailable},
     *     {@code corrupted}, {@code observed} (another request refreshed first)
     */
    void recordRefresh(String outcome);

    /**
     * Record a session identifier rotation.
     */
    void recordRotation();

    /**
     * Record a logout and whether the provider acknowledged the revocation.
     *
     * @param revoked true if the provider revoked the refresh token
     */
    void recordLogout(boolean revoked);

    /**
     * Record a key-value store timeout.
     *
     * @param backend the backend name
     * @param operation the store operation
     */
    void recordStoreTimeout(String backend, String operation);

    /**
     * Record a non-timeout key-value store failure.
     *
     * @param backend the backend name
     * @param operation the store operation
     */
    void recordStoreFailure(String backend, String operation);
}
