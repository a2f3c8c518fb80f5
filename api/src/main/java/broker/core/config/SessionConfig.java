package broker.core.config;

import java.time.Duration;
import java.util.Optional;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

/**
 * Configuration mapping for session management.
 *
 * <p>Configuration prefix: {@code broker.session}
 */
@ConfigMapping(prefix = "broker.session")
public interface SessionConfig {

    /**
     * Session TTL (time-to-live), measured from session creation.
     *
     * @return Session duration (default: 1 hour)
     */
    @WithDefault("PT1H")
    Duration ttl();

    /**
     * Access token lifetime assumed when the provider omits {@code expires_in}.
     *
     * @return Fallback access token lifetime (default: 2 minutes)
     */
    @WithDefault("PT2M")
    Duration defaultAccessTokenTtl();

    /**
     * Front-end URL the browser is sent back to after callback and logout.
     *
     * @return Front-end URL (default: http://localhost:3000)
     */
    @WithDefault("http://localhost:3000")
    String frontendUrl();

    /**
     * Cookie configuration.
     */
    CookieConfig cookie();

    /**
     * ID generation configuration.
     */
    IdGenerationConfig idGeneration();

    /**
     * Storage configuration.
     */
    StorageConfig storage();

    /**
     * Token refresh coordination.
     */
    RefreshConfig refresh();

    /**
     * Cookie configuration options.
     */
    interface CookieConfig {

        /**
         * Session cookie name.
         *
         * @return Cookie name (default: bionicpro_session)
         */
        @WithDefault("bionicpro_session")
        String name();

        /**
         * Cookie path.
         *
         * @return Cookie path (default: /)
         */
        @WithDefault("/")
        String path();

        /**
         * Cookie domain.
         *
         * <p>If not set, defaults to the request domain.
         *
         * @return Cookie domain (optional)
         */
        Optional<String> domain();

        /**
         * Mark cookie as secure (HTTPS only).
         *
         * @return true if secure (default: true)
         */
        @WithDefault("true")
        boolean secure();

        /**
         * Mark cookie as HttpOnly (not accessible via JavaScript).
         *
         * @return true if HttpOnly (default: true)
         */
        @WithDefault("true")
        boolean httpOnly();

        /**
         * SameSite attribute.
         *
         * @return SameSite value: Strict, Lax, or None (default: Lax)
         */
        @WithDefault("Lax")
        String sameSite();
    }

    /**
     * Session ID generation configuration.
     */
    interface IdGenerationConfig {

        /**
         * Maximum retries for session ID collision.
         *
         * @return Max retry attempts (default: 3)
         */
        @WithDefault("3")
        int maxRetries();
    }

    /**
     * Storage configuration options.
     */
    interface StorageConfig {

        /**
         * Storage provider name.
         *
         * <p>Available providers: redis, memory, or custom SPI name.
         *
         * @return Provider name (default: redis)
         */
        @WithDefault("redis")
        String provider();

        /**
         * Timeout applied to every backend operation.
         *
         * @return Operation timeout (default: 2 seconds)
         */
        @WithDefault("PT2S")
        Duration timeout();

        /**
         * Key prefix for session records.
         *
         * @return Key prefix (default: session:)
         */
        @WithDefault("session:")
        String sessionKeyPrefix();

        /**
         * Key prefix for refresh leases.
         *
         * @return Key prefix (default: lease:)
         */
        @WithDefault("lease:")
        String leaseKeyPrefix();
    }

    /**
     * Refresh coordination options.
     *
     * <p>Only one request per session refreshes tokens at a time; the others wait for its result.
     */
    interface RefreshConfig {

        /**
         * Lifetime of a refresh lease. Must exceed the provider timeout so that a lease never
         * lapses while its holder is still talking to the provider.
         *
         * @return Lease TTL (default: 30 seconds)
         */
        @WithDefault("PT30S")
        Duration leaseTtl();

        /**
         * Interval at which waiting requests re-read the session.
         *
         * @return Poll interval (default: 100 milliseconds)
         */
        @WithDefault("PT0.1S")
        Duration pollInterval();

        /**
         * Maximum time a request waits for another request's refresh.
         *
         * <p>Values below the provider timeout times {@code 1 + retryBudget} are raised to that
         * bound at runtime.
         *
         * @return Wait timeout (default: 25 seconds)
         */
        @WithDefault("PT25S")
        Duration waitTimeout();

        /**
         * Extra refresh attempts after the provider was unreachable.
         *
         * @return Retry budget (default: 1)
         */
        @WithDefault("1")
        int retryBudget();
    }
}
