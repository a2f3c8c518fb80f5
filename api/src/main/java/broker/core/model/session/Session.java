package broker.core.model.session;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;

/**
 * Server-side session holding the encrypted provider tokens of one browser login.
 *
 * <p>The identifier is the only value that ever leaves the broker (as the session cookie).
 * Both tokens are stored as Token Vault ciphertext, never in raw form.
 *
 * @param id Opaque, cryptographically random session identifier
 * @param accessToken Encrypted access token
 * @param refreshToken Encrypted refresh token
 * @param accessTokenExpiresAt Absolute instant after which the access token must be refreshed
 * @param createdAt Session creation timestamp
 * @param expiresAt Absolute session deadline ({@code createdAt} plus the session TTL)
 * @param userInfo Cached user information (may be empty)
 */
public record Session(
        String id,
        String accessToken,
        String refreshToken,
        Instant accessTokenExpiresAt,
        Instant createdAt,
        Instant expiresAt,
        Map<String, Object> userInfo) {

    public Session {
        if (userInfo == null) {
            userInfo = Map.of();
        }
    }

    /**
     * Creates a new session with a different ID. Used by rotation.
     */
    public Session withId(String id) {
        return new Session(id, accessToken, refreshToken, accessTokenExpiresAt, createdAt, expiresAt, userInfo);
    }

    /**
     * Creates a new session carrying refreshed tokens and a recomputed access token deadline.
     */
    public Session withTokens(String accessToken, String refreshToken, Instant accessTokenExpiresAt) {
        return new Session(id, accessToken, refreshToken, accessTokenExpiresAt, createdAt, expiresAt, userInfo);
    }

    /**
     * Checks whether the access token has reached its deadline.
     *
     * <p>The check is exact: a token is still usable at {@code accessTokenExpiresAt - 1ms}
     * and needs a refresh from {@code accessTokenExpiresAt} on.
     *
     * @param now the current instant
     * @return true if a refresh is required
     */
    public boolean needsRefresh(Instant now) {
        return !now.isBefore(accessTokenExpiresAt);
    }

    /**
     * Time left until the session itself expires.
     *
     * @param now the current instant
     * @return remaining lifetime, zero or negative once expired
     */
    public Duration remainingLifetime(Instant now) {
        return Duration.between(now, expiresAt);
    }
}
