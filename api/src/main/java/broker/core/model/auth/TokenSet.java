package broker.core.model.auth;

import java.time.Duration;
import java.util.Optional;

/**
 * Tokens returned by the identity provider's token endpoint.
 *
 * <p>Holds raw token values; instances must only live for the duration of a single request.
 *
 * @param accessToken The access token (always present on success)
 * @param refreshToken The refresh token, absent when the provider does not rotate it on refresh
 * @param expiresIn Access token lifetime, absent when the provider omits {@code expires_in}
 */
public record TokenSet(String accessToken, Optional<String> refreshToken, Optional<Duration> expiresIn) {

    public TokenSet {
        if (accessToken == null || accessToken.isBlank()) {
            throw new IllegalArgumentException("Access token is required");
        }
        if (refreshToken == null) {
            refreshToken = Optional.empty();
        }
        if (expiresIn == null) {
            expiresIn = Optional.empty();
        }
    }
}
