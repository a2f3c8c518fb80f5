package broker.core.port.out;

import io.smallrye.mutiny.Uni;

import broker.core.model.auth.Introspection;
import broker.core.model.auth.RevocationOutcome;
import broker.core.model.auth.TokenSet;

/**
 * Outbound port for the external OAuth2/OIDC identity provider.
 *
 * <p>Every call carries a bounded timeout. Failures come in two distinct kinds:
 * <ul>
 *   <li>{@link UpstreamRejectedException}: the provider answered with a non-2xx status or an
 *       unusable body (invalid code, revoked refresh token, ...)</li>
 *   <li>{@link UpstreamUnavailableException}: the provider could not be reached or timed out</li>
 * </ul>
 */
public interface IdentityProviderClient {

    /**
     * Exchange an authorization code for tokens (authorization_code grant with PKCE).
     *
     * @param code the authorization code from the callback
     * @param verifier the PKCE code verifier bound to the login's state
     * @param redirectUri the redirect URI used in the authorization request
     * @return the issued tokens
     */
    Uni<TokenSet> exchangeCode(String code, String verifier, String redirectUri);

    /**
     * Obtain new tokens with a refresh token (refresh_token grant).
     *
     * <p>Providers with refresh-token rotation accept a given refresh token at most once.
     *
     * @param refreshToken the raw refresh token
     * @return the new tokens
     */
    Uni<TokenSet> refresh(String refreshToken);

    /**
     * End the provider session for a refresh token. Best-effort.
     *
     * <p>This Uni never fails; failures are reported through the returned outcome.
     *
     * @param refreshToken the raw refresh token
     * @return the revocation outcome
     */
    Uni<RevocationOutcome> revoke(String refreshToken);

    /**
     * Introspect a token. Diagnostic only.
     *
     * @param token the raw token
     * @return the introspection result
     */
    Uni<Introspection> introspect(String token);

    /**
     * Build the browser-facing authorization URL for a login attempt.
     *
     * @param challenge the S256 code challenge
     * @param state the CSRF-binding state
     * @return absolute authorization URL
     */
    String authorizationUrl(String challenge, String state);

    /**
     * The provider answered but refused the request.
     */
    class UpstreamRejectedException extends RuntimeException {

        private final int status;

        public UpstreamRejectedException(String message, int status) {
            super(message);
            this.status = status;
        }

        /** Returns the HTTP status returned by the provider, or 0 if it was a 2xx with a bad body. */
        public int getStatus() {
            return status;
        }
    }

    /**
     * The provider could not be reached or did not answer within the timeout.
     */
    class UpstreamUnavailableException extends RuntimeException {

        public UpstreamUnavailableException(String message) {
            super(message);
        }

        public UpstreamUnavailableException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
