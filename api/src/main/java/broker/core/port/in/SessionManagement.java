package broker.core.port.in;

import java.net.URI;

import io.smallrye.mutiny.Uni;

import broker.core.model.auth.Introspection;
import broker.core.model.session.Session;

/**
 * Inbound port for the session lifecycle.
 *
 * <p>Sessions move between three implicit states, derived from the stored record:
 * <ul>
 *   <li><b>Active</b>: record exists and its access token deadline lies in the future</li>
 *   <li><b>NeedsRefresh</b>: record exists and the deadline has passed; resolved within one call</li>
 *   <li><b>Absent</b>: no record (never created, logged out, expired or revoked)</li>
 * </ul>
 */
public interface SessionManagement {

    /**
     * Start a login: generate and bind a PKCE triple and build the provider authorization URL.
     *
     * @return the URL the browser must be redirected to
     */
    Uni<URI> login();

    /**
     * Complete a login: consume the PKCE binding, exchange the code and create a session.
     *
     * <p>Nothing is created if the state is unknown or the exchange fails.
     *
     * @param code authorization code from the provider
     * @param state state returned by the provider
     * @return the new session
     */
    Uni<Session> callback(String code, String state);

    /**
     * Refresh the session if needed and rotate its identifier.
     *
     * @param sessionId the current session identifier
     * @return the session stored under its new identifier
     * @throws SessionExpiredException if the session is absent or could not be refreshed
     */
    Uni<Session> sessionInfo(String sessionId);

    /**
     * Refresh the session if needed, without rotation, and return the raw access token.
     *
     * <p>The only operation returning a raw token. Callers must be internal services; the
     * restriction is enforced by network policy, not by anything in the token.
     *
     * @param sessionId the session identifier
     * @return the decrypted access token
     * @throws SessionExpiredException if the session is absent or could not be refreshed
     */
    Uni<String> validate(String sessionId);

    /**
     * Introspect the session's access token at the provider. Diagnostic only.
     *
     * @param sessionId the session identifier
     * @return the introspection result
     */
    Uni<Introspection> introspect(String sessionId);

    /**
     * Revoke the provider session (best-effort) and delete the local session unconditionally.
     *
     * @param sessionId the session identifier
     * @return Uni completing once the local session is gone
     */
    Uni<Void> logout(String sessionId);

    /**
     * Raised when a request carries no usable session; the caller must log in again.
     */
    class SessionExpiredException extends RuntimeException {

        /**
         * Why the session is not usable.
         */
        public enum Reason {
            /** No cookie, or no record for the identifier. */
            NO_SESSION,
            /** The provider rejected the refresh token. */
            REFRESH_REJECTED,
            /** The stored tokens could not be decrypted. */
            CORRUPTED
        }

        private final Reason reason;

        public SessionExpiredException(Reason reason) {
            super(messageFor(reason));
            this.reason = reason;
        }

        public Reason getReason() {
            return reason;
        }

        private static String messageFor(Reason reason) {
            return switch (reason) {
                case NO_SESSION -> "No session";
                case REFRESH_REJECTED -> "Session expired";
                case CORRUPTED -> "Session is no longer valid";
            };
        }
    }
}
