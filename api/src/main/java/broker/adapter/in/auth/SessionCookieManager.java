package broker.adapter.in.auth;

import java.time.Clock;
import java.util.Optional;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.ws.rs.core.NewCookie;

import io.vertx.core.http.Cookie;
import io.vertx.core.http.HttpServerRequest;

import broker.core.config.SessionConfig;
import broker.core.model.session.Session;

/**
 * Manages session cookies - creation, extraction, and invalidation.
 *
 * <p>The cookie carries only the session identifier.
 */
@ApplicationScoped
public class SessionCookieManager {

    private final SessionConfig config;
    private final Clock clock;

    @Inject
    public SessionCookieManager(SessionConfig config, Clock clock) {
        this.config = config;
        this.clock = clock;
    }

    /**
     * Creates a session cookie for the given session.
     *
     * <p>Max-Age is the session's remaining lifetime, so the browser drops the cookie when the
     * server-side record expires.
     *
     * @param session The session to create a cookie for
     * @return The session cookie
     */
    public NewCookie createCookie(Session session) {
        final long maxAge = Math.max(0, session.remainingLifetime(clock.instant()).toSeconds());
        return baseCookie(session.id()).maxAge((int) Math.min(maxAge, Integer.MAX_VALUE)).build();
    }

    /**
     * Creates a logout cookie that expires immediately.
     *
     * @return Cookie that clears the session
     */
    public NewCookie createLogoutCookie() {
        return baseCookie("").maxAge(0).build();
    }

    /**
     * Extracts the session ID from a request's cookies.
     *
     * @param request The HTTP request
     * @return The session ID, or empty if not present
     */
    public Optional<String> extractSessionId(HttpServerRequest request) {
        Cookie cookie = request.getCookie(config.cookie().name());
        if (cookie == null || cookie.getValue() == null || cookie.getValue().isBlank()) {
            return Optional.empty();
        }
        return Optional.of(cookie.getValue());
    }

    private NewCookie.Builder baseCookie(String value) {
        final var builder = new NewCookie.Builder(config.cookie().name())
                .value(value)
                .path(config.cookie().path())
                .secure(config.cookie().secure())
                .httpOnly(config.cookie().httpOnly())
                .sameSite(parseSameSite(config.cookie().sameSite()));
        config.cookie().domain().ifPresent(builder::domain);
        return builder;
    }

    private NewCookie.SameSite parseSameSite(String sameSite) {
        return switch (sameSite.toUpperCase()) {
            case "STRICT" -> NewCookie.SameSite.STRICT;
            case "NONE" -> NewCookie.SameSite.NONE;
            default -> NewCookie.SameSite.LAX;
        };
    }
}
