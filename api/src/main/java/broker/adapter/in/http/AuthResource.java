package broker.adapter.in.http;

import java.net.URI;
import java.util.LinkedHashMap;
import java.util.Map;

import jakarta.inject.Inject;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.QueryParam;
import jakarta.ws.rs.core.Context;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;

import io.smallrye.mutiny.Uni;
import io.vertx.core.http.HttpServerRequest;
import org.jboss.logging.Logger;

import broker.adapter.in.auth.SessionCookieManager;
import broker.core.config.SessionConfig;
import broker.core.port.in.SessionManagement;
import broker.core.port.in.SessionManagement.SessionExpiredException;

/**
 * Browser-facing login flow and session endpoints.
 *
 * <p>{@code /auth/validate} and {@code /auth/introspect} return token material and must only be
 * reachable by internal services.
 */
@Path("/auth")
@Produces(MediaType.APPLICATION_JSON)
public class AuthResource {

    private static final Logger LOG = Logger.getLogger(AuthResource.class);

    private final SessionManagement sessionManagement;
    private final SessionCookieManager cookieManager;
    private final SessionConfig config;

    @Inject
    public AuthResource(
            SessionManagement sessionManagement, SessionCookieManager cookieManager, SessionConfig config) {
        this.sessionManagement = sessionManagement;
        this.cookieManager = cookieManager;
        this.config = config;
    }

    /**
     * Start a login and redirect the browser to the identity provider.
     */
    @GET
    @Path("/login")
    public Uni<Response> login() {
        return sessionManagement.login().map(authorizationUrl -> Response.status(Response.Status.FOUND)
                .location(authorizationUrl)
                .build());
    }

    /**
     * Provider callback: create the session, set the cookie and return to the front end.
     */
    @GET
    @Path("/callback")
    public Uni<Response> callback(@QueryParam("code") String code, @QueryParam("state") String state) {
        return sessionManagement.callback(code, state).map(session -> Response.status(Response.Status.FOUND)
                .location(URI.create(config.frontendUrl()))
                .cookie(cookieManager.createCookie(session))
                .build());
    }

    /**
     * End the session and return to the front end. Always clears the cookie.
     */
    @GET
    @Path("/logout")
    public Uni<Response> logout(@Context HttpServerRequest request) {
        final var sessionId = cookieManager.extractSessionId(request).orElse(null);
        return sessionManagement.logout(sessionId).map(v -> Response.status(Response.Status.FOUND)
                .location(URI.create(config.frontendUrl()))
                .cookie(cookieManager.createLogoutCookie())
                .build());
    }

    /**
     * Report the session state and rotate the session identifier.
     */
    @GET
    @Path("/session")
    public Uni<Response> session(@Context HttpServerRequest request) {
        return sessionManagement.sessionInfo(requireSessionId(request)).map(session -> {
            final Map<String, Object> body = new LinkedHashMap<>();
            body.put("authenticated", true);
            body.put("session_valid_until", session.expiresAt().toString());
            return Response.ok(body).cookie(cookieManager.createCookie(session)).build();
        });
    }

    /**
     * Return the raw access token for the session. Internal callers only.
     */
    @GET
    @Path("/validate")
    public Uni<Map<String, String>> validate(@Context HttpServerRequest request) {
        return sessionManagement.validate(requireSessionId(request)).map(token -> Map.of("access_token", token));
    }

    /**
     * Return the provider's introspection of the session's access token. Internal callers only.
     */
    @GET
    @Path("/introspect")
    public Uni<Map<String, Object>> introspect(@Context HttpServerRequest request) {
        return sessionManagement.introspect(requireSessionId(request)).map(introspection -> {
            final Map<String, Object> body = new LinkedHashMap<>(introspection.claims());
            body.put("active", introspection.active());
            return body;
        });
    }

    private String requireSessionId(HttpServerRequest request) {
        return cookieManager.extractSessionId(request).orElseThrow(() -> {
            LOG.debug("Request without session cookie");
            return new SessionExpiredException(SessionExpiredException.Reason.NO_SESSION);
        });
    }
}
