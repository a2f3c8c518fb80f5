package broker.adapter.out.idp;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.smallrye.mutiny.Uni;
import io.vertx.core.json.JsonObject;
import io.vertx.mutiny.core.Vertx;
import io.vertx.mutiny.core.buffer.Buffer;
import io.vertx.mutiny.ext.web.client.HttpResponse;
import io.vertx.mutiny.ext.web.client.WebClient;
import org.jboss.logging.Logger;

import broker.core.config.IdentityProviderConfig;
import broker.core.model.auth.Introspection;
import broker.core.model.auth.RevocationOutcome;
import broker.core.model.auth.TokenSet;
import broker.core.port.out.IdentityProviderClient;

/**
 * Identity provider client for a Keycloak realm, using the standard OAuth 2.0 endpoints.
 *
 * <p>Supports:
 * <ul>
 *   <li>Authorization code exchange with PKCE code verifier (RFC 7636)</li>
 *   <li>Refresh token grant</li>
 *   <li>Refresh token revocation through the realm logout endpoint</li>
 *   <li>Token introspection (RFC 7662)</li>
 * </ul>
 *
 * <p>Requests are form-encoded with {@code client_id} and, for confidential clients,
 * {@code client_secret} in the body.
 */
@ApplicationScoped
public class KeycloakIdentityProviderClient implements IdentityProviderClient {

    private static final Logger LOG = Logger.getLogger(KeycloakIdentityProviderClient.class);

    private final WebClient webClient;
    private final IdentityProviderConfig config;

    @Inject
    public KeycloakIdentityProviderClient(Vertx vertx, IdentityProviderConfig config) {
        this.webClient = WebClient.create(vertx);
        this.config = config;
    }

    @Override
    public Uni<TokenSet> exchangeCode(String code, String verifier, String redirectUri) {
        LOG.debug("Exchanging authorization code with identity provider");

        final Map<String, String> params = new LinkedHashMap<>();
        params.put("grant_type", "authorization_code");
        params.put("code", code);
        params.put("redirect_uri", redirectUri);
        params.put("code_verifier", verifier);

        return post(endpoint("token"), params, "Token exchange").flatMap(this::parseTokenResponse);
    }

    @Override
    public Uni<TokenSet> refresh(String refreshToken) {
        final Map<String, String> params = new LinkedHashMap<>();
        params.put("grant_type", "refresh_token");
        params.put("refresh_token", refreshToken);

        return post(endpoint("token"), params, "Token refresh").flatMap(this::parseTokenResponse);
    }

    @Override
    public Uni<RevocationOutcome> revoke(String refreshToken) {
        final Map<String, String> params = new LinkedHashMap<>();
        params.put("refresh_token", refreshToken);

        return post(endpoint("logout"), params, "Logout")
                .map(response -> {
                    if (isSuccess(response)) {
                        return RevocationOutcome.revoked();
                    }
                    return RevocationOutcome.failed("Identity provider returned " + response.statusCode());
                })
                .onFailure()
                .recoverWithItem(error -> RevocationOutcome.failed(error.getMessage()));
    }

    @Override
    public Uni<Introspection> introspect(String token) {
        final Map<String, String> params = new LinkedHashMap<>();
        params.put("token", token);

        return post(endpoint("token/introspect"), params, "Introspection").map(response -> {
            if (!isSuccess(response)) {
                LOG.warnf("Introspection failed with status %d", response.statusCode());
                throw new UpstreamRejectedException(
                        "Identity provider returned error: " + response.statusCode(), response.statusCode());
            }
            final var json = parseJson(response);
            return new Introspection(json.getBoolean("active", false), json.getMap());
        });
    }

    @Override
    public String authorizationUrl(String challenge, String state) {
        final Map<String, String> params = new LinkedHashMap<>();
        params.put("client_id", config.clientId());
        params.put("redirect_uri", config.redirectUri());
        params.put("response_type", "code");
        params.put("scope", config.scopes());
        params.put("state", state);
        params.put("code_challenge", challenge);
        params.put("code_challenge_method", "S256");

        return realmBase(config.publicUrl()) + "/auth?" + encodeForm(params);
    }

    private Uni<HttpResponse<Buffer>> post(String url, Map<String, String> params, String operation) {
        params.put("client_id", config.clientId());
        config.clientSecret().ifPresent(secret -> params.put("client_secret", secret));

        return webClient
                .postAbs(url)
                .timeout(config.timeout().toMillis())
                .putHeader("Content-Type", "application/x-www-form-urlencoded")
                .putHeader("Accept", "application/json")
                .sendBuffer(Buffer.buffer(encodeForm(params)))
                .onFailure()
                .transform(error -> {
                    LOG.warnf("%s request to identity provider failed: %s", operation, error.getMessage());
                    return new UpstreamUnavailableException(
                            operation + " request to identity provider failed: " + error.getMessage(), error);
                });
    }

    private Uni<TokenSet> parseTokenResponse(HttpResponse<Buffer> response) {
        if (!isSuccess(response)) {
            // The body may echo the submitted grant, so only the status is logged
            LOG.warnf("Token endpoint returned status %d", response.statusCode());
            return Uni.createFrom()
                    .failure(new UpstreamRejectedException(
                            "Identity provider returned error: " + response.statusCode(), response.statusCode()));
        }

        try {
            final var json = parseJson(response);

            final var accessToken = json.getString("access_token");
            if (accessToken == null || accessToken.isBlank()) {
                return Uni.createFrom()
                        .failure(new UpstreamRejectedException("Token response missing access_token", 0));
            }

            final var expiresIn = Optional.ofNullable(json.getLong("expires_in")).map(Duration::ofSeconds);
            final var refreshToken = Optional.ofNullable(json.getString("refresh_token")).filter(t -> !t.isBlank());

            LOG.debugf("Token response received, expires_in: %s", expiresIn.map(Duration::toSeconds).orElse(null));
            return Uni.createFrom().item(new TokenSet(accessToken, refreshToken, expiresIn));
        } catch (UpstreamRejectedException e) {
            return Uni.createFrom().failure(e);
        } catch (RuntimeException e) {
            LOG.warnf("Failed to parse token response: %s", e.getMessage());
            return Uni.createFrom().failure(new UpstreamRejectedException("Unparsable token response", 0));
        }
    }

    private JsonObject parseJson(HttpResponse<Buffer> response) {
        final JsonObject json;
        try {
            json = response.bodyAsJsonObject();
        } catch (RuntimeException e) {
            throw new UpstreamRejectedException("Unparsable identity provider response", 0);
        }
        if (json == null) {
            throw new UpstreamRejectedException("Empty identity provider response", 0);
        }
        return json;
    }

    private boolean isSuccess(HttpResponse<Buffer> response) {
        return response.statusCode() >= 200 && response.statusCode() < 300;
    }

    private String endpoint(String path) {
        return realmBase(config.url()) + "/" + path;
    }

    private String realmBase(String baseUrl) {
        final var base = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        return base + "/realms/" + config.realm() + "/protocol/openid-connect";
    }

    private String encodeForm(Map<String, String> params) {
        return params.entrySet().stream()
                .map(e -> urlEncode(e.getKey()) + "=" + urlEncode(e.getValue()))
                .reduce((a, b) -> a + "&" + b)
                .orElse("");
    }

    private String urlEncode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8);
    }
}
