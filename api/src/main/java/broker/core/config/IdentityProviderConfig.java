package broker.core.config;

import java.time.Duration;
import java.util.Optional;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

/**
 * Configuration mapping for the external OIDC identity provider.
 *
 * <p>Configuration prefix: {@code broker.idp}
 *
 * <p>Endpoints follow the Keycloak realm layout:
 * {@code {url}/realms/{realm}/protocol/openid-connect/{token,logout,token/introspect,auth}}.
 */
@ConfigMapping(prefix = "broker.idp")
public interface IdentityProviderConfig {

    /**
     * Provider base URL as reachable from the broker.
     *
     * @return Internal base URL (default: http://keycloak:8080)
     */
    @WithDefault("http://keycloak:8080")
    String url();

    /**
     * Provider base URL as reachable from the browser. Used for the authorization redirect.
     *
     * @return Public base URL (default: http://localhost:8080)
     */
    @WithDefault("http://localhost:8080")
    String publicUrl();

    /**
     * Realm name.
     *
     * @return Realm (default: reports-realm)
     */
    @WithDefault("reports-realm")
    String realm();

    /**
     * OAuth2 client ID.
     *
     * @return Client ID (default: reports-frontend)
     */
    @WithDefault("reports-frontend")
    String clientId();

    /**
     * OAuth2 client secret. Absent for public clients.
     *
     * @return Client secret
     */
    Optional<String> clientSecret();

    /**
     * Redirect URI registered for the callback endpoint.
     *
     * @return Redirect URI (default: http://localhost:8001/auth/callback)
     */
    @WithDefault("http://localhost:8001/auth/callback")
    String redirectUri();

    /**
     * Space-separated scopes requested at login.
     *
     * @return Scopes (default: openid profile email)
     */
    @WithDefault("openid profile email")
    String scopes();

    /**
     * HTTP timeout for every provider call.
     *
     * @return Timeout duration (default: 10 seconds)
     */
    @WithDefault("PT10S")
    Duration timeout();
}
