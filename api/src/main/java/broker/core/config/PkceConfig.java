package broker.core.config;

import java.time.Duration;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

/**
 * Configuration mapping for PKCE (Proof Key for Code Exchange) bindings.
 *
 * <p>Configuration prefix: {@code broker.pkce}
 */
@ConfigMapping(prefix = "broker.pkce")
public interface PkceConfig {

    /**
     * Binding TTL (time-to-live).
     *
     * <p>How long a state/verifier binding remains valid after login starts. Long enough for
     * the user to authenticate, short enough to limit replay windows.
     *
     * @return Binding duration (default: 5 minutes)
     */
    @WithDefault("PT5M")
    Duration bindingTtl();

    /**
     * Key prefix for PKCE bindings in the key-value store.
     *
     * @return Key prefix (default: pkce:)
     */
    @WithDefault("pkce:")
    String keyPrefix();
}
