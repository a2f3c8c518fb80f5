package broker.core.model.auth;

import java.util.Map;

/**
 * Token introspection result (RFC 7662).
 *
 * @param active whether the provider considers the token active
 * @param claims all fields returned by the introspection endpoint
 */
public record Introspection(boolean active, Map<String, Object> claims) {

    public Introspection {
        if (claims == null) {
            claims = Map.of();
        }
    }
}
