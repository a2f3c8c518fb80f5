package broker.core.model.auth;

/**
 * A freshly generated PKCE triple (RFC 7636).
 *
 * @param verifier The code verifier, kept server-side until the callback
 * @param challenge BASE64URL(SHA-256(verifier)) sent to the provider
 * @param state Independent random value binding the callback to this login attempt
 */
public record PkceParameters(String verifier, String challenge, String state) {}
