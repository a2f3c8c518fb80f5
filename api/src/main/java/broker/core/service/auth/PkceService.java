package broker.core.service.auth;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.security.SecureRandom;
import java.util.Base64;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import broker.core.config.PkceConfig;
import broker.core.model.auth.PkceParameters;
import broker.core.port.out.KeyValueStore;

/**
 * Service for PKCE (Proof Key for Code Exchange) operations.
 *
 * <p>Implements the client side of RFC 7636: the broker generates the verifier, sends only the
 * S256 challenge to the identity provider and keeps the verifier in the key-value store, bound to
 * the OAuth state, until the callback consumes it.
 *
 * @see <a href="https://tools.ietf.org/html/rfc7636">RFC 7636</a>
 */
@ApplicationScoped
public class PkceService {

    private static final Logger LOG = Logger.getLogger(PkceService.class);
    private static final int VERIFIER_LENGTH = 64;
    private static final int STATE_LENGTH = 32;
    private static final SecureRandom SECURE_RANDOM = new SecureRandom();

    private final KeyValueStore store;
    private final PkceConfig config;

    @Inject
    public PkceService(KeyValueStore store, PkceConfig config) {
        this.store = store;
        this.config = config;
    }

    /**
     * Generate a verifier, its challenge and an independent state.
     *
     * @return a fresh PKCE triple
     */
    public PkceParameters generate() {
        final var verifier = generateCodeVerifier();
        return new PkceParameters(verifier, generateChallenge(verifier), generateState());
    }

    /**
     * Generate a cryptographically secure code verifier.
     *
     * <p>Per RFC 7636, the verifier must be between 43-128 characters,
     * using unreserved characters (A-Z, a-z, 0-9, "-", ".", "_", "~").
     * 64 random bytes encode to 86 URL-safe Base64 characters.
     *
     * @return URL-safe base64 encoded random string
     */
    public String generateCodeVerifier() {
        byte[] randomBytes = new byte[VERIFIER_LENGTH];
        SECURE_RANDOM.nextBytes(randomBytes);
        return Base64.getUrlEncoder().withoutPadding().encodeToString(randomBytes);
    }

    /**
     * Generate S256 challenge from verifier.
     *
     * <p>Computes: BASE64URL(SHA256(verifier))
     *
     * @param verifier The code verifier
     * @return Base64URL encoded SHA-256 hash of the verifier
     */
    public String generateChallenge(String verifier) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] hash = digest.digest(verifier.getBytes(StandardCharsets.US_ASCII));
            return Base64.getUrlEncoder().withoutPadding().encodeToString(hash);
        } catch (NoSuchAlgorithmException e) {
            // SHA-256 is required by the Java spec, so this should never happen
            throw new IllegalStateException("SHA-256 algorithm not available", e);
        }
    }

    /**
     * Generate a cryptographically secure state parameter.
     *
     * @return URL-safe base64 encoded random string
     */
    public String generateState() {
        final var bytes = new byte[STATE_LENGTH];
        SECURE_RANDOM.nextBytes(bytes);
        return Base64.getUrlEncoder().withoutPadding().encodeToString(bytes);
    }

    /**
     * Store a one-time state to verifier binding.
     *
     * <p>The binding expires automatically after the configured TTL.
     *
     * @param state The OAuth state parameter (must not be null or blank)
     * @param verifier The code verifier (must not be null or blank)
     * @return Uni completing when the binding is stored
     * @throws IllegalArgumentException if state or verifier is null or blank
     */
    public Uni<Void> bind(String state, String verifier) {
        if (state == null || state.isBlank()) {
            throw new IllegalArgumentException("state must not be null or blank");
        }
        if (verifier == null || verifier.isBlank()) {
            throw new IllegalArgumentException("verifier must not be null or blank");
        }
        LOG.debugf("Binding PKCE verifier for state: %s", state);
        return store.put(config.keyPrefix() + state, verifier, config.bindingTtl());
    }

    /**
     * Retrieve and delete the verifier bound to a state (one-time use).
     *
     * <p>Of two concurrent calls with the same state at most one succeeds.
     *
     * @param state The OAuth state parameter
     * @return Uni with the verifier, failing with {@link InvalidStateException} if the state is
     *     unknown, expired or already consumed
     */
    public Uni<String> consume(String state) {
        if (state == null || state.isBlank()) {
            return Uni.createFrom().failure(new InvalidStateException());
        }
        return store.getAndDelete(config.keyPrefix() + state).map(verifier -> {
            if (verifier.isEmpty()) {
                LOG.debugf("No PKCE binding found for state: %s", state);
                throw new InvalidStateException();
            }
            LOG.debugf("Consumed PKCE binding for state: %s", state);
            return verifier.get();
        });
    }

    /**
     * Raised when a callback's state has no live PKCE binding.
     */
    public static class InvalidStateException extends RuntimeException {

        public InvalidStateException() {
            super("Invalid or expired state");
        }
    }
}
