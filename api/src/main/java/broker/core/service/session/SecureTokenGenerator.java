package broker.core.service.session;

import java.security.SecureRandom;
import java.util.Base64;

import jakarta.enterprise.context.ApplicationScoped;

/**
 * Opaque random values handed out by the session store: session IDs (the cookie value) and
 * refresh lease owner tokens. Both are URL-safe Base64 without padding.
 */
@ApplicationScoped
public class SecureTokenGenerator {

    static final int SESSION_ID_BYTES = 32;
    static final int LEASE_OWNER_BYTES = 16;

    private final SecureRandom random = new SecureRandom();
    private final Base64.Encoder encoder = Base64.getUrlEncoder().withoutPadding();

    /**
     * @return a 256-bit session ID, 43 characters
     */
    public String sessionId() {
        return randomToken(SESSION_ID_BYTES);
    }

    /**
     * Lease owners only need to be unique among concurrent holders of one lease.
     *
     * @return a 128-bit owner token, 22 characters
     */
    public String leaseOwner() {
        return randomToken(LEASE_OWNER_BYTES);
    }

    private String randomToken(int byteCount) {
        final byte[] bytes = new byte[byteCount];
        random.nextBytes(bytes);
        return encoder.encodeToString(bytes);
    }
}
