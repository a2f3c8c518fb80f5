package broker.core.model.auth;

/**
 * Result of a best-effort refresh token revocation at the identity provider.
 *
 * <p>Revocation never fails as an exception; callers decide what to do with the outcome.
 *
 * @param revoked true if the provider acknowledged the revocation
 * @param detail short description of the failure, empty when revoked
 */
public record RevocationOutcome(boolean revoked, String detail) {

    private static final RevocationOutcome REVOKED = new RevocationOutcome(true, "");

    public static RevocationOutcome revoked() {
        return REVOKED;
    }

    public static RevocationOutcome failed(String detail) {
        return new RevocationOutcome(false, detail);
    }
}
