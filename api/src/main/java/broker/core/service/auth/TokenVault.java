package broker.core.service.auth;

import java.nio.BufferUnderflowException;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.SecureRandom;
import java.util.Base64;
import javax.crypto.Cipher;
import javax.crypto.SecretKey;
import javax.crypto.spec.GCMParameterSpec;
import javax.crypto.spec.SecretKeySpec;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

/**
 * Encryption of provider tokens at rest.
 *
 * <p>Uses AES-256-GCM encryption with unique IVs per operation. This provides
 * both confidentiality and integrity: any modification of a stored ciphertext,
 * or decryption under a different key, fails with {@link InvalidCiphertextException}.
 *
 * <p>Output layout before Base64: {@code keyIdLength | keyId | iv | ciphertext+tag}.
 *
 * <h2>Configuration</h2>
 * <pre>
 * broker.vault.key=${TOKEN_ENCRYPTION_KEY}  # Base64-encoded 256-bit key
 * broker.vault.key-id=v1                     # Written into every ciphertext
 * </pre>
 */
@ApplicationScoped
public class TokenVault {

    private static final Logger LOG = Logger.getLogger(TokenVault.class);

    private static final String ALGORITHM = "AES/GCM/NoPadding";
    private static final int IV_LENGTH = 12;
    private static final int TAG_LENGTH_BITS = 128;
    private static final int KEY_LENGTH = 32;

    private final SecretKey secretKey;
    private final String keyId;
    private final SecureRandom secureRandom;

    /**
     * CDI constructor.
     *
     * @param encryptionKey base64-encoded encryption key from config
     * @param keyId         key identifier stored alongside each ciphertext
     */
    @Inject
    public TokenVault(
            @ConfigProperty(name = "broker.vault.key") String encryptionKey,
            @ConfigProperty(name = "broker.vault.key-id", defaultValue = "v1") String keyId) {
        if (encryptionKey == null || encryptionKey.isBlank()) {
            throw new IllegalArgumentException("broker.vault.key must be set");
        }
        final byte[] keyBytes;
        try {
            keyBytes = Base64.getDecoder().decode(encryptionKey.trim());
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("broker.vault.key must be Base64-encoded", e);
        }
        if (keyBytes.length != KEY_LENGTH) {
            throw new IllegalArgumentException(
                    "Encryption key must be 256 bits (32 bytes). Got: " + keyBytes.length + " bytes");
        }
        if (keyId.getBytes(StandardCharsets.UTF_8).length > 255) {
            throw new IllegalArgumentException("broker.vault.key-id must be at most 255 bytes");
        }
        this.secretKey = new SecretKeySpec(keyBytes, "AES");
        this.keyId = keyId;
        this.secureRandom = new SecureRandom();
        LOG.info("Token vault initialized with key ID: " + keyId);
    }

    /**
     * Encrypt a token for storage.
     *
     * @param token the raw token
     * @return Base64-encoded ciphertext, safe to store as text
     */
    public String encrypt(String token) {
        try {
            final byte[] iv = new byte[IV_LENGTH];
            secureRandom.nextBytes(iv);

            final Cipher cipher = Cipher.getInstance(ALGORITHM);
            cipher.init(Cipher.ENCRYPT_MODE, secretKey, new GCMParameterSpec(TAG_LENGTH_BITS, iv));

            final byte[] ciphertext = cipher.doFinal(token.getBytes(StandardCharsets.UTF_8));
            final byte[] keyIdBytes = keyId.getBytes(StandardCharsets.UTF_8);

            final ByteBuffer buffer = ByteBuffer.allocate(1 + keyIdBytes.length + IV_LENGTH + ciphertext.length);
            buffer.put((byte) keyIdBytes.length);
            buffer.put(keyIdBytes);
            buffer.put(iv);
            buffer.put(ciphertext);

            return Base64.getEncoder().encodeToString(buffer.array());
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("Failed to encrypt token", e);
        }
    }

    /**
     * Decrypt a stored token.
     *
     * @param encryptedData Base64-encoded ciphertext produced by {@link #encrypt}
     * @return the raw token
     * @throws InvalidCiphertextException if the data is malformed, was tampered with, or was
     *     encrypted under another key
     */
    public String decrypt(String encryptedData) {
        if (encryptedData == null || encryptedData.isEmpty()) {
            throw new InvalidCiphertextException("Empty ciphertext", null);
        }
        try {
            final byte[] data = Base64.getDecoder().decode(encryptedData);
            final ByteBuffer buffer = ByteBuffer.wrap(data);

            final int keyIdLength = buffer.get() & 0xFF;
            final byte[] keyIdBytes = new byte[keyIdLength];
            buffer.get(keyIdBytes);
            final String dataKeyId = new String(keyIdBytes, StandardCharsets.UTF_8);

            if (!this.keyId.equals(dataKeyId)) {
                LOG.warnf("Key ID mismatch: expected %s, got %s", this.keyId, dataKeyId);
                throw new InvalidCiphertextException("Ciphertext was written under key " + dataKeyId, null);
            }

            final byte[] iv = new byte[IV_LENGTH];
            buffer.get(iv);
            final byte[] ciphertext = new byte[buffer.remaining()];
            buffer.get(ciphertext);

            final Cipher cipher = Cipher.getInstance(ALGORITHM);
            cipher.init(Cipher.DECRYPT_MODE, secretKey, new GCMParameterSpec(TAG_LENGTH_BITS, iv));
            final byte[] plaintext = cipher.doFinal(ciphertext);

            return new String(plaintext, StandardCharsets.UTF_8);
        } catch (IllegalArgumentException | BufferUnderflowException e) {
            throw new InvalidCiphertextException("Malformed ciphertext", e);
        } catch (GeneralSecurityException e) {
            throw new InvalidCiphertextException("Ciphertext failed authentication", e);
        }
    }

    /**
     * Raised when a stored token cannot be decrypted.
     */
    public static class InvalidCiphertextException extends RuntimeException {

        public InvalidCiphertextException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
