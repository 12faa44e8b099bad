package io.backup4j.crypto;

import io.backup4j.core.exception.DecryptionException;

import javax.crypto.AEADBadTagException;
import javax.crypto.Cipher;
import javax.crypto.SecretKeyFactory;
import javax.crypto.spec.GCMParameterSpec;
import javax.crypto.spec.PBEKeySpec;
import javax.crypto.spec.SecretKeySpec;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.security.SecureRandom;
import java.util.Arrays;
import java.util.Base64;
import java.util.function.Supplier;

/**
 * Symmetric encryption of stored secrets under a key derived from the process secret.
 *
 * <p>Token layout: {@code base64url(salt[16] || nonce[12] || ciphertext || tag[16])}. Every call
 * draws a fresh salt and nonce, so encrypting the same plaintext twice never yields equal tokens.
 * The key is derived per call with PBKDF2-HMAC-SHA256 and is never cached.
 */
public class CredentialVault {

    public static final int SALT_LENGTH = 16;
    public static final int NONCE_LENGTH = 12;
    public static final int TAG_BITS = 128;
    public static final int ITERATIONS = 600_000;
    private static final int KEY_BITS = 256;

    private static final String KDF = "PBKDF2WithHmacSHA256";
    private static final String CIPHER = "AES/GCM/NoPadding";

    private final Supplier<String> secret;
    private final SecureRandom secureRandom = new SecureRandom();

    /**
     * @param secret supplies the process-wide secret; read on every call so a missing secret
     *               surfaces as {@link DecryptionException} at use time
     */
    public CredentialVault(Supplier<String> secret) {
        this.secret = secret;
    }

    public static CredentialVault ofSecret(String secret) {
        return new CredentialVault(() -> secret);
    }

    public String encrypt(String plaintext) {
        if (plaintext == null) {
            throw new IllegalArgumentException("plaintext must not be null");
        }
        String processSecret = requireSecret();

        byte[] salt = randomBytes(SALT_LENGTH);
        byte[] nonce = randomBytes(NONCE_LENGTH);

        try {
            Cipher cipher = Cipher.getInstance(CIPHER);
            cipher.init(Cipher.ENCRYPT_MODE, deriveKey(processSecret, salt), new GCMParameterSpec(TAG_BITS, nonce));
            byte[] ciphertext = cipher.doFinal(plaintext.getBytes(StandardCharsets.UTF_8));

            ByteBuffer packed = ByteBuffer.allocate(salt.length + nonce.length + ciphertext.length);
            packed.put(salt);
            packed.put(nonce);
            packed.put(ciphertext);
            return Base64.getUrlEncoder().encodeToString(packed.array());
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("AES-GCM encryption unavailable", e);
        }
    }

    public String decrypt(String token) {
        String processSecret = requireSecret();
        if (token == null || token.isBlank()) {
            throw new DecryptionException("Decryption failed: empty token");
        }

        byte[] data;
        try {
            data = Base64.getUrlDecoder().decode(token.trim());
        } catch (IllegalArgumentException e) {
            throw new DecryptionException("Decryption failed: token is not base64url", e);
        }
        if (data.length < SALT_LENGTH + NONCE_LENGTH + TAG_BITS / 8) {
            throw new DecryptionException("Decryption failed: token too short");
        }

        byte[] salt = Arrays.copyOfRange(data, 0, SALT_LENGTH);
        GCMParameterSpec spec = new GCMParameterSpec(TAG_BITS, data, SALT_LENGTH, NONCE_LENGTH);
        int offset = SALT_LENGTH + NONCE_LENGTH;

        try {
            Cipher cipher = Cipher.getInstance(CIPHER);
            cipher.init(Cipher.DECRYPT_MODE, deriveKey(processSecret, salt), spec);
            byte[] plaintext = cipher.doFinal(data, offset, data.length - offset);
            return new String(plaintext, StandardCharsets.UTF_8);
        } catch (AEADBadTagException e) {
            throw new DecryptionException("Decryption failed: invalid key or data tampered", e);
        } catch (GeneralSecurityException e) {
            throw new DecryptionException("Decryption failed: " + e.getMessage(), e);
        }
    }

    /**
     * Decrypts an optional stored field; {@code null} stays {@code null}.
     */
    public String decryptNullable(String token) {
        return token == null ? null : decrypt(token);
    }

    /**
     * One-way hash for account passwords: {@code base64url(salt[16] || pbkdf2(password + secret))}.
     */
    public String hashPassword(String password) {
        if (password == null) {
            throw new IllegalArgumentException("password must not be null");
        }
        String processSecret = requireSecret();
        byte[] salt = randomBytes(SALT_LENGTH);
        byte[] hash = pbkdf2(password + processSecret, salt);

        ByteBuffer packed = ByteBuffer.allocate(salt.length + hash.length);
        packed.put(salt);
        packed.put(hash);
        return Base64.getUrlEncoder().encodeToString(packed.array());
    }

    /**
     * Constant-time check of a password against {@link #hashPassword(String)} output.
     * Malformed hashes never match.
     */
    public boolean verifyPassword(String password, String hashed) {
        if (password == null || hashed == null) {
            return false;
        }
        String processSecret = requireSecret();
        byte[] data;
        try {
            data = Base64.getUrlDecoder().decode(hashed.trim());
        } catch (IllegalArgumentException e) {
            return false;
        }
        if (data.length != SALT_LENGTH + KEY_BITS / 8) {
            return false;
        }
        byte[] salt = Arrays.copyOfRange(data, 0, SALT_LENGTH);
        byte[] stored = Arrays.copyOfRange(data, SALT_LENGTH, data.length);
        return MessageDigest.isEqual(stored, pbkdf2(password + processSecret, salt));
    }

    private String requireSecret() {
        String s = secret.get();
        if (s == null || s.isEmpty()) {
            throw new DecryptionException("Process secret is not configured (backup.secret-key / SECRET_KEY)");
        }
        return s;
    }

    private SecretKeySpec deriveKey(String processSecret, byte[] salt) {
        return new SecretKeySpec(pbkdf2(processSecret, salt), "AES");
    }

    private static byte[] pbkdf2(String input, byte[] salt) {
        PBEKeySpec spec = new PBEKeySpec(input.toCharArray(), salt, ITERATIONS, KEY_BITS);
        try {
            return SecretKeyFactory.getInstance(KDF).generateSecret(spec).getEncoded();
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException(KDF + " unavailable", e);
        } finally {
            spec.clearPassword();
        }
    }

    private byte[] randomBytes(int length) {
        byte[] bytes = new byte[length];
        secureRandom.nextBytes(bytes);
        return bytes;
    }
}
