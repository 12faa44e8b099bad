package io.backup4j.crypto;

import io.backup4j.core.exception.DecryptionException;
import org.junit.jupiter.api.Test;

import java.util.Base64;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class CredentialVaultTest {

    private final CredentialVault vault = CredentialVault.ofSecret("test-process-secret");

    @Test
    void decryptShouldReturnOriginalPlaintext() {
        String token = vault.encrypt("s3cr3t-pässword");
        assertEquals("s3cr3t-pässword", vault.decrypt(token));
    }

    @Test
    void encryptShouldUseFreshSaltAndNonceEachCall() {
        String first = vault.encrypt("same");
        String second = vault.encrypt("same");

        assertNotEquals(first, second);
        assertEquals("same", vault.decrypt(first));
        assertEquals("same", vault.decrypt(second));
    }

    @Test
    void decryptShouldFailUnderDifferentSecret() {
        String token = vault.encrypt("payload");
        CredentialVault other = CredentialVault.ofSecret("another-secret");

        assertThrows(DecryptionException.class, () -> other.decrypt(token));
    }

    @Test
    void decryptShouldDetectTampering() {
        byte[] raw = Base64.getUrlDecoder().decode(vault.encrypt("payload"));
        raw[raw.length - 1] ^= 0x01;
        String tampered = Base64.getUrlEncoder().encodeToString(raw);

        assertThrows(DecryptionException.class, () -> vault.decrypt(tampered));
    }

    @Test
    void decryptShouldRejectMalformedTokens() {
        assertThrows(DecryptionException.class, () -> vault.decrypt("not base64 !!"));
        assertThrows(DecryptionException.class, () -> vault.decrypt(Base64.getUrlEncoder().encodeToString(new byte[10])));
        assertThrows(DecryptionException.class, () -> vault.decrypt(""));
    }

    @Test
    void missingSecretShouldSurfaceAsDecryptionException() {
        CredentialVault unconfigured = new CredentialVault(() -> null);

        assertThrows(DecryptionException.class, () -> unconfigured.encrypt("x"));
        assertThrows(DecryptionException.class, () -> unconfigured.decrypt("abc"));
    }

    @Test
    void decryptNullableShouldPassNullThrough() {
        assertNull(vault.decryptNullable(null));
    }

    @Test
    void verifyPasswordShouldMatchOnlyTheHashedPassword() {
        String hash = vault.hashPassword("hunter2");

        assertTrue(vault.verifyPassword("hunter2", hash));
        assertFalse(vault.verifyPassword("hunter3", hash));
        assertFalse(vault.verifyPassword("hunter2", "garbage"));
        assertFalse(vault.verifyPassword("hunter2", null));
    }
}
