package io.backup4j.core.exception;

/**
 * A stored secret could not be decrypted: wrong process secret, tampered or malformed token,
 * or no secret configured at all.
 */
public class DecryptionException extends BackupException {

    public DecryptionException(String message) {
        super(message);
    }

    public DecryptionException(String message, Throwable cause) {
        super(message, cause);
    }
}
