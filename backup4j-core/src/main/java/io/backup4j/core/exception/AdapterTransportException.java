package io.backup4j.core.exception;

/**
 * Wraps a backend failure raised while creating, uploading, listing, deleting or fetching an
 * artifact. The backend's own exception is kept as the cause.
 */
public class AdapterTransportException extends BackupException {

    public AdapterTransportException(String message) {
        super(message);
    }

    public AdapterTransportException(String message, Throwable cause) {
        super(message, cause);
    }
}
