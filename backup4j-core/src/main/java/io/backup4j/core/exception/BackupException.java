package io.backup4j.core.exception;

/**
 * Base type for every failure raised by backup4j.
 *
 * <p>Only {@link AdapterTransportException} is a candidate for an outer retry policy; all other
 * subclasses are terminal for the invocation that raised them.
 */
public class BackupException extends RuntimeException {

    public BackupException(String message) {
        super(message);
    }

    public BackupException(String message, Throwable cause) {
        super(message, cause);
    }
}
