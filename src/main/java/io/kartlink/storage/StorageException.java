package io.kartlink.storage;

/**
 * Raised when the telemetry database cannot be read or written.
 */
public class StorageException extends RuntimeException {
    public StorageException(String message, Throwable cause) {
        super(message, cause);
    }

    public StorageException(String message) {
        super(message);
    }
}
