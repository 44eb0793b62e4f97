package io.agentloom.storage;

/**
 * Unrecoverable persistence fault. Raised by {@link ProjectStore} implementations
 * and propagated unchanged through project memory mutators.
 */
public class StorageException extends RuntimeException {
    public StorageException(String message) {
        super(message);
    }

    public StorageException(String message, Throwable cause) {
        super(message, cause);
    }
}
