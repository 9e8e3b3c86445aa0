package com.job.matching.store;

/**
 * Thrown when persisted application records cannot be read back.
 * Not recoverable at runtime; the files need to be inspected.
 */
public class StorageCorruptionException extends RuntimeException {

    public StorageCorruptionException(String message) {
        super(message);
    }

    public StorageCorruptionException(String message, Throwable cause) {
        super(message, cause);
    }
}
