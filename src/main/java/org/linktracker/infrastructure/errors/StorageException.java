package org.linktracker.infrastructure.errors;

/**
 * Base type for failures reported by a storage backend.
 * Checked, so every caller of {@code load}/{@code save} decides what a failure means.
 */
public abstract class StorageException extends Exception {

    protected StorageException(String message) {
        super(message);
    }

    protected StorageException(String message, Throwable cause) {
        super(message, cause);
    }
}
