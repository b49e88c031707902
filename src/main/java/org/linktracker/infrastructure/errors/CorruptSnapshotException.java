package org.linktracker.infrastructure.errors;

/** Persisted content exists but is not a readable Snapshot document. */
public class CorruptSnapshotException extends StorageException {

    public CorruptSnapshotException(String message, Throwable cause) {
        super(message, cause);
    }
}
