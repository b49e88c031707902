package org.linktracker.infrastructure.errors;

/** The backend rejected a save because the stored revision moved since the last load. */
public class WriteConflictException extends StorageException {

    public WriteConflictException(String message) {
        super(message);
    }
}
