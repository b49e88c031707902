package org.linktracker.infrastructure.errors;

/** Network, authorization, timeout or I/O failure talking to the backend. */
public class BackendUnavailableException extends StorageException {

    public BackendUnavailableException(String message) {
        super(message);
    }

    public BackendUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
