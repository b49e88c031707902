package org.linktracker.infrastructure.errors;

/**
 * A mutation could not be made durable within the retry budget.
 * The coordinator's cache is untouched when this is thrown.
 */
public class PersistenceException extends RuntimeException {

    private final int attempts;

    public PersistenceException(String message, int attempts, Throwable cause) {
        super(message, cause);
        this.attempts = attempts;
    }

    public int attempts() {
        return attempts;
    }
}
