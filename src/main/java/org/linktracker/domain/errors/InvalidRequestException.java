package org.linktracker.domain.errors;

/** Client sent a body that is not JSON or lacks a required field. */
public class InvalidRequestException extends RuntimeException {

    public InvalidRequestException(String message) {
        super(message);
    }

    public InvalidRequestException(String message, Throwable cause) {
        super(message, cause);
    }
}
