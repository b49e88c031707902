package org.linktracker.api.impl;

import org.linktracker.api.impl.handlers.JsonResponses;
import org.linktracker.domain.errors.InvalidRequestException;
import org.linktracker.domain.errors.LinkNotFoundException;
import org.linktracker.infrastructure.errors.PersistenceException;

/**
 * Single place where exceptions escaping a handler become HTTP responses.
 * Messages are short; stack traces go to the server log only.
 */
public final class ErrorResponses {

    private ErrorResponses() {}

    /** @return the status written to {@code res} */
    public static int apply(HttpResponseImpl res, Exception e) {
        res.reset();
        if (e instanceof LinkNotFoundException) {
            JsonResponses.error(res, JsonResponses.NOT_FOUND, "Link not found");
            return JsonResponses.NOT_FOUND;
        }
        if (e instanceof InvalidRequestException) {
            JsonResponses.error(res, JsonResponses.BAD_REQUEST, e.getMessage());
            return JsonResponses.BAD_REQUEST;
        }
        if (e instanceof PersistenceException) {
            JsonResponses.error(res, JsonResponses.INTERNAL_SERVER_ERROR, "Failed to save changes");
            return JsonResponses.INTERNAL_SERVER_ERROR;
        }
        System.err.println("[Server] unexpected handler error: " + e);
        e.printStackTrace();
        JsonResponses.error(res, JsonResponses.INTERNAL_SERVER_ERROR, "Internal server error");
        return JsonResponses.INTERNAL_SERVER_ERROR;
    }
}
