package org.linktracker.api.impl.handlers;

import org.linktracker.api.interfaces.IHttpHandler;
import org.linktracker.api.interfaces.http.HttpRequest;
import org.linktracker.api.interfaces.http.HttpResponse;

/** OPTIONS on any path: 204; the writer adds the CORS headers. */
public class PreflightHandler implements IHttpHandler {
    @Override
    public void handle(HttpRequest req, HttpResponse res) {
        JsonResponses.empty(res, JsonResponses.NO_CONTENT);
    }
}
