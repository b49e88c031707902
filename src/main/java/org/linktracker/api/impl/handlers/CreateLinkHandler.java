package org.linktracker.api.impl.handlers;

import org.linktracker.api.interfaces.IHttpHandler;
import org.linktracker.api.interfaces.http.HttpRequest;
import org.linktracker.api.interfaces.http.HttpResponse;
import org.linktracker.domain.interfaces.ILinkService;
import org.linktracker.domain.model.Link;
import org.linktracker.infrastructure.errors.PersistenceException;

/** POST /links: creates a link and answers with it, including the generated id. */
public class CreateLinkHandler implements IHttpHandler {
    private final ILinkService service;

    public CreateLinkHandler(ILinkService service) { this.service = service; }

    @Override
    public void handle(HttpRequest req, HttpResponse res) {
        try {
            Link created = service.addLink(RequestBodies.linkDraft(req));
            JsonResponses.json(res, JsonResponses.OK, created);
        } catch (PersistenceException e) {
            JsonResponses.error(res, JsonResponses.INTERNAL_SERVER_ERROR, "Failed to save link");
        }
    }
}
