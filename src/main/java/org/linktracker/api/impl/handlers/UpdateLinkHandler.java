package org.linktracker.api.impl.handlers;

import org.linktracker.api.interfaces.IHttpHandler;
import org.linktracker.api.interfaces.http.HttpRequest;
import org.linktracker.api.interfaces.http.HttpResponse;
import org.linktracker.domain.errors.LinkNotFoundException;
import org.linktracker.domain.interfaces.ILinkService;
import org.linktracker.infrastructure.errors.PersistenceException;

/** PUT /links/{id} */
public class UpdateLinkHandler implements IHttpHandler {
    private final ILinkService service;
    private final String id;

    public UpdateLinkHandler(ILinkService service, String id) {
        this.service = service;
        this.id = id;
    }

    @Override
    public void handle(HttpRequest req, HttpResponse res) {
        try {
            JsonResponses.json(res, JsonResponses.OK, service.updateLink(id, RequestBodies.linkDraft(req)));
        } catch (LinkNotFoundException e) {
            JsonResponses.error(res, JsonResponses.NOT_FOUND, "Link not found");
        } catch (PersistenceException e) {
            JsonResponses.error(res, JsonResponses.INTERNAL_SERVER_ERROR, "Failed to update link");
        }
    }
}
