package org.linktracker.api.impl.handlers;

import org.linktracker.api.interfaces.IHttpHandler;
import org.linktracker.api.interfaces.http.HttpRequest;
import org.linktracker.api.interfaces.http.HttpResponse;
import org.linktracker.domain.errors.LinkNotFoundException;
import org.linktracker.domain.interfaces.ILinkService;
import org.linktracker.infrastructure.errors.PersistenceException;

import java.util.Map;

/** DELETE /links/{id} */
public class DeleteLinkHandler implements IHttpHandler {
    private final ILinkService service;
    private final String id;

    public DeleteLinkHandler(ILinkService service, String id) {
        this.service = service;
        this.id = id;
    }

    @Override
    public void handle(HttpRequest req, HttpResponse res) {
        try {
            service.deleteLink(id);
            JsonResponses.json(res, JsonResponses.OK, Map.of("success", true));
        } catch (LinkNotFoundException e) {
            JsonResponses.error(res, JsonResponses.NOT_FOUND, "Link not found");
        } catch (PersistenceException e) {
            JsonResponses.error(res, JsonResponses.INTERNAL_SERVER_ERROR, "Failed to delete link");
        }
    }
}
