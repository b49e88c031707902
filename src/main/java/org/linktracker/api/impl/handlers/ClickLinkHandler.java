package org.linktracker.api.impl.handlers;

import org.linktracker.api.interfaces.IHttpHandler;
import org.linktracker.api.interfaces.http.HttpRequest;
import org.linktracker.api.interfaces.http.HttpResponse;
import org.linktracker.domain.errors.LinkNotFoundException;
import org.linktracker.domain.interfaces.ILinkService;
import org.linktracker.infrastructure.errors.PersistenceException;

import java.util.Map;

/** POST /links/{id}/click: answers {@code {"clicks": n}}. */
public class ClickLinkHandler implements IHttpHandler {
    private final ILinkService service;
    private final String id;

    public ClickLinkHandler(ILinkService service, String id) {
        this.service = service;
        this.id = id;
    }

    @Override
    public void handle(HttpRequest req, HttpResponse res) {
        try {
            int clicks = service.click(id);
            JsonResponses.json(res, JsonResponses.OK, Map.of("clicks", clicks));
        } catch (LinkNotFoundException e) {
            JsonResponses.error(res, JsonResponses.NOT_FOUND, "Link not found");
        } catch (PersistenceException e) {
            JsonResponses.error(res, JsonResponses.INTERNAL_SERVER_ERROR, "Failed to update clicks");
        }
    }
}
