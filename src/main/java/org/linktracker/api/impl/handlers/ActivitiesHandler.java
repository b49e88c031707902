package org.linktracker.api.impl.handlers;

import org.linktracker.api.interfaces.IHttpHandler;
import org.linktracker.api.interfaces.http.HttpRequest;
import org.linktracker.api.interfaces.http.HttpResponse;
import org.linktracker.domain.interfaces.ILinkService;

public class ActivitiesHandler implements IHttpHandler {
    private final ILinkService service;

    public ActivitiesHandler(ILinkService service) { this.service = service; }

    @Override
    public void handle(HttpRequest req, HttpResponse res) {
        JsonResponses.json(res, JsonResponses.OK, service.activities());
    }
}
