package org.linktracker.api.impl.handlers;

import org.linktracker.api.interfaces.IHttpHandler;
import org.linktracker.api.interfaces.http.HttpRequest;
import org.linktracker.api.interfaces.http.HttpResponse;
import org.linktracker.infrastructure.impl.CoordinatorHealth;
import org.linktracker.infrastructure.impl.PersistenceCoordinator;

import java.util.LinkedHashMap;
import java.util.Map;

/** GET /health: liveness plus cache freshness. Always 200 while the process serves. */
public class HealthHandler implements IHttpHandler {
    private final PersistenceCoordinator coordinator;
    private final int activityRetention;

    public HealthHandler(PersistenceCoordinator coordinator, int activityRetention) {
        this.coordinator = coordinator;
        this.activityRetention = activityRetention;
    }

    @Override
    public void handle(HttpRequest req, HttpResponse res) {
        CoordinatorHealth h = coordinator.health();
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", h.status());
        body.put("activityRetention", activityRetention);
        body.put("coordinator", h);
        JsonResponses.json(res, JsonResponses.OK, body);
    }
}
