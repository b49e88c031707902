package org.linktracker.api.impl.handlers;

import org.linktracker.api.impl.MinimalHttpRequest;
import org.linktracker.api.interfaces.IHttpHandler;
import org.linktracker.domain.impl.SnapshotMutations;
import org.linktracker.infrastructure.impl.LinkServiceImpl;
import org.linktracker.infrastructure.impl.PersistenceCoordinator;
import org.linktracker.infrastructure.util.IdGenerator;
import org.linktracker.testing.InMemoryStorageBackend;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Clock;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class HandlerFactoryTest {

    @TempDir
    Path staticRoot;

    private HandlerFactory factory;
    private HandlerFactory apiOnly;

    @BeforeEach
    void setUp() {
        PersistenceCoordinator coordinator = new PersistenceCoordinator(new InMemoryStorageBackend());
        LinkServiceImpl service = new LinkServiceImpl(coordinator,
                new SnapshotMutations(50, Clock.systemUTC(), new IdGenerator()));
        factory = new HandlerFactory(service, coordinator, 50, staticRoot);
        apiOnly = new HandlerFactory(service, coordinator, 50, null);
    }

    private IHttpHandler route(HandlerFactory f, String method, String target) {
        return f.create(new MinimalHttpRequest(method, target, "HTTP/1.1", Map.of(), null));
    }

    private IHttpHandler route(String method, String target) {
        return route(factory, method, target);
    }

    @Test
    void linkCollectionRoutes() {
        assertInstanceOf(ListLinksHandler.class, route("GET", "/links"));
        assertInstanceOf(ListLinksHandler.class, route("GET", "/api/links"));
        assertInstanceOf(ListLinksHandler.class, route("GET", "/api/links/?x=1"));
        assertInstanceOf(CreateLinkHandler.class, route("POST", "/api/links"));
        assertInstanceOf(NotFoundHandler.class, route("PATCH", "/api/links"));
    }

    @Test
    void singleLinkRoutes() {
        assertInstanceOf(UpdateLinkHandler.class, route("PUT", "/api/links/abc"));
        assertInstanceOf(DeleteLinkHandler.class, route("DELETE", "/links/abc"));
        assertInstanceOf(ClickLinkHandler.class, route("POST", "/api/links/abc/click"));
        assertInstanceOf(NotFoundHandler.class, route("GET", "/api/links/abc/click"));
        assertInstanceOf(NotFoundHandler.class, route("POST", "/api/links/abc/other"));
        assertInstanceOf(NotFoundHandler.class, route("PUT", "/api/links//click"));
    }

    @Test
    void methodIsCaseInsensitive() {
        assertInstanceOf(ClickLinkHandler.class, route("post", "/api/links/abc/click"));
    }

    @Test
    void activitiesHealthAndPreflight() {
        assertInstanceOf(ActivitiesHandler.class, route("GET", "/api/activities"));
        assertInstanceOf(HealthHandler.class, route("GET", "/health"));
        assertInstanceOf(PreflightHandler.class, route("OPTIONS", "/api/links/abc"));
        assertInstanceOf(PreflightHandler.class, route("OPTIONS", "/anything"));
    }

    @Test
    void otherGetsFallThroughToStaticFiles() {
        assertInstanceOf(StaticFileHandler.class, route("GET", "/"));
        assertInstanceOf(StaticFileHandler.class, route("HEAD", "/app.js"));
        assertInstanceOf(NotFoundHandler.class, route("POST", "/app.js"));
    }

    @Test
    void withoutStaticRootUnknownPathsAreNotFound() {
        assertInstanceOf(NotFoundHandler.class, route(apiOnly, "GET", "/"));
        assertInstanceOf(ListLinksHandler.class, route(apiOnly, "GET", "/api/links"));
    }
}
