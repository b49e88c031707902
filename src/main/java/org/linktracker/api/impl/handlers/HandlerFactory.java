package org.linktracker.api.impl.handlers;

import org.linktracker.api.interfaces.IHandlerFactory;
import org.linktracker.api.interfaces.IHttpHandler;
import org.linktracker.api.interfaces.http.HttpRequest;
import org.linktracker.domain.interfaces.ILinkService;
import org.linktracker.infrastructure.impl.PersistenceCoordinator;

import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;

/**
 * Routes a request to its handler. API routes answer with or without the
 * {@code /api} prefix; any other GET falls through to static files.
 */
public class HandlerFactory implements IHandlerFactory {

    private static final String API_PREFIX = "/api";
    private static final String LINKS = "/links";

    private final ILinkService service;
    private final IHttpHandler health;
    private final IHttpHandler staticFiles;   // null when no static directory is configured

    public HandlerFactory(ILinkService service, PersistenceCoordinator coordinator,
                          int activityRetention, Path staticRoot) {
        this.service = service;
        this.health = new HealthHandler(coordinator, activityRetention);
        this.staticFiles = staticRoot == null ? null : new StaticFileHandler(staticRoot);
    }

    @Override
    public IHttpHandler create(HttpRequest req) {
        String m = req.method();
        String p = stripApiPrefix(req.path());

        if ("OPTIONS".equals(m)) return new PreflightHandler();

        if (LINKS.equals(p) || (LINKS + "/").equals(p)) {
            if ("GET".equals(m)) return new ListLinksHandler(service);
            if ("POST".equals(m)) return new CreateLinkHandler(service);
            return new NotFoundHandler();
        }
        if (p.startsWith(LINKS + "/")) {
            String[] parts = p.substring(LINKS.length() + 1).split("/", -1);
            String id = decode(parts[0]);
            if (id.isEmpty()) return new NotFoundHandler();

            if (parts.length == 1) {
                if ("PUT".equals(m)) return new UpdateLinkHandler(service, id);
                if ("DELETE".equals(m)) return new DeleteLinkHandler(service, id);
            }
            if (parts.length == 2 && "click".equals(parts[1]) && "POST".equals(m)) {
                return new ClickLinkHandler(service, id);
            }
            return new NotFoundHandler();
        }
        if ("/activities".equals(p) && "GET".equals(m)) return new ActivitiesHandler(service);
        if ("/health".equals(p) && "GET".equals(m)) return health;

        if (staticFiles != null && ("GET".equals(m) || "HEAD".equals(m))) return staticFiles;

        return new NotFoundHandler();
    }

    private static String stripApiPrefix(String path) {
        if (path.equals(API_PREFIX)) return "/";
        return path.startsWith(API_PREFIX + "/") ? path.substring(API_PREFIX.length()) : path;
    }

    private static String decode(String segment) {
        try {
            return URLDecoder.decode(segment, StandardCharsets.UTF_8);
        } catch (IllegalArgumentException e) {
            return segment;
        }
    }
}
