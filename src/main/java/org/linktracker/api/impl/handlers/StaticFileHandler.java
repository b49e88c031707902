package org.linktracker.api.impl.handlers;

import org.linktracker.api.interfaces.IHttpHandler;
import org.linktracker.api.interfaces.http.HttpRequest;
import org.linktracker.api.interfaces.http.HttpResponse;

import java.io.IOException;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Map;

/**
 * Serves files below a root directory for GET and HEAD. {@code /} and directories
 * map to their {@code index.html}. Paths escaping the root answer 404.
 */
public class StaticFileHandler implements IHttpHandler {

    private static final Map<String, String> TYPES = Map.ofEntries(
            Map.entry("html", "text/html; charset=utf-8"),
            Map.entry("htm", "text/html; charset=utf-8"),
            Map.entry("css", "text/css; charset=utf-8"),
            Map.entry("js", "application/javascript; charset=utf-8"),
            Map.entry("json", "application/json; charset=utf-8"),
            Map.entry("svg", "image/svg+xml"),
            Map.entry("png", "image/png"),
            Map.entry("jpg", "image/jpeg"),
            Map.entry("jpeg", "image/jpeg"),
            Map.entry("gif", "image/gif"),
            Map.entry("ico", "image/x-icon"),
            Map.entry("txt", "text/plain; charset=utf-8"),
            Map.entry("woff2", "font/woff2"));

    private final Path root;

    public StaticFileHandler(Path root) {
        this.root = root.toAbsolutePath().normalize();
    }

    @Override
    public void handle(HttpRequest req, HttpResponse res) throws IOException {
        Path file = resolve(req.path());
        if (file == null) {
            JsonResponses.error(res, JsonResponses.NOT_FOUND, "not found: " + req.path());
            return;
        }
        res.status(JsonResponses.OK, JsonResponses.reason(JsonResponses.OK));
        res.header("Content-Type", contentType(file));
        res.body(Files.readAllBytes(file));
    }

    /** @return a readable regular file under the root, or null */
    Path resolve(String urlPath) {
        String decoded;
        try {
            decoded = URLDecoder.decode(urlPath, StandardCharsets.UTF_8);
        } catch (IllegalArgumentException e) {
            return null;
        }
        String relative = decoded.startsWith("/") ? decoded.substring(1) : decoded;
        if (relative.indexOf('\0') >= 0) {
            return null;
        }
        Path candidate = root.resolve(relative).normalize();
        if (!candidate.startsWith(root)) {
            return null;
        }
        if (Files.isDirectory(candidate)) {
            candidate = candidate.resolve("index.html");
        }
        return Files.isRegularFile(candidate) && Files.isReadable(candidate) ? candidate : null;
    }

    static String contentType(Path file) {
        String name = file.getFileName().toString();
        int dot = name.lastIndexOf('.');
        String ext = dot < 0 ? "" : name.substring(dot + 1).toLowerCase(Locale.ROOT);
        return TYPES.getOrDefault(ext, "application/octet-stream");
    }
}
