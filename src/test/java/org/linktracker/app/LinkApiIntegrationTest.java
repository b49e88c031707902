package org.linktracker.app;

import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import org.linktracker.testing.InMemoryStorageBackend;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.HashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/** Drives a real server on an ephemeral port over HTTP. */
class LinkApiIntegrationTest {

    @TempDir
    Path dir;

    private final HttpClient client = HttpClient.newBuilder()
            .version(HttpClient.Version.HTTP_1_1)
            .connectTimeout(Duration.ofSeconds(2))
            .build();

    private LinkTrackerServer server;
    private String base;

    @BeforeEach
    void setUp() throws Exception {
        Files.createDirectories(dir.resolve("public"));
        Files.writeString(dir.resolve("public/index.html"), "<title>links</title>");
        start(new LinkTrackerServer(config()));
    }

    @AfterEach
    void tearDown() throws Exception {
        if (server != null) server.close();
    }

    private ServerConfig config() {
        Map<String, String> props = new HashMap<>();
        props.put("links.file", dir.resolve("data.json").toString());
        props.put("links.static.dir", dir.resolve("public").toString());
        props.put("links.write.backoff.ms", "5");
        props.put("links.refresh.interval.ms", "0");
        props.put("links.http.workers", "4");
        return ServerConfig.from(new String[]{"0"}, props::get, k -> null);
    }

    private void start(LinkTrackerServer s) throws Exception {
        if (server != null) server.close();
        server = s;
        server.start();
        base = "http://localhost:" + server.port();
    }

    private HttpResponse<String> send(String method, String path, String body) throws Exception {
        HttpRequest.Builder b = HttpRequest.newBuilder(URI.create(base + path)).timeout(Duration.ofSeconds(10));
        if (body != null) {
            b.header("Content-Type", "application/json");
        }
        b.method(method, body == null ? HttpRequest.BodyPublishers.noBody()
                : HttpRequest.BodyPublishers.ofString(body, StandardCharsets.UTF_8));
        return client.send(b.build(), HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
    }

    private static JsonObject object(HttpResponse<String> res) {
        return JsonParser.parseString(res.body()).getAsJsonObject();
    }

    private static JsonArray array(HttpResponse<String> res) {
        return JsonParser.parseString(res.body()).getAsJsonArray();
    }

    @Test
    void docsLinkLifecycle() throws Exception {
        HttpResponse<String> created = send("POST", "/api/links",
                "{\"name\":\"Docs\",\"url\":\"http://x\",\"category\":\"ref\"}");
        assertEquals(200, created.statusCode());
        JsonObject link = object(created);
        String id = link.get("id").getAsString();
        assertFalse(id.isBlank());
        assertEquals(0, link.get("clicks").getAsInt());
        assertEquals("", link.get("description").getAsString());
        assertFalse(link.has("updatedAt"));

        JsonArray links = array(send("GET", "/api/links", null));
        assertEquals(1, links.size());
        assertEquals(id, links.get(0).getAsJsonObject().get("id").getAsString());

        assertEquals(1, object(send("POST", "/api/links/" + id + "/click", null)).get("clicks").getAsInt());
        assertEquals(2, object(send("POST", "/links/" + id + "/click", null)).get("clicks").getAsInt());

        HttpResponse<String> updated = send("PUT", "/api/links/" + id,
                "{\"name\":\"Docs v2\",\"url\":\"http://y\"}");
        assertEquals(200, updated.statusCode());
        assertEquals(2, object(updated).get("clicks").getAsInt());
        assertTrue(object(updated).has("updatedAt"));

        JsonArray activities = array(send("GET", "/api/activities", null));
        assertEquals(4, activities.size());
        assertEquals("edited", type(activities.get(0)));
        assertEquals("clicked", type(activities.get(1)));
        assertEquals("clicked", type(activities.get(2)));
        assertEquals("added", type(activities.get(3)));
        assertEquals("Docs v2", activities.get(0).getAsJsonObject().get("linkName").getAsString());

        HttpResponse<String> deleted = send("DELETE", "/api/links/" + id, null);
        assertEquals(200, deleted.statusCode());
        assertTrue(object(deleted).get("success").getAsBoolean());
        assertEquals(0, array(send("GET", "/api/links", null)).size());
        assertEquals("deleted", type(array(send("GET", "/api/activities", null)).get(0)));
    }

    private static String type(JsonElement activity) {
        return activity.getAsJsonObject().get("type").getAsString();
    }

    @Test
    void unknownIdsAreNotFound() throws Exception {
        HttpResponse<String> click = send("POST", "/api/links/nope/click", null);
        assertEquals(404, click.statusCode());
        assertEquals("Link not found", object(click).get("error").getAsString());

        assertEquals(404, send("PUT", "/api/links/nope", "{\"name\":\"n\",\"url\":\"u\"}").statusCode());
        assertEquals(404, send("DELETE", "/api/links/nope", null).statusCode());
        assertEquals(0, array(send("GET", "/api/activities", null)).size(), "nothing was logged");
    }

    @Test
    void invalidBodiesAreBadRequests() throws Exception {
        HttpResponse<String> missingName = send("POST", "/api/links", "{\"url\":\"http://x\"}");
        assertEquals(400, missingName.statusCode());
        assertEquals("name is required", object(missingName).get("error").getAsString());

        assertEquals(400, send("POST", "/api/links", "{\"name\":\"x\"}").statusCode());
        assertEquals(400, send("POST", "/api/links", "{not json").statusCode());
        assertEquals(400, send("POST", "/api/links", "").statusCode());
        assertEquals(0, array(send("GET", "/api/links", null)).size());
    }

    @Test
    void writesSurviveRestart() throws Exception {
        send("POST", "/api/links", "{\"name\":\"Keep\",\"url\":\"http://k\"}");

        start(new LinkTrackerServer(config()));

        JsonArray links = array(send("GET", "/api/links", null));
        assertEquals(1, links.size());
        assertEquals("Keep", links.get(0).getAsJsonObject().get("name").getAsString());
        String onDisk = Files.readString(dir.resolve("data.json"));
        assertTrue(onDisk.contains("\"activities\": ["), onDisk);
    }

    @Test
    void corsPreflightAndHeaders() throws Exception {
        HttpResponse<String> preflight = send("OPTIONS", "/api/links", null);
        assertEquals(204, preflight.statusCode());
        assertEquals("*", preflight.headers().firstValue("Access-Control-Allow-Origin").orElse(null));
        assertTrue(preflight.headers().firstValue("Access-Control-Allow-Methods").orElse("").contains("DELETE"));

        HttpResponse<String> list = send("GET", "/api/links", null);
        assertEquals("*", list.headers().firstValue("Access-Control-Allow-Origin").orElse(null));
        assertTrue(list.headers().firstValue("Content-Type").orElse("").startsWith("application/json"));
    }

    @Test
    void staticFilesAndUnknownRoutes() throws Exception {
        HttpResponse<String> index = send("GET", "/", null);
        assertEquals(200, index.statusCode());
        assertEquals("<title>links</title>", index.body());

        assertEquals(404, send("GET", "/missing.css", null).statusCode());
        assertEquals(404, send("PATCH", "/api/links", "{}").statusCode());
    }

    @Test
    void healthReportsBackendAndCache() throws Exception {
        send("POST", "/api/links", "{\"name\":\"A\",\"url\":\"http://a\"}");

        HttpResponse<String> res = send("GET", "/api/health", null);
        assertEquals(200, res.statusCode());
        JsonObject body = object(res);
        assertEquals("ok", body.get("status").getAsString());
        assertEquals(50, body.get("activityRetention").getAsInt());
        JsonObject coordinator = body.getAsJsonObject("coordinator");
        assertEquals("file", coordinator.get("backend").getAsString());
        assertEquals(1, coordinator.get("links").getAsInt());
        assertEquals(1, coordinator.get("commits").getAsInt());
    }

    @Test
    void backendThatRejectsEveryWriteAnswers500AndKeepsServingReads() throws Exception {
        InMemoryStorageBackend failing = new InMemoryStorageBackend();
        start(new LinkTrackerServer(config(), failing));
        failing.failNextSaves.set(100);

        HttpResponse<String> res = send("POST", "/api/links", "{\"name\":\"Lost\",\"url\":\"http://l\"}");

        assertEquals(500, res.statusCode());
        assertEquals("Failed to save link", object(res).get("error").getAsString());
        assertEquals(3, failing.saves.get());
        assertEquals(0, array(send("GET", "/api/links", null)).size());
        assertEquals("degraded", object(send("GET", "/health", null)).get("status").getAsString());
        assertEquals(0, server.coordinator().health().commits());
    }
}
