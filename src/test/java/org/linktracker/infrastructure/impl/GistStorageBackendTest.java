package org.linktracker.infrastructure.impl;

import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import org.linktracker.domain.model.Link;
import org.linktracker.domain.model.Snapshot;
import org.linktracker.infrastructure.errors.BackendUnavailableException;
import org.linktracker.infrastructure.errors.CorruptSnapshotException;
import org.linktracker.infrastructure.errors.WriteConflictException;
import org.linktracker.infrastructure.util.SnapshotCodec;
import org.linktracker.testing.StubHttpServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class GistStorageBackendTest {

    private StubHttpServer stub;
    private GistStorageBackend backend;

    @BeforeEach
    void setUp() throws Exception {
        stub = new StubHttpServer();
        backend = new GistStorageBackend(stub.baseUrl(), "g123", "data.json", "tok",
                Duration.ofSeconds(2), Duration.ofSeconds(5));
    }

    @AfterEach
    void tearDown() throws Exception {
        stub.close();
    }

    private static Snapshot sample() {
        Link l = new Link("l1", "Docs", "http://x", "", "ref", 2, Instant.parse("2024-01-01T00:00:00Z"), null);
        return new Snapshot(List.of(l), List.of());
    }

    private static String gistWith(String fileName, JsonObject file) {
        JsonObject files = new JsonObject();
        files.add(fileName, file);
        JsonObject gist = new JsonObject();
        gist.addProperty("id", "g123");
        gist.add("files", files);
        return gist.toString();
    }

    private static JsonObject inline(String content) {
        JsonObject f = new JsonObject();
        f.addProperty("filename", "data.json");
        f.addProperty("content", content);
        f.addProperty("truncated", false);
        return f;
    }

    @Test
    void loadReadsFileContentWithTokenAndGithubHeaders() throws Exception {
        stub.respond(200, gistWith("data.json", inline(SnapshotCodec.encode(sample()))));

        assertEquals(sample(), backend.load());

        StubHttpServer.Recorded req = stub.requests().get(0);
        assertEquals("GET", req.method());
        assertEquals("/gists/g123", req.target());
        assertTrue(req.hasHeader("Authorization", "Bearer tok"));
        assertTrue(req.hasHeader("Accept", "application/vnd.github+json"));
    }

    @Test
    void missingFileEntryIsEmpty() throws Exception {
        stub.respond(200, gistWith("other.json", inline("{}")));

        assertEquals(Snapshot.empty(), backend.load());
    }

    @Test
    void blankContentIsEmpty() throws Exception {
        stub.respond(200, gistWith("data.json", inline("")));

        assertEquals(Snapshot.empty(), backend.load());
    }

    @Test
    void truncatedContentIsFetchedFromRawUrl() throws Exception {
        JsonObject file = new JsonObject();
        file.addProperty("content", "{\"links\": [");
        file.addProperty("truncated", true);
        file.addProperty("raw_url", stub.baseUrl() + "/raw/data.json");
        stub.respond(200, gistWith("data.json", file))
            .respond(200, SnapshotCodec.encode(sample()));

        assertEquals(sample(), backend.load());
        assertEquals("/raw/data.json", stub.requests().get(1).target());
    }

    @Test
    void corruptContentIsReportedAsCorrupt() {
        stub.respond(200, gistWith("data.json", inline("not json at all {")));

        assertThrows(CorruptSnapshotException.class, () -> backend.load());
    }

    @Test
    void saveReplacesTheFileWithPatch() throws Exception {
        stub.respond(200, "{\"id\":\"g123\"}");

        backend.save(sample());

        StubHttpServer.Recorded req = stub.requests().get(0);
        assertEquals("PATCH", req.method());
        assertEquals("/gists/g123", req.target());
        JsonObject body = JsonParser.parseString(req.body()).getAsJsonObject();
        String content = body.getAsJsonObject("files").getAsJsonObject("data.json").get("content").getAsString();
        assertEquals(sample(), SnapshotCodec.decode(content));
    }

    @Test
    void authAndMissingGistAreUnavailable() {
        stub.respond(401, "{\"message\":\"Bad credentials\"}").respond(404, "{\"message\":\"Not Found\"}");

        BackendUnavailableException e = assertThrows(BackendUnavailableException.class, () -> backend.load());
        assertTrue(e.getMessage().contains("401"), e.getMessage());
        assertThrows(BackendUnavailableException.class, () -> backend.load());
    }

    @Test
    void serverErrorOnSaveIsUnavailable() {
        stub.respond(502, "");

        assertThrows(BackendUnavailableException.class, () -> backend.save(sample()));
    }

    @Test
    void conflictStatusIsWriteConflict() {
        stub.respond(409, "{\"message\":\"Conflict\"}");

        assertThrows(WriteConflictException.class, () -> backend.save(sample()));
    }

    @Test
    void unreachableApiIsUnavailable() throws Exception {
        String url = stub.baseUrl();
        stub.close();
        GistStorageBackend dead = new GistStorageBackend(url, "g123", null, null,
                Duration.ofSeconds(1), Duration.ofSeconds(2));

        assertThrows(BackendUnavailableException.class, dead::load);
    }

    @Test
    void gistIdIsRequired() {
        assertThrows(IllegalArgumentException.class, () -> new GistStorageBackend(null, " ", null, null,
                Duration.ofSeconds(1), Duration.ofSeconds(1)));
    }
}
