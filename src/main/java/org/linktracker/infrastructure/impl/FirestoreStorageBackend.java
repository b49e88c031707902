package org.linktracker.infrastructure.impl;

import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import org.linktracker.domain.model.Snapshot;
import org.linktracker.infrastructure.errors.BackendUnavailableException;
import org.linktracker.infrastructure.errors.StorageException;
import org.linktracker.infrastructure.errors.WriteConflictException;
import org.linktracker.infrastructure.util.JsonSupport;
import org.linktracker.infrastructure.util.SnapshotCodec;

import java.net.URLEncoder;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;

/**
 * FirestoreStorageBackend keeps the Snapshot in a single Firestore document,
 * as the JSON text of its {@code snapshot} string field, through the Firestore
 * REST API.
 * <p>
 * Writes are revision-checked. Every load remembers the document's
 * {@code updateTime}; the next save sends it as
 * {@code currentDocument.updateTime} (or {@code currentDocument.exists=false}
 * when the document did not exist), so a save racing another writer is rejected
 * with {@link WriteConflictException} instead of overwriting it.
 */
public final class FirestoreStorageBackend extends RemoteStorageBackend {

    public static final String DEFAULT_BASE_URL = "https://firestore.googleapis.com";
    public static final String DEFAULT_COLLECTION = "linktracker";
    public static final String DEFAULT_DOCUMENT = "state";

    static final String FIELD = "snapshot";

    private final String documentUrl;

    /** Revision seen by the last load or save; null when the document is absent. */
    private volatile String updateTime;
    /** False until a load or save told us whether the document exists. */
    private volatile boolean revisionKnown;

    public FirestoreStorageBackend(String baseUrl, String projectId, String collection, String document,
                                   String token, Duration connectTimeout, Duration requestTimeout) {
        super(token, connectTimeout, requestTimeout);
        if (projectId == null || projectId.isBlank()) {
            throw new IllegalArgumentException("project id is required for the firestore backend");
        }
        String base = baseUrl == null ? DEFAULT_BASE_URL : baseUrl;
        if (base.endsWith("/")) base = base.substring(0, base.length() - 1);
        this.documentUrl = base + "/v1/projects/" + projectId + "/databases/(default)/documents/"
                + (collection == null ? DEFAULT_COLLECTION : collection) + "/"
                + (document == null ? DEFAULT_DOCUMENT : document);
    }

    @Override
    public String name() {
        return "firestore";
    }

    @Override
    public Snapshot load() throws StorageException {
        HttpResponse<String> res = send(request(documentUrl).GET().build(), "load");
        if (res.statusCode() == 404) {
            updateTime = null;
            revisionKnown = true;
            return Snapshot.empty();
        }
        if (res.statusCode() != 200) {
            throw unexpectedStatus("load", res);
        }

        JsonObject doc = parseObject(res.body(), "load");
        // the revision is current even when the content is corrupt, so a save can replace it
        updateTime = textOrNull(doc.get("updateTime"));
        revisionKnown = true;
        return SnapshotCodec.decode(stringField(doc));
    }

    @Override
    public void save(Snapshot snapshot) throws StorageException {
        JsonObject value = new JsonObject();
        value.addProperty("stringValue", SnapshotCodec.encode(snapshot));
        JsonObject fields = new JsonObject();
        fields.add(FIELD, value);
        JsonObject body = new JsonObject();
        body.add("fields", fields);

        HttpRequest req = request(documentUrl + "?" + queryFor(updateTime, revisionKnown))
                .header("Content-Type", "application/json")
                .method("PATCH", HttpRequest.BodyPublishers.ofString(JsonSupport.GSON.toJson(body)))
                .build();
        HttpResponse<String> res = send(req, "save");

        if (isConflict(res)) {
            throw new WriteConflictException("firestore document changed since revision "
                    + (updateTime == null ? "<absent>" : updateTime) + " (HTTP " + res.statusCode() + ")");
        }
        if (res.statusCode() != 200) {
            throw unexpectedStatus("save", res);
        }

        String next = textOrNull(parseObject(res.body(), "save").get("updateTime"));
        if (next == null) {
            throw new BackendUnavailableException("firestore save response has no updateTime");
        }
        updateTime = next;
        revisionKnown = true;
    }

    /** Query string with the field mask and, when a revision is known, the precondition. */
    static String queryFor(String updateTime, boolean revisionKnown) {
        StringBuilder q = new StringBuilder("updateMask.fieldPaths=").append(FIELD);
        if (revisionKnown) {
            if (updateTime == null) {
                q.append("&currentDocument.exists=false");
            } else {
                q.append("&currentDocument.updateTime=").append(URLEncoder.encode(updateTime, StandardCharsets.UTF_8));
            }
        }
        return q.toString();
    }

    /**
     * ABORTED/ALREADY_EXISTS come back as 409, a failed precondition as 400 or 412
     * with status {@code FAILED_PRECONDITION} in the error body.
     */
    private static boolean isConflict(HttpResponse<String> res) {
        int code = res.statusCode();
        if (code == 409 || code == 412) {
            return true;
        }
        return code == 400 && res.body() != null && res.body().contains("FAILED_PRECONDITION");
    }

    private static String stringField(JsonObject doc) {
        JsonElement fields = doc.get("fields");
        if (fields == null || !fields.isJsonObject()) {
            return null;
        }
        JsonElement value = fields.getAsJsonObject().get(FIELD);
        if (value == null || !value.isJsonObject()) {
            return null;
        }
        return textOrNull(value.getAsJsonObject().get("stringValue"));
    }

    private static String textOrNull(JsonElement el) {
        return el == null || el.isJsonNull() ? null : el.getAsString();
    }
}
