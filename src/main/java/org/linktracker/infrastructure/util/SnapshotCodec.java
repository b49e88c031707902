package org.linktracker.infrastructure.util;

import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import org.linktracker.domain.model.Snapshot;
import org.linktracker.infrastructure.errors.CorruptSnapshotException;

/**
 * Converts a Snapshot to and from its persisted JSON document
 * {@code {"links": [...], "activities": [...]}}.
 * <p>
 * Output is pretty-printed; callers write it as UTF-8.
 */
public final class SnapshotCodec {

    private SnapshotCodec() {}

    public static String encode(Snapshot snapshot) {
        return JsonSupport.PRETTY_GSON.toJson(snapshot);
    }

    /**
     * Parses a persisted document. Blank input is an empty Snapshot; missing
     * arrays decode as empty lists.
     *
     * @throws CorruptSnapshotException if the text is not a JSON object of the expected shape
     */
    public static Snapshot decode(String json) throws CorruptSnapshotException {
        if (json == null || json.isBlank()) {
            return Snapshot.empty();
        }
        try {
            JsonElement root = JsonParser.parseString(json);
            if (!root.isJsonObject()) {
                throw new CorruptSnapshotException("snapshot is not a JSON object", null);
            }
            requireNoNullEntries(root.getAsJsonObject(), "links");
            requireNoNullEntries(root.getAsJsonObject(), "activities");
            Snapshot snapshot = JsonSupport.GSON.fromJson(root, Snapshot.class);
            if (snapshot.links().stream().anyMatch(l -> l.id() == null)) {
                throw new CorruptSnapshotException("snapshot contains a link without id", null);
            }
            return snapshot;
        } catch (RuntimeException e) {
            // Gson wraps failures of the record constructors in a plain RuntimeException
            throw new CorruptSnapshotException("malformed snapshot: " + e.getMessage(), e);
        }
    }

    private static void requireNoNullEntries(JsonObject root, String member) throws CorruptSnapshotException {
        JsonElement el = root.get(member);
        if (el == null || !el.isJsonArray()) {
            return;
        }
        for (JsonElement entry : el.getAsJsonArray()) {
            if (entry == null || entry.isJsonNull()) {
                throw new CorruptSnapshotException("snapshot " + member + " contains a null entry", null);
            }
        }
    }
}
