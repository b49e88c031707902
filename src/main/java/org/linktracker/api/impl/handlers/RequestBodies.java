package org.linktracker.api.impl.handlers;

import com.google.gson.JsonElement;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import org.linktracker.api.interfaces.http.HttpRequest;
import org.linktracker.domain.errors.InvalidRequestException;
import org.linktracker.domain.model.LinkDraft;
import org.linktracker.infrastructure.util.JsonSupport;

import java.nio.charset.StandardCharsets;

final class RequestBodies {

    private RequestBodies() {}

    /** Parses {@code {name,url,description,category}}; unknown fields are ignored. */
    static LinkDraft linkDraft(HttpRequest req) {
        byte[] bytes = req.body();
        String payload = bytes == null ? "" : new String(bytes, StandardCharsets.UTF_8).trim();
        if (payload.isEmpty()) {
            throw new InvalidRequestException("request body is required");
        }
        try {
            JsonElement root = JsonParser.parseString(payload);
            if (!root.isJsonObject()) {
                throw new InvalidRequestException("request body must be a JSON object");
            }
            return JsonSupport.GSON.fromJson(root, LinkDraft.class);
        } catch (JsonParseException | IllegalStateException | UnsupportedOperationException e) {
            throw new InvalidRequestException("invalid json", e);
        }
    }
}
