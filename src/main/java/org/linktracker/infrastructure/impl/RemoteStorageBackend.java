package org.linktracker.infrastructure.impl;

import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import org.linktracker.infrastructure.errors.BackendUnavailableException;
import org.linktracker.infrastructure.interfaces.IStorageBackend;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;

/**
 * Shared HTTP plumbing for backends that live behind a JSON web API.
 * Transport failures, timeouts and interrupts all surface as
 * {@link BackendUnavailableException}; status handling is left to subclasses.
 */
abstract class RemoteStorageBackend implements IStorageBackend {

    protected final HttpClient http;
    protected final Duration requestTimeout;
    protected final String token;

    protected RemoteStorageBackend(String token, Duration connectTimeout, Duration requestTimeout) {
        this.token = token;
        this.requestTimeout = requestTimeout;
        this.http = HttpClient.newBuilder()
                .version(HttpClient.Version.HTTP_1_1)
                .connectTimeout(connectTimeout)
                .build();
    }

    /** Request builder with timeout, JSON accept header and bearer token (when configured). */
    protected HttpRequest.Builder request(String url) {
        HttpRequest.Builder b = HttpRequest.newBuilder(URI.create(url))
                .timeout(requestTimeout)
                .header("Accept", "application/json");
        if (token != null && !token.isBlank()) {
            b.header("Authorization", "Bearer " + token);
        }
        return b;
    }

    protected HttpResponse<String> send(HttpRequest req, String operation) throws BackendUnavailableException {
        try {
            return http.send(req, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new BackendUnavailableException(name() + " " + operation + " failed: " + e, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new BackendUnavailableException(name() + " " + operation + " interrupted", e);
        }
    }

    /** Parses a response envelope; a broken envelope means the API misbehaved, not that our data is bad. */
    protected JsonObject parseObject(String body, String operation) throws BackendUnavailableException {
        try {
            JsonElement el = JsonParser.parseString(body);
            if (!el.isJsonObject()) {
                throw new BackendUnavailableException(name() + " " + operation + ": response is not a JSON object");
            }
            return el.getAsJsonObject();
        } catch (JsonParseException e) {
            throw new BackendUnavailableException(name() + " " + operation + ": unreadable response", e);
        }
    }

    protected BackendUnavailableException unexpectedStatus(String operation, HttpResponse<String> res) {
        String body = res.body() == null ? "" : res.body();
        if (body.length() > 200) body = body.substring(0, 200) + "...";
        return new BackendUnavailableException(name() + " " + operation + " returned HTTP " + res.statusCode()
                + (body.isBlank() ? "" : ": " + body));
    }
}
