package org.linktracker.api.impl.handlers;

import org.linktracker.api.interfaces.http.HttpResponse;
import org.linktracker.infrastructure.util.JsonSupport;

import java.util.Map;

/** Helpers every handler uses to write JSON bodies with the right status line. */
public final class JsonResponses {

    public static final int OK = 200;
    public static final int NO_CONTENT = 204;
    public static final int BAD_REQUEST = 400;
    public static final int NOT_FOUND = 404;
    public static final int PAYLOAD_TOO_LARGE = 413;
    public static final int INTERNAL_SERVER_ERROR = 500;
    public static final int SERVICE_UNAVAILABLE = 503;

    private static final String JSON = "application/json; charset=utf-8";

    private JsonResponses() {}

    public static void json(HttpResponse res, int status, Object body) {
        res.status(status, reason(status));
        res.header("Content-Type", JSON);
        res.body(JsonSupport.GSON.toJson(body));
    }

    public static void error(HttpResponse res, int status, String message) {
        json(res, status, Map.of("error", message == null ? reason(status) : message));
    }

    public static void empty(HttpResponse res, int status) {
        res.status(status, reason(status));
        res.body("");
    }

    /** Maps HTTP status codes to reason phrases. */
    public static String reason(int code) {
        return switch (code) {
            case OK -> "OK";
            case NO_CONTENT -> "No Content";
            case BAD_REQUEST -> "Bad Request";
            case NOT_FOUND -> "Not Found";
            case PAYLOAD_TOO_LARGE -> "Payload Too Large";
            case INTERNAL_SERVER_ERROR -> "Internal Server Error";
            case SERVICE_UNAVAILABLE -> "Service Unavailable";
            default -> "Unknown";
        };
    }
}
