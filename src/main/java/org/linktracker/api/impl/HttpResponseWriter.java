package org.linktracker.api.impl;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.util.Map;

/**
 * Serializes a response as HTTP/1.1 on a connection that is closed afterwards.
 * Adds {@code Content-Length}, {@code Connection: close} and the CORS headers
 * unless a handler set them already.
 */
public final class HttpResponseWriter {

    static final Map<String, String> CORS_HEADERS = Map.of(
            "Access-Control-Allow-Origin", "*",
            "Access-Control-Allow-Methods", "GET, POST, PUT, DELETE, OPTIONS",
            "Access-Control-Allow-Headers", "Content-Type");

    private HttpResponseWriter() {}

    /**
     * @param headOnly true for HEAD requests: headers describe the body, which is not sent
     */
    public static void write(OutputStream out, HttpResponseImpl res, boolean headOnly) throws IOException {
        CORS_HEADERS.forEach((k, v) -> res.headers().putIfAbsent(k, v));
        res.headers().putIfAbsent("Content-Length", String.valueOf(res.body().length));
        res.headers().put("Connection", "close");

        StringBuilder head = new StringBuilder(256)
                .append("HTTP/1.1 ").append(res.status()).append(' ').append(res.reason()).append("\r\n");
        for (Map.Entry<String, String> e : res.headers().entrySet()) {
            head.append(e.getKey()).append(": ").append(e.getValue()).append("\r\n");
        }
        head.append("\r\n");

        out.write(head.toString().getBytes(StandardCharsets.ISO_8859_1));
        if (!headOnly) {
            out.write(res.body());
        }
        out.flush();
    }

    public static void write(OutputStream out, HttpResponseImpl res) throws IOException {
        write(out, res, false);
    }
}
