package org.linktracker.api.impl;

import org.linktracker.domain.errors.InvalidRequestException;

import java.io.BufferedInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Reads one HTTP/1.1 request (request line, headers, Content-Length body) from a
 * connection. Chunked bodies are not supported.
 */
public final class HttpRequestReader {

    static final int MAX_LINE_BYTES = 8 * 1024;
    static final int MAX_BODY_BYTES = 1024 * 1024;

    private HttpRequestReader() {}

    /**
     * @return the request, or null if the peer closed before sending a request line
     * @throws InvalidRequestException on a malformed request line or an oversized body
     */
    public static MinimalHttpRequest read(BufferedInputStream in, OutputStream out) throws IOException {
        String start = readLineAscii(in);   // e.g. "POST /api/links HTTP/1.1"
        if (start == null || start.isEmpty()) {
            return null;
        }
        String[] p = start.split(" ", 3);
        if (p.length < 2 || p[1].isEmpty()) {
            throw new InvalidRequestException("malformed request line");
        }
        String method = p[0];
        String target = p[1];
        String ver    = p.length > 2 ? p[2] : "HTTP/1.1";

        Map<String,String> headers = new LinkedHashMap<>();
        String line;
        while ((line = readLineAscii(in)) != null && !line.isEmpty()) {
            int idx = line.indexOf(':');
            if (idx > 0) {
                headers.put(line.substring(0, idx).trim().toLowerCase(Locale.ROOT), line.substring(idx + 1).trim());
            }
        }

        String expect = headers.get("expect");
        if (expect != null && expect.equalsIgnoreCase("100-continue")) {
            out.write("HTTP/1.1 100 Continue\r\n\r\n".getBytes(StandardCharsets.US_ASCII));
            out.flush();
        }

        int len;
        try { len = Integer.parseInt(headers.getOrDefault("content-length", "0").trim()); }
        catch (NumberFormatException e) { throw new InvalidRequestException("bad Content-Length"); }
        if (len < 0 || len > MAX_BODY_BYTES) {
            throw new InvalidRequestException("body too large or negative: " + len + " bytes");
        }

        byte[] body = in.readNBytes(len);
        return new MinimalHttpRequest(method, target, ver, headers, body);
    }

    private static String readLineAscii(BufferedInputStream in) throws IOException {
        ByteArrayOutputStream buf = new ByteArrayOutputStream(128);
        int prev = -1, b;
        while ((b = in.read()) != -1) {
            if (prev == '\r' && b == '\n') {
                byte[] bytes = buf.toByteArray();
                return new String(bytes, 0, Math.max(0, bytes.length - 1), StandardCharsets.US_ASCII);
            }
            if (buf.size() >= MAX_LINE_BYTES) {
                throw new InvalidRequestException("header line too long");
            }
            buf.write(b);
            prev = b;
        }
        return (buf.size() == 0) ? null : buf.toString(StandardCharsets.US_ASCII);
    }
}
