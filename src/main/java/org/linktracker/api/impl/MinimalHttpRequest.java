package org.linktracker.api.impl;

import org.linktracker.api.interfaces.http.HttpRequest;

import java.util.Locale;
import java.util.Map;

/**
 * Parsed request as read off the socket. The request target is split into
 * path and query; the query is kept raw since no route uses it.
 */
public final class MinimalHttpRequest implements HttpRequest {
    private final String method;
    private final String path;
    private final String query;
    private final String version;
    private final Map<String,String> headers;   // lower-cased names
    private final byte[] body;

    public MinimalHttpRequest(String method, String target, String version,
                              Map<String,String> headers, byte[] body){
        int q = target.indexOf('?');
        this.method = method.toUpperCase(Locale.ROOT);
        this.path = q < 0 ? target : target.substring(0, q);
        this.query = q < 0 ? "" : target.substring(q + 1);
        this.version = version;
        this.headers = headers;
        this.body = body == null ? new byte[0] : body;
    }

    @Override public String method(){ return method; }
    @Override public String path(){ return path; }
    @Override public String version(){ return version; }

    public String query(){ return query; }

    @Override
    public String header(String name){
        return name == null ? null : headers.get(name.toLowerCase(Locale.ROOT));
    }

    @Override public byte[] body() { return body; }
}
