package org.linktracker.api.interfaces.http;

/** Minimal request contract */
public interface HttpRequest {
    String method();
    String path();      // without query string

    String version();
    String header(String name);
    byte[] body();
}
