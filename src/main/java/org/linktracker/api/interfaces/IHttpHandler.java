package org.linktracker.api.interfaces;

import org.linktracker.api.interfaces.http.HttpRequest;
import org.linktracker.api.interfaces.http.HttpResponse;

public interface IHttpHandler {
    void handle(HttpRequest req, HttpResponse res) throws Exception;
}
