package org.linktracker.api.interfaces;

import org.linktracker.api.interfaces.http.HttpRequest;

public interface IHandlerFactory {
    IHttpHandler create(HttpRequest req);
}
