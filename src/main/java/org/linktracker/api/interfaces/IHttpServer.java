package org.linktracker.api.interfaces;

/*
AutoCloseable so tests and the shutdown hook can stop the server with try-with-resources
 */
public interface IHttpServer extends AutoCloseable {
    void start(int port) throws Exception;
    /** Actual listening port; differs from the requested one when started on port 0. */
    int port();
    @Override void close() throws Exception;
}
