package org.linktracker.api.impl;

import org.linktracker.api.interfaces.IHandlerFactory;
import org.linktracker.api.interfaces.IHttpHandler;
import org.linktracker.api.interfaces.IHttpServer;
import org.linktracker.domain.errors.InvalidRequestException;

import java.io.BufferedInputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.net.ServerSocket;
import java.net.Socket;
import java.net.SocketException;
import java.net.SocketTimeoutException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Blocking HTTP/1.1 server: one acceptor thread hands each connection to a
 * fixed worker pool; one request per connection.
 * <p>
 * A handler failure becomes a JSON error response and the worker moves on; a
 * broken connection is logged and dropped. Nothing a request does can stop the
 * accept loop.
 */
public final class SocketHttpServer implements IHttpServer {

    static final int SOCKET_READ_TIMEOUT_MS = 15_000;

    private final IHandlerFactory factory;
    private final int workers;

    private volatile boolean running;
    private ServerSocket server;
    private ExecutorService pool;
    private Thread acceptor;

    public SocketHttpServer(IHandlerFactory factory, int workers) {
        this.factory = factory;
        this.workers = Math.max(1, workers);
    }

    @Override
    public synchronized void start(int port) throws IOException {
        if (running) {
            throw new IllegalStateException("server already started on port " + port());
        }
        server = new ServerSocket(port);
        AtomicInteger n = new AtomicInteger();
        pool = Executors.newFixedThreadPool(workers, r -> {
            Thread t = new Thread(r, "http-worker-" + n.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
        running = true;

        acceptor = new Thread(this::acceptLoop, "http-acceptor");
        acceptor.setDaemon(true);
        acceptor.start();
        System.out.println("[Server] listening on port " + server.getLocalPort() + " with " + workers + " workers");
    }

    @Override
    public int port() {
        ServerSocket s = server;
        return s == null ? -1 : s.getLocalPort();
    }

    private void acceptLoop() {
        while (running) {
            Socket client;
            try {
                client = server.accept();
            } catch (IOException e) {
                if (running) {
                    System.err.println("[Server] accept failed: " + e.getMessage());
                    continue;
                }
                return;
            }
            try {
                pool.execute(() -> serve(client));
            } catch (RejectedExecutionException e) {
                closeQuietly(client);
            }
        }
    }

    /** Reads one request, dispatches it and writes the response. */
    void serve(Socket client) {
        long started = System.nanoTime();
        String method = "-";
        String path = "-";
        int status = 0;
        try (client;
             BufferedInputStream in = new BufferedInputStream(client.getInputStream());
             OutputStream out = client.getOutputStream()) {

            client.setSoTimeout(SOCKET_READ_TIMEOUT_MS);
            HttpResponseImpl res = new HttpResponseImpl();
            MinimalHttpRequest req;
            try {
                req = HttpRequestReader.read(in, out);
            } catch (InvalidRequestException e) {
                status = ErrorResponses.apply(res, e);
                HttpResponseWriter.write(out, res);
                return;
            }
            if (req == null) {
                return; // peer opened and closed without a request
            }
            method = req.method();
            path = req.path();

            IHttpHandler handler = factory.create(req);
            try {
                handler.handle(req, res);
            } catch (Exception e) {
                ErrorResponses.apply(res, e);
            }
            status = res.status();
            HttpResponseWriter.write(out, res, "HEAD".equals(method));

        } catch (SocketTimeoutException e) {
            System.err.println("[Server] read timeout for " + method + " " + path);
        } catch (SocketException se) {
            String msg = String.valueOf(se.getMessage()).toLowerCase();
            if (!(msg.contains("connection reset") || msg.contains("broken pipe")
                    || msg.contains("socket closed") || msg.contains("software caused connection abort"))) {
                System.err.println("[Server] socket error: " + se.getMessage());
            }
        } catch (Exception e) {
            System.err.println("[Server] error serving " + method + " " + path + ": " + e);
        } finally {
            if (status != 0) {
                long ms = (System.nanoTime() - started) / 1_000_000L;
                System.out.println("[Server] " + method + " " + path + " -> " + status + " (" + ms + " ms)");
            }
        }
    }

    @Override
    public synchronized void close() throws Exception {
        if (!running) {
            return;
        }
        running = false;
        server.close();
        pool.shutdown();
        if (!pool.awaitTermination(2, TimeUnit.SECONDS)) {
            pool.shutdownNow();
        }
        acceptor.join(1000);
        System.out.println("[Server] stopped");
    }

    private static void closeQuietly(Socket s) {
        try {
            s.close();
        } catch (IOException e) {
            System.err.println("[Server] close failed: " + e.getMessage());
        }
    }
}
