package org.linktracker.app;

import org.linktracker.api.impl.SocketHttpServer;
import org.linktracker.api.impl.handlers.HandlerFactory;
import org.linktracker.api.interfaces.IHttpServer;
import org.linktracker.domain.impl.SnapshotMutations;
import org.linktracker.infrastructure.impl.LinkServiceImpl;
import org.linktracker.infrastructure.impl.PersistenceCoordinator;
import org.linktracker.infrastructure.interfaces.IStorageBackend;
import org.linktracker.infrastructure.util.FixedTtlPolicy;
import org.linktracker.infrastructure.util.IdGenerator;
import org.linktracker.infrastructure.util.SimpleRetryExecutor;

import java.time.Clock;
import java.util.concurrent.CountDownLatch;

/**
 * Wires backend, coordinator, service and HTTP server together and owns their
 * lifecycle. One instance per process in production; tests start their own on
 * port 0.
 */
public final class LinkTrackerServer implements AutoCloseable {

    private final ServerConfig config;
    private final PersistenceCoordinator coordinator;
    private final IHttpServer http;

    public LinkTrackerServer(ServerConfig config) {
        this(config, StorageBackends.create(config));
    }

    public LinkTrackerServer(ServerConfig config, IStorageBackend backend) {
        this.config = config;
        this.coordinator = new PersistenceCoordinator(backend,
                SimpleRetryExecutor.fixed(config.writeAttempts(), config.writeBackoffMs(), backend.name() + " save"),
                new FixedTtlPolicy(config.staleAfterMs()),
                config.refreshIntervalMs(),
                Clock.systemUTC());
        SnapshotMutations mutations = new SnapshotMutations(config.activityRetention(), Clock.systemUTC(),
                new IdGenerator());
        LinkServiceImpl service = new LinkServiceImpl(coordinator, mutations);
        this.http = new SocketHttpServer(
                new HandlerFactory(service, coordinator, config.activityRetention(), config.staticDir()),
                config.httpWorkers());
    }

    /** Loads the initial Snapshot, starts the refresher, then opens the port. */
    public void start() throws Exception {
        coordinator.initialize();
        coordinator.start();
        http.start(config.port());
    }

    public int port() {
        return http.port();
    }

    public PersistenceCoordinator coordinator() {
        return coordinator;
    }

    @Override
    public void close() throws Exception {
        try {
            http.close();
        } finally {
            coordinator.close();
        }
    }

    public static void main(String[] args) throws Exception {
        // keep serving from cache whatever a stray thread throws
        Thread.setDefaultUncaughtExceptionHandler((t, e) ->
                System.err.println("[Server] uncaught exception in " + t.getName() + ": " + e));

        ServerConfig config = ServerConfig.fromEnvironment(args);
        System.out.println("[Server] starting linktracker: " + config.describe());

        LinkTrackerServer server = new LinkTrackerServer(config);
        CountDownLatch stopped = new CountDownLatch(1);
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            try {
                server.close();
            } catch (Exception e) {
                System.err.println("[Server] shutdown error: " + e.getMessage());
            } finally {
                stopped.countDown();
            }
        }, "shutdown"));

        server.start();
        stopped.await();
    }
}
