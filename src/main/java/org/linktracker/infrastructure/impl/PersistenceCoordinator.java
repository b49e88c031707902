package org.linktracker.infrastructure.impl;

import org.linktracker.domain.interfaces.SnapshotTransform;
import org.linktracker.domain.model.Mutation;
import org.linktracker.domain.model.Snapshot;
import org.linktracker.infrastructure.errors.BackendUnavailableException;
import org.linktracker.infrastructure.errors.CorruptSnapshotException;
import org.linktracker.infrastructure.errors.PersistenceException;
import org.linktracker.infrastructure.errors.StorageException;
import org.linktracker.infrastructure.errors.WriteConflictException;
import org.linktracker.infrastructure.interfaces.ExpiryPolicy;
import org.linktracker.infrastructure.interfaces.IStorageBackend;
import org.linktracker.infrastructure.interfaces.RetryExecutor;
import org.linktracker.infrastructure.util.FixedTtlPolicy;
import org.linktracker.infrastructure.util.SimpleRetryExecutor;

import java.time.Clock;
import java.time.Instant;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.UnaryOperator;

/**
 * PersistenceCoordinator owns the cached Snapshot and is the only path to the
 * storage backend.
 * <p>
 * <b>Writes</b> are serialized by a single write gate: a caller blocks until no
 * other save is in flight, then applies its transform to the latest committed
 * Snapshot, saves the result and commits it to the cache only after the backend
 * acknowledged it. Unavailable and conflict failures are retried (3 attempts,
 * 100 ms apart by default); a conflict, or a cache that was never loaded, makes
 * the next attempt re-read the backend before re-applying the transform. When
 * the budget runs out a {@link PersistenceException} is thrown and the cache is
 * left exactly as it was.
 * <p>
 * <b>Reads</b> never wait for the gate. A stale cache is reloaded inline only if
 * the gate is free at that moment; any load failure keeps the last good Snapshot.
 * <p>
 * <b>Background refresh</b> runs on its own thread every {@code refreshIntervalMs}
 * and is skipped while a write holds the gate.
 */
public final class PersistenceCoordinator implements AutoCloseable {

    public static final long DEFAULT_REFRESH_INTERVAL_MS = 5 * 60_000L;
    public static final long DEFAULT_STALE_AFTER_MS = 4 * 60_000L;
    public static final int DEFAULT_WRITE_ATTEMPTS = 3;
    public static final long DEFAULT_WRITE_BACKOFF_MS = 100L;

    /** Minimum gap between two inline reloads after a failed one. */
    static final long FAILED_REFRESH_BACKOFF_MS = 5_000L;

    private final IStorageBackend backend;
    private final RetryExecutor retry;
    private final ExpiryPolicy staleness;
    private final long refreshIntervalMs;
    private final Clock clock;

    private final ReentrantLock writeGate = new ReentrantLock();
    private final AtomicLong commits = new AtomicLong();

    private volatile Snapshot cache = Snapshot.empty();
    private volatile long lastRefreshedAt = 0L;
    private volatile long lastFailedRefreshAt = 0L;
    private volatile boolean hydrated = false;
    private volatile String lastError = null;

    private ScheduledExecutorService refresher;

    public PersistenceCoordinator(IStorageBackend backend) {
        this(backend,
                SimpleRetryExecutor.fixed(DEFAULT_WRITE_ATTEMPTS, DEFAULT_WRITE_BACKOFF_MS, "save"),
                new FixedTtlPolicy(DEFAULT_STALE_AFTER_MS),
                DEFAULT_REFRESH_INTERVAL_MS,
                Clock.systemUTC());
    }

    public PersistenceCoordinator(IStorageBackend backend,
                                  RetryExecutor retry,
                                  ExpiryPolicy staleness,
                                  long refreshIntervalMs,
                                  Clock clock) {
        this.backend = backend;
        this.retry = retry;
        this.staleness = staleness;
        this.refreshIntervalMs = refreshIntervalMs;
        this.clock = clock;
    }

    /* ============================ lifecycle ============================ */

    /**
     * Prepares the backend and loads the initial Snapshot. Never throws for
     * backend trouble: corrupt content starts empty, an unreachable backend starts
     * empty but unhydrated so the first write re-reads before saving.
     */
    public void initialize() {
        try {
            backend.initialize();
        } catch (StorageException e) {
            recordFailure("initialize", e);
        }

        try {
            commitLoaded(backend.load());
            System.out.println("[Coordinator] loaded snapshot from " + backend.name() + ": "
                    + cache.links().size() + " link(s), " + cache.activities().size() + " activity entries");
        } catch (CorruptSnapshotException e) {
            System.err.println("[Coordinator] stored snapshot is corrupt, starting empty: " + e.getMessage());
            commitLoaded(Snapshot.empty());
        } catch (StorageException | RuntimeException e) {
            recordFailure("initial load", e);
            lastFailedRefreshAt = clock.millis();
        }
    }

    /** Starts the periodic background refresh. Idempotent. */
    public synchronized void start() {
        if (refresher != null || refreshIntervalMs <= 0) {
            return;
        }
        refresher = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "snapshot-refresher");
            t.setDaemon(true);
            return t;
        });
        refresher.scheduleWithFixedDelay(this::refresh,
                refreshIntervalMs, refreshIntervalMs, TimeUnit.MILLISECONDS);
    }

    @Override
    public synchronized void close() {
        if (refresher != null) {
            refresher.shutdownNow();
            refresher = null;
        }
    }

    /* ============================== reads ============================== */

    /**
     * Returns the committed Snapshot, reloading it first when stale and no write
     * is in flight. Backend failures fall back to the cached copy.
     */
    public Snapshot read() {
        long now = clock.millis();
        if (staleness.isExpired(lastRefreshedAt, now)
                && now - lastFailedRefreshAt > FAILED_REFRESH_BACKOFF_MS) {
            refresh();
        }
        return cache;
    }

    /**
     * Reloads the cache from the backend unless a write holds the gate.
     *
     * @return true if the cache was replaced
     */
    public boolean refresh() {
        if (!writeGate.tryLock()) {
            System.out.println("[Coordinator] refresh skipped, write in flight");
            return false;
        }
        try {
            commitLoaded(backend.load());
            return true;
        } catch (StorageException | RuntimeException e) {
            // keep serving the last good snapshot
            recordFailure("refresh", e);
            lastFailedRefreshAt = clock.millis();
            return false;
        } finally {
            writeGate.unlock();
        }
    }

    /* ============================== writes ============================= */

    /**
     * Applies {@code transform} and persists the result; see the class comment for
     * the locking and retry rules. Exceptions thrown by the transform itself (for
     * example an unknown link id) are rethrown as-is and never retried.
     *
     * @return the transform's value, once the new Snapshot is committed
     * @throws PersistenceException if the backend did not accept the write within the retry budget
     */
    public <T> T mutate(SnapshotTransform<T> transform) {
        writeGate.lock();
        try {
            AtomicInteger attempts = new AtomicInteger();
            AtomicBoolean reloadFirst = new AtomicBoolean(!hydrated);
            try {
                return retry.execute(() -> attemptWrite(transform, attempts.incrementAndGet(), reloadFirst),
                        PersistenceCoordinator::isRetryable);
            } catch (RuntimeException e) {
                throw e;
            } catch (Exception e) {
                System.err.println("[Coordinator] write failed after " + attempts.get()
                        + " attempt(s), cache unchanged: " + e.getMessage());
                throw new PersistenceException("write failed after " + attempts.get()
                        + " attempt(s): " + e.getMessage(), attempts.get(), e);
            }
        } finally {
            writeGate.unlock();
        }
    }

    /** Convenience form for transforms that only produce the next Snapshot. */
    public Snapshot mutateSnapshot(UnaryOperator<Snapshot> fn) {
        return mutate(current -> {
            Snapshot next = fn.apply(current);
            return new Mutation<>(next, next);
        });
    }

    /** Read-latest, apply, write, commit. Runs with the write gate held. */
    private <T> T attemptWrite(SnapshotTransform<T> transform, int attempt, AtomicBoolean reloadFirst)
            throws StorageException {
        Snapshot base = reloadFirst.get() ? loadLatest(attempt) : cache;
        reloadFirst.set(false);

        Mutation<T> mutation = transform.apply(base);

        try {
            backend.save(mutation.next());
        } catch (WriteConflictException e) {
            reloadFirst.set(true);
            recordFailure("save attempt " + attempt, e);
            throw e;
        } catch (StorageException e) {
            recordFailure("save attempt " + attempt, e);
            throw e;
        }

        cache = mutation.next();
        lastRefreshedAt = clock.millis();
        hydrated = true;
        lastError = null;
        commits.incrementAndGet();
        return mutation.value();
    }

    /** Fresh read for a write; corrupt content counts as empty so a write can repair it. */
    private Snapshot loadLatest(int attempt) throws StorageException {
        try {
            return backend.load();
        } catch (CorruptSnapshotException e) {
            System.err.println("[Coordinator] stored snapshot is corrupt, writing over it: " + e.getMessage());
            return Snapshot.empty();
        } catch (StorageException e) {
            recordFailure("reload before write attempt " + attempt, e);
            throw new BackendUnavailableException("reload failed: " + e.getMessage(), e);
        }
    }

    private static boolean isRetryable(Exception e) {
        return e instanceof BackendUnavailableException || e instanceof WriteConflictException;
    }

    /* ============================== health ============================= */

    public CoordinatorHealth health() {
        long now = clock.millis();
        Snapshot s = cache;
        long refreshedAt = lastRefreshedAt;
        String error = lastError;
        return new CoordinatorHealth(
                (error == null && hydrated) ? "ok" : "degraded",
                backend.name(),
                s.links().size(),
                s.activities().size(),
                refreshedAt == 0L ? null : Instant.ofEpochMilli(refreshedAt),
                refreshedAt == 0L ? -1L : now - refreshedAt,
                staleness.isExpired(refreshedAt, now),
                writeGate.isLocked(),
                error,
                commits.get());
    }

    /** Cached Snapshot without any staleness check. */
    public Snapshot cached() {
        return cache;
    }

    /* ============================== helpers ============================ */

    private void commitLoaded(Snapshot loaded) {
        cache = loaded;
        lastRefreshedAt = clock.millis();
        hydrated = true;
        lastError = null;
    }

    private void recordFailure(String operation, Exception e) {
        lastError = operation + ": " + e.getMessage();
        System.err.println("[Coordinator] " + backend.name() + " " + operation + " failed: " + e.getMessage());
    }
}
