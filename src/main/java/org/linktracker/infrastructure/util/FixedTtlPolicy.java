package org.linktracker.infrastructure.util;

import org.linktracker.infrastructure.interfaces.ExpiryPolicy;

/**
 * FixedTtlPolicy implements a constant time-to-live staleness rule for the
 * coordinator's cached Snapshot.
 * <p>
 * <b>SonarQube notes:</b>
 * <ul>
 *   <li>Immutable and thread-safe; {@code ttlMs} is final.</li>
 *   <li>Read on every request without synchronization since it holds no mutable state.</li>
 *   <li>Used by {@code PersistenceCoordinator} to decide when a read reloads the backend.</li>
 * </ul>
 */
public final class FixedTtlPolicy implements ExpiryPolicy {

    /** Maximum cache age in milliseconds before a read triggers a reload. */
    private final long ttlMs;

    /**
     * Constructs a fixed TTL policy.
     *
     * @param ttlMs duration in milliseconds before the cache is considered stale
     */
    public FixedTtlPolicy(long ttlMs) {
        this.ttlMs = ttlMs;
    }

    /**
     * Returns the TTL duration in milliseconds.
     *
     * @return TTL in ms
     */
    @Override
    public long ttlMs() {
        return ttlMs;
    }

    /**
     * Determines whether the cache is stale.
     * <p>
     * The cache is stale if:
     * <ul>
     *   <li>{@code lastRefreshedAt == 0L} (never loaded), or</li>
     *   <li>the elapsed time {@code (now - lastRefreshedAt)} exceeds the TTL.</li>
     * </ul>
     *
     * @param lastRefreshedAt time the cache last matched the backend (ms)
     * @param now             current time in milliseconds
     * @return true if stale, false otherwise
     */
    @Override
    public boolean isExpired(long lastRefreshedAt, long now) {
        return lastRefreshedAt == 0L || (now - lastRefreshedAt) > ttlMs;
    }
}
