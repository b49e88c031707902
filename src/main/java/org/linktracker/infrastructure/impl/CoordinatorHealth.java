package org.linktracker.infrastructure.impl;

import java.time.Instant;

/**
 * Point-in-time view of the coordinator for {@code GET /health}.
 *
 * @param status         "ok", or "degraded" when the last backend call failed or
 *                       the cache was never loaded
 * @param cacheAgeMs     milliseconds since the cache last matched the backend, -1 if never
 * @param writeInFlight  whether a save currently holds the write gate
 * @param lastError      message of the most recent backend failure, cleared by the next success
 */
public record CoordinatorHealth(String status,
                                String backend,
                                int links,
                                int activities,
                                Instant lastRefreshedAt,
                                long cacheAgeMs,
                                boolean stale,
                                boolean writeInFlight,
                                String lastError,
                                long commits) {
}
