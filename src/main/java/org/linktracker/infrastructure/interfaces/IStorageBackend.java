package org.linktracker.infrastructure.interfaces;

import org.linktracker.domain.model.Snapshot;
import org.linktracker.infrastructure.errors.BackendUnavailableException;
import org.linktracker.infrastructure.errors.CorruptSnapshotException;
import org.linktracker.infrastructure.errors.StorageException;
import org.linktracker.infrastructure.errors.WriteConflictException;

/**
 * Durable home of the Snapshot.
 * <p>
 * Implementations never hand back a partially populated Snapshot: {@link #load()}
 * either returns a complete document or throws. {@link #save(Snapshot)} returns
 * only after the backend acknowledged the write.
 */
public interface IStorageBackend {

    /** Short name used in logs and health output, e.g. {@code "file"}. */
    String name();

    /**
     * Reads the current Snapshot.
     *
     * @throws BackendUnavailableException network, auth, timeout or I/O failure
     * @throws CorruptSnapshotException    stored content is not a valid document
     */
    Snapshot load() throws StorageException;

    /**
     * Replaces the stored Snapshot.
     *
     * @throws BackendUnavailableException network, auth, timeout or I/O failure
     * @throws WriteConflictException      the backend's revision moved since the last load
     */
    void save(Snapshot snapshot) throws StorageException;

    /** Prepares the backend on startup, e.g. creating an empty document. No-op by default. */
    default void initialize() throws StorageException {
    }
}
