package org.linktracker.domain.interfaces;

import org.linktracker.domain.model.Mutation;
import org.linktracker.domain.model.Snapshot;

/**
 * Pure function from the current Snapshot to the next one.
 * May be applied more than once for one request (after a write conflict), so it
 * must not have side effects.
 */
@FunctionalInterface
public interface SnapshotTransform<T> {
    Mutation<T> apply(Snapshot current);
}
