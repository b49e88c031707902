package org.linktracker.domain.model;

/**
 * Result of a Snapshot transform: the next Snapshot to persist and the value
 * handed back to the caller once it is committed.
 */
public record Mutation<T>(Snapshot next, T value) {
}
