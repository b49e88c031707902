package org.linktracker.domain.model;

import java.time.Instant;

/**
 * One bookmarked link.
 * <p>
 * Immutable; every change produces a new instance so a Snapshot holding the
 * old one is never modified in place. {@code updatedAt} stays {@code null}
 * until the first edit.
 */
public record Link(String id,
                   String name,
                   String url,
                   String description,
                   String category,
                   int clicks,
                   Instant createdAt,
                   Instant updatedAt) {

    /** Copy with the editable fields replaced from {@code draft}. */
    public Link withDetails(LinkDraft draft, Instant now) {
        return new Link(id, draft.name(), draft.url(), draft.description(), draft.category(),
                clicks, createdAt, now);
    }

    /** Copy with the click counter incremented by one. */
    public Link withClick() {
        return new Link(id, name, url, description, category, clicks + 1, createdAt, updatedAt);
    }
}
