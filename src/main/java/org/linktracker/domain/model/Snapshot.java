package org.linktracker.domain.model;

import java.util.List;
import java.util.Optional;

/**
 * Complete persisted state: links (newest first) and the bounded activity log
 * (most recent first).
 * <p>
 * Both lists are unmodifiable copies, so a Snapshot can be shared between
 * threads and is only ever replaced, never edited.
 */
public record Snapshot(List<Link> links, List<Activity> activities) {

    private static final Snapshot EMPTY = new Snapshot(List.of(), List.of());

    public Snapshot {
        links = links == null ? List.of() : List.copyOf(links);
        activities = activities == null ? List.of() : List.copyOf(activities);
    }

    public static Snapshot empty() {
        return EMPTY;
    }

    public Optional<Link> findLink(String id) {
        return links.stream().filter(l -> l.id().equals(id)).findFirst();
    }

    /** @return index of the link with {@code id}, or -1. */
    public int indexOf(String id) {
        for (int i = 0; i < links.size(); i++) {
            if (links.get(i).id().equals(id)) {
                return i;
            }
        }
        return -1;
    }
}
