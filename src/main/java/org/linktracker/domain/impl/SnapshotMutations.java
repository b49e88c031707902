package org.linktracker.domain.impl;

import org.linktracker.domain.errors.LinkNotFoundException;
import org.linktracker.domain.interfaces.SnapshotTransform;
import org.linktracker.domain.model.Activity;
import org.linktracker.domain.model.ActivityType;
import org.linktracker.domain.model.Link;
import org.linktracker.domain.model.LinkDraft;
import org.linktracker.domain.model.Mutation;
import org.linktracker.domain.model.Snapshot;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Supplier;

/**
 * Builds the Snapshot transforms behind each link operation.
 * <p>
 * Every transform changes the link list and prepends exactly one activity in the
 * same new Snapshot, then trims the activity log to {@code activityRetention}
 * entries by dropping the oldest (tail) ones. Unknown ids raise
 * {@link LinkNotFoundException} before anything is built.
 */
public final class SnapshotMutations {

    public static final int DEFAULT_ACTIVITY_RETENTION = 50;

    private final int activityRetention;
    private final Clock clock;
    private final Supplier<String> ids;

    public SnapshotMutations(int activityRetention, Clock clock, Supplier<String> ids) {
        if (activityRetention < 1) {
            throw new IllegalArgumentException("activityRetention must be >= 1, got " + activityRetention);
        }
        this.activityRetention = activityRetention;
        this.clock = clock;
        this.ids = ids;
    }

    /** New link at the head of the list, zero clicks. */
    public SnapshotTransform<Link> addLink(LinkDraft draft) {
        return current -> {
            Instant now = clock.instant();
            Link link = new Link(ids.get(), draft.name(), draft.url(), draft.description(),
                    draft.category(), 0, now, null);

            List<Link> links = new ArrayList<>(current.links().size() + 1);
            links.add(link);
            links.addAll(current.links());

            return new Mutation<>(next(current, links, ActivityType.ADDED, draft.name(), now), link);
        };
    }

    /** Replaces the editable fields, keeps id, clicks and createdAt. */
    public SnapshotTransform<Link> updateLink(String id, LinkDraft draft) {
        return current -> {
            int idx = requireIndex(current, id);
            Instant now = clock.instant();
            Link updated = current.links().get(idx).withDetails(draft, now);

            List<Link> links = new ArrayList<>(current.links());
            links.set(idx, updated);

            return new Mutation<>(next(current, links, ActivityType.EDITED, draft.name(), now), updated);
        };
    }

    /** Removes the link; the value is the removed link. */
    public SnapshotTransform<Link> deleteLink(String id) {
        return current -> {
            int idx = requireIndex(current, id);
            Link removed = current.links().get(idx);

            List<Link> links = new ArrayList<>(current.links());
            links.remove(idx);

            return new Mutation<>(next(current, links, ActivityType.DELETED, removed.name(), clock.instant()),
                    removed);
        };
    }

    /** Increments the click counter; the value is the new count. */
    public SnapshotTransform<Integer> clickLink(String id) {
        return current -> {
            int idx = requireIndex(current, id);
            Link clicked = current.links().get(idx).withClick();

            List<Link> links = new ArrayList<>(current.links());
            links.set(idx, clicked);

            return new Mutation<>(next(current, links, ActivityType.CLICKED, clicked.name(), clock.instant()),
                    clicked.clicks());
        };
    }

    /** Prepends one activity and applies the retention cap. */
    List<Activity> appendActivity(List<Activity> log, ActivityType type, String linkName, Instant now) {
        List<Activity> out = new ArrayList<>(Math.min(log.size() + 1, activityRetention));
        out.add(new Activity(ids.get(), type, linkName, now));
        for (Activity a : log) {
            if (out.size() >= activityRetention) break;
            out.add(a);
        }
        return out;
    }

    private Snapshot next(Snapshot current, List<Link> links, ActivityType type, String linkName, Instant now) {
        return new Snapshot(links, appendActivity(current.activities(), type, linkName, now));
    }

    private static int requireIndex(Snapshot snapshot, String id) {
        int idx = snapshot.indexOf(id);
        if (idx < 0) {
            throw new LinkNotFoundException(id);
        }
        return idx;
    }
}
