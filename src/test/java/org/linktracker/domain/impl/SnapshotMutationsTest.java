package org.linktracker.domain.impl;

import org.linktracker.domain.errors.LinkNotFoundException;
import org.linktracker.domain.model.Activity;
import org.linktracker.domain.model.ActivityType;
import org.linktracker.domain.model.Link;
import org.linktracker.domain.model.LinkDraft;
import org.linktracker.domain.model.Mutation;
import org.linktracker.domain.model.Snapshot;
import org.linktracker.testing.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

import static org.junit.jupiter.api.Assertions.*;

class SnapshotMutationsTest {

    private MutableClock clock;
    private SnapshotMutations mutations;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(1_700_000_000_000L);
        AtomicInteger seq = new AtomicInteger();
        Supplier<String> ids = () -> "id" + seq.incrementAndGet();
        mutations = new SnapshotMutations(50, clock, ids);
    }

    private Snapshot add(Snapshot s, String name) {
        return mutations.addLink(new LinkDraft(name, "http://" + name, null, "ref")).apply(s).next();
    }

    @Test
    void addPrependsLinkWithZeroClicksAndOneAddedActivity() {
        Snapshot s1 = add(Snapshot.empty(), "First");
        Mutation<Link> m = mutations.addLink(new LinkDraft("Docs", "http://x", "", "ref")).apply(s1);

        Link docs = m.value();
        assertNotNull(docs.id());
        assertEquals(0, docs.clicks());
        assertEquals(clock.instant(), docs.createdAt());
        assertNull(docs.updatedAt());

        assertEquals(docs, m.next().links().get(0), "new link goes first");
        assertEquals("First", m.next().links().get(1).name());

        Activity head = m.next().activities().get(0);
        assertEquals(ActivityType.ADDED, head.type());
        assertEquals("Docs", head.linkName());
        assertEquals(2, m.next().activities().size());
    }

    @Test
    void transformsDoNotTouchTheInputSnapshot() {
        Snapshot s1 = add(Snapshot.empty(), "A");
        String id = s1.links().get(0).id();
        Snapshot before = new Snapshot(s1.links(), s1.activities());

        mutations.clickLink(id).apply(s1);
        mutations.deleteLink(id).apply(s1);

        assertEquals(before, s1);
    }

    @Test
    void retentionCapEvictsOldestActivity() {
        AtomicInteger seq = new AtomicInteger();
        SnapshotMutations capped = new SnapshotMutations(10, clock, () -> "c" + seq.incrementAndGet());
        Snapshot s = Snapshot.empty();
        for (int i = 0; i < 12; i++) {
            clock.advance(1000);
            s = capped.addLink(new LinkDraft("L" + i, "http://l" + i, "", "")).apply(s).next();
        }
        assertEquals(10, s.activities().size());
        assertEquals("L11", s.activities().get(0).linkName(), "newest first");
        assertEquals("L2", s.activities().get(9).linkName(), "L0 and L1 evicted");
        assertEquals(12, s.links().size(), "links are not capped");
    }

    @Test
    void defaultCapIsFifty() {
        Snapshot s = Snapshot.empty();
        for (int i = 0; i < 60; i++) {
            s = add(s, "L" + i);
        }
        assertEquals(SnapshotMutations.DEFAULT_ACTIVITY_RETENTION, s.activities().size());
        assertEquals("L10", s.activities().get(49).linkName());
    }

    @Test
    void clickingNTimesCountsNAndLogsNClickedEntries() {
        Snapshot s = add(Snapshot.empty(), "Docs");
        String id = s.links().get(0).id();
        int last = -1;
        for (int i = 0; i < 7; i++) {
            Mutation<Integer> m = mutations.clickLink(id).apply(s);
            s = m.next();
            last = m.value();
        }
        assertEquals(7, last);
        assertEquals(7, s.findLink(id).orElseThrow().clicks());
        assertEquals(7, s.activities().stream().filter(a -> a.type() == ActivityType.CLICKED).count());
    }

    @Test
    void updateReplacesDetailsButKeepsIdentityAndClicks() {
        Snapshot s = add(Snapshot.empty(), "Old");
        Link original = s.links().get(0);
        s = mutations.clickLink(original.id()).apply(s).next();

        clock.advance(5_000);
        Mutation<Link> m = mutations.updateLink(original.id(), new LinkDraft("New", "http://new", "d", "c")).apply(s);
        Link updated = m.value();

        assertEquals(original.id(), updated.id());
        assertEquals(1, updated.clicks());
        assertEquals(original.createdAt(), updated.createdAt());
        assertEquals(Instant.ofEpochMilli(clock.millis()), updated.updatedAt());
        assertEquals("New", updated.name());
        assertEquals("http://new", updated.url());
        assertEquals(ActivityType.EDITED, m.next().activities().get(0).type());
        assertEquals("New", m.next().activities().get(0).linkName());
    }

    @Test
    void deleteRemovesLinkAndLogsItsName() {
        Snapshot s = add(add(Snapshot.empty(), "Keep"), "Drop");
        String dropId = s.links().get(0).id();

        Mutation<Link> m = mutations.deleteLink(dropId).apply(s);

        assertEquals("Drop", m.value().name());
        assertEquals(1, m.next().links().size());
        assertTrue(m.next().findLink(dropId).isEmpty());
        assertEquals(ActivityType.DELETED, m.next().activities().get(0).type());
        assertEquals("Drop", m.next().activities().get(0).linkName());
    }

    @Test
    void unknownIdIsRejectedForUpdateDeleteAndClick() {
        Snapshot s = add(Snapshot.empty(), "A");
        LinkDraft draft = new LinkDraft("n", "u", "", "");

        assertThrows(LinkNotFoundException.class, () -> mutations.updateLink("nope", draft).apply(s));
        assertThrows(LinkNotFoundException.class, () -> mutations.deleteLink("nope").apply(s));
        LinkNotFoundException e = assertThrows(LinkNotFoundException.class,
                () -> mutations.clickLink("nope").apply(s));
        assertEquals("nope", e.linkId());
    }

    @Test
    void retentionBelowOneIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> new SnapshotMutations(0, clock, () -> "x"));
    }
}
