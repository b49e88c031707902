package org.linktracker.infrastructure.impl;

import org.linktracker.domain.errors.InvalidRequestException;
import org.linktracker.domain.impl.SnapshotMutations;
import org.linktracker.domain.interfaces.ILinkService;
import org.linktracker.domain.model.Activity;
import org.linktracker.domain.model.Link;
import org.linktracker.domain.model.LinkDraft;

import java.util.List;

public class LinkServiceImpl implements ILinkService {

    private final PersistenceCoordinator coordinator;
    private final SnapshotMutations mutations;

    public LinkServiceImpl(PersistenceCoordinator coordinator, SnapshotMutations mutations) {
        this.coordinator = coordinator;
        this.mutations = mutations;
    }

    @Override
    public List<Link> listLinks() {
        return coordinator.read().links();
    }

    @Override
    public Link addLink(LinkDraft draft) {
        requireFields(draft);
        return coordinator.mutate(mutations.addLink(draft));
    }

    @Override
    public Link updateLink(String id, LinkDraft draft) {
        requireFields(draft);
        return coordinator.mutate(mutations.updateLink(id, draft));
    }

    @Override
    public Link deleteLink(String id) {
        return coordinator.mutate(mutations.deleteLink(id));
    }

    @Override
    public int click(String id) {
        return coordinator.mutate(mutations.clickLink(id));
    }

    @Override
    public List<Activity> activities() {
        return coordinator.read().activities();
    }

    private static void requireFields(LinkDraft draft) {
        if (draft == null) {
            throw new InvalidRequestException("request body is required");
        }
        if (draft.name() == null || draft.name().isBlank()) {
            throw new InvalidRequestException("name is required");
        }
        if (draft.url() == null || draft.url().isBlank()) {
            throw new InvalidRequestException("url is required");
        }
    }
}
