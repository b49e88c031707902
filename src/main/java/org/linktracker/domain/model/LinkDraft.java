package org.linktracker.domain.model;

/**
 * Editable fields of a link as sent by a client on create and update.
 * Only {@code name} and {@code url} are required.
 */
public record LinkDraft(String name, String url, String description, String category) {

    public LinkDraft {
        description = description == null ? "" : description;
        category = category == null ? "" : category;
    }
}
