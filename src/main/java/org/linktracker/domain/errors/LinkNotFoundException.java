package org.linktracker.domain.errors;

/** Raised when an operation names a link id that is not in the current Snapshot. */
public class LinkNotFoundException extends RuntimeException {

    private final String linkId;

    public LinkNotFoundException(String linkId) {
        super("Link not found: " + linkId);
        this.linkId = linkId;
    }

    public String linkId() {
        return linkId;
    }
}
