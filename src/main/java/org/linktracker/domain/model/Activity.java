package org.linktracker.domain.model;

import java.time.Instant;

/** One entry of the activity log. */
public record Activity(String id, ActivityType type, String linkName, Instant timestamp) {
}
