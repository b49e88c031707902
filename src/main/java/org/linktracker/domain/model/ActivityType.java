package org.linktracker.domain.model;

import com.google.gson.annotations.SerializedName;

/** Kinds of mutation recorded in the activity log. Lower-case on the wire. */
public enum ActivityType {
    @SerializedName("added")
    ADDED,
    @SerializedName("edited")
    EDITED,
    @SerializedName("deleted")
    DELETED,
    @SerializedName("clicked")
    CLICKED
}
