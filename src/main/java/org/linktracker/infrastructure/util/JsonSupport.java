package org.linktracker.infrastructure.util;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;

import java.time.Instant;

/** Shared Gson instances. Both are thread-safe. */
public final class JsonSupport {

    /** Compact output for HTTP bodies. */
    public static final Gson GSON = new GsonBuilder()
            .registerTypeAdapter(Instant.class, new InstantTypeAdapter().nullSafe())
            .disableHtmlEscaping()
            .create();

    /** Pretty-printed output for persisted documents. */
    public static final Gson PRETTY_GSON = GSON.newBuilder()
            .setPrettyPrinting()
            .create();

    private JsonSupport() {}
}
