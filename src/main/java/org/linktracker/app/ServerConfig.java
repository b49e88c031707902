package org.linktracker.app;

import org.linktracker.domain.impl.SnapshotMutations;
import org.linktracker.infrastructure.impl.FirestoreStorageBackend;
import org.linktracker.infrastructure.impl.GistStorageBackend;
import org.linktracker.infrastructure.impl.PersistenceCoordinator;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Locale;
import java.util.function.Function;

/**
 * Runtime settings.
 * <p>
 * Each value is looked up as a system property ({@code -Dlinks.backend=gist}),
 * then as the matching environment variable ({@code LINKS_BACKEND}), then any
 * listed alias ({@code PORT}, {@code GITHUB_TOKEN}, ...), then the default. A
 * port given as the first program argument wins over everything.
 */
public record ServerConfig(int port,
                           String backend,
                           Path dataFile,
                           Path staticDir,
                           int activityRetention,
                           int httpWorkers,
                           long refreshIntervalMs,
                           long staleAfterMs,
                           int writeAttempts,
                           long writeBackoffMs,
                           Duration connectTimeout,
                           Duration requestTimeout,
                           String gistApiUrl,
                           String gistId,
                           String gistFile,
                           String gistToken,
                           String firestoreUrl,
                           String firestoreProject,
                           String firestoreCollection,
                           String firestoreDocument,
                           String firestoreToken) {

    public static final int DEFAULT_PORT = 3000;

    public static ServerConfig fromEnvironment(String[] args) {
        return from(args, System::getProperty, System::getenv);
    }

    static ServerConfig from(String[] args, Function<String, String> props, Function<String, String> env) {
        Lookup l = new Lookup(props, env);

        int port = args != null && args.length > 0
                ? parseInt("port argument", args[0])
                : l.integer("links.port", DEFAULT_PORT, "PORT");

        String staticDir = l.text("links.static.dir", "public");

        return new ServerConfig(
                port,
                l.text("links.backend", "file").toLowerCase(Locale.ROOT),
                Path.of(l.text("links.file", "data.json")),
                staticDir.isBlank() ? null : Path.of(staticDir),
                l.integer("links.activity.retention", SnapshotMutations.DEFAULT_ACTIVITY_RETENTION),
                l.integer("links.http.workers", 16),
                l.longValue("links.refresh.interval.ms", PersistenceCoordinator.DEFAULT_REFRESH_INTERVAL_MS),
                l.longValue("links.refresh.stale.ms", PersistenceCoordinator.DEFAULT_STALE_AFTER_MS),
                l.integer("links.write.attempts", PersistenceCoordinator.DEFAULT_WRITE_ATTEMPTS),
                l.longValue("links.write.backoff.ms", PersistenceCoordinator.DEFAULT_WRITE_BACKOFF_MS),
                Duration.ofMillis(l.longValue("links.http.connect.timeout.ms", 5_000L)),
                Duration.ofMillis(l.longValue("links.http.request.timeout.ms", 10_000L)),
                l.text("links.gist.api", GistStorageBackend.DEFAULT_API_URL),
                l.text("links.gist.id", null, "GIST_ID"),
                l.text("links.gist.file", GistStorageBackend.DEFAULT_FILE_NAME),
                l.text("links.gist.token", null, "GITHUB_TOKEN"),
                l.text("links.firestore.url", FirestoreStorageBackend.DEFAULT_BASE_URL),
                l.text("links.firestore.project", null, "FIRESTORE_PROJECT_ID", "GOOGLE_CLOUD_PROJECT"),
                l.text("links.firestore.collection", FirestoreStorageBackend.DEFAULT_COLLECTION),
                l.text("links.firestore.document", FirestoreStorageBackend.DEFAULT_DOCUMENT),
                l.text("links.firestore.token", null, "FIRESTORE_ACCESS_TOKEN"));
    }

    /** Settings safe to print: tokens are masked. */
    public String describe() {
        return "backend=" + backend
                + ", port=" + port
                + ("file".equals(backend) ? ", file=" + dataFile.toAbsolutePath() : "")
                + ("gist".equals(backend) ? ", gist=" + gistId + "/" + gistFile + ", token=" + mask(gistToken) : "")
                + ("firestore".equals(backend) ? ", firestore=" + firestoreProject + "/" + firestoreCollection
                        + "/" + firestoreDocument + ", token=" + mask(firestoreToken) : "")
                + ", activityRetention=" + activityRetention
                + ", static=" + (staticDir == null ? "off" : staticDir.toAbsolutePath());
    }

    private static String mask(String secret) {
        return secret == null || secret.isBlank() ? "<none>" : "****";
    }

    private static int parseInt(String what, String value) {
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("invalid " + what + ": '" + value + "'", e);
        }
    }

    private static final class Lookup {
        private final Function<String, String> props;
        private final Function<String, String> env;

        Lookup(Function<String, String> props, Function<String, String> env) {
            this.props = props;
            this.env = env;
        }

        String text(String key, String def, String... aliases) {
            String v = props.apply(key);
            if (v == null) v = env.apply(key.toUpperCase(Locale.ROOT).replace('.', '_'));
            for (int i = 0; v == null && i < aliases.length; i++) {
                v = env.apply(aliases[i]);
            }
            return v == null ? def : v.trim();
        }

        int integer(String key, int def, String... aliases) {
            String v = text(key, null, aliases);
            return v == null ? def : parseInt(key, v);
        }

        long longValue(String key, long def) {
            String v = text(key, null);
            if (v == null) return def;
            try {
                return Long.parseLong(v);
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("invalid " + key + ": '" + v + "'", e);
            }
        }
    }
}
