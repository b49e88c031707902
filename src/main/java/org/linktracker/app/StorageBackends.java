package org.linktracker.app;

import org.linktracker.infrastructure.impl.FileStorageBackend;
import org.linktracker.infrastructure.impl.FirestoreStorageBackend;
import org.linktracker.infrastructure.impl.GistStorageBackend;
import org.linktracker.infrastructure.interfaces.IStorageBackend;

/** Picks the backend named by {@code links.backend}. */
final class StorageBackends {

    private StorageBackends() {}

    static IStorageBackend create(ServerConfig cfg) {
        return switch (cfg.backend()) {
            case "file" -> new FileStorageBackend(cfg.dataFile());
            case "gist" -> new GistStorageBackend(cfg.gistApiUrl(), cfg.gistId(), cfg.gistFile(),
                    cfg.gistToken(), cfg.connectTimeout(), cfg.requestTimeout());
            case "firestore" -> new FirestoreStorageBackend(cfg.firestoreUrl(), cfg.firestoreProject(),
                    cfg.firestoreCollection(), cfg.firestoreDocument(), cfg.firestoreToken(),
                    cfg.connectTimeout(), cfg.requestTimeout());
            default -> throw new IllegalArgumentException("unknown backend '" + cfg.backend()
                    + "', expected file, gist or firestore");
        };
    }
}
