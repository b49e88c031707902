package org.linktracker.infrastructure.impl;

import org.linktracker.domain.model.Snapshot;
import org.linktracker.infrastructure.errors.BackendUnavailableException;
import org.linktracker.infrastructure.errors.StorageException;
import org.linktracker.infrastructure.interfaces.IStorageBackend;
import org.linktracker.infrastructure.util.SnapshotCodec;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;

/**
 * FileStorageBackend keeps the Snapshot in one local JSON file (e.g. {@code data.json}).
 * <p>
 * Writes go to a {@code .tmp} sibling that is forced to disk and then renamed
 * over the target, so a crash leaves either the old or the new document, never a
 * half-written one. A missing file reads as an empty Snapshot.
 * <p>
 * There is no conflict detection; the file is assumed to have one writer process.
 */
public final class FileStorageBackend implements IStorageBackend {

    private final Path file;

    public FileStorageBackend(Path file) {
        this.file = file;
    }

    @Override
    public String name() {
        return "file";
    }

    /** Writes an empty document if the file does not exist yet. */
    @Override
    public void initialize() throws StorageException {
        if (!Files.exists(file)) {
            System.out.println("[FileBackend] creating " + file.toAbsolutePath());
            save(Snapshot.empty());
        }
    }

    @Override
    public Snapshot load() throws StorageException {
        String json;
        try {
            json = Files.readString(file, StandardCharsets.UTF_8);
        } catch (NoSuchFileException e) {
            return Snapshot.empty();
        } catch (IOException e) {
            throw new BackendUnavailableException("cannot read " + file + ": " + e.getMessage(), e);
        }
        return SnapshotCodec.decode(json);
    }

    @Override
    public void save(Snapshot snapshot) throws StorageException {
        byte[] bytes = SnapshotCodec.encode(snapshot).getBytes(StandardCharsets.UTF_8);
        Path tmp = file.resolveSibling(file.getFileName() + ".tmp");
        try {
            Path parent = file.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }

            try (FileChannel ch = FileChannel.open(tmp,
                    StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING, StandardOpenOption.WRITE)) {
                ByteBuffer buf = ByteBuffer.wrap(bytes);
                while (buf.hasRemaining()) {
                    ch.write(buf);
                }
                ch.force(true);
            }

            try {
                Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException e) {
            throw new BackendUnavailableException("cannot write " + file + ": " + e.getMessage(), e);
        }
    }
}
