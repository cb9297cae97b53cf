package com.meteoharvest.service.store;

import com.meteoharvest.ingest.api.BlobStore;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.logging.Logger;

/**
 * Local blob store laid out as {@code root/container/path}. Each upload goes to a sibling temp file
 * first and is then moved over the target, so readers see either the old or the new object.
 */
public class FileSystemBlobStore implements BlobStore {
    private static final Logger LOGGER = Logger.getLogger(FileSystemBlobStore.class.getName());

    private final Path root;

    public FileSystemBlobStore(Path root) {
        this.root = root.toAbsolutePath().normalize();
    }

    @Override
    public void upload(String container, String path, byte[] payload) throws IOException {
        Path target = resolve(container, path);
        Files.createDirectories(target.getParent());
        Path temp = Files.createTempFile(target.getParent(), "." + target.getFileName(), ".tmp");
        try {
            Files.write(temp, payload);
            try {
                Files.move(temp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException e) {
                LOGGER.fine(() -> "sink.filesystem atomic move unsupported for " + target + ", replacing");
                Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
            }
        } finally {
            Files.deleteIfExists(temp);
        }
    }

    Path resolve(String container, String path) throws IOException {
        if (container == null || container.isBlank() || path == null || path.isBlank()) {
            throw new IOException("Container and path are required");
        }
        Path containerDir = root.resolve(container).normalize();
        if (!containerDir.getParent().equals(root)) {
            throw new IOException("Invalid container name: " + container);
        }
        Path relative = Path.of(path);
        if (relative.isAbsolute()) {
            throw new IOException("Blob path must be relative: " + path);
        }
        Path target = containerDir.resolve(relative).normalize();
        if (!target.startsWith(containerDir) || target.equals(containerDir)) {
            throw new IOException("Blob path escapes container " + container + ": " + path);
        }
        return target;
    }
}
