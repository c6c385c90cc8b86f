package com.example.archiveuploader.store;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

/**
 * Object store backed by a directory tree on the local filesystem. Store paths
 * resolve against the root; {@code copies} and headers are accepted and ignored.
 */
public final class LocalDirectoryStore implements ObjectStore {
    private static final Logger LOGGER = LoggerFactory.getLogger(LocalDirectoryStore.class);

    private final Path root;

    public LocalDirectoryStore(Path root) {
        this.root = root.toAbsolutePath().normalize();
    }

    @Override
    public void put(String path, InputStream body, PutOptions options) throws StoreException {
        Path target = resolve(path);
        if (target.equals(root)) {
            throw new StoreException(StoreException.Kind.OTHER, path, "Cannot write an object at the store root");
        }
        Path parent = target.getParent();
        if (!Files.exists(parent, LinkOption.NOFOLLOW_LINKS)) {
            throw new StoreException(StoreException.Kind.DIRECTORY_DOES_NOT_EXIST, path,
                    ObjectStore.parentOf(path) + " does not exist");
        }
        if (!Files.isDirectory(parent, LinkOption.NOFOLLOW_LINKS)) {
            throw new StoreException(StoreException.Kind.PARENT_NOT_DIRECTORY, path,
                    ObjectStore.parentOf(path) + " is not a directory");
        }
        try {
            long written = Files.copy(body, target, StandardCopyOption.REPLACE_EXISTING);
            LOGGER.debug("Wrote {} bytes to {}", written, target);
        } catch (IOException ex) {
            throw new StoreException(StoreException.Kind.OTHER, path, "Failed to write " + target, ex);
        }
    }

    @Override
    public void mkdirp(String path) throws StoreException {
        Path target = resolve(path);
        try {
            Files.createDirectories(target);
        } catch (FileAlreadyExistsException ex) {
            throw new StoreException(StoreException.Kind.OTHER, path, path + " exists and is not a directory", ex);
        } catch (IOException ex) {
            throw new StoreException(StoreException.Kind.OTHER, path, "Failed to create " + target, ex);
        }
    }

    private Path resolve(String path) throws StoreException {
        String relative = path.replaceAll("^/+", "");
        Path resolved = root.resolve(relative).normalize();
        if (!resolved.startsWith(root)) {
            throw new StoreException(StoreException.Kind.OTHER, path, path + " is outside the store root");
        }
        return resolved;
    }
}
