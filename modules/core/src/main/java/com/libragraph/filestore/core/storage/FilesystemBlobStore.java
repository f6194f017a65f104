package com.libragraph.filestore.core.storage;

import com.libragraph.filestore.util.StorageNames;
import io.quarkus.arc.properties.IfBuildProperty;
import io.smallrye.mutiny.Uni;
import jakarta.enterprise.context.ApplicationScoped;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Filesystem-backed BlobStore.
 *
 * <p>Layout: {@code {root}/{storageName}}, flat.
 * Names that are not already safe path segments are treated as absent.
 */
@ApplicationScoped
@IfBuildProperty(name = "filestore.blob-store.type", stringValue = "filesystem", enableIfMissing = true)
public class FilesystemBlobStore implements BlobStore {

    private static final Logger log = Logger.getLogger(FilesystemBlobStore.class);

    @ConfigProperty(name = "filestore.storage-dir", defaultValue = "./files")
    String root;

    private Path resolvePath(String storageName) {
        return Path.of(root, storageName);
    }

    @Override
    public Uni<Void> commit(Path stagedPath, String storageName) {
        return Uni.createFrom().voidItem().invoke(() -> {
            if (!StorageNames.isSafeSegment(storageName)) {
                throw new StorageException("Invalid storage name: " + storageName);
            }
            Path target = resolvePath(storageName);
            try {
                try {
                    // link creation fails if the name is taken, so a blob is never replaced
                    Files.createLink(target, stagedPath);
                } catch (FileAlreadyExistsException e) {
                    throw e;
                } catch (IOException | UnsupportedOperationException e) {
                    // staging dir on another filesystem
                    copyNew(stagedPath, target);
                }
            } catch (FileAlreadyExistsException e) {
                throw new BlobAlreadyExistsException(storageName);
            } catch (IOException e) {
                throw new StorageException("Failed to commit blob: " + storageName, e);
            }
            try {
                Files.deleteIfExists(stagedPath);
            } catch (IOException e) {
                // the blob is committed; the staging sweep removes the leftover
                log.warnf("Committed %s but could not remove staged file %s: %s",
                        storageName, stagedPath, e.getMessage());
            }
        });
    }

    private static void copyNew(Path source, Path target) throws IOException {
        try {
            // without REPLACE_EXISTING the target is created exclusively
            Files.copy(source, target);
        } catch (FileAlreadyExistsException e) {
            throw e;
        } catch (IOException e) {
            Files.deleteIfExists(target);
            throw e;
        }
    }

    @Override
    public Uni<Boolean> exists(String storageName) {
        return Uni.createFrom().item(() ->
                StorageNames.isSafeSegment(storageName)
                        && Files.isRegularFile(resolvePath(storageName)));
    }

    @Override
    public Uni<InputStream> read(String storageName) {
        return Uni.createFrom().item(() -> {
            if (!StorageNames.isSafeSegment(storageName)) {
                throw new BlobNotFoundException(storageName);
            }
            Path path = resolvePath(storageName);
            if (!Files.isRegularFile(path)) {
                throw new BlobNotFoundException(storageName);
            }
            try {
                return Files.newInputStream(path);
            } catch (IOException e) {
                throw new StorageException("Failed to read blob: " + storageName, e);
            }
        });
    }

    @Override
    public Uni<Void> delete(String storageName) {
        return Uni.createFrom().voidItem().invoke(() -> {
            if (!StorageNames.isSafeSegment(storageName)) {
                throw new BlobNotFoundException(storageName);
            }
            try {
                if (!Files.deleteIfExists(resolvePath(storageName))) {
                    throw new BlobNotFoundException(storageName);
                }
            } catch (IOException e) {
                throw new StorageException("Failed to delete blob: " + storageName, e);
            }
        });
    }

    @Override
    public Uni<Void> verifyAvailable() {
        return Uni.createFrom().voidItem().invoke(() -> {
            if (!Files.isDirectory(Path.of(root))) {
                throw new StorageException("Storage root is not a directory: " + root);
            }
        });
    }
}
