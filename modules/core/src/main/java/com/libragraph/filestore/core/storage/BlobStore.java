package com.libragraph.filestore.core.storage;

import io.smallrye.mutiny.Uni;

import java.io.InputStream;
import java.nio.file.Path;

/**
 * Flat blob storage keyed by storage name. Knows nothing about file metadata.
 *
 * <p>Implementations perform blocking I/O when subscribed; callers decide
 * which executor that happens on.
 */
public interface BlobStore {

    /**
     * Moves a staged file into the store under {@code storageName}.
     * Write-once: an existing blob under the same name is never replaced. The
     * filesystem store enforces this atomically; the S3 store relies on a
     * conditional put, which servers without {@code If-None-Match} support ignore.
     *
     * @throws BlobAlreadyExistsException if the name is taken
     * @throws StorageException on I/O errors
     */
    Uni<Void> commit(Path stagedPath, String storageName);

    /**
     * Checks whether a blob exists.
     */
    Uni<Boolean> exists(String storageName);

    /**
     * Opens a blob for reading. The caller closes the stream.
     *
     * @throws BlobNotFoundException if the blob does not exist
     * @throws StorageException on I/O errors
     */
    Uni<InputStream> read(String storageName);

    /**
     * Deletes a blob.
     *
     * @throws BlobNotFoundException if the blob does not exist
     * @throws StorageException on I/O errors
     */
    Uni<Void> delete(String storageName);

    /**
     * Fails with {@link StorageException} when the store as a whole is unreachable.
     */
    Uni<Void> verifyAvailable();
}
