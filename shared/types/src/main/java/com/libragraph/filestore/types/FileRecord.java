package com.libragraph.filestore.types;

import java.time.Instant;
import java.util.Objects;

/**
 * Catalog entry describing one committed upload.
 *
 * <p>{@code storageName} is the key of the matching blob; {@code originalFilename}
 * is stored verbatim and carries no uniqueness guarantee.
 */
public record FileRecord(
        long id,
        String originalFilename,
        String storageName,
        String mimeType,
        Instant dateAdded,
        String authorId,
        long size,
        boolean isPrivate
) {

    public FileRecord {
        Objects.requireNonNull(originalFilename, "originalFilename");
        Objects.requireNonNull(storageName, "storageName");
        Objects.requireNonNull(dateAdded, "dateAdded");
        Objects.requireNonNull(authorId, "authorId");
    }
}
