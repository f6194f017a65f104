package com.libragraph.filestore.types;

import java.time.Instant;
import java.util.Objects;

/**
 * A file record that has not yet been assigned a catalog id.
 */
public record NewFileRecord(
        String originalFilename,
        String storageName,
        String mimeType,
        Instant dateAdded,
        String authorId,
        long size,
        boolean isPrivate
) {

    public NewFileRecord {
        Objects.requireNonNull(originalFilename, "originalFilename");
        Objects.requireNonNull(storageName, "storageName");
        Objects.requireNonNull(dateAdded, "dateAdded");
        Objects.requireNonNull(authorId, "authorId");
        if (size < 0) {
            throw new IllegalArgumentException("size must be >= 0, got " + size);
        }
    }

    public FileRecord withId(long id) {
        return new FileRecord(id, originalFilename, storageName, mimeType,
                dateAdded, authorId, size, isPrivate);
    }
}
