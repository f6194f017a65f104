package com.libragraph.filestore.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.libragraph.filestore.types.FileRecord;

/**
 * Wire form of a {@link FileRecord}. {@code filename} is the storage name clients fetch by.
 */
public record FileDetailsResponse(
        long id,
        String originalFilename,
        String filename,
        String mimetype,
        String dateAdded,
        String authorId,
        long size,
        @JsonProperty("isPrivate") boolean isPrivate
) {

    public static FileDetailsResponse from(FileRecord record) {
        return new FileDetailsResponse(
                record.id(),
                record.originalFilename(),
                record.storageName(),
                record.mimeType(),
                record.dateAdded().toString(),
                record.authorId(),
                record.size(),
                record.isPrivate());
    }
}
