package com.libragraph.filestore.core.catalog.dao;

import com.libragraph.filestore.types.FileRecord;
import org.jdbi.v3.core.mapper.reflect.ColumnName;

import java.time.Instant;

public record FileRecordRow(
        @ColumnName("id") long id,
        @ColumnName("original_filename") String originalFilename,
        @ColumnName("storage_name") String storageName,
        @ColumnName("mime_type") String mimeType,
        @ColumnName("date_added") Instant dateAdded,
        @ColumnName("author_id") String authorId,
        @ColumnName("size") long size,
        @ColumnName("is_private") boolean isPrivate
) {

    public FileRecord toRecord() {
        return new FileRecord(id, originalFilename, storageName, mimeType,
                dateAdded, authorId, size, isPrivate);
    }
}
