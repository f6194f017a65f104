package com.libragraph.filestore.core.catalog.dao;

import com.libragraph.filestore.types.NewFileRecord;
import org.jdbi.v3.sqlobject.config.RegisterConstructorMapper;
import org.jdbi.v3.sqlobject.customizer.Bind;
import org.jdbi.v3.sqlobject.customizer.BindList;
import org.jdbi.v3.sqlobject.customizer.BindMethods;
import org.jdbi.v3.sqlobject.customizer.Define;
import org.jdbi.v3.sqlobject.statement.SqlQuery;
import org.jdbi.v3.sqlobject.statement.SqlUpdate;

import java.util.List;
import java.util.Optional;

@RegisterConstructorMapper(FileRecordRow.class)
public interface FileRecordDao {

    /** ORDER BY expressions for listing; byte-wise collation keeps name order lexicographic. */
    String ORDER_BY_NAME = "original_filename COLLATE \"C\"";
    String ORDER_BY_DATE = "date_added";

    @SqlUpdate("CREATE TABLE IF NOT EXISTS file_record (" +
            "id BIGSERIAL PRIMARY KEY, " +
            "original_filename TEXT NOT NULL, " +
            "storage_name VARCHAR(64) NOT NULL UNIQUE, " +
            "mime_type TEXT, " +
            "date_added TIMESTAMPTZ NOT NULL, " +
            "author_id TEXT NOT NULL, " +
            "size BIGINT NOT NULL CHECK (size >= 0), " +
            "is_private BOOLEAN NOT NULL DEFAULT TRUE)")
    void createTable();

    @SqlUpdate("CREATE INDEX IF NOT EXISTS file_record_original_filename_idx " +
            "ON file_record (original_filename COLLATE \"C\", id)")
    void createOriginalFilenameIndex();

    @SqlUpdate("CREATE INDEX IF NOT EXISTS file_record_date_added_idx ON file_record (date_added, id)")
    void createDateAddedIndex();

    /**
     * Creates the table and listing indexes if they are missing.
     */
    default void createSchema() {
        createTable();
        createOriginalFilenameIndex();
        createDateAddedIndex();
    }

    @SqlQuery("INSERT INTO file_record " +
            "(original_filename, storage_name, mime_type, date_added, author_id, size, is_private) " +
            "VALUES (:originalFilename, :storageName, :mimeType, :dateAdded, :authorId, :size, :isPrivate) " +
            "RETURNING *")
    FileRecordRow insert(@BindMethods NewFileRecord record);

    @SqlQuery("SELECT * FROM file_record ORDER BY <orderBy>, id LIMIT :limit OFFSET :offset")
    List<FileRecordRow> page(@Define("orderBy") String orderBy,
                             @Bind("limit") long limit,
                             @Bind("offset") long offset);

    @SqlQuery("SELECT * FROM file_record WHERE storage_name = :storageName")
    Optional<FileRecordRow> findByStorageName(@Bind("storageName") String storageName);

    @SqlQuery("DELETE FROM file_record WHERE storage_name IN (<storageNames>) RETURNING *")
    List<FileRecordRow> deleteByStorageNames(@BindList("storageNames") List<String> storageNames);
}
