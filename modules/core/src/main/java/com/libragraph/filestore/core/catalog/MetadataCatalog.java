package com.libragraph.filestore.core.catalog;

import com.libragraph.filestore.types.DeleteOutcome;
import com.libragraph.filestore.types.FilePage;
import com.libragraph.filestore.types.FileRecord;
import com.libragraph.filestore.types.NewFileRecord;
import com.libragraph.filestore.types.SortOrder;
import io.smallrye.mutiny.Uni;

import java.util.List;
import java.util.Map;

/**
 * Owns the lifecycle of {@link FileRecord}s. Implementations are selected with
 * the {@code filestore.catalog.type} build property.
 */
public interface MetadataCatalog {

    String NOT_IN_CATALOG = "File Does Not Exist In Database";

    /**
     * Assigns ids and persists the batch, all-or-nothing. Records are returned in input order.
     *
     * @throws CatalogException if the batch cannot be stored
     */
    Uni<List<FileRecord>> insert(List<NewFileRecord> records);

    /**
     * Returns one page of records, ascending by {@code sortBy} with ties broken by id.
     * Pages past the end are empty with {@code morePages = false}.
     *
     * @param page 1-indexed
     * @throws IllegalArgumentException if {@code page} or {@code pageSize} is below 1
     */
    Uni<FilePage> list(int page, int pageSize, SortOrder sortBy);

    /**
     * @throws RecordNotFoundException if no record has this storage name
     */
    Uni<FileRecord> findByStorageName(String storageName);

    /**
     * Deletes each name independently. Every requested name appears in the result;
     * a name with no record maps to a failed outcome carrying {@link #NOT_IN_CATALOG}.
     */
    Uni<Map<String, DeleteOutcome>> deleteByStorageNames(List<String> storageNames);

    static void checkPaging(int page, int pageSize) {
        if (page < 1) {
            throw new IllegalArgumentException("page must be >= 1, got " + page);
        }
        if (pageSize < 1) {
            throw new IllegalArgumentException("pageSize must be >= 1, got " + pageSize);
        }
    }
}
