package com.libragraph.filestore.core.catalog;

import com.libragraph.filestore.core.catalog.dao.FileRecordDao;
import com.libragraph.filestore.core.catalog.dao.FileRecordRow;
import com.libragraph.filestore.types.DeleteOutcome;
import com.libragraph.filestore.types.FilePage;
import com.libragraph.filestore.types.FileRecord;
import com.libragraph.filestore.types.NewFileRecord;
import com.libragraph.filestore.types.SortOrder;
import io.quarkus.arc.properties.IfBuildProperty;
import io.smallrye.mutiny.Uni;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.inject.Named;
import org.jdbi.v3.core.Jdbi;
import org.jboss.logging.Logger;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.function.Supplier;

/**
 * PostgreSQL-backed catalog. Concurrency control is left to the database:
 * the unique {@code storage_name} constraint and one transaction per batch insert.
 */
@ApplicationScoped
@IfBuildProperty(name = "filestore.catalog.type", stringValue = "postgres")
public class JdbiMetadataCatalog implements MetadataCatalog {

    private static final Logger log = Logger.getLogger(JdbiMetadataCatalog.class);

    @Inject
    Jdbi jdbi;

    @Inject
    @Named("ioExecutor")
    ExecutorService executor;

    @Override
    public Uni<List<FileRecord>> insert(List<NewFileRecord> records) {
        if (records.isEmpty()) {
            return Uni.createFrom().item(List.of());
        }
        return blocking("insert file records", () -> jdbi.inTransaction(h -> {
            FileRecordDao dao = h.attach(FileRecordDao.class);
            List<FileRecord> inserted = new ArrayList<>(records.size());
            for (NewFileRecord r : records) {
                inserted.add(dao.insert(r).toRecord());
            }
            log.debugf("Inserted %d file records", inserted.size());
            return inserted;
        }));
    }

    @Override
    public Uni<FilePage> list(int page, int pageSize, SortOrder sortBy) {
        String orderBy = sortBy == SortOrder.DATE_ADDED
                ? FileRecordDao.ORDER_BY_DATE
                : FileRecordDao.ORDER_BY_NAME;
        long offset = (long) (page - 1) * pageSize;
        return blocking("list file records", () -> {
            MetadataCatalog.checkPaging(page, pageSize);
            // one extra row tells us whether another page exists; long so MAX_VALUE cannot wrap
            List<FileRecordRow> rows = jdbi.withExtension(FileRecordDao.class,
                    dao -> dao.page(orderBy, (long) pageSize + 1, offset));
            boolean morePages = rows.size() > pageSize;
            List<FileRecord> files = rows.stream()
                    .limit(pageSize)
                    .map(FileRecordRow::toRecord)
                    .toList();
            return new FilePage(files, morePages);
        });
    }

    @Override
    public Uni<FileRecord> findByStorageName(String storageName) {
        return blocking("find file record", () -> jdbi.withExtension(FileRecordDao.class,
                        dao -> dao.findByStorageName(storageName)))
                .onItem().transform(row -> row
                        .map(FileRecordRow::toRecord)
                        .orElseThrow(() -> new RecordNotFoundException(storageName)));
    }

    @Override
    public Uni<Map<String, DeleteOutcome>> deleteByStorageNames(List<String> storageNames) {
        if (storageNames.isEmpty()) {
            return Uni.createFrom().item(Map.of());
        }
        return blocking("delete file records", () -> {
            List<FileRecordRow> deleted = jdbi.withExtension(FileRecordDao.class,
                    dao -> dao.deleteByStorageNames(storageNames));
            Map<String, FileRecord> byName = new LinkedHashMap<>();
            for (FileRecordRow row : deleted) {
                byName.put(row.storageName(), row.toRecord());
            }
            Map<String, DeleteOutcome> outcomes = new LinkedHashMap<>();
            for (String name : storageNames) {
                FileRecord record = byName.get(name);
                outcomes.put(name, record != null
                        ? DeleteOutcome.deleted(record)
                        : DeleteOutcome.failed(NOT_IN_CATALOG));
            }
            return outcomes;
        });
    }

    private <T> Uni<T> blocking(String what, Supplier<T> work) {
        return Uni.createFrom().item(work)
                .runSubscriptionOn(executor)
                .onFailure(failure -> !(failure instanceof RecordNotFoundException)
                        && !(failure instanceof IllegalArgumentException))
                .transform(failure -> new CatalogException("Failed to " + what, failure));
    }
}
