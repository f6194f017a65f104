package com.libragraph.filestore.core.catalog;

import com.libragraph.filestore.types.DeleteOutcome;
import com.libragraph.filestore.types.FilePage;
import com.libragraph.filestore.types.FileRecord;
import com.libragraph.filestore.types.NewFileRecord;
import com.libragraph.filestore.types.SortOrder;
import io.quarkus.arc.properties.IfBuildProperty;
import io.smallrye.mutiny.Uni;
import jakarta.enterprise.context.ApplicationScoped;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Process-local catalog for development, tests and single-node deployments
 * that do not need records to survive a restart.
 */
@ApplicationScoped
@IfBuildProperty(name = "filestore.catalog.type", stringValue = "memory", enableIfMissing = true)
public class InMemoryMetadataCatalog implements MetadataCatalog {

    private static final Comparator<FileRecord> BY_NAME =
            Comparator.comparing(FileRecord::originalFilename).thenComparingLong(FileRecord::id);
    private static final Comparator<FileRecord> BY_DATE =
            Comparator.comparing(FileRecord::dateAdded).thenComparingLong(FileRecord::id);

    private final Map<String, FileRecord> byStorageName = new LinkedHashMap<>();
    private final ReadWriteLock lock = new ReentrantReadWriteLock();
    private final AtomicLong ids = new AtomicLong();

    @Override
    public Uni<List<FileRecord>> insert(List<NewFileRecord> records) {
        return Uni.createFrom().item(() -> {
            lock.writeLock().lock();
            try {
                // check the whole batch before touching the map
                Set<String> batchNames = new HashSet<>();
                for (NewFileRecord r : records) {
                    if (byStorageName.containsKey(r.storageName()) || !batchNames.add(r.storageName())) {
                        throw new CatalogException("Duplicate storage name: " + r.storageName());
                    }
                }
                List<FileRecord> inserted = new ArrayList<>(records.size());
                for (NewFileRecord r : records) {
                    FileRecord record = r.withId(ids.incrementAndGet());
                    byStorageName.put(record.storageName(), record);
                    inserted.add(record);
                }
                return inserted;
            } finally {
                lock.writeLock().unlock();
            }
        });
    }

    @Override
    public Uni<FilePage> list(int page, int pageSize, SortOrder sortBy) {
        return Uni.createFrom().item(() -> {
            MetadataCatalog.checkPaging(page, pageSize);
            List<FileRecord> all;
            lock.readLock().lock();
            try {
                all = new ArrayList<>(byStorageName.values());
            } finally {
                lock.readLock().unlock();
            }
            all.sort(sortBy == SortOrder.DATE_ADDED ? BY_DATE : BY_NAME);

            long from = (long) (page - 1) * pageSize;
            if (from >= all.size()) {
                return FilePage.empty();
            }
            int to = (int) Math.min(from + pageSize, all.size());
            return new FilePage(all.subList((int) from, to), to < all.size());
        });
    }

    @Override
    public Uni<FileRecord> findByStorageName(String storageName) {
        return Uni.createFrom().item(() -> {
            lock.readLock().lock();
            try {
                FileRecord record = byStorageName.get(storageName);
                if (record == null) {
                    throw new RecordNotFoundException(storageName);
                }
                return record;
            } finally {
                lock.readLock().unlock();
            }
        });
    }

    @Override
    public Uni<Map<String, DeleteOutcome>> deleteByStorageNames(List<String> storageNames) {
        return Uni.createFrom().item(() -> {
            Map<String, DeleteOutcome> outcomes = new LinkedHashMap<>();
            lock.writeLock().lock();
            try {
                for (String name : storageNames) {
                    if (outcomes.containsKey(name)) {
                        continue;
                    }
                    FileRecord removed = byStorageName.remove(name);
                    outcomes.put(name, removed != null
                            ? DeleteOutcome.deleted(removed)
                            : DeleteOutcome.failed(NOT_IN_CATALOG));
                }
            } finally {
                lock.writeLock().unlock();
            }
            return outcomes;
        });
    }
}
