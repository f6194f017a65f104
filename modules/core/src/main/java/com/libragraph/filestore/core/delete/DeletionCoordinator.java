package com.libragraph.filestore.core.delete;

import com.libragraph.filestore.core.catalog.CatalogException;
import com.libragraph.filestore.core.catalog.MetadataCatalog;
import com.libragraph.filestore.core.storage.BlobService;
import com.libragraph.filestore.types.DeleteOutcome;
import io.smallrye.mutiny.Uni;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;

/**
 * Deletes a batch of storage names from the catalog and the blob store concurrently
 * and merges both sides into one {@link DeleteReport} per name.
 *
 * <p>Per-name problems (no record, no blob) are reported inline. Only a failure of
 * a whole side turns into a {@link DeletionException}.
 */
@ApplicationScoped
public class DeletionCoordinator {

    private static final Logger log = Logger.getLogger(DeletionCoordinator.class);

    @Inject
    MetadataCatalog catalog;

    @Inject
    BlobService blobService;

    @ConfigProperty(name = "filestore.io.timeout", defaultValue = "30S")
    Duration timeout;

    public Uni<List<DeleteReport>> delete(List<String> storageNames) {
        List<String> names = new ArrayList<>(new LinkedHashSet<>(storageNames));
        if (names.isEmpty()) {
            return Uni.createFrom().item(List.of());
        }

        Uni<Map<String, DeleteOutcome>> fromCatalog = catalog.deleteByStorageNames(names)
                .ifNoItem().after(timeout)
                .failWith(() -> new CatalogException("Timed out deleting file records"));
        Uni<Map<String, DeleteOutcome>> fromStore = blobService.deleteAll(names);

        return Uni.combine().all().unis(fromCatalog, fromStore).asTuple()
                .onItem().transform(t -> merge(names, t.getItem1(), t.getItem2()))
                .onFailure().invoke(e -> log.errorf("Delete of %d file(s) failed: %s", names.size(), e.getMessage()))
                .onFailure().transform(e -> new DeletionException("Error Deleting Files", e));
    }

    static List<DeleteReport> merge(List<String> names,
                                    Map<String, DeleteOutcome> catalogOutcomes,
                                    Map<String, DeleteOutcome> blobOutcomes) {
        List<DeleteReport> reports = new ArrayList<>(names.size());
        for (String name : names) {
            DeleteOutcome fromCatalog = catalogOutcomes.get(name);
            DeleteOutcome fromStore = blobOutcomes.get(name);
            List<String> errors = new ArrayList<>(2);
            if (fromCatalog != null && !fromCatalog.isDeleted()) {
                errors.add(fromCatalog.error());
            }
            if (fromStore != null && !fromStore.isDeleted()) {
                errors.add(fromStore.error());
            }
            reports.add(new DeleteReport(name,
                    fromCatalog == null ? null : fromCatalog.fileRecord(),
                    errors));
        }
        return reports;
    }
}
