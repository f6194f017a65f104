package com.libragraph.filestore.core.access;

import com.libragraph.filestore.core.catalog.CatalogException;
import com.libragraph.filestore.core.catalog.MetadataCatalog;
import com.libragraph.filestore.core.catalog.RecordNotFoundException;
import com.libragraph.filestore.core.storage.BlobNotFoundException;
import com.libragraph.filestore.core.storage.BlobService;
import com.libragraph.filestore.util.StorageNames;
import io.smallrye.mutiny.Uni;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

import java.time.Duration;

/**
 * Looks up a file by storage name, applies {@link AccessPolicy} and opens its bytes.
 *
 * <p>An unsafe name, a missing record, a denial and a missing blob all fail with
 * {@link FileUnavailableException}. The blob is never opened for a denied caller.
 */
@ApplicationScoped
public class FileRetriever {

    private static final Logger log = Logger.getLogger(FileRetriever.class);

    @Inject
    MetadataCatalog catalog;

    @Inject
    BlobService blobService;

    @Inject
    AccessPolicy policy;

    @ConfigProperty(name = "filestore.io.timeout", defaultValue = "30S")
    Duration timeout;

    public Uni<RetrievedFile> retrieve(String storageName, CallerIdentity caller) {
        if (!StorageNames.isSafeSegment(storageName)) {
            return unavailable(storageName, FileUnavailableException.Reason.INVALID_NAME);
        }
        return catalog.findByStorageName(storageName)
                .ifNoItem().after(timeout)
                .failWith(() -> new CatalogException("Timed out looking up " + storageName))
                .onFailure(RecordNotFoundException.class)
                .transform(e -> new FileUnavailableException(storageName, FileUnavailableException.Reason.NO_RECORD))
                .chain(record -> {
                    if (policy.evaluate(record, caller) == AccessDecision.DENIED) {
                        return FileRetriever.<RetrievedFile>unavailable(storageName,
                                FileUnavailableException.Reason.DENIED);
                    }
                    return blobService.retrieve(storageName)
                            .onFailure(BlobNotFoundException.class)
                            .transform(e -> new FileUnavailableException(storageName,
                                    FileUnavailableException.Reason.NO_BLOB))
                            .onItem().transform(in -> new RetrievedFile(record, in));
                })
                .onFailure(FileUnavailableException.class).invoke(e -> log.debugf(
                        "File %s unavailable: %s", storageName, ((FileUnavailableException) e).reason()));
    }

    private static <T> Uni<T> unavailable(String storageName, FileUnavailableException.Reason reason) {
        return Uni.createFrom().failure(new FileUnavailableException(storageName, reason));
    }
}
