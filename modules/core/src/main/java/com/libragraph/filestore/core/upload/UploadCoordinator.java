package com.libragraph.filestore.core.upload;

import com.libragraph.filestore.core.catalog.CatalogException;
import com.libragraph.filestore.core.catalog.MetadataCatalog;
import com.libragraph.filestore.core.staging.StagingArea;
import com.libragraph.filestore.core.storage.BlobNotFoundException;
import com.libragraph.filestore.core.storage.BlobService;
import com.libragraph.filestore.core.storage.CommitTimeoutException;
import com.libragraph.filestore.types.FileRecord;
import com.libragraph.filestore.types.NewFileRecord;
import com.libragraph.filestore.util.StorageNames;
import io.smallrye.mutiny.Uni;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Supplier;

/**
 * Commits a batch of staged uploads to the blob store and the catalog.
 *
 * <p>Blob commits run concurrently; the catalog insert runs only once every
 * commit has succeeded. Any failure rolls back the batch: committed blobs and
 * staged files are deleted best-effort and the caller receives an
 * {@link UploadException} wrapping the first failure. A commit or insert that
 * timed out may still complete, so it is undone once it settles.
 */
@ApplicationScoped
public class UploadCoordinator {

    private static final Logger log = Logger.getLogger(UploadCoordinator.class);

    @Inject
    BlobService blobService;

    @Inject
    MetadataCatalog catalog;

    @Inject
    StagingArea stagingArea;

    @Inject
    MimeTypeDetector mimeTypeDetector;

    @ConfigProperty(name = "filestore.io.timeout", defaultValue = "30S")
    Duration timeout;

    record CommitResult(String storageName, Throwable failure) {}

    public Uni<List<FileRecord>> upload(String ownerId, List<UploadedPayload> payloads, boolean isPrivate) {
        if (payloads.isEmpty()) {
            return Uni.createFrom().item(List.of());
        }
        try {
            validate(ownerId, payloads);
        } catch (PayloadValidationException e) {
            return Uni.createFrom().failure(e);
        }

        Instant now = Instant.now();
        List<NewFileRecord> drafts = new ArrayList<>(payloads.size());
        for (UploadedPayload p : payloads) {
            drafts.add(new NewFileRecord(
                    p.originalFilename(),
                    StorageNames.generate(),
                    mimeTypeDetector.detect(p.originalFilename(), p.mimeType()),
                    now,
                    ownerId,
                    p.declaredSize(),
                    isPrivate));
        }

        List<Uni<CommitResult>> commits = new ArrayList<>(payloads.size());
        for (int i = 0; i < payloads.size(); i++) {
            String storageName = drafts.get(i).storageName();
            commits.add(blobService.commit(payloads.get(i).stagedPath(), storageName)
                    .onItem().transform(v -> new CommitResult(storageName, null))
                    .onFailure().recoverWithItem(e -> new CommitResult(storageName, e)));
        }

        return Uni.join().all(commits).andFailFast()
                .chain(results -> {
                    List<String> committed = new ArrayList<>();
                    List<CommitTimeoutException> inFlight = new ArrayList<>();
                    Throwable firstFailure = null;
                    for (CommitResult r : results) {
                        if (r.failure() == null) {
                            committed.add(r.storageName());
                            continue;
                        }
                        if (r.failure() instanceof CommitTimeoutException late) {
                            inFlight.add(late);
                        }
                        if (firstFailure == null) {
                            firstFailure = r.failure();
                        }
                    }
                    if (firstFailure != null) {
                        Throwable cause = firstFailure;
                        return rollback(committed, inFlight, payloads, cause)
                                .chain(() -> Uni.createFrom().<List<FileRecord>>failure(
                                        new UploadException("Error Uploading Files", cause)));
                    }
                    return insert(drafts)
                            .onFailure().call(e -> rollback(committed, List.of(), payloads, e))
                            .onFailure().transform(e -> new UploadException("Error Uploading Files", e));
                });
    }

    /**
     * Inserts the batch. On timeout the insert may still commit, so its records
     * are removed once it settles, before the caller rolls back the blobs.
     */
    private Uni<List<FileRecord>> insert(List<NewFileRecord> drafts) {
        Uni<List<FileRecord>> write = catalog.insert(drafts).memoize().indefinitely();
        List<String> storageNames = drafts.stream().map(NewFileRecord::storageName).toList();
        return write.ifNoItem().after(timeout)
                .recoverWithUni(() -> undoWhenSettled(write,
                        () -> catalog.deleteByStorageNames(storageNames),
                        "insert of " + storageNames.size() + " record(s)")
                        .chain(() -> Uni.createFrom().<List<FileRecord>>failure(
                                new CatalogException("Timed out inserting file records"))));
    }

    private static void validate(String ownerId, List<UploadedPayload> payloads) {
        if (ownerId == null || ownerId.isBlank()) {
            throw new PayloadValidationException("Upload has no owner");
        }
        for (int i = 0; i < payloads.size(); i++) {
            UploadedPayload p = payloads.get(i);
            if (p == null) {
                throw new PayloadValidationException("File " + i + " is missing");
            }
            if (p.stagedPath() == null) {
                throw new PayloadValidationException("File " + i + " has no staged content");
            }
            if (p.originalFilename() == null || p.originalFilename().isBlank()) {
                throw new PayloadValidationException("File " + i + " has no filename");
            }
            if (p.declaredSize() == null) {
                throw new PayloadValidationException("File " + i + " has no size");
            }
            if (p.declaredSize() < 0) {
                throw new PayloadValidationException("File " + i + " has a negative size");
            }
        }
    }

    /**
     * Best-effort removal of everything this batch wrote. Commits that timed out
     * are deleted after they settle. Never fails.
     */
    Uni<Void> rollback(List<String> committed, List<CommitTimeoutException> inFlight,
                       List<UploadedPayload> payloads, Throwable cause) {
        log.warnf("Rolling back upload of %d file(s) (%d committed, %d in flight): %s",
                payloads.size(), committed.size(), inFlight.size(), cause.getMessage());
        List<Uni<Void>> ops = new ArrayList<>();
        for (String storageName : committed) {
            ops.add(blobService.delete(storageName)
                    .onFailure().invoke(e -> log.errorf("Unable to roll back blob %s: %s",
                            storageName, e.getMessage()))
                    .onFailure().recoverWithNull());
        }
        for (CommitTimeoutException late : inFlight) {
            String storageName = late.storageName();
            ops.add(undoWhenSettled(late.settled(),
                    () -> blobService.delete(storageName)
                            .onFailure(BlobNotFoundException.class).recoverWithNull(),
                    "commit of " + storageName));
        }
        for (UploadedPayload p : payloads) {
            ops.add(stagingArea.discard(p.stagedPath()));
        }
        return Uni.combine().all().unis(ops).discardItems()
                .onFailure().invoke(e -> log.errorf("Unable to roll back writes: %s", e.getMessage()))
                .onFailure().recoverWithNull();
    }

    /**
     * Runs {@code undo} once {@code inFlight} has completed or failed. Waits at most
     * {@code filestore.io.timeout}; past that the undo still runs when the operation
     * finishes, but the caller stops waiting. Never fails.
     */
    private Uni<Void> undoWhenSettled(Uni<?> inFlight, Supplier<Uni<?>> undo, String what) {
        Uni<Void> cleanup = inFlight
                .onItemOrFailure().transformToUni((item, failure) -> undo.get())
                .onFailure().invoke(e -> log.errorf("Unable to undo %s: %s", what, e.getMessage()))
                .onFailure().recoverWithNull()
                .replaceWithVoid()
                .memoize().indefinitely();
        return cleanup.ifNoItem().after(timeout).recoverWithUni(() -> {
            log.warnf("%s still running after %s; it will be undone when it finishes", what, timeout);
            return Uni.createFrom().voidItem();
        });
    }
}
