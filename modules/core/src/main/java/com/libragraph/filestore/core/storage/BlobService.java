package com.libragraph.filestore.core.storage;

import com.libragraph.filestore.types.DeleteOutcome;
import io.smallrye.mutiny.Uni;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.inject.Named;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

import java.io.InputStream;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;

/**
 * Facade over BlobStore used by the coordinators.
 *
 * <p>Every call is subscribed on the I/O executor and bounded by
 * {@code filestore.io.timeout}; a timeout surfaces as {@link StorageException}.
 */
@ApplicationScoped
public class BlobService {

    public static final String NOT_ON_DISK = "File Does Not Exist On File System";

    private static final Logger log = Logger.getLogger(BlobService.class);

    @Inject
    BlobStore store;

    @Inject
    @Named("ioExecutor")
    ExecutorService executor;

    @ConfigProperty(name = "filestore.io.timeout", defaultValue = "30S")
    Duration timeout;

    /**
     * Commits a staged file. A timeout fails with {@link CommitTimeoutException}
     * while the write keeps running; callers that roll back must wait for
     * {@link CommitTimeoutException#settled()} before deleting the name.
     */
    public Uni<Void> commit(Path stagedPath, String storageName) {
        // memoized so the write can be observed after the caller stops waiting
        Uni<Void> write = store.commit(stagedPath, storageName)
                .runSubscriptionOn(executor)
                .memoize().indefinitely();
        return write.ifNoItem().after(timeout)
                .failWith(() -> new CommitTimeoutException(storageName, timeout,
                        write.onFailure().recoverWithNull()));
    }

    public Uni<InputStream> retrieve(String storageName) {
        return bounded(store.read(storageName), "read " + storageName);
    }

    public Uni<Boolean> exists(String storageName) {
        return bounded(store.exists(storageName), "exists " + storageName);
    }

    public Uni<Void> delete(String storageName) {
        return bounded(store.delete(storageName), "delete " + storageName);
    }

    /**
     * Deletes every name independently. The returned map preserves input order;
     * a missing blob or a failed delete is reported for that name only.
     *
     * @throws StorageException (as a failed Uni) if the store itself is unavailable
     */
    public Uni<Map<String, DeleteOutcome>> deleteAll(List<String> storageNames) {
        if (storageNames.isEmpty()) {
            return Uni.createFrom().item(Map.of());
        }
        List<Uni<Map.Entry<String, DeleteOutcome>>> ops = new ArrayList<>();
        for (String name : storageNames) {
            ops.add(delete(name)
                    .onItem().transform(v -> Map.entry(name, DeleteOutcome.deleted()))
                    .onFailure(BlobNotFoundException.class)
                    .recoverWithItem(e -> Map.entry(name, DeleteOutcome.failed(NOT_ON_DISK)))
                    .onFailure().recoverWithItem(e -> {
                        log.warnf("Error deleting blob %s: %s", name, e.getMessage());
                        return Map.entry(name, DeleteOutcome.failed("Error Deleting File: " + e.getMessage()));
                    }));
        }
        return bounded(store.verifyAvailable(), "verify store")
                .chain(() -> Uni.join().all(ops).andFailFast())
                .onItem().transform(entries -> {
                    Map<String, DeleteOutcome> outcomes = new LinkedHashMap<>();
                    for (Map.Entry<String, DeleteOutcome> entry : entries) {
                        outcomes.put(entry.getKey(), entry.getValue());
                    }
                    return outcomes;
                });
    }

    private <T> Uni<T> bounded(Uni<T> op, String what) {
        return op.runSubscriptionOn(executor)
                .ifNoItem().after(timeout)
                .failWith(() -> new StorageException("Timed out after " + timeout + ": " + what));
    }
}
