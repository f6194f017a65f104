package com.libragraph.filestore.core.staging;

import io.smallrye.mutiny.Uni;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.inject.Named;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.concurrent.ExecutorService;

/**
 * The directory uploaded bytes land in before they are committed to the blob store.
 */
@ApplicationScoped
public class StagingArea {

    private static final Logger log = Logger.getLogger(StagingArea.class);

    @ConfigProperty(name = "filestore.staging-dir", defaultValue = "./temp")
    String stagingDir;

    @Inject
    @Named("ioExecutor")
    ExecutorService executor;

    /**
     * Removes a staged file if it is still present. Never fails: errors are logged.
     */
    public Uni<Void> discard(Path stagedPath) {
        return Uni.createFrom().voidItem().invoke(() -> {
                    try {
                        if (Files.deleteIfExists(stagedPath)) {
                            log.debugf("Discarded staged file %s", stagedPath);
                        }
                    } catch (IOException e) {
                        log.errorf("Unable to remove staged file %s: %s", stagedPath, e.getMessage());
                    }
                })
                .runSubscriptionOn(executor);
    }

    /**
     * Deletes regular files in the staging directory last modified before {@code cutoff}.
     *
     * @return number of files removed
     */
    public int sweep(Instant cutoff) {
        Path dir = Path.of(stagingDir);
        if (!Files.isDirectory(dir)) {
            return 0;
        }
        int removed = 0;
        try (DirectoryStream<Path> entries = Files.newDirectoryStream(dir)) {
            for (Path entry : entries) {
                try {
                    if (Files.isRegularFile(entry)
                            && Files.getLastModifiedTime(entry).toInstant().isBefore(cutoff)
                            && Files.deleteIfExists(entry)) {
                        removed++;
                    }
                } catch (IOException e) {
                    log.warnf("Unable to sweep staged file %s: %s", entry, e.getMessage());
                }
            }
        } catch (IOException e) {
            log.errorf("Unable to list staging directory %s: %s", dir, e.getMessage());
        }
        return removed;
    }
}
