package com.libragraph.filestore.core.storage;

import com.libragraph.filestore.types.DeleteOutcome;
import io.smallrye.mutiny.Uni;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.assertj.core.api.Assertions.*;

class BlobServiceTest {

    @TempDir
    Path tmp;

    ExecutorService executor;
    Path root;
    BlobService blobs;

    @BeforeEach
    void setUp() throws IOException {
        executor = Executors.newFixedThreadPool(4);
        root = Files.createDirectory(tmp.resolve("files"));
        blobs = BlobServices.over(BlobServices.filesystem(root), executor);
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    private void put(String name) throws IOException {
        Files.writeString(root.resolve(name), name);
    }

    @Test
    void deleteAllReportsEachNameIndependently() throws IOException {
        put("one");
        put("three");

        Map<String, DeleteOutcome> outcomes = blobs.deleteAll(List.of("one", "two", "three"))
                .await().indefinitely();

        assertThat(outcomes).containsOnlyKeys("one", "two", "three");
        assertThat(outcomes.keySet()).containsExactly("one", "two", "three");
        assertThat(outcomes.get("one").isDeleted()).isTrue();
        assertThat(outcomes.get("two").error()).isEqualTo(BlobService.NOT_ON_DISK);
        assertThat(outcomes.get("three").isDeleted()).isTrue();
        assertThat(root.resolve("one")).doesNotExist();
    }

    @Test
    void deleteAllOfNothingTouchesNothing() {
        assertThat(blobs.deleteAll(List.of()).await().indefinitely()).isEmpty();
    }

    @Test
    void deleteAllFailsWholeWhenStoreIsUnavailable() throws IOException {
        Files.delete(root);

        assertThatThrownBy(() -> blobs.deleteAll(List.of("a")).await().indefinitely())
                .isInstanceOf(StorageException.class);
    }

    @Test
    void slowStoreCallTimesOutAsStorageFailure() {
        BlobStore slow = new FilesystemBlobStore() {
            @Override
            public Uni<Boolean> exists(String storageName) {
                return Uni.createFrom().item(true).onItem().delayIt().by(Duration.ofSeconds(5));
            }
        };
        BlobService impatient = BlobServices.over(slow, executor, Duration.ofMillis(100));

        assertThatThrownBy(() -> impatient.exists("x").await().atMost(Duration.ofSeconds(2)))
                .isInstanceOf(StorageException.class)
                .hasMessageContaining("Timed out");
    }

    @Test
    void timedOutCommitCanBeAwaitedUntilItLands() throws IOException {
        FilesystemBlobStore fs = BlobServices.filesystem(root);
        BlobStore slow = new FilesystemBlobStore() {
            @Override
            public Uni<Void> commit(Path stagedPath, String storageName) {
                return fs.commit(stagedPath, storageName).onItem().delayIt().by(Duration.ofMillis(500));
            }
        };
        BlobService impatient = BlobServices.over(slow, executor, Duration.ofMillis(100));
        Path staged = Files.writeString(tmp.resolve("staged.part"), "late");

        Throwable failure = catchThrowable(() -> impatient.commit(staged, "late").await().indefinitely());

        assertThat(failure).isInstanceOf(CommitTimeoutException.class);
        CommitTimeoutException timeout = (CommitTimeoutException) failure;
        assertThat(timeout.storageName()).isEqualTo("late");
        timeout.settled().await().atMost(Duration.ofSeconds(5));
        assertThat(root.resolve("late")).hasContent("late");
    }

    @Test
    void retrieveMissingBlobPropagatesNotFound() {
        assertThatThrownBy(() -> blobs.retrieve("nope").await().indefinitely())
                .isInstanceOf(BlobNotFoundException.class);
    }

    @Test
    void retrieveStreamsContent() throws IOException {
        put("present");

        try (InputStream in = blobs.retrieve("present").await().indefinitely()) {
            assertThat(in).hasContent("present");
        }
    }
}
