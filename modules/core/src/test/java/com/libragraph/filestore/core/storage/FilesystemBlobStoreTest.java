package com.libragraph.filestore.core.storage;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.*;

class FilesystemBlobStoreTest {

    @TempDir
    Path tmp;

    Path staging;
    Path root;
    FilesystemBlobStore store;

    @BeforeEach
    void setUp() throws IOException {
        staging = Files.createDirectory(tmp.resolve("staging"));
        root = Files.createDirectory(tmp.resolve("files"));
        store = BlobServices.filesystem(root);
    }

    private Path stage(String content) throws IOException {
        return Files.writeString(Files.createTempFile(staging, "upload", ".part"), content);
    }

    @Test
    void commitMovesStagedFileUnderStorageName() throws IOException {
        Path staged = stage("hello filestore");

        store.commit(staged, "abc-123").await().indefinitely();

        assertThat(staged).doesNotExist();
        assertThat(root.resolve("abc-123")).hasContent("hello filestore");
        assertThat(store.exists("abc-123").await().indefinitely()).isTrue();
    }

    @Test
    void readReturnsCommittedBytes() throws IOException {
        store.commit(stage("round trip"), "rt").await().indefinitely();

        try (InputStream in = store.read("rt").await().indefinitely()) {
            assertThat(new String(in.readAllBytes(), StandardCharsets.UTF_8)).isEqualTo("round trip");
        }
    }

    @Test
    void commitOntoExistingNameFails() throws IOException {
        store.commit(stage("first"), "taken").await().indefinitely();
        Path second = stage("second");

        assertThatThrownBy(() -> store.commit(second, "taken").await().indefinitely())
                .isInstanceOf(BlobAlreadyExistsException.class);
        assertThat(root.resolve("taken")).hasContent("first");
        assertThat(second).exists();
    }

    @Test
    void racingCommitsToOneNameHaveOneWinner() throws Exception {
        int racers = 8;
        List<Path> staged = new ArrayList<>();
        for (int i = 0; i < racers; i++) {
            staged.add(stage("racer-" + i));
        }
        ExecutorService pool = Executors.newFixedThreadPool(racers);
        CountDownLatch start = new CountDownLatch(1);
        try {
            List<Future<Boolean>> results = new ArrayList<>();
            for (Path p : staged) {
                results.add(pool.submit(() -> {
                    start.await();
                    try {
                        store.commit(p, "contested").await().indefinitely();
                        return true;
                    } catch (BlobAlreadyExistsException e) {
                        return false;
                    }
                }));
            }
            start.countDown();

            int winners = 0;
            for (Future<Boolean> r : results) {
                if (r.get(10, TimeUnit.SECONDS)) {
                    winners++;
                }
            }
            assertThat(winners).isEqualTo(1);
            String content = Files.readString(root.resolve("contested"));
            assertThat(staged).filteredOn(Files::exists).hasSize(racers - 1);
            assertThat(content).startsWith("racer-");
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    void commitOfMissingStagedFileIsStorageFailure() {
        assertThatThrownBy(() -> store.commit(staging.resolve("gone"), "x").await().indefinitely())
                .isInstanceOf(StorageException.class);
    }

    @Test
    void commitRejectsUnsafeName() throws IOException {
        Path staged = stage("escape");

        assertThatThrownBy(() -> store.commit(staged, "../escape").await().indefinitely())
                .isInstanceOf(StorageException.class);
        assertThat(tmp.resolve("escape")).doesNotExist();
    }

    @Test
    void readMissingBlobThrows() {
        assertThatThrownBy(() -> store.read("missing").await().indefinitely())
                .isInstanceOf(BlobNotFoundException.class);
    }

    @Test
    void unsafeNamesAreTreatedAsAbsent() {
        assertThat(store.exists("..").await().indefinitely()).isFalse();
        assertThatThrownBy(() -> store.read("../files").await().indefinitely())
                .isInstanceOf(BlobNotFoundException.class);
        assertThatThrownBy(() -> store.delete("a/b").await().indefinitely())
                .isInstanceOf(BlobNotFoundException.class);
    }

    @Test
    void deleteRemovesBlob() throws IOException {
        store.commit(stage("bye"), "doomed").await().indefinitely();

        store.delete("doomed").await().indefinitely();

        assertThat(root.resolve("doomed")).doesNotExist();
        assertThatThrownBy(() -> store.delete("doomed").await().indefinitely())
                .isInstanceOf(BlobNotFoundException.class);
    }

    @Test
    void verifyAvailableFailsWhenRootIsGone() throws IOException {
        store.verifyAvailable().await().indefinitely();

        Files.delete(root);

        assertThatThrownBy(() -> store.verifyAvailable().await().indefinitely())
                .isInstanceOf(StorageException.class);
    }
}
