package com.libragraph.filestore.core.staging;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.assertj.core.api.Assertions.*;

class StagingAreaTest {

    @TempDir
    Path dir;

    ExecutorService executor;
    StagingArea staging;

    @BeforeEach
    void setUp() {
        executor = Executors.newSingleThreadExecutor();
        staging = StagingAreas.at(dir, executor);
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    void discardRemovesStagedFile() throws IOException {
        Path staged = Files.writeString(dir.resolve("upload-1"), "bytes");

        staging.discard(staged).await().indefinitely();

        assertThat(staged).doesNotExist();
    }

    @Test
    void discardOfMissingFileCompletesQuietly() {
        assertThatCode(() -> staging.discard(dir.resolve("never-there")).await().indefinitely())
                .doesNotThrowAnyException();
    }

    @Test
    void sweepRemovesOnlyOldFiles() throws IOException {
        Instant now = Instant.now();
        Path old = Files.writeString(dir.resolve("old"), "stale");
        Files.setLastModifiedTime(old, FileTime.from(now.minus(Duration.ofDays(2))));
        Path fresh = Files.writeString(dir.resolve("fresh"), "in flight");
        Files.createDirectory(dir.resolve("subdir"));

        int removed = staging.sweep(now.minus(Duration.ofDays(1)));

        assertThat(removed).isEqualTo(1);
        assertThat(old).doesNotExist();
        assertThat(fresh).exists();
        assertThat(dir.resolve("subdir")).isDirectory();
    }

    @Test
    void sweepOfMissingDirectoryIsNoOp() {
        StagingArea elsewhere = StagingAreas.at(dir.resolve("absent"), executor);

        assertThat(elsewhere.sweep(Instant.now())).isZero();
    }
}
