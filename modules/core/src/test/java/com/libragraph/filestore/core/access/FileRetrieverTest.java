package com.libragraph.filestore.core.access;

import com.libragraph.filestore.core.catalog.InMemoryMetadataCatalog;
import com.libragraph.filestore.core.storage.BlobServices;
import com.libragraph.filestore.types.FileRecord;
import com.libragraph.filestore.types.NewFileRecord;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.assertj.core.api.Assertions.*;

class FileRetrieverTest {

    @TempDir
    Path root;

    ExecutorService executor;
    InMemoryMetadataCatalog catalog;
    FileRetriever retriever;

    static final CallerIdentity ALICE = CallerIdentity.of("alice");

    @BeforeEach
    void setUp() throws IOException {
        executor = Executors.newFixedThreadPool(2);
        catalog = new InMemoryMetadataCatalog();
        retriever = new FileRetriever();
        retriever.catalog = catalog;
        retriever.blobService = BlobServices.over(BlobServices.filesystem(root), executor);
        retriever.policy = new AccessPolicy();
        retriever.timeout = Duration.ofSeconds(5);

        catalog.insert(List.of(
                record("public.txt", "pub", false),
                record("secret.txt", "priv", true),
                record("lost.txt", "no-blob", false))).await().indefinitely();
        Files.writeString(root.resolve("pub"), "for everyone");
        Files.writeString(root.resolve("priv"), "for members");
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    private static NewFileRecord record(String name, String storageName, boolean isPrivate) {
        return new NewFileRecord(name, storageName, "text/plain", Instant.now(), "alice", 12, isPrivate);
    }

    private String read(String storageName, CallerIdentity caller) throws IOException {
        RetrievedFile file = retriever.retrieve(storageName, caller).await().indefinitely();
        try (InputStream in = file.content()) {
            return new String(in.readAllBytes());
        }
    }

    @Test
    void publicFileIsServedToAnonymousCaller() throws IOException {
        assertThat(read("pub", CallerIdentity.anonymous())).isEqualTo("for everyone");
    }

    @Test
    void privateFileIsServedToAuthenticatedCaller() throws IOException {
        RetrievedFile file = retriever.retrieve("priv", ALICE).await().indefinitely();
        try (InputStream in = file.content()) {
            assertThat(in).hasContent("for members");
        }
        FileRecord record = file.record();
        assertThat(record.originalFilename()).isEqualTo("secret.txt");
    }

    @Test
    void denialLooksExactlyLikeAMissingFile() {
        Throwable denied = catchThrowable(() ->
                retriever.retrieve("priv", CallerIdentity.anonymous()).await().indefinitely());
        Throwable missing = catchThrowable(() ->
                retriever.retrieve("does-not-exist", CallerIdentity.anonymous()).await().indefinitely());

        assertThat(denied).isInstanceOf(FileUnavailableException.class);
        assertThat(missing).isInstanceOf(FileUnavailableException.class);
        assertThat(denied.getMessage()).isEqualTo(missing.getMessage()).isEqualTo("File Not Found");
        assertThat(((FileUnavailableException) denied).reason()).isEqualTo(FileUnavailableException.Reason.DENIED);
        assertThat(((FileUnavailableException) missing).reason()).isEqualTo(FileUnavailableException.Reason.NO_RECORD);
    }

    @Test
    void recordWithoutBlobIsUnavailable() {
        assertThatThrownBy(() -> retriever.retrieve("no-blob", ALICE).await().indefinitely())
                .isInstanceOf(FileUnavailableException.class)
                .extracting(e -> ((FileUnavailableException) e).reason())
                .isEqualTo(FileUnavailableException.Reason.NO_BLOB);
    }

    @Test
    void pathTraversalNamesNeverReachTheStore() {
        assertThatThrownBy(() -> retriever.retrieve("../pub", ALICE).await().indefinitely())
                .isInstanceOf(FileUnavailableException.class)
                .extracting(e -> ((FileUnavailableException) e).reason())
                .isEqualTo(FileUnavailableException.Reason.INVALID_NAME);
    }
}
