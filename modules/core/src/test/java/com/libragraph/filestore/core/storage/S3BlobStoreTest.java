package com.libragraph.filestore.core.storage;

import io.minio.MinioClient;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.testcontainers.containers.MinIOContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.UUID;

import static org.assertj.core.api.Assertions.*;

@Testcontainers(disabledWithoutDocker = true)
class S3BlobStoreTest {

    @Container
    static final MinIOContainer MINIO = new MinIOContainer("minio/minio:RELEASE.2024-11-07T00-52-20Z");

    static MinioClient client;

    @TempDir
    Path staging;

    S3BlobStore store;

    @BeforeAll
    static void connect() {
        client = MinioClient.builder()
                .endpoint(MINIO.getS3URL())
                .credentials(MINIO.getUserName(), MINIO.getPassword())
                .build();
    }

    @BeforeEach
    void setUp() {
        store = new S3BlobStore();
        store.minioClient = client;
        store.bucket = "filestore-" + UUID.randomUUID();
    }

    private Path stage(String content) throws IOException {
        return Files.writeString(Files.createTempFile(staging, "upload", ".part"), content);
    }

    @Test
    void commitUploadsAndRemovesStagedFile() throws IOException {
        Path staged = stage("hello s3");

        store.commit(staged, "blob-1").await().indefinitely();

        assertThat(staged).doesNotExist();
        assertThat(store.exists("blob-1").await().indefinitely()).isTrue();
        try (InputStream in = store.read("blob-1").await().indefinitely()) {
            assertThat(in).hasContent("hello s3");
        }
    }

    @Test
    void commitOntoExistingKeyFails() throws IOException {
        store.commit(stage("first"), "same").await().indefinitely();
        Path second = stage("second");

        assertThatThrownBy(() -> store.commit(second, "same").await().indefinitely())
                .isInstanceOf(BlobAlreadyExistsException.class);
    }

    @Test
    void missingKeyIsNotFound() {
        store.verifyAvailable().await().indefinitely();

        assertThat(store.exists("absent").await().indefinitely()).isFalse();
        assertThatThrownBy(() -> store.read("absent").await().indefinitely())
                .isInstanceOf(BlobNotFoundException.class);
        assertThatThrownBy(() -> store.delete("absent").await().indefinitely())
                .isInstanceOf(BlobNotFoundException.class);
    }

    @Test
    void deleteRemovesObject() throws IOException {
        store.commit(stage("short lived"), "tmp").await().indefinitely();

        store.delete("tmp").await().indefinitely();

        assertThat(store.exists("tmp").await().indefinitely()).isFalse();
    }
}
