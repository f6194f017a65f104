package com.libragraph.filestore.core.storage;

import com.libragraph.filestore.util.StorageNames;
import io.minio.BucketExistsArgs;
import io.minio.GetObjectArgs;
import io.minio.MakeBucketArgs;
import io.minio.MinioClient;
import io.minio.RemoveObjectArgs;
import io.minio.StatObjectArgs;
import io.minio.UploadObjectArgs;
import io.minio.errors.ErrorResponseException;
import io.quarkus.arc.properties.IfBuildProperty;
import io.smallrye.mutiny.Uni;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

/**
 * S3/MinIO-backed BlobStore.
 *
 * <p>All blobs live in one bucket; the object key is the storage name.
 * Commit uploads the staged file and then removes it from staging.
 */
@ApplicationScoped
@IfBuildProperty(name = "filestore.blob-store.type", stringValue = "s3")
public class S3BlobStore implements BlobStore {

    private static final Logger log = Logger.getLogger(S3BlobStore.class);

    @Inject
    MinioClient minioClient;

    @ConfigProperty(name = "filestore.s3.bucket", defaultValue = "filestore")
    String bucket;

    private volatile boolean bucketReady;

    private void ensureBucket() {
        if (bucketReady) {
            return;
        }
        try {
            if (!minioClient.bucketExists(BucketExistsArgs.builder().bucket(bucket).build())) {
                minioClient.makeBucket(MakeBucketArgs.builder().bucket(bucket).build());
                log.infof("Created bucket %s", bucket);
            }
            bucketReady = true;
        } catch (ErrorResponseException e) {
            // another thread created the bucket first
            if ("BucketAlreadyOwnedByYou".equals(e.errorResponse().code())) {
                bucketReady = true;
                return;
            }
            throw new StorageException("Failed to ensure bucket: " + bucket, e);
        } catch (Exception e) {
            throw new StorageException("Failed to ensure bucket: " + bucket, e);
        }
    }

    private static boolean isMissing(ErrorResponseException e) {
        String code = e.errorResponse().code();
        return "NoSuchKey".equals(code) || "NoSuchBucket".equals(code);
    }

    private boolean statExists(String storageName) {
        try {
            minioClient.statObject(StatObjectArgs.builder()
                    .bucket(bucket).object(storageName).build());
            return true;
        } catch (ErrorResponseException e) {
            if (isMissing(e)) {
                return false;
            }
            throw new StorageException("Failed to check existence: " + storageName, e);
        } catch (Exception e) {
            throw new StorageException("Failed to check existence: " + storageName, e);
        }
    }

    @Override
    public Uni<Void> commit(Path stagedPath, String storageName) {
        return Uni.createFrom().voidItem().invoke(() -> {
            if (!StorageNames.isSafeSegment(storageName)) {
                throw new StorageException("Invalid storage name: " + storageName);
            }
            ensureBucket();
            if (statExists(storageName)) {
                throw new BlobAlreadyExistsException(storageName);
            }
            try {
                // conditional put closes the gap between the stat and the upload
                minioClient.uploadObject(UploadObjectArgs.builder()
                        .bucket(bucket)
                        .object(storageName)
                        .filename(stagedPath.toString())
                        .extraHeaders(Map.of("If-None-Match", "*"))
                        .build());
            } catch (ErrorResponseException e) {
                if ("PreconditionFailed".equals(e.errorResponse().code())) {
                    throw new BlobAlreadyExistsException(storageName);
                }
                throw new StorageException("Failed to commit blob: " + storageName, e);
            } catch (Exception e) {
                throw new StorageException("Failed to commit blob: " + storageName, e);
            }
            try {
                Files.deleteIfExists(stagedPath);
            } catch (IOException e) {
                log.warnf("Committed %s but could not remove staged file %s: %s",
                        storageName, stagedPath, e.getMessage());
            }
        });
    }

    @Override
    public Uni<Boolean> exists(String storageName) {
        return Uni.createFrom().item(() ->
                StorageNames.isSafeSegment(storageName) && statExists(storageName));
    }

    @Override
    public Uni<InputStream> read(String storageName) {
        return Uni.createFrom().item(() -> {
            if (!StorageNames.isSafeSegment(storageName)) {
                throw new BlobNotFoundException(storageName);
            }
            try {
                return (InputStream) minioClient.getObject(
                        GetObjectArgs.builder().bucket(bucket).object(storageName).build());
            } catch (ErrorResponseException e) {
                if (isMissing(e)) {
                    throw new BlobNotFoundException(storageName);
                }
                throw new StorageException("Failed to read blob: " + storageName, e);
            } catch (Exception e) {
                throw new StorageException("Failed to read blob: " + storageName, e);
            }
        });
    }

    @Override
    public Uni<Void> delete(String storageName) {
        return Uni.createFrom().voidItem().invoke(() -> {
            if (!StorageNames.isSafeSegment(storageName)) {
                throw new BlobNotFoundException(storageName);
            }
            // removeObject is silent on missing keys
            if (!statExists(storageName)) {
                throw new BlobNotFoundException(storageName);
            }
            try {
                minioClient.removeObject(RemoveObjectArgs.builder()
                        .bucket(bucket).object(storageName).build());
            } catch (Exception e) {
                throw new StorageException("Failed to delete blob: " + storageName, e);
            }
        });
    }

    @Override
    public Uni<Void> verifyAvailable() {
        return Uni.createFrom().voidItem().invoke(this::ensureBucket);
    }
}
