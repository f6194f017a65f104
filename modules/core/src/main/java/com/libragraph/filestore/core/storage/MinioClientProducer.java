package com.libragraph.filestore.core.storage;

import io.minio.MinioClient;
import io.quarkus.arc.properties.IfBuildProperty;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Singleton;
import org.eclipse.microprofile.config.inject.ConfigProperty;

import java.util.Optional;

@ApplicationScoped
@IfBuildProperty(name = "filestore.blob-store.type", stringValue = "s3")
public class MinioClientProducer {

    @ConfigProperty(name = "filestore.minio.endpoint")
    String endpoint;

    @ConfigProperty(name = "filestore.minio.access-key")
    String accessKey;

    @ConfigProperty(name = "filestore.minio.secret-key")
    String secretKey;

    /** Needed by AWS S3; MinIO ignores it. */
    @ConfigProperty(name = "filestore.minio.region")
    Optional<String> region;

    @Produces
    @Singleton
    public MinioClient minioClient() {
        MinioClient.Builder builder = MinioClient.builder()
                .endpoint(endpoint)
                .credentials(accessKey, secretKey);
        region.ifPresent(builder::region);
        return builder.build();
    }
}
