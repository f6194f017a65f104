package com.libragraph.filestore.core.health;

import io.minio.BucketExistsArgs;
import io.minio.MinioClient;
import io.quarkus.arc.properties.IfBuildProperty;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.eclipse.microprofile.health.HealthCheck;
import org.eclipse.microprofile.health.HealthCheckResponse;
import org.eclipse.microprofile.health.Readiness;

@Readiness
@ApplicationScoped
@IfBuildProperty(name = "filestore.blob-store.type", stringValue = "s3")
public class MinioHealthCheck implements HealthCheck {

    @Inject
    MinioClient minioClient;

    @ConfigProperty(name = "filestore.s3.bucket", defaultValue = "filestore")
    String bucket;

    @Override
    public HealthCheckResponse call() {
        try {
            // a missing bucket is created on first commit, so reachability is enough
            boolean present = minioClient.bucketExists(BucketExistsArgs.builder().bucket(bucket).build());
            return HealthCheckResponse.named("minio")
                    .up()
                    .withData("bucket", bucket)
                    .withData("bucketExists", present)
                    .build();
        } catch (Exception e) {
            return HealthCheckResponse.named("minio")
                    .down()
                    .withData("error", String.valueOf(e.getMessage()))
                    .build();
        }
    }
}
