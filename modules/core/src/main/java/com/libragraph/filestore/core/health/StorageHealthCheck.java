package com.libragraph.filestore.core.health;

import com.libragraph.filestore.core.storage.StorageDirectoryService;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.health.HealthCheck;
import org.eclipse.microprofile.health.HealthCheckResponse;
import org.eclipse.microprofile.health.Readiness;

@Readiness
@ApplicationScoped
public class StorageHealthCheck implements HealthCheck {

    @Inject
    StorageDirectoryService directories;

    @Override
    public HealthCheckResponse call() {
        String root = directories.storageDir().toAbsolutePath().toString();
        if (directories.isRunning() && directories.storageWritable()) {
            return HealthCheckResponse.named("storage")
                    .up()
                    .withData("root", root)
                    .build();
        }
        return HealthCheckResponse.named("storage")
                .down()
                .withData("root", root)
                .withData("state", directories.state().name())
                .build();
    }
}
