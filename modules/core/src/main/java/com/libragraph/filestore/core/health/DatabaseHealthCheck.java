package com.libragraph.filestore.core.health;

import com.libragraph.filestore.core.db.DatabaseService;
import io.quarkus.arc.properties.IfBuildProperty;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.health.HealthCheck;
import org.eclipse.microprofile.health.HealthCheckResponse;
import org.eclipse.microprofile.health.Readiness;

@Readiness
@ApplicationScoped
@IfBuildProperty(name = "filestore.catalog.type", stringValue = "postgres")
public class DatabaseHealthCheck implements HealthCheck {

    @Inject
    DatabaseService databaseService;

    @Override
    public HealthCheckResponse call() {
        if (databaseService.ping()) {
            return HealthCheckResponse.named("database")
                    .up()
                    .withData("version", String.valueOf(databaseService.pgVersion()))
                    .build();
        }
        return HealthCheckResponse.named("database")
                .down()
                .withData("state", databaseService.state().name())
                .build();
    }
}
