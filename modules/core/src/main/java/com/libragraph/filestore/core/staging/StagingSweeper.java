package com.libragraph.filestore.core.staging;

import io.quarkus.scheduler.Scheduled;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

import java.time.Duration;
import java.time.Instant;

import static io.quarkus.scheduler.Scheduled.ConcurrentExecution.SKIP;

/**
 * Removes staged uploads that an interrupted request left behind.
 */
@ApplicationScoped
public class StagingSweeper {

    private static final Logger log = Logger.getLogger(StagingSweeper.class);

    @Inject
    StagingArea stagingArea;

    @ConfigProperty(name = "filestore.staging.max-age", defaultValue = "24H")
    Duration maxAge;

    @Scheduled(every = "${filestore.staging.sweep-interval:1h}", concurrentExecution = SKIP)
    public void sweep() {
        int removed = stagingArea.sweep(Instant.now().minus(maxAge));
        if (removed > 0) {
            log.warnf("Removed %d abandoned staged file(s) older than %s", removed, maxAge);
        }
    }
}
