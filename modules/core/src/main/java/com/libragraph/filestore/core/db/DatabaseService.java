package com.libragraph.filestore.core.db;

import com.libragraph.filestore.core.catalog.dao.DatabaseDao;
import com.libragraph.filestore.core.catalog.dao.FileRecordDao;
import com.libragraph.filestore.core.service.AbstractManagedService;
import io.quarkus.arc.properties.IfBuildProperty;
import io.quarkus.runtime.Startup;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jdbi.v3.core.Jdbi;

/**
 * Verifies PostgreSQL connectivity at boot and creates the {@code file_record}
 * schema when it is missing.
 */
@ApplicationScoped
@Startup
@IfBuildProperty(name = "filestore.catalog.type", stringValue = "postgres")
public class DatabaseService extends AbstractManagedService {

    @Inject
    Jdbi jdbi;

    private String pgVersion;

    @Override
    public String serviceId() {
        return "database";
    }

    @Override
    protected void doStart() {
        pgVersion = jdbi.withExtension(DatabaseDao.class, DatabaseDao::pgVersion);
        log.infof("Connected to: %s", pgVersion);
        jdbi.useExtension(FileRecordDao.class, FileRecordDao::createSchema);
    }

    @Override
    protected void doStop() {
        log.info("DatabaseService stopping (Agroal manages pool shutdown)");
    }

    /** Executes SELECT 1 to verify connectivity. Calls {@link #fail} on error. */
    public boolean ping() {
        try {
            jdbi.withExtension(DatabaseDao.class, DatabaseDao::ping);
            return true;
        } catch (Exception e) {
            fail(e);
            return false;
        }
    }

    /** PostgreSQL version string from startup probe. */
    public String pgVersion() {
        return pgVersion;
    }

    @PostConstruct
    void init() {
        try {
            start();
        } catch (Exception e) {
            throw new IllegalStateException("DatabaseService failed to start", e);
        }
    }

    @PreDestroy
    void shutdown() {
        try {
            stop();
        } catch (Exception e) {
            log.warn("Error stopping DatabaseService", e);
        }
    }
}
