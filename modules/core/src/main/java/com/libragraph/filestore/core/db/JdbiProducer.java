package com.libragraph.filestore.core.db;

import io.agroal.api.AgroalDataSource;
import io.quarkus.arc.properties.IfBuildProperty;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Singleton;
import org.jdbi.v3.core.Jdbi;
import org.jdbi.v3.core.statement.Slf4JSqlLogger;
import org.jdbi.v3.postgres.PostgresPlugin;
import org.jdbi.v3.sqlobject.SqlObjectPlugin;

@ApplicationScoped
@IfBuildProperty(name = "filestore.catalog.type", stringValue = "postgres")
public class JdbiProducer {

    @Produces
    @Singleton
    public Jdbi jdbi(AgroalDataSource dataSource) {
        return configure(Jdbi.create(dataSource));
    }

    /** Installs the plugins every catalog handle relies on. */
    public static Jdbi configure(Jdbi jdbi) {
        return jdbi
                .installPlugin(new PostgresPlugin())
                .installPlugin(new SqlObjectPlugin())
                .setSqlLogger(new Slf4JSqlLogger());
    }
}
