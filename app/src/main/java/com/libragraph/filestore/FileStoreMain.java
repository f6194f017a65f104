package com.libragraph.filestore;

import io.quarkus.runtime.Quarkus;
import io.quarkus.runtime.annotations.QuarkusMain;
import org.jboss.logging.Logger;

/**
 * Process entry point. A service that fails to start (for example an unwritable
 * storage directory) aborts boot; the failure ends up here and the process exits non-zero.
 */
@QuarkusMain
public class FileStoreMain {

    private static final Logger log = Logger.getLogger(FileStoreMain.class);

    public static void main(String... args) {
        Quarkus.run(null, (exitCode, failure) -> {
            if (failure != null) {
                log.fatalf(failure, "File store failed to start");
                System.exit(exitCode == 0 ? 1 : exitCode);
            }
            System.exit(exitCode);
        }, args);
    }
}
