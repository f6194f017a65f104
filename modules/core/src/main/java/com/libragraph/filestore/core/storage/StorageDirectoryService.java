package com.libragraph.filestore.core.storage;

import com.libragraph.filestore.core.service.AbstractManagedService;
import io.quarkus.runtime.Startup;
import jakarta.annotation.PostConstruct;
import jakarta.enterprise.context.ApplicationScoped;
import org.eclipse.microprofile.config.inject.ConfigProperty;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Creates the staging and storage directories at boot.
 * An unusable directory fails startup; the process entry point decides what happens next.
 */
@ApplicationScoped
@Startup
public class StorageDirectoryService extends AbstractManagedService {

    @ConfigProperty(name = "filestore.staging-dir", defaultValue = "./temp")
    String stagingDir;

    @ConfigProperty(name = "filestore.storage-dir", defaultValue = "./files")
    String storageDir;

    @Override
    public String serviceId() {
        return "storage-directories";
    }

    @Override
    protected void doStart() throws IOException {
        prepare(Path.of(stagingDir), "staging");
        prepare(Path.of(storageDir), "storage");
    }

    @Override
    protected void doStop() {
        // directories outlive the process
    }

    private void prepare(Path dir, String label) throws IOException {
        try {
            Files.createDirectories(dir);
        } catch (IOException e) {
            throw new IOException("Invalid " + label + " path " + dir + ": " + e.getMessage(), e);
        }
        if (!Files.isWritable(dir)) {
            throw new IOException("The " + label + " directory " + dir + " is not writable");
        }
        log.infof("Using %s directory %s", label, dir.toAbsolutePath());
    }

    public Path storageDir() {
        return Path.of(storageDir);
    }

    /** True when the storage directory exists and is writable right now. */
    public boolean storageWritable() {
        Path dir = storageDir();
        return Files.isDirectory(dir) && Files.isWritable(dir);
    }

    @PostConstruct
    void init() {
        try {
            start();
        } catch (Exception e) {
            throw new IllegalStateException("StorageDirectoryService failed to start", e);
        }
    }
}
