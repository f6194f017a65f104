package com.libragraph.filestore.core.io;

import jakarta.annotation.PreDestroy;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Named;
import org.eclipse.microprofile.config.inject.ConfigProperty;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Produces the executor that blob and catalog I/O is subscribed on, so that
 * fanned-out store calls run in parallel off the event loop.
 */
@ApplicationScoped
public class IoExecutorProducer {

    @ConfigProperty(name = "filestore.io.threads", defaultValue = "8")
    int threads;

    private ExecutorService executor;

    @Produces
    @ApplicationScoped
    @Named("ioExecutor")
    public ExecutorService ioExecutor() {
        executor = Executors.newFixedThreadPool(threads, namedThreads("filestore-io-"));
        return executor;
    }

    @PreDestroy
    void shutdown() {
        if (executor != null) executor.shutdown();
    }

    static ThreadFactory namedThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, prefix + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }
}
