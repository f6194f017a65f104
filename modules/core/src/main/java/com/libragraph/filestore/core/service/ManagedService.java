package com.libragraph.filestore.core.service;

/**
 * Contract for infrastructure services with a managed lifecycle.
 * A service that cannot start moves to {@link State#FAILED} and reports the
 * cause to its caller; it never terminates the process itself.
 */
public interface ManagedService {

    enum State { STOPPED, STARTING, RUNNING, STOPPING, FAILED }

    String serviceId();

    State state();

    void start() throws Exception;

    void stop() throws Exception;

    void fail(Throwable cause);

    default boolean isRunning() {
        return state() == State.RUNNING;
    }
}
