package com.libragraph.filestore.api;

/**
 * A protected operation was called without an authenticated caller.
 */
public class NotAuthenticatedException extends RuntimeException {

    public NotAuthenticatedException() {
        super("Not Authenticated");
    }
}
