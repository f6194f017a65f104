package com.libragraph.filestore.api;

/**
 * The request itself is malformed (bad body, bad upload options, no files).
 */
public class InvalidRequestException extends RuntimeException {

    public InvalidRequestException(String message) {
        super(message);
    }
}
