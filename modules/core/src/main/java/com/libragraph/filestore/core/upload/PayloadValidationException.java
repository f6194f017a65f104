package com.libragraph.filestore.core.upload;

/**
 * An upload payload is malformed. Raised before any blob or catalog I/O.
 */
public class PayloadValidationException extends RuntimeException {

    public PayloadValidationException(String message) {
        super(message);
    }
}
