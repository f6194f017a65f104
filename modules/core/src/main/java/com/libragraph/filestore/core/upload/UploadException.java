package com.libragraph.filestore.core.upload;

/**
 * An upload batch failed after I/O began. The cause is the first underlying failure;
 * partial writes have already been rolled back on a best-effort basis.
 */
public class UploadException extends RuntimeException {

    public UploadException(String message, Throwable cause) {
        super(message, cause);
    }
}
