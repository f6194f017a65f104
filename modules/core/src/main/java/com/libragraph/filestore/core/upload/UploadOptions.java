package com.libragraph.filestore.core.upload;

/**
 * Options sent alongside an upload. Files are private unless the client explicitly opts out.
 */
public record UploadOptions(boolean isPrivate) {

    public static UploadOptions defaults() {
        return new UploadOptions(true);
    }
}
