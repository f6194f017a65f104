package com.libragraph.filestore.core.upload;

import jakarta.enterprise.context.ApplicationScoped;
import org.apache.tika.Tika;

/**
 * Picks the content type recorded for an upload. The client-declared type wins
 * unless it is absent or the generic octet-stream, in which case the type is
 * guessed from the original filename.
 */
@ApplicationScoped
public class MimeTypeDetector {

    static final String OCTET_STREAM = "application/octet-stream";

    private final Tika tika = new Tika();

    public String detect(String originalFilename, String declared) {
        if (declared != null && !declared.isBlank() && !OCTET_STREAM.equalsIgnoreCase(declared.trim())) {
            return declared.trim();
        }
        return tika.detect(originalFilename);
    }
}
