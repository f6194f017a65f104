package com.libragraph.filestore.core.upload;

import java.nio.file.Path;

/**
 * One file as handed over by the request parser: bytes already staged on disk.
 * {@code mimeType} may be null; {@code declaredSize} is null when the parser did not supply it.
 */
public record UploadedPayload(
        Path stagedPath,
        String originalFilename,
        String mimeType,
        Long declaredSize
) {}
