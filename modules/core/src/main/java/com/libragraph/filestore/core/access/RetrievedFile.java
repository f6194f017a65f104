package com.libragraph.filestore.core.access;

import com.libragraph.filestore.types.FileRecord;

import java.io.InputStream;

/**
 * A permitted file: its record and an open stream over its bytes. The caller closes the stream.
 */
public record RetrievedFile(FileRecord record, InputStream content) {}
