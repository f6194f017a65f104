/**
 * Shared utilities for all file store modules.
 *
 * <p>Contains storage-name generation and filename sanitization
 * ({@link com.libragraph.filestore.util.StorageNames}) and the tagged
 * {@link com.libragraph.filestore.util.ParseResult} used by boundary decoders.
 * No framework dependencies.
 */
package com.libragraph.filestore.util;
