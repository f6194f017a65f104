package com.libragraph.filestore.util;

import java.util.UUID;
import java.util.regex.Pattern;

/**
 * Storage-name generation and sanitization of user-controlled names.
 */
public final class StorageNames {

    private static final Pattern DISALLOWED = Pattern.compile("[^A-Za-z0-9._-]+");
    private static final Pattern UNDERSCORE_RUN = Pattern.compile("_+");

    private StorageNames() {}

    /** Returns a fresh random storage name. */
    public static String generate() {
        return UUID.randomUUID().toString();
    }

    /**
     * Replaces every run of characters outside {@code [A-Za-z0-9._-]} with {@code _},
     * then collapses repeated underscores.
     */
    public static String sanitize(String name) {
        String replaced = DISALLOWED.matcher(name).replaceAll("_");
        return UNDERSCORE_RUN.matcher(replaced).replaceAll("_");
    }

    /**
     * True if {@code name} can be used as a single flat path segment as-is:
     * non-empty, already sanitized, and not a relative directory reference.
     */
    public static boolean isSafeSegment(String name) {
        if (name == null || name.isEmpty() || ".".equals(name) || "..".equals(name)) {
            return false;
        }
        return sanitize(name).equals(name);
    }
}
