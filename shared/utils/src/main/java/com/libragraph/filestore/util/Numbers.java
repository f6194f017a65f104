package com.libragraph.filestore.util;

public final class Numbers {

    private Numbers() {}

    /** Parses a strictly positive base-10 int. */
    public static ParseResult<Integer> parsePositiveInt(String raw) {
        if (raw == null || raw.isBlank()) {
            return ParseResult.err("missing value");
        }
        try {
            int n = Integer.parseInt(raw.trim());
            return n > 0 ? ParseResult.ok(n) : ParseResult.err("must be > 0: " + raw);
        } catch (NumberFormatException e) {
            return ParseResult.err("not a number: " + raw);
        }
    }
}
