package com.libragraph.filestore.types;

import java.util.List;

/**
 * One page of a catalog listing. {@code morePages} is true iff records exist
 * beyond this page.
 */
public record FilePage(List<FileRecord> files, boolean morePages) {

    public FilePage {
        files = List.copyOf(files);
    }

    public static FilePage empty() {
        return new FilePage(List.of(), false);
    }
}
