package com.libragraph.filestore.types;

import java.util.Optional;

public enum SortOrder {
    ORIGINAL_NAME("Filename"),
    DATE_ADDED("DateAdded");

    private final String label;

    SortOrder(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    /**
     * Looks up a sort order by its label or constant name, ignoring case.
     */
    public static Optional<SortOrder> fromLabel(String value) {
        if (value == null) return Optional.empty();
        for (SortOrder s : values()) {
            if (s.label.equalsIgnoreCase(value) || s.name().equalsIgnoreCase(value)) {
                return Optional.of(s);
            }
        }
        return Optional.empty();
    }
}
