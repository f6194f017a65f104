package com.libragraph.filestore.core.delete;

import com.libragraph.filestore.types.FileRecord;

import java.util.List;

/**
 * Merged result of deleting one storage name from both stores.
 *
 * @param fileDetails the removed catalog record, or null when the catalog had none
 * @param errors      catalog error first, then blob error; empty on full success
 */
public record DeleteReport(String filename, FileRecord fileDetails, List<String> errors) {

    public DeleteReport {
        errors = List.copyOf(errors);
    }

    public boolean succeeded() {
        return errors.isEmpty();
    }
}
