package com.libragraph.filestore.types;

/**
 * Result of deleting a single name from one store.
 *
 * <p>Catalog deletions carry the removed record; blob deletions carry none.
 * A failed outcome carries an error message and never a record.
 */
public record DeleteOutcome(FileRecord fileRecord, String error) {

    public static DeleteOutcome deleted(FileRecord fileRecord) {
        return new DeleteOutcome(fileRecord, null);
    }

    public static DeleteOutcome deleted() {
        return new DeleteOutcome(null, null);
    }

    public static DeleteOutcome failed(String error) {
        return new DeleteOutcome(null, error);
    }

    public boolean isDeleted() {
        return error == null;
    }
}
