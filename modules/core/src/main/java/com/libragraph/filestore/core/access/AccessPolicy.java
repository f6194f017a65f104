package com.libragraph.filestore.core.access;

import com.libragraph.filestore.types.FileRecord;
import jakarta.enterprise.context.ApplicationScoped;

/**
 * Visibility rule for reading a file: public files are readable by anyone,
 * private files by any authenticated caller.
 */
@ApplicationScoped
public class AccessPolicy {

    public AccessDecision evaluate(boolean isPrivate, boolean authenticated) {
        if (!isPrivate || authenticated) {
            return AccessDecision.PERMITTED;
        }
        return AccessDecision.DENIED;
    }

    public AccessDecision evaluate(FileRecord record, CallerIdentity caller) {
        return evaluate(record.isPrivate(), caller.authenticated());
    }
}
