package com.libragraph.filestore.core.access;

/**
 * Who is making a request, as established by the upstream gateway.
 *
 * @param ownerId null for anonymous callers
 */
public record CallerIdentity(boolean authenticated, String ownerId) {

    private static final CallerIdentity ANONYMOUS = new CallerIdentity(false, null);

    public CallerIdentity {
        if (authenticated && (ownerId == null || ownerId.isBlank())) {
            throw new IllegalArgumentException("authenticated caller needs an owner id");
        }
    }

    public static CallerIdentity anonymous() {
        return ANONYMOUS;
    }

    public static CallerIdentity of(String ownerId) {
        return new CallerIdentity(true, ownerId);
    }
}
