package com.libragraph.filestore.core.access;

public enum AccessDecision {
    PERMITTED,
    DENIED
}
