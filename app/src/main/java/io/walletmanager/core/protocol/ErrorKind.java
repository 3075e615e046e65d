package io.walletmanager.core.protocol;

public enum ErrorKind {
    /** Catalog invariant violated at registration time; nothing is appended. */
    CONFIGURATION,
    AUTHORIZATION,
    VERSION,
    /** A module setup hook failed; the whole upgrade is rolled back. */
    INITIALIZATION,
    STORAGE,
    INVOCATION
}
