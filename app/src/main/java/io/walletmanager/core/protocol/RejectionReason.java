package io.walletmanager.core.protocol;

import java.util.Locale;

/**
 * Reason tag attached to every rejected privileged call.
 */
public enum RejectionReason {
    DUPLICATE_STORAGE_OR_MODULE(ErrorKind.CONFIGURATION),
    INVALID_INIT_SUBSET(ErrorKind.CONFIGURATION),
    UNKNOWN_MODULE(ErrorKind.CONFIGURATION),
    DUPLICATE_STATIC_SELECTOR(ErrorKind.CONFIGURATION),
    INVALID_FEATURE(ErrorKind.CONFIGURATION),

    NOT_CATALOG_OWNER(ErrorKind.AUTHORIZATION),
    NOT_OWNER_AUTHORITY(ErrorKind.AUTHORIZATION),
    ACCOUNT_NOT_UPGRADED(ErrorKind.AUTHORIZATION),
    MODULE_NOT_AUTHORIZED(ErrorKind.AUTHORIZATION),
    STATIC_CALL_REQUIRED(ErrorKind.AUTHORIZATION),
    MUTATING_CALL_IN_READ_ONLY_CONTEXT(ErrorKind.AUTHORIZATION),
    STATIC_CALL_NOT_SUPPORTED(ErrorKind.AUTHORIZATION),
    ACCOUNT_LOCKED(ErrorKind.AUTHORIZATION),

    INVALID_VERSION(ErrorKind.VERSION),
    ALREADY_ON_VERSION(ErrorKind.VERSION),
    UPGRADE_IN_PROGRESS(ErrorKind.VERSION),

    INITIALIZATION_FAILED(ErrorKind.INITIALIZATION),

    UNREGISTERED_STORAGE(ErrorKind.STORAGE),
    TARGET_MISMATCH(ErrorKind.STORAGE),
    STORAGE_CALL_FAILED(ErrorKind.STORAGE),

    ACCOUNT_CALL_FAILED(ErrorKind.INVOCATION);

    private final ErrorKind kind;

    RejectionReason(ErrorKind kind) {
        this.kind = kind;
    }

    public ErrorKind kind() {
        return kind;
    }

    /** Wire form used in RPC responses and metric tags, e.g. "target_mismatch". */
    public String code() {
        return name().toLowerCase(Locale.ROOT);
    }
}
