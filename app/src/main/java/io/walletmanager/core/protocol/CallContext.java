package io.walletmanager.core.protocol;

/**
 * Class of a privileged call, and the kind of execution context it runs in.
 * The outermost dispatch layer decides the execution context and passes it down.
 */
public enum CallContext {
    MUTATING,
    READ_ONLY;

    public boolean isReadOnly() {
        return this == READ_ONLY;
    }
}
