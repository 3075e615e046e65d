package io.walletmanager.core.module;

import io.walletmanager.core.protocol.Address;

@FunctionalInterface
public interface LockOracle {
    LockOracle NEVER_LOCKED = account -> false;

    boolean isLocked(Address account);
}
