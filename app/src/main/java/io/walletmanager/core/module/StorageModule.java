package io.walletmanager.core.module;

import io.walletmanager.core.protocol.Address;
import io.walletmanager.core.protocol.CallData;

/**
 * Storage owned by a subsystem (locks, guardians, limits). Modules write to it only
 * through the version manager, which checks the call targets the right account.
 */
public interface StorageModule {

    Address address();

    /**
     * Reject a write this storage would not accept, without applying it. Writes issued
     * during an upgrade are checked here when queued and handled after the commit.
     */
    default void check(CallData call) {
    }

    /** Apply an encoded write. Any exception means the write failed and was not applied. */
    void handle(CallData call);
}
