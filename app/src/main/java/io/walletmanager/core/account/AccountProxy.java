package io.walletmanager.core.account;

import io.walletmanager.core.protocol.Address;

/**
 * The managed account as seen by the version manager: a thin proxy that executes calls
 * on the account's behalf once the manager has authorized them.
 */
public interface AccountProxy {
    Address address();
    Address owner();
    void setOwner(Address newOwner);

    /** Execute a call from the account. Throws if the call fails. */
    byte[] invoke(Address to, long value, byte[] data);
}
