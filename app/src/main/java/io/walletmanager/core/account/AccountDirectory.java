package io.walletmanager.core.account;

import io.walletmanager.core.protocol.Address;

import java.util.Optional;

public interface AccountDirectory {
    Optional<AccountProxy> lookup(Address account);
}
