package io.walletmanager.core.account;

import io.walletmanager.core.module.OwnershipOracle;
import io.walletmanager.core.protocol.Address;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Known accounts by address. Doubles as the ownership oracle: the account's current
 * owner is its owner authority.
 */
public final class InMemoryAccountDirectory implements AccountDirectory, OwnershipOracle {

    private final Map<Address, AccountProxy> accounts = new ConcurrentHashMap<>();

    public InMemoryAccountDirectory register(AccountProxy account) {
        if (account == null || account.address() == null) {
            throw new IllegalArgumentException("Account with an address required");
        }
        if (accounts.putIfAbsent(account.address(), account) != null) {
            throw new IllegalArgumentException("Account already registered: " + account.address());
        }
        return this;
    }

    @Override
    public Optional<AccountProxy> lookup(Address account) {
        return account == null ? Optional.empty() : Optional.ofNullable(accounts.get(account));
    }

    @Override
    public boolean isOwnerAuthority(Address account, Address requester) {
        AccountProxy proxy = account == null ? null : accounts.get(account);
        return proxy != null && requester != null && requester.equals(proxy.owner());
    }

    public List<AccountProxy> list() {
        return List.copyOf(accounts.values());
    }
}
