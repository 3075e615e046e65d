package io.walletmanager.core.state;

import io.walletmanager.core.protocol.Address;

import java.util.List;

/**
 * Read-only snapshot of one managed account. The authorized module list is
 * derived from the bound feature set, never stored on its own.
 */
public final class AccountState {

    public enum Status { IDLE, UPGRADING }

    private final Address account;
    private final long currentVersion;
    private final boolean locked;
    private final Status status;
    private final List<Address> authorizedModules;

    public AccountState(Address account, long currentVersion, boolean locked, Status status, List<Address> authorizedModules) {
        this.account = account;
        this.currentVersion = currentVersion;
        this.locked = locked;
        this.status = status;
        this.authorizedModules = authorizedModules == null ? List.of() : List.copyOf(authorizedModules);
    }

    public Address account() { return account; }
    public long currentVersion() { return currentVersion; }
    public boolean locked() { return locked; }
    public Status status() { return status; }
    public List<Address> authorizedModules() { return authorizedModules; }
    public boolean isVersioned() { return currentVersion > 0; }

    @Override
    public String toString() {
        return "AccountState(" + account + ", v" + currentVersion + (locked ? ", locked" : "") + ", " + status + ")";
    }
}
