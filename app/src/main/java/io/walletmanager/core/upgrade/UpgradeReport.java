package io.walletmanager.core.upgrade;

import io.walletmanager.core.protocol.Address;

import java.util.List;

/** What an upgrade changed: the authorization delta and the setup hooks that ran. */
public final class UpgradeReport {
    private final Address account;
    private final long fromVersion;
    private final long toVersion;
    private final List<Address> authorized;
    private final List<Address> deauthorized;
    private final List<Address> initialized;
    private final int queuedWrites;

    public UpgradeReport(Address account, long fromVersion, long toVersion,
                         List<Address> authorized, List<Address> deauthorized, List<Address> initialized,
                         int queuedWrites) {
        this.account = account;
        this.fromVersion = fromVersion;
        this.toVersion = toVersion;
        this.authorized = List.copyOf(authorized);
        this.deauthorized = List.copyOf(deauthorized);
        this.initialized = List.copyOf(initialized);
        this.queuedWrites = queuedWrites;
    }

    public Address account() { return account; }
    public long fromVersion() { return fromVersion; }
    public long toVersion() { return toVersion; }
    public List<Address> authorized() { return authorized; }
    public List<Address> deauthorized() { return deauthorized; }
    public List<Address> initialized() { return initialized; }
    /** Writes issued by setup hooks and applied after the commit. */
    public int queuedWrites() { return queuedWrites; }

    @Override
    public String toString() {
        return account + " v" + fromVersion + " -> v" + toVersion
                + " (+" + authorized.size() + " -" + deauthorized.size() + ", init " + initialized.size() + ")";
    }
}
