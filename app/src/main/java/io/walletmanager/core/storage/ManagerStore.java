package io.walletmanager.core.storage;

import io.walletmanager.core.catalog.FeatureSet;
import io.walletmanager.core.protocol.Address;

import java.util.Collection;
import java.util.Optional;
import java.util.Set;

/**
 * Persistence API for the version manager.
 *
 * Layout:
 * - feature sets: append-only log keyed by version (1-based, contiguous)
 * - storages: registered storage module addresses (never removed)
 * - accounts: current version per account (absent = 0, unversioned)
 * - inits: "ever initialized" flags keyed by (account, module)
 */
public interface ManagerStore {

    /** Highest version stored, 0 when empty. */
    long lastVersion();

    Optional<FeatureSet> getFeatureSet(long version);

    /** Append the next feature set. Its version must be exactly lastVersion() + 1. */
    void appendFeatureSet(FeatureSet featureSet);

    boolean isStorageRegistered(Address storage);

    /** Register a storage address. Fails if already present. */
    void registerStorage(Address storage);

    Set<Address> registeredStorages();

    /** Current version bound to the account, 0 if it was never upgraded. */
    long getAccountVersion(Address account);

    boolean isInitialized(Address account, Address module);

    /**
     * Bind the account to {@code toVersion} and record every module in
     * {@code newlyInitialized} as initialized for it, all in one step.
     */
    void commitUpgrade(Address account, long toVersion, Collection<Address> newlyInitialized);

    /** Number of accounts bound to some version (debug/metrics). */
    long accountCount();
}
