package io.walletmanager.core.storage;

import io.walletmanager.core.catalog.FeatureSet;
import io.walletmanager.core.protocol.Address;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Simple in-memory store. Good for tests and throwaway local runs; resets every process run.
 */
public final class InMemoryManagerStore implements ManagerStore {

    /** Index i holds version i + 1. */
    private final List<FeatureSet> featureSets = new ArrayList<>();
    private final Set<Address> storages = new LinkedHashSet<>();
    private final Map<Address, Long> accountVersions = new HashMap<>();
    private final Map<Address, Set<Address>> initialized = new HashMap<>();

    @Override
    public synchronized long lastVersion() {
        return featureSets.size();
    }

    @Override
    public synchronized Optional<FeatureSet> getFeatureSet(long version) {
        if (version < 1 || version > featureSets.size()) return Optional.empty();
        return Optional.of(featureSets.get((int) (version - 1)));
    }

    @Override
    public synchronized void appendFeatureSet(FeatureSet featureSet) {
        if (featureSet == null) throw new IllegalArgumentException("featureSet required");
        long expected = featureSets.size() + 1L;
        if (featureSet.version() != expected) {
            throw new IllegalStateException("Expected version " + expected + " but got " + featureSet.version());
        }
        featureSets.add(featureSet);
    }

    @Override
    public synchronized boolean isStorageRegistered(Address storage) {
        return storages.contains(storage);
    }

    @Override
    public synchronized void registerStorage(Address storage) {
        if (storage == null) throw new IllegalArgumentException("storage required");
        if (!storages.add(storage)) {
            throw new IllegalStateException("Storage already registered: " + storage);
        }
    }

    @Override
    public synchronized Set<Address> registeredStorages() {
        return Set.copyOf(storages);
    }

    @Override
    public synchronized long getAccountVersion(Address account) {
        return accountVersions.getOrDefault(account, 0L);
    }

    @Override
    public synchronized boolean isInitialized(Address account, Address module) {
        Set<Address> modules = initialized.get(account);
        return modules != null && modules.contains(module);
    }

    @Override
    public synchronized void commitUpgrade(Address account, long toVersion, Collection<Address> newlyInitialized) {
        if (account == null) throw new IllegalArgumentException("account required");
        if (toVersion < 1 || toVersion > featureSets.size()) {
            throw new IllegalStateException("Unknown version " + toVersion);
        }
        accountVersions.put(account, toVersion);
        if (newlyInitialized != null && !newlyInitialized.isEmpty()) {
            initialized.computeIfAbsent(account, k -> new HashSet<>()).addAll(newlyInitialized);
        }
    }

    @Override
    public synchronized long accountCount() {
        return accountVersions.size();
    }
}
