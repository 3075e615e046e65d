package io.walletmanager.core.manager;

import io.walletmanager.core.account.AccountDirectory;
import io.walletmanager.core.account.AccountProxy;
import io.walletmanager.core.auth.AuthorizationGate;
import io.walletmanager.core.auth.AuthorizationResult;
import io.walletmanager.core.catalog.FeatureSet;
import io.walletmanager.core.catalog.FeatureSetCatalog;
import io.walletmanager.core.invoke.AccountInvoker;
import io.walletmanager.core.invoke.ReadOnlyRouter;
import io.walletmanager.core.invoke.StorageInvocationGate;
import io.walletmanager.core.metrics.ManagerMetrics;
import io.walletmanager.core.module.LockOracle;
import io.walletmanager.core.module.ModuleRegistry;
import io.walletmanager.core.module.OwnershipOracle;
import io.walletmanager.core.module.StorageModule;
import io.walletmanager.core.protocol.Address;
import io.walletmanager.core.protocol.CallContext;
import io.walletmanager.core.protocol.CallData;
import io.walletmanager.core.protocol.RejectionException;
import io.walletmanager.core.state.AccountState;
import io.walletmanager.core.state.UpgradeGuard;
import io.walletmanager.core.storage.InMemoryManagerStore;
import io.walletmanager.core.storage.ManagerStore;
import io.walletmanager.core.storage.RocksDBManagerStore;
import io.walletmanager.core.upgrade.UpgradeEngine;
import io.walletmanager.core.upgrade.UpgradeReport;

import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;
import java.util.logging.Logger;

/**
 * Wires catalog, authorization, upgrades and invocation gates behind the entry points
 * that capability modules and account owners call.
 *
 * Every privileged entry point authorizes first and then does its work; a rejection is
 * counted, logged and rethrown to the caller unchanged. Writes made while the account
 * is being upgraded are validated immediately but applied only when the upgrade commits.
 */
public final class VersionManager implements AutoCloseable {
    private static final Logger LOG = Logger.getLogger(VersionManager.class.getName());

    private final ManagerStore store;
    private final ModuleRegistry registry;
    private final LockOracle locks;
    private final UpgradeGuard guard;
    private final FeatureSetCatalog catalog;
    private final AuthorizationGate gate;
    private final UpgradeEngine upgrades;
    private final StorageInvocationGate storageGate;
    private final AccountInvoker accountInvoker;
    private final ReadOnlyRouter readOnlyRouter;

    public VersionManager(ManagerStore store,
                          ModuleRegistry registry,
                          OwnershipOracle owners,
                          LockOracle locks,
                          AccountDirectory accounts,
                          Address catalogOwner) {
        this.store = store;
        this.registry = registry;
        this.locks = locks;
        this.guard = new UpgradeGuard();
        this.catalog = new FeatureSetCatalog(store, registry, catalogOwner);
        this.gate = new AuthorizationGate(catalog, store, registry, guard);
        this.upgrades = new UpgradeEngine(catalog, store, registry, gate, guard, owners, locks);
        this.storageGate = new StorageInvocationGate(catalog);
        this.accountInvoker = new AccountInvoker(accounts);
        this.readOnlyRouter = new ReadOnlyRouter(gate, registry);
    }

    /** Convenience factory for an in-memory manager. */
    public static VersionManager inMemory(ModuleRegistry registry,
                                          OwnershipOracle owners,
                                          LockOracle locks,
                                          AccountDirectory accounts,
                                          Address catalogOwner) {
        return new VersionManager(new InMemoryManagerStore(), registry, owners, locks, accounts, catalogOwner);
    }

    /** Convenience factory for a RocksDB-backed manager. */
    public static VersionManager rocks(String dataDir,
                                       ModuleRegistry registry,
                                       OwnershipOracle owners,
                                       LockOracle locks,
                                       AccountDirectory accounts,
                                       Address catalogOwner) {
        return new VersionManager(RocksDBManagerStore.open(dataDir), registry, owners, locks, accounts, catalogOwner);
    }

    // -------------------- catalog --------------------

    public long addFeatureSet(Address caller, List<Address> features, List<Address> toInitialize) {
        long version = guarded("addFeatureSet", () -> catalog.addFeatureSet(caller, features, toInitialize));
        ManagerMetrics.incrementFeatureSets();
        return version;
    }

    /** Register a storage module and bind its implementation. */
    public void registerStorage(Address caller, StorageModule storage) {
        if (storage == null) throw new IllegalArgumentException("storage required");
        guarded("registerStorage", () -> {
            catalog.registerStorage(caller, storage.address());
            storageGate.bind(storage);
            return null;
        });
    }

    /**
     * Bind the implementation of a storage module, registering it first when the
     * store does not know it yet. Used when reopening a persisted manager.
     */
    public void attachStorage(Address caller, StorageModule storage) {
        if (storage == null) throw new IllegalArgumentException("storage required");
        if (catalog.isRegisteredStorage(storage.address())) {
            storageGate.bind(storage);
        } else {
            registerStorage(caller, storage);
        }
    }

    public Optional<FeatureSet> getFeatureSet(long version) {
        return catalog.getFeatureSet(version);
    }

    public long lastVersion() {
        return catalog.lastVersion();
    }

    // -------------------- accounts --------------------

    public UpgradeReport upgradeAccount(Address account, long toVersion, Address requester) {
        return guarded("upgradeAccount", () -> upgrades.upgradeAccount(account, toVersion, requester));
    }

    public AccountState account(Address account) {
        if (account == null) throw new IllegalArgumentException("account required");
        long version = gate.boundVersion(account);
        List<Address> authorized = catalog.getFeatureSet(version).map(FeatureSet::features).orElse(List.of());
        return new AccountState(account, version, locks.isLocked(account), guard.status(account), authorized);
    }

    public boolean isAuthorized(Address account, Address module) {
        return gate.isAuthorized(account, module);
    }

    public AuthorizationResult check(Address account, Address callingModule, CallContext requested, CallContext execution) {
        return gate.check(account, callingModule, requested, execution);
    }

    public void authorize(Address account, Address callingModule, CallContext requested, CallContext execution) {
        guarded("authorize", () -> {
            gate.authorize(account, callingModule, requested, execution);
            return null;
        });
    }

    // -------------------- privileged entry points for modules --------------------

    public void invokeStorage(Address account, Address storage, CallData call, Address callingModule) {
        guarded("invokeStorage", () -> {
            gate.authorizeMutating(account, callingModule);
            Runnable write = storageGate.prepare(account, storage, call);
            defer("invokeStorage", account, write);
            return null;
        });
    }

    /**
     * Call out from the account. While the account is being upgraded the call is queued
     * until the upgrade commits and an empty result is returned.
     */
    public byte[] invokeAccount(Address account, Address callingModule, Address to, long value, byte[] data) {
        return guarded("invokeAccount", () -> {
            gate.authorizeMutating(account, callingModule);
            AccountProxy proxy = accountInvoker.resolve(account);
            byte[][] result = {new byte[0]};
            defer("invokeAccount", account, () -> result[0] = accountInvoker.invoke(proxy, account, to, value, data));
            return result[0];
        });
    }

    public void setOwner(Address account, Address callingModule, Address newOwner) {
        if (newOwner == null || newOwner.isZero()) {
            throw new IllegalArgumentException("New owner must be non-zero");
        }
        guarded("setOwner", () -> {
            gate.authorizeMutating(account, callingModule);
            AccountProxy proxy = accountInvoker.resolve(account);
            defer("setOwner", account, () -> accountInvoker.setOwner(proxy, account, newOwner));
            return null;
        });
    }

    /** Read-only query sent to the account, routed to the module serving the selector. */
    public byte[] staticCall(Address account, CallData call, CallContext execution) {
        return guarded("staticCall", () -> readOnlyRouter.staticCall(account, call, execution));
    }

    // -------------------- accessors --------------------

    public FeatureSetCatalog catalog() { return catalog; }
    public ModuleRegistry registry() { return registry; }
    public ManagerStore store() { return store; }

    /** Close underlying resources if any (e.g., RocksDB). */
    @Override
    public void close() {
        if (store instanceof AutoCloseable) {
            try {
                ((AutoCloseable) store).close();
            } catch (Exception e) {
                throw new IllegalStateException("Failed to close store", e);
            }
        }
    }

    private void defer(String operation, Address account, Runnable effect) {
        if (guard.deferOrRun(account, effect)) {
            LOG.fine(operation + " for " + account + " queued until its upgrade commits");
        }
    }

    private static <T> T guarded(String operation, Supplier<T> action) {
        try {
            return action.get();
        } catch (RejectionException e) {
            ManagerMetrics.recordRejection(e.reason());
            LOG.warning(operation + " rejected: " + e);
            throw e;
        }
    }
}
