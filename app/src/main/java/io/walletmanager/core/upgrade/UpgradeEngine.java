package io.walletmanager.core.upgrade;

import io.walletmanager.core.auth.AuthorizationGate;
import io.walletmanager.core.catalog.FeatureSet;
import io.walletmanager.core.catalog.FeatureSetCatalog;
import io.walletmanager.core.metrics.ManagerMetrics;
import io.walletmanager.core.module.LockOracle;
import io.walletmanager.core.module.Module;
import io.walletmanager.core.module.ModuleRegistry;
import io.walletmanager.core.module.OwnershipOracle;
import io.walletmanager.core.protocol.Address;
import io.walletmanager.core.protocol.RejectionException;
import io.walletmanager.core.protocol.RejectionReason;
import io.walletmanager.core.state.UpgradeGuard;
import io.walletmanager.core.storage.ManagerStore;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Moves an account from its current feature-set version to another one.
 *
 * The account state only changes in the final commit: setup hooks run first, and if any
 * of them throws the account stays on its prior version with no init flag recorded.
 * Storage and account writes issued while the hooks run are queued and applied right
 * after the commit, so a failed upgrade leaves no trace of the hooks that did run.
 * "Initialized" is tracked per (account, module) for the account's whole lifetime, so
 * a module dropped and re-added later (N -> M -> N) is not set up again.
 */
public final class UpgradeEngine {
    private static final Logger LOG = Logger.getLogger(UpgradeEngine.class.getName());

    private final FeatureSetCatalog catalog;
    private final ManagerStore store;
    private final ModuleRegistry registry;
    private final AuthorizationGate gate;
    private final UpgradeGuard guard;
    private final OwnershipOracle owners;
    private final LockOracle locks;

    public UpgradeEngine(FeatureSetCatalog catalog,
                         ManagerStore store,
                         ModuleRegistry registry,
                         AuthorizationGate gate,
                         UpgradeGuard guard,
                         OwnershipOracle owners,
                         LockOracle locks) {
        this.catalog = Objects.requireNonNull(catalog, "catalog");
        this.store = Objects.requireNonNull(store, "store");
        this.registry = Objects.requireNonNull(registry, "registry");
        this.gate = Objects.requireNonNull(gate, "gate");
        this.guard = Objects.requireNonNull(guard, "guard");
        this.owners = Objects.requireNonNull(owners, "owners");
        this.locks = Objects.requireNonNull(locks, "locks");
    }

    public UpgradeReport upgradeAccount(Address account, long toVersion, Address requester) {
        if (account == null || requester == null) {
            throw new IllegalArgumentException("account and requester are required");
        }
        // reserve first so the checks below and the commit see the same account state;
        // a setup hook calling back for the same account is rejected here
        try (UpgradeGuard.Scope scope = guard.enter(account, toVersion)) {
            if (!owners.isOwnerAuthority(account, requester) && !gate.isAuthorized(account, requester)) {
                throw new RejectionException(RejectionReason.NOT_OWNER_AUTHORITY,
                        "Requester " + requester + " may not upgrade " + account);
            }
            if (locks.isLocked(account)) {
                throw new RejectionException(RejectionReason.ACCOUNT_LOCKED, "Account " + account + " is locked");
            }
            FeatureSet target = catalog.getFeatureSet(toVersion).orElseThrow(() -> new RejectionException(
                    RejectionReason.INVALID_VERSION,
                    "Invalid version " + toVersion + " (last is " + catalog.lastVersion() + ")"));
            long fromVersion = store.getAccountVersion(account);
            if (fromVersion == toVersion) {
                throw new RejectionException(RejectionReason.ALREADY_ON_VERSION,
                        "Account " + account + " already on v" + toVersion);
            }
            scope.activate();
            return ManagerMetrics.recordUpgrade(() -> apply(scope, account, fromVersion, target));
        }
    }

    private UpgradeReport apply(UpgradeGuard.Scope scope, Address account, long fromVersion, FeatureSet target) {
        List<Address> oldFeatures = catalog.getFeatureSet(fromVersion)
                .map(FeatureSet::features)
                .orElse(List.of());

        List<Address> added = new ArrayList<>();
        List<Address> removed = new ArrayList<>();
        for (Address module : target.features()) {
            if (!oldFeatures.contains(module)) added.add(module);
        }
        for (Address module : oldFeatures) {
            if (!target.contains(module)) removed.add(module);
        }

        List<Address> initialized = new ArrayList<>();
        for (Address moduleAddress : added) {
            if (!target.requiresInitialization(moduleAddress) || store.isInitialized(account, moduleAddress)) {
                continue;
            }
            runSetup(account, moduleAddress);
            initialized.add(moduleAddress);
        }

        // deauthorization needs no step of its own: authorization is derived from the bound version
        store.commitUpgrade(account, target.version(), initialized);
        int applied = applyQueued(account, scope.drain());

        ManagerMetrics.incrementUpgrades();
        ManagerMetrics.incrementModuleInits(initialized.size());
        UpgradeReport report = new UpgradeReport(account, fromVersion, target.version(),
                added, removed, initialized, applied);
        LOG.info("Account upgraded: " + report);
        return report;
    }

    /** Writes the hooks issued were validated when queued; one that still fails does not undo the commit. */
    private static int applyQueued(Address account, List<Runnable> effects) {
        int applied = 0;
        for (Runnable effect : effects) {
            try {
                effect.run();
                applied++;
            } catch (RejectionException e) {
                ManagerMetrics.recordRejection(e.reason());
                LOG.log(Level.WARNING, "Queued write for " + account + " failed after commit: " + e.getMessage(), e);
            }
        }
        return applied;
    }

    private void runSetup(Address account, Address moduleAddress) {
        if (!registry.isRegisteredModule(moduleAddress)) {
            throw RejectionException.initializationFailed(moduleAddress,
                    new IllegalStateException("module is not registered"));
        }
        Module module = registry.lookup(moduleAddress).orElseThrow(() -> RejectionException.initializationFailed(
                moduleAddress, new IllegalStateException("no module deployed at address")));
        try {
            module.initialize(account);
        } catch (RuntimeException e) {
            throw RejectionException.initializationFailed(moduleAddress, e);
        }
    }
}
