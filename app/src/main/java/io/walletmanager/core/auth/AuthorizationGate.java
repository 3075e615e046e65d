package io.walletmanager.core.auth;

import io.walletmanager.core.catalog.FeatureSet;
import io.walletmanager.core.catalog.FeatureSetCatalog;
import io.walletmanager.core.module.ModuleRegistry;
import io.walletmanager.core.protocol.Address;
import io.walletmanager.core.protocol.CallContext;
import io.walletmanager.core.protocol.RejectionReason;
import io.walletmanager.core.state.UpgradeGuard;
import io.walletmanager.core.storage.ManagerStore;

import java.util.Objects;
import java.util.Optional;

/**
 * Decides whether a calling module may act for an account under the account's bound version.
 *
 * Checks, in order:
 * 1. the module is registered and not revoked in the module registry
 * 2. the account is bound to some version (not 0)
 * 3. the module is a feature of that version
 * 4. the claimed call class matches the execution context: a read-only claim must run
 *    inside a read-only context, a mutating call must not run inside one
 *
 * Once an upgrade has passed its checks and starts running setup hooks, the account's
 * effective version is the upgrade's target, so hooks act under the version they are
 * being initialized for.
 */
public final class AuthorizationGate {

    private final FeatureSetCatalog catalog;
    private final ManagerStore store;
    private final ModuleRegistry registry;
    private final UpgradeGuard guard;

    public AuthorizationGate(FeatureSetCatalog catalog, ManagerStore store, ModuleRegistry registry, UpgradeGuard guard) {
        this.catalog = Objects.requireNonNull(catalog, "catalog");
        this.store = Objects.requireNonNull(store, "store");
        this.registry = Objects.requireNonNull(registry, "registry");
        this.guard = Objects.requireNonNull(guard, "guard");
    }

    public long boundVersion(Address account) {
        return store.getAccountVersion(account);
    }

    public long effectiveVersion(Address account) {
        return guard.pendingVersion(account).orElseGet(() -> store.getAccountVersion(account));
    }

    public Optional<FeatureSet> effectiveFeatureSet(Address account) {
        return catalog.getFeatureSet(effectiveVersion(account));
    }

    public AuthorizationResult check(Address account, Address callingModule, CallContext requested, CallContext execution) {
        if (account == null || callingModule == null || requested == null || execution == null) {
            throw new IllegalArgumentException("account, callingModule, requested and execution are required");
        }
        if (!registry.isRegisteredModule(callingModule)) {
            return AuthorizationResult.rejected(RejectionReason.MODULE_NOT_AUTHORIZED,
                    "Module " + callingModule + " is not registered");
        }
        long version = effectiveVersion(account);
        if (version == 0) {
            return AuthorizationResult.rejected(RejectionReason.ACCOUNT_NOT_UPGRADED,
                    "Account " + account + " is not bound to any version");
        }
        Optional<FeatureSet> featureSet = catalog.getFeatureSet(version);
        if (featureSet.isEmpty() || !featureSet.get().contains(callingModule)) {
            return AuthorizationResult.rejected(RejectionReason.MODULE_NOT_AUTHORIZED,
                    "Module " + callingModule + " is not a feature of v" + version + " for " + account);
        }
        if (requested.isReadOnly() && !execution.isReadOnly()) {
            return AuthorizationResult.rejected(RejectionReason.STATIC_CALL_REQUIRED,
                    "Read-only call claimed inside a mutating context");
        }
        if (!requested.isReadOnly() && execution.isReadOnly()) {
            return AuthorizationResult.rejected(RejectionReason.MUTATING_CALL_IN_READ_ONLY_CONTEXT,
                    "Mutating call attempted inside a read-only context");
        }
        return AuthorizationResult.authorized();
    }

    /** Same as {@link #check} but throws on rejection. */
    public void authorize(Address account, Address callingModule, CallContext requested, CallContext execution) {
        check(account, callingModule, requested, execution).orThrow();
    }

    /** Mutating call in a mutating context, the common case for privileged writes. */
    public void authorizeMutating(Address account, Address callingModule) {
        authorize(account, callingModule, CallContext.MUTATING, CallContext.MUTATING);
    }

    public boolean isAuthorized(Address account, Address module) {
        return check(account, module, CallContext.MUTATING, CallContext.MUTATING).ok;
    }
}
