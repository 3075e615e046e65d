package io.walletmanager.core.invoke;

import io.walletmanager.core.catalog.FeatureSetCatalog;
import io.walletmanager.core.metrics.ManagerMetrics;
import io.walletmanager.core.module.StorageModule;
import io.walletmanager.core.protocol.Address;
import io.walletmanager.core.protocol.CallData;
import io.walletmanager.core.protocol.RejectionException;
import io.walletmanager.core.protocol.RejectionReason;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Forwards a module's storage write to a registered storage module.
 *
 * Callers must have authorized the module (mutating) for the account already.
 * The first argument of the encoded call must name that same account; the target
 * check runs before the registration check so a redirected write is always
 * reported as a mismatch.
 */
public final class StorageInvocationGate {

    private final FeatureSetCatalog catalog;
    private final Map<Address, StorageModule> bound = new ConcurrentHashMap<>();

    public StorageInvocationGate(FeatureSetCatalog catalog) {
        this.catalog = Objects.requireNonNull(catalog, "catalog");
    }

    /** Attach the implementation behind an already registered storage address. */
    public void bind(StorageModule storage) {
        if (storage == null || storage.address() == null) {
            throw new IllegalArgumentException("Storage module with an address required");
        }
        if (!catalog.isRegisteredStorage(storage.address())) {
            throw new IllegalStateException("Storage not registered: " + storage.address());
        }
        bound.put(storage.address(), storage);
    }

    public Optional<StorageModule> boundStorage(Address storage) {
        return storage == null ? Optional.empty() : Optional.ofNullable(bound.get(storage));
    }

    public void invokeStorage(Address account, Address storage, CallData call) {
        prepare(account, storage, call).run();
    }

    /**
     * Run every check of {@link #invokeStorage} and return the write itself, to be run
     * now or once a pending upgrade commits.
     */
    public Runnable prepare(Address account, Address storage, CallData call) {
        if (account == null || call == null) {
            throw new IllegalArgumentException("account and call are required");
        }
        Optional<Address> target = call.addressAt(0);
        if (target.isEmpty() || !target.get().equals(account)) {
            throw new RejectionException(RejectionReason.TARGET_MISMATCH,
                    "Target of call data " + target.map(Address::hex).orElse("<none>") + " != " + account);
        }
        if (!catalog.isRegisteredStorage(storage)) {
            throw new RejectionException(RejectionReason.UNREGISTERED_STORAGE,
                    "Invalid storage invoked: " + storage);
        }
        StorageModule module = bound.get(storage);
        if (module == null) {
            throw new RejectionException(RejectionReason.STORAGE_CALL_FAILED,
                    "No implementation bound for storage " + storage);
        }
        try {
            module.check(call);
        } catch (RuntimeException e) {
            throw failed(storage, e);
        }
        return () -> {
            try {
                module.handle(call);
            } catch (RuntimeException e) {
                throw failed(storage, e);
            }
            ManagerMetrics.incrementStorageInvocations();
        };
    }

    private static RejectionException failed(Address storage, RuntimeException cause) {
        return new RejectionException(RejectionReason.STORAGE_CALL_FAILED,
                "Storage " + storage + " failed: " + cause.getMessage(), null, cause);
    }
}
