package io.walletmanager.core.catalog;

import io.walletmanager.core.module.Module;
import io.walletmanager.core.module.ModuleRegistry;
import io.walletmanager.core.protocol.Address;
import io.walletmanager.core.protocol.RejectionException;
import io.walletmanager.core.protocol.RejectionReason;
import io.walletmanager.core.storage.ManagerStore;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.logging.Logger;

/**
 * Append-only, ordered list of feature sets plus the storage-registration table.
 * Only the owner identity given at construction may append.
 * Entries are never mutated or removed, so they are cached per version once read.
 */
public final class FeatureSetCatalog {
    private static final Logger LOG = Logger.getLogger(FeatureSetCatalog.class.getName());

    private final ManagerStore store;
    private final ModuleRegistry registry;
    private final Address owner;
    private final Map<Long, FeatureSet> cache = new ConcurrentHashMap<>();

    public FeatureSetCatalog(ManagerStore store, ModuleRegistry registry, Address owner) {
        this.store = Objects.requireNonNull(store, "store");
        this.registry = Objects.requireNonNull(registry, "registry");
        this.owner = Objects.requireNonNull(owner, "owner");
    }

    public Address owner() {
        return owner;
    }

    /**
     * Append a new feature set and return its version (previous max + 1).
     * Nothing is appended when any check fails.
     */
    public synchronized long addFeatureSet(Address caller, List<Address> features, List<Address> toInitialize) {
        requireOwner(caller);
        if (features == null || toInitialize == null) {
            throw new IllegalArgumentException("features and toInitialize required");
        }
        for (Address feature : features) {
            if (feature != null && store.isStorageRegistered(feature)) {
                throw new RejectionException(RejectionReason.DUPLICATE_STORAGE_OR_MODULE,
                        "Address already registered as storage: " + feature);
            }
        }
        long version = store.lastVersion() + 1;
        // validates duplicates and the init subset before we resolve anything
        FeatureSet draft = new FeatureSet(version, features, toInitialize, Map.of());
        FeatureSet featureSet = new FeatureSet(version, draft.features(), List.copyOf(draft.toInitialize()),
                collectStaticCallRoutes(draft.features()));
        store.appendFeatureSet(featureSet);
        cache.put(version, featureSet);
        LOG.info("Feature set v" + version + " added: " + featureSet.features().size() + " features, "
                + featureSet.toInitialize().size() + " to initialize, "
                + featureSet.staticCallRoutes().size() + " static calls");
        return version;
    }

    /** Register a storage module address. Registrations are permanent. */
    public synchronized void registerStorage(Address caller, Address storage) {
        requireOwner(caller);
        if (storage == null || storage.isZero()) {
            throw new IllegalArgumentException("Storage address must be non-zero");
        }
        if (store.isStorageRegistered(storage)) {
            throw new RejectionException(RejectionReason.DUPLICATE_STORAGE_OR_MODULE,
                    "Storage already added: " + storage);
        }
        if (isFeatureInAnyVersion(storage)) {
            throw new RejectionException(RejectionReason.DUPLICATE_STORAGE_OR_MODULE,
                    "Address already used as a feature: " + storage);
        }
        store.registerStorage(storage);
        LOG.info("Storage registered: " + storage);
    }

    public Optional<FeatureSet> getFeatureSet(long version) {
        if (version < 1) {
            return Optional.empty();
        }
        FeatureSet cached = cache.get(version);
        if (cached != null) {
            return Optional.of(cached);
        }
        Optional<FeatureSet> loaded = store.getFeatureSet(version);
        loaded.ifPresent(fs -> cache.putIfAbsent(version, fs));
        return loaded;
    }

    public long lastVersion() {
        return store.lastVersion();
    }

    public boolean isRegisteredStorage(Address storage) {
        return storage != null && store.isStorageRegistered(storage);
    }

    public Set<Address> storages() {
        return store.registeredStorages();
    }

    private void requireOwner(Address caller) {
        if (!owner.equals(caller)) {
            throw new RejectionException(RejectionReason.NOT_CATALOG_OWNER,
                    "Caller " + caller + " is not the catalog owner");
        }
    }

    private Map<String, Address> collectStaticCallRoutes(List<Address> features) {
        Map<String, Address> routes = new LinkedHashMap<>();
        for (Address feature : features) {
            Module module = registry.lookup(feature).orElseThrow(() -> new RejectionException(
                    RejectionReason.UNKNOWN_MODULE, "No module deployed at " + feature));
            for (String selector : module.staticCallSelectors()) {
                Address previous = routes.putIfAbsent(selector.toLowerCase(Locale.ROOT), feature);
                if (previous != null) {
                    throw new RejectionException(RejectionReason.DUPLICATE_STATIC_SELECTOR,
                            "Static call " + selector + " served by both " + previous + " and " + feature);
                }
            }
        }
        return routes;
    }

    private boolean isFeatureInAnyVersion(Address address) {
        long last = store.lastVersion();
        for (long v = 1; v <= last; v++) {
            if (getFeatureSet(v).map(fs -> fs.contains(address)).orElse(false)) {
                return true;
            }
        }
        return false;
    }
}
