package io.walletmanager.core.catalog;

import io.walletmanager.core.protocol.Address;
import io.walletmanager.core.protocol.ProtocolLimits;
import io.walletmanager.core.protocol.RejectionException;
import io.walletmanager.core.protocol.RejectionReason;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Immutable, numbered bundle of modules authorized together.
 *
 * Invariants checked here, at creation time:
 * - version >= 1 (0 means "unversioned" and never names a feature set)
 * - at most MAX_FEATURES_PER_SET features, none of them null or zero
 * - no duplicate features
 * - toInitialize is a subset of features
 * - every static-call route points at one of the features
 */
public final class FeatureSet {

    private final long version;
    private final List<Address> features;
    private final Set<Address> featureIndex;
    private final Set<Address> toInitialize;
    private final Map<String, Address> staticCallRoutes;

    public FeatureSet(long version, List<Address> features, List<Address> toInitialize, Map<String, Address> staticCallRoutes) {
        if (version < 1) {
            throw new IllegalArgumentException("Feature set version must be >= 1");
        }
        if (features == null || toInitialize == null) {
            throw new IllegalArgumentException("features and toInitialize required");
        }
        if (features.size() > ProtocolLimits.MAX_FEATURES_PER_SET) {
            throw new RejectionException(RejectionReason.INVALID_FEATURE,
                    "At most " + ProtocolLimits.MAX_FEATURES_PER_SET + " features per set, got " + features.size());
        }
        LinkedHashSet<Address> index = new LinkedHashSet<>();
        for (Address feature : features) {
            if (feature == null || feature.isZero()) {
                throw new RejectionException(RejectionReason.INVALID_FEATURE, "Feature address must be non-zero");
            }
            if (!index.add(feature)) {
                throw new RejectionException(RejectionReason.DUPLICATE_STORAGE_OR_MODULE,
                        "Feature listed twice: " + feature);
            }
        }
        LinkedHashSet<Address> init = new LinkedHashSet<>();
        for (Address module : toInitialize) {
            if (module == null || !index.contains(module)) {
                throw new RejectionException(RejectionReason.INVALID_INIT_SUBSET,
                        "Module to initialize is not a feature of the set: " + module);
            }
            if (!init.add(module)) {
                throw new RejectionException(RejectionReason.DUPLICATE_STORAGE_OR_MODULE,
                        "Module listed twice for initialization: " + module);
            }
        }
        Map<String, Address> routes = new LinkedHashMap<>();
        if (staticCallRoutes != null) {
            for (Map.Entry<String, Address> route : staticCallRoutes.entrySet()) {
                if (!index.contains(route.getValue())) {
                    throw new IllegalArgumentException("Static call " + route.getKey() + " routed outside the set");
                }
                routes.put(route.getKey().toLowerCase(Locale.ROOT), route.getValue());
            }
        }
        this.version = version;
        this.features = Collections.unmodifiableList(new ArrayList<>(index));
        this.featureIndex = Collections.unmodifiableSet(index);
        this.toInitialize = Collections.unmodifiableSet(init);
        this.staticCallRoutes = Collections.unmodifiableMap(routes);
    }

    public long version() { return version; }
    public List<Address> features() { return features; }
    public Set<Address> toInitialize() { return toInitialize; }
    public Map<String, Address> staticCallRoutes() { return staticCallRoutes; }

    public boolean contains(Address module) {
        return featureIndex.contains(module);
    }

    public boolean requiresInitialization(Address module) {
        return toInitialize.contains(module);
    }

    public Optional<Address> staticCallTarget(String selectorHex) {
        if (selectorHex == null) return Optional.empty();
        return Optional.ofNullable(staticCallRoutes.get(selectorHex.toLowerCase(Locale.ROOT)));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof FeatureSet)) return false;
        FeatureSet other = (FeatureSet) o;
        return version == other.version
                && features.equals(other.features)
                && toInitialize.equals(other.toInitialize)
                && staticCallRoutes.equals(other.staticCallRoutes);
    }

    @Override
    public int hashCode() {
        return Long.hashCode(version) * 31 + features.hashCode();
    }

    @Override
    public String toString() {
        return "FeatureSet(v" + version + ", features=" + features + ", init=" + toInitialize + ")";
    }
}
