package io.walletmanager.core.manager;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.walletmanager.core.protocol.Address;
import io.walletmanager.core.protocol.Hashes;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Deployment config for a manager: catalog owner, lock storage, the feature sets to
 * publish (in version order) and the accounts to manage.
 *
 * JSON form:
 * <pre>
 * {
 *   "catalogOwner": "0x..",
 *   "lockStorage": "0x..",
 *   "featureSets": [ { "features": ["0x.."], "toInitialize": ["0x.."] } ],
 *   "accounts": [ { "address": "0x..", "owner": "0x..", "balance": 1000 } ]
 * }
 * </pre>
 */
public final class ManagerConfig {
    private static final ObjectMapper JSON = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    public final Address catalogOwner;
    public final Address lockStorage;
    public final List<FeatureSetSpec> featureSets;
    public final List<AccountSpec> accounts;

    public ManagerConfig(Address catalogOwner, Address lockStorage, List<FeatureSetSpec> featureSets, List<AccountSpec> accounts) {
        if (catalogOwner == null || lockStorage == null) {
            throw new IllegalArgumentException("catalogOwner and lockStorage are required");
        }
        this.catalogOwner = catalogOwner;
        this.lockStorage = lockStorage;
        this.featureSets = featureSets == null ? List.of() : List.copyOf(featureSets);
        this.accounts = accounts == null ? List.of() : List.copyOf(accounts);
    }

    public static final class FeatureSetSpec {
        public final List<Address> features;
        public final List<Address> toInitialize;

        public FeatureSetSpec(List<Address> features, List<Address> toInitialize) {
            this.features = List.copyOf(features);
            this.toInitialize = toInitialize == null ? List.of() : List.copyOf(toInitialize);
        }
    }

    public static final class AccountSpec {
        public final Address address;
        public final Address owner;
        public final long balance;

        public AccountSpec(Address address, Address owner, long balance) {
            this.address = address;
            this.owner = owner;
            this.balance = balance;
        }
    }

    public static ManagerConfig defaultLocal() {
        Address guardian = labelled("guardian-manager");
        Address relayer = labelled("relayer-manager");
        Address transfer = labelled("transfer-manager");
        return new ManagerConfig(
                labelled("catalog-owner"),
                labelled("lock-storage"),
                List.of(
                        new FeatureSetSpec(List.of(guardian, relayer), List.of(guardian)),
                        new FeatureSetSpec(List.of(guardian, relayer, transfer), List.of(transfer))
                ),
                List.of(
                        new AccountSpec(labelled("alice-wallet"), labelled("alice"), 1_000_000L),
                        new AccountSpec(labelled("bob-wallet"), labelled("bob"), 500_000L)
                )
        );
    }

    /** Deterministic address for a label: first 20 bytes of SHA-256(label). */
    public static Address labelled(String label) {
        byte[] digest = Hashes.sha256(label.getBytes(StandardCharsets.UTF_8));
        return new Address(Arrays.copyOf(digest, Address.LENGTH));
    }

    /** Every module address named by any feature set, in first-seen order. */
    public Set<Address> moduleAddresses() {
        Set<Address> out = new LinkedHashSet<>();
        for (FeatureSetSpec spec : featureSets) {
            out.addAll(spec.features);
        }
        return out;
    }

    public static ManagerConfig load(Path path) {
        ConfigFile file;
        try {
            file = JSON.readValue(path.toFile(), ConfigFile.class);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read manager config from " + path, e);
        }
        if (file == null || file.catalogOwner == null || file.lockStorage == null) {
            throw new IllegalStateException("Manager config " + path + " must set catalogOwner and lockStorage");
        }
        List<FeatureSetSpec> sets = new ArrayList<>();
        if (file.featureSets != null) {
            for (FeatureSetEntry entry : file.featureSets) {
                if (entry == null || entry.features == null) {
                    throw new IllegalStateException("Feature set entry without features in " + path);
                }
                sets.add(new FeatureSetSpec(addresses(entry.features), addresses(entry.toInitialize)));
            }
        }
        List<AccountSpec> accounts = new ArrayList<>();
        if (file.accounts != null) {
            for (AccountEntry entry : file.accounts) {
                if (entry == null || entry.address == null || entry.owner == null) {
                    throw new IllegalStateException("Account entry needs address and owner in " + path);
                }
                accounts.add(new AccountSpec(Address.fromHex(entry.address), Address.fromHex(entry.owner), entry.balance));
            }
        }
        return new ManagerConfig(Address.fromHex(file.catalogOwner), Address.fromHex(file.lockStorage), sets, accounts);
    }

    public void save(Path path) {
        ConfigFile file = new ConfigFile();
        file.catalogOwner = catalogOwner.hex();
        file.lockStorage = lockStorage.hex();
        file.featureSets = new ArrayList<>();
        for (FeatureSetSpec spec : featureSets) {
            FeatureSetEntry entry = new FeatureSetEntry();
            entry.features = hexes(spec.features);
            entry.toInitialize = hexes(spec.toInitialize);
            file.featureSets.add(entry);
        }
        file.accounts = new ArrayList<>();
        for (AccountSpec spec : accounts) {
            AccountEntry entry = new AccountEntry();
            entry.address = spec.address.hex();
            entry.owner = spec.owner.hex();
            entry.balance = spec.balance;
            file.accounts.add(entry);
        }
        try {
            JSON.writerWithDefaultPrettyPrinter().writeValue(path.toFile(), file);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to persist manager config to " + path, e);
        }
    }

    private static List<Address> addresses(List<String> hexes) {
        List<Address> out = new ArrayList<>();
        if (hexes != null) {
            for (String hex : hexes) out.add(Address.fromHex(hex));
        }
        return out;
    }

    private static List<String> hexes(List<Address> addresses) {
        List<String> out = new ArrayList<>();
        for (Address a : addresses) out.add(a.hex());
        return out;
    }

    private static class ConfigFile {
        public String catalogOwner;
        public String lockStorage;
        public List<FeatureSetEntry> featureSets;
        public List<AccountEntry> accounts;
    }

    private static class FeatureSetEntry {
        public List<String> features;
        public List<String> toInitialize;
    }

    private static class AccountEntry {
        public String address;
        public String owner;
        public long balance;
    }
}
