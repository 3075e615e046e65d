package io.walletmanager.core.storage;

import io.walletmanager.core.catalog.FeatureSet;
import io.walletmanager.core.protocol.Address;
import org.rocksdb.*;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Persistent ManagerStore using RocksDB.
 *
 * Layout (column families):
 *  - "featuresets": key = version(8, big-endian), val = FeatureSetCodec bytes
 *  - "storages"   : key = storage address(20),    val = 0x01
 *  - "accounts"   : key = account address(20),    val = version(8, big-endian)
 *  - "inits"      : key = account(20) | module(20), val = 0x01
 *  - "meta"       : key = "lastVersion",          val = version(8, big-endian)
 */
public final class RocksDBManagerStore implements ManagerStore, AutoCloseable {

    static {
        RocksDB.loadLibrary();
    }

    private static final byte[] LAST_VERSION = "lastVersion".getBytes(StandardCharsets.US_ASCII);
    private static final byte[] PRESENT = new byte[] {1};

    private final RocksDB db;
    private final ColumnFamilyHandle cfFeatureSets;
    private final ColumnFamilyHandle cfStorages;
    private final ColumnFamilyHandle cfAccounts;
    private final ColumnFamilyHandle cfInits;
    private final ColumnFamilyHandle cfMeta;
    private final List<ColumnFamilyHandle> handles;
    private final DBOptions dbOptions;

    private RocksDBManagerStore(RocksDB db, List<ColumnFamilyHandle> handles, DBOptions dbOptions) {
        this.db = db;
        this.handles = handles;
        // index 0 is the default CF
        this.cfFeatureSets = handles.get(1);
        this.cfStorages = handles.get(2);
        this.cfAccounts = handles.get(3);
        this.cfInits = handles.get(4);
        this.cfMeta = handles.get(5);
        this.dbOptions = dbOptions;
    }

    /** Factory: open/create a store in the given directory path. */
    public static RocksDBManagerStore open(String dataDir) {
        DBOptions dbOpts = new DBOptions()
                .setCreateIfMissing(true)
                .setCreateMissingColumnFamilies(true);
        try {
            List<ColumnFamilyDescriptor> cfDescs = Arrays.asList(
                    new ColumnFamilyDescriptor(RocksDB.DEFAULT_COLUMN_FAMILY),
                    new ColumnFamilyDescriptor("featuresets".getBytes(StandardCharsets.US_ASCII)),
                    new ColumnFamilyDescriptor("storages".getBytes(StandardCharsets.US_ASCII)),
                    new ColumnFamilyDescriptor("accounts".getBytes(StandardCharsets.US_ASCII)),
                    new ColumnFamilyDescriptor("inits".getBytes(StandardCharsets.US_ASCII)),
                    new ColumnFamilyDescriptor("meta".getBytes(StandardCharsets.US_ASCII))
            );
            List<ColumnFamilyHandle> cfHandles = new ArrayList<>();
            RocksDB db = RocksDB.open(dbOpts, dataDir, cfDescs, cfHandles);
            return new RocksDBManagerStore(db, cfHandles, dbOpts);
        } catch (RocksDBException e) {
            dbOpts.close();
            throw new IllegalStateException("Failed to open RocksDB at " + dataDir, e);
        }
    }

    // -------------- ManagerStore API ----------------

    @Override
    public synchronized long lastVersion() {
        try {
            byte[] v = db.get(cfMeta, LAST_VERSION);
            return v == null ? 0L : bytesToLong(v);
        } catch (RocksDBException e) {
            throw new IllegalStateException("lastVersion failed", e);
        }
    }

    @Override
    public synchronized Optional<FeatureSet> getFeatureSet(long version) {
        if (version < 1) return Optional.empty();
        try {
            byte[] body = db.get(cfFeatureSets, longToBytes(version));
            return body == null ? Optional.empty() : Optional.of(FeatureSetCodec.fromBytes(body));
        } catch (RocksDBException e) {
            throw new IllegalStateException("getFeatureSet failed", e);
        }
    }

    @Override
    public synchronized void appendFeatureSet(FeatureSet featureSet) {
        if (featureSet == null) throw new IllegalArgumentException("featureSet required");
        long expected = lastVersion() + 1;
        if (featureSet.version() != expected) {
            throw new IllegalStateException("Expected version " + expected + " but got " + featureSet.version());
        }
        byte[] key = longToBytes(featureSet.version());
        try (WriteOptions wo = new WriteOptions().setSync(true);
             WriteBatch batch = new WriteBatch()) {
            batch.put(cfFeatureSets, key, FeatureSetCodec.toBytes(featureSet));
            batch.put(cfMeta, LAST_VERSION, key);
            db.write(wo, batch);
        } catch (RocksDBException e) {
            throw new IllegalStateException("appendFeatureSet failed", e);
        }
    }

    @Override
    public synchronized boolean isStorageRegistered(Address storage) {
        if (storage == null) return false;
        try {
            return db.get(cfStorages, storage.bytes()) != null;
        } catch (RocksDBException e) {
            throw new IllegalStateException("isStorageRegistered failed", e);
        }
    }

    @Override
    public synchronized void registerStorage(Address storage) {
        if (storage == null) throw new IllegalArgumentException("storage required");
        if (isStorageRegistered(storage)) {
            throw new IllegalStateException("Storage already registered: " + storage);
        }
        try {
            db.put(cfStorages, storage.bytes(), PRESENT);
        } catch (RocksDBException e) {
            throw new IllegalStateException("registerStorage failed", e);
        }
    }

    @Override
    public synchronized Set<Address> registeredStorages() {
        Set<Address> out = new LinkedHashSet<>();
        try (RocksIterator it = db.newIterator(cfStorages)) {
            for (it.seekToFirst(); it.isValid(); it.next()) {
                out.add(new Address(it.key()));
            }
        }
        return out;
    }

    @Override
    public synchronized long getAccountVersion(Address account) {
        if (account == null) return 0L;
        try {
            byte[] v = db.get(cfAccounts, account.bytes());
            return v == null ? 0L : bytesToLong(v);
        } catch (RocksDBException e) {
            throw new IllegalStateException("getAccountVersion failed", e);
        }
    }

    @Override
    public synchronized boolean isInitialized(Address account, Address module) {
        if (account == null || module == null) return false;
        try {
            return db.get(cfInits, initKey(account, module)) != null;
        } catch (RocksDBException e) {
            throw new IllegalStateException("isInitialized failed", e);
        }
    }

    @Override
    public synchronized void commitUpgrade(Address account, long toVersion, Collection<Address> newlyInitialized) {
        if (account == null) throw new IllegalArgumentException("account required");
        if (toVersion < 1 || toVersion > lastVersion()) {
            throw new IllegalStateException("Unknown version " + toVersion);
        }
        // batch for atomicity: version and init flags land together or not at all
        try (WriteOptions wo = new WriteOptions().setSync(true);
             WriteBatch batch = new WriteBatch()) {
            batch.put(cfAccounts, account.bytes(), longToBytes(toVersion));
            if (newlyInitialized != null) {
                for (Address module : newlyInitialized) {
                    batch.put(cfInits, initKey(account, module), PRESENT);
                }
            }
            db.write(wo, batch);
        } catch (RocksDBException e) {
            throw new IllegalStateException("commitUpgrade failed", e);
        }
    }

    @Override
    public synchronized long accountCount() {
        try (RocksIterator it = db.newIterator(cfAccounts)) {
            long n = 0;
            for (it.seekToFirst(); it.isValid(); it.next()) n++;
            return n;
        }
    }

    @Override
    public synchronized void close() {
        for (ColumnFamilyHandle handle : handles) {
            handle.close();
        }
        db.close();
        dbOptions.close();
    }

    // -------------- helpers ----------------

    private static byte[] initKey(Address account, Address module) {
        ByteBuffer b = ByteBuffer.allocate(Address.LENGTH * 2);
        b.put(account.bytes());
        b.put(module.bytes());
        return b.array();
    }

    private static byte[] longToBytes(long v) {
        ByteBuffer b = ByteBuffer.allocate(8);
        b.putLong(v);
        return b.array();
    }

    private static long bytesToLong(byte[] a) {
        return ByteBuffer.wrap(a).getLong();
    }
}
