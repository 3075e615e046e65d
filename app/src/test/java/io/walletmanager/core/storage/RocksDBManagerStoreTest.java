package io.walletmanager.core.storage;

import io.walletmanager.core.Fixtures.CountingModule;
import io.walletmanager.core.account.BaseAccount;
import io.walletmanager.core.account.InMemoryAccountDirectory;
import io.walletmanager.core.catalog.FeatureSet;
import io.walletmanager.core.lock.LockStorage;
import io.walletmanager.core.manager.VersionManager;
import io.walletmanager.core.module.InMemoryModuleRegistry;
import io.walletmanager.core.protocol.Address;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static io.walletmanager.core.Fixtures.addr;
import static org.junit.jupiter.api.Assertions.*;

class RocksDBManagerStoreTest {

    @TempDir
    Path tempDir;

    private final Address a = addr("module-a");
    private final Address b = addr("module-b");
    private final Address wallet = addr("wallet");

    @Test
    void persistsCatalogAccountsAndInitFlags() {
        String dir = tempDir.resolve("db").toString();
        try (RocksDBManagerStore store = RocksDBManagerStore.open(dir)) {
            assertEquals(0, store.lastVersion());
            store.appendFeatureSet(new FeatureSet(1, List.of(a, b), List.of(a), Map.of("0x01020304", b)));
            store.registerStorage(addr("lock-storage"));
            store.commitUpgrade(wallet, 1, List.of(a));
        }
        try (RocksDBManagerStore store = RocksDBManagerStore.open(dir)) {
            assertEquals(1, store.lastVersion());
            FeatureSet fs = store.getFeatureSet(1).orElseThrow();
            assertEquals(List.of(a, b), fs.features());
            assertEquals(b, fs.staticCallTarget("0x01020304").orElseThrow());
            assertTrue(store.isStorageRegistered(addr("lock-storage")));
            assertEquals(1, store.registeredStorages().size());
            assertEquals(1, store.getAccountVersion(wallet));
            assertEquals(0, store.getAccountVersion(addr("other")));
            assertTrue(store.isInitialized(wallet, a));
            assertFalse(store.isInitialized(wallet, b));
            assertEquals(1, store.accountCount());
        }
    }

    @Test
    void enforcesAppendOrderAndUniqueStorages() {
        try (RocksDBManagerStore store = RocksDBManagerStore.open(tempDir.resolve("db").toString())) {
            assertThrows(IllegalStateException.class,
                    () -> store.appendFeatureSet(new FeatureSet(2, List.of(a), List.of(), Map.of())));
            store.registerStorage(addr("lock-storage"));
            assertThrows(IllegalStateException.class, () -> store.registerStorage(addr("lock-storage")));
            assertThrows(IllegalStateException.class, () -> store.commitUpgrade(wallet, 1, List.of()));
        }
    }

    @Test
    void reopenedManagerKeepsInitializationHistory() {
        String dir = tempDir.resolve("manager").toString();
        Address owner = addr("catalog-owner");
        Address alice = addr("alice");
        InMemoryModuleRegistry registry = new InMemoryModuleRegistry();
        CountingModule module = new CountingModule(a);
        registry.register(module).register(new CountingModule(b));
        InMemoryAccountDirectory accounts = new InMemoryAccountDirectory().register(new BaseAccount(wallet, alice));
        LockStorage lock = new LockStorage(addr("lock-storage"));

        try (VersionManager manager = VersionManager.rocks(dir, registry, accounts, lock, accounts, owner)) {
            manager.attachStorage(owner, lock);
            manager.addFeatureSet(owner, List.of(a, b), List.of(a));
            manager.addFeatureSet(owner, List.of(b), List.of());
            manager.upgradeAccount(wallet, 1, alice);
            manager.upgradeAccount(wallet, 2, alice);
        }
        try (VersionManager manager = VersionManager.rocks(dir, registry, accounts, lock, accounts, owner)) {
            manager.attachStorage(owner, lock);
            assertEquals(2, manager.lastVersion());
            assertEquals(2, manager.account(wallet).currentVersion());
            assertTrue(manager.upgradeAccount(wallet, 1, alice).initialized().isEmpty());
        }
        assertEquals(1, module.inits(wallet));
    }
}
