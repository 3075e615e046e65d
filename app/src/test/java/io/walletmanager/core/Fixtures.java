package io.walletmanager.core;

import io.walletmanager.core.account.BaseAccount;
import io.walletmanager.core.account.InMemoryAccountDirectory;
import io.walletmanager.core.lock.LockStorage;
import io.walletmanager.core.manager.ManagerConfig;
import io.walletmanager.core.manager.VersionManager;
import io.walletmanager.core.module.InMemoryModuleRegistry;
import io.walletmanager.core.module.Module;
import io.walletmanager.core.protocol.Address;
import io.walletmanager.core.protocol.CallData;
import io.walletmanager.core.protocol.Hashes;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.BiFunction;
import java.util.function.Consumer;

/** Shared wiring for tests: labelled addresses, counting modules and an in-memory manager. */
public final class Fixtures {
    public static final Instant NOW = Instant.ofEpochSecond(1_700_000_000L);

    public final Address catalogOwner = addr("catalog-owner");
    public final Address alice = addr("alice");
    public final Address aliceWallet = addr("alice-wallet");
    public final InMemoryModuleRegistry registry = new InMemoryModuleRegistry();
    public final InMemoryAccountDirectory accounts = new InMemoryAccountDirectory();
    public final LockStorage lockStorage = new LockStorage(addr("lock-storage"), Clock.fixed(NOW, ZoneOffset.UTC));
    public final BaseAccount wallet = new BaseAccount(aliceWallet, alice);
    public final VersionManager manager;

    public Fixtures() {
        accounts.register(wallet);
        manager = VersionManager.inMemory(registry, accounts, lockStorage, accounts, catalogOwner);
        manager.registerStorage(catalogOwner, lockStorage);
    }

    public static Address addr(String label) {
        return ManagerConfig.labelled(label);
    }

    public CountingModule module(String label) {
        CountingModule module = new CountingModule(addr(label));
        registry.register(module);
        return module;
    }

    /** Module that counts setup calls per account and can be told to fail or call back. */
    public static final class CountingModule implements Module {
        private final Address address;
        private final Map<Address, AtomicInteger> inits = new ConcurrentHashMap<>();
        private final Map<String, BiFunction<Address, CallData, byte[]>> staticCalls = new ConcurrentHashMap<>();
        private volatile RuntimeException failure;
        private volatile Consumer<Address> onInitialize = account -> {};

        public CountingModule(Address address) {
            this.address = address;
        }

        public CountingModule failWith(RuntimeException failure) {
            this.failure = failure;
            return this;
        }

        public CountingModule onInitialize(Consumer<Address> hook) {
            this.onInitialize = hook;
            return this;
        }

        public CountingModule serves(String signature, BiFunction<Address, CallData, byte[]> handler) {
            staticCalls.put(Hashes.selectorHex(signature), handler);
            return this;
        }

        public int inits(Address account) {
            AtomicInteger n = inits.get(account);
            return n == null ? 0 : n.get();
        }

        @Override
        public Address address() {
            return address;
        }

        @Override
        public void initialize(Address account) {
            inits.computeIfAbsent(account, k -> new AtomicInteger()).incrementAndGet();
            onInitialize.accept(account);
            if (failure != null) {
                throw failure;
            }
        }

        @Override
        public Set<String> staticCallSelectors() {
            return Set.copyOf(staticCalls.keySet());
        }

        @Override
        public byte[] handleStaticCall(Address account, CallData call) {
            return staticCalls.get(call.selectorHex()).apply(account, call);
        }
    }
}
