package io.walletmanager.core.lock;

import io.walletmanager.core.module.LockOracle;
import io.walletmanager.core.module.StorageModule;
import io.walletmanager.core.protocol.Address;
import io.walletmanager.core.protocol.CallData;

import java.time.Clock;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Per-account lock expiry, written by modules through the version manager.
 *
 * Methods:
 *  - setLock(address,uint256): lock the account until the given epoch second (0 unlocks)
 */
public final class LockStorage implements StorageModule, LockOracle {
    public static final String SET_LOCK = "setLock(address,uint256)";

    private final Address address;
    private final Clock clock;
    private final Map<Address, Long> releaseAfter = new ConcurrentHashMap<>();

    public LockStorage(Address address, Clock clock) {
        this.address = Objects.requireNonNull(address, "address");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public LockStorage(Address address) {
        this(address, Clock.systemUTC());
    }

    public static CallData setLockCall(Address account, long releaseAfterEpochSeconds) {
        return CallData.builder(SET_LOCK).address(account).uint(releaseAfterEpochSeconds).build();
    }

    @Override
    public Address address() {
        return address;
    }

    @Override
    public void check(CallData call) {
        if (!call.hasSelector(SET_LOCK)) {
            throw new IllegalArgumentException("Unknown storage method " + (call.length() >= CallData.SELECTOR_LENGTH ? call.selectorHex() : call.hex()));
        }
        call.addressAt(0).orElseThrow(() -> new IllegalArgumentException("Bad account argument"));
        call.longAt(1);
    }

    @Override
    public void handle(CallData call) {
        check(call);
        Address account = call.addressAt(0).orElseThrow(() -> new IllegalArgumentException("Bad account argument"));
        long until = call.longAt(1);
        if (until == 0) {
            releaseAfter.remove(account);
        } else {
            releaseAfter.put(account, until);
        }
    }

    /** Epoch second the lock is released at, 0 when never locked. */
    public long getLock(Address account) {
        return releaseAfter.getOrDefault(account, 0L);
    }

    @Override
    public boolean isLocked(Address account) {
        return getLock(account) > clock.instant().getEpochSecond();
    }
}
