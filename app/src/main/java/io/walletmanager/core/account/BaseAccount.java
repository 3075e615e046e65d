package io.walletmanager.core.account;

import io.walletmanager.core.protocol.Address;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * In-process account proxy: holds an owner and a balance, and keeps a log of
 * the calls it executed.
 */
public final class BaseAccount implements AccountProxy {

    public static final class Invocation {
        public final Address to;
        public final long value;
        public final byte[] data;

        Invocation(Address to, long value, byte[] data) {
            this.to = to;
            this.value = value;
            this.data = data.clone();
        }
    }

    private final Address address;
    private Address owner;
    private long balance;
    private final List<Invocation> invocations = new ArrayList<>();

    public BaseAccount(Address address, Address owner) {
        this.address = Objects.requireNonNull(address, "address");
        this.owner = Objects.requireNonNull(owner, "owner");
    }

    @Override public Address address() { return address; }
    @Override public synchronized Address owner() { return owner; }

    @Override
    public synchronized void setOwner(Address newOwner) {
        if (newOwner == null || newOwner.isZero()) {
            throw new IllegalArgumentException("New owner must be non-zero");
        }
        this.owner = newOwner;
    }

    public synchronized void credit(long amount) {
        if (amount < 0) throw new IllegalArgumentException("amount must be >= 0");
        balance += amount;
    }

    public synchronized long balance() { return balance; }

    @Override
    public synchronized byte[] invoke(Address to, long value, byte[] data) {
        if (to == null) throw new IllegalArgumentException("Missing to");
        if (value < 0) throw new IllegalArgumentException("value must be >= 0");
        if (value > balance) {
            throw new IllegalStateException("Insufficient balance: " + balance + " < " + value);
        }
        balance -= value;
        invocations.add(new Invocation(to, value, data == null ? new byte[0] : data));
        return new byte[0];
    }

    public synchronized List<Invocation> invocations() {
        return List.copyOf(invocations);
    }
}
