package io.walletmanager.core.module;

import io.walletmanager.core.protocol.Address;

/** Answers whether {@code requester} holds owner authority over {@code account}. */
@FunctionalInterface
public interface OwnershipOracle {
    boolean isOwnerAuthority(Address account, Address requester);
}
