package io.walletmanager.core.module;

import io.walletmanager.core.protocol.Address;
import io.walletmanager.core.protocol.CallData;

import java.util.Set;

/**
 * A capability module (recovery, transfer limits, relayer, ...) that can be granted
 * delegated authority over an account by being part of the account's feature set.
 */
public interface Module {

    Address address();

    /**
     * One-time setup for an account. Invoked at most once per account over its whole
     * version history, and only when the module is in the target version's init subset.
     * Throwing aborts the surrounding upgrade.
     */
    default void initialize(Address account) {}

    /** Selectors (0x-prefixed, 4 bytes) this module answers as read-only queries. */
    default Set<String> staticCallSelectors() {
        return Set.of();
    }

    /** Answer a read-only query routed to this module on behalf of {@code account}. */
    default byte[] handleStaticCall(Address account, CallData call) {
        throw new UnsupportedOperationException("Module " + address() + " serves no static calls");
    }

    /** A module known only by its address: no setup work, no read-only queries. */
    static Module ofAddress(Address address) {
        if (address == null) {
            throw new IllegalArgumentException("Module address required");
        }
        return () -> address;
    }
}
