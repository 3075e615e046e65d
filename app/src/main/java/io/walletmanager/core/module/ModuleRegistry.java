package io.walletmanager.core.module;

import io.walletmanager.core.protocol.Address;

import java.util.Optional;

/**
 * Trusted list of deployed modules. Read-only from the version manager's point of view.
 */
public interface ModuleRegistry {

    /** True when the module is registered and has not been revoked. */
    boolean isRegisteredModule(Address module);

    /** Resolve the implementation behind an address, registered or not. */
    Optional<Module> lookup(Address module);
}
