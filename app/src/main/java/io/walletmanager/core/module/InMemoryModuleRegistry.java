package io.walletmanager.core.module;

import io.walletmanager.core.protocol.Address;

import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.logging.Logger;

public final class InMemoryModuleRegistry implements ModuleRegistry {
    private static final Logger LOG = Logger.getLogger(InMemoryModuleRegistry.class.getName());

    private final Map<Address, Module> modules = new ConcurrentHashMap<>();
    private final Set<Address> revoked = ConcurrentHashMap.newKeySet();

    public InMemoryModuleRegistry register(Module module) {
        if (module == null || module.address() == null) {
            throw new IllegalArgumentException("Module with an address required");
        }
        Module existing = modules.putIfAbsent(module.address(), module);
        if (existing != null && existing != module) {
            throw new IllegalArgumentException("Module already registered: " + module.address());
        }
        revoked.remove(module.address());
        return this;
    }

    public void revoke(Address module) {
        if (modules.containsKey(module) && revoked.add(module)) {
            LOG.info("Module revoked: " + module);
        }
    }

    @Override
    public boolean isRegisteredModule(Address module) {
        return module != null && modules.containsKey(module) && !revoked.contains(module);
    }

    @Override
    public Optional<Module> lookup(Address module) {
        return module == null ? Optional.empty() : Optional.ofNullable(modules.get(module));
    }
}
