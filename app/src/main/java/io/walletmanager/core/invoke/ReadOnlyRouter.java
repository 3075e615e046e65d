package io.walletmanager.core.invoke;

import io.walletmanager.core.auth.AuthorizationGate;
import io.walletmanager.core.catalog.FeatureSet;
import io.walletmanager.core.metrics.ManagerMetrics;
import io.walletmanager.core.module.Module;
import io.walletmanager.core.module.ModuleRegistry;
import io.walletmanager.core.protocol.Address;
import io.walletmanager.core.protocol.CallContext;
import io.walletmanager.core.protocol.CallData;
import io.walletmanager.core.protocol.RejectionException;
import io.walletmanager.core.protocol.RejectionReason;

import java.util.Objects;

/**
 * Fallback routing for read-only queries sent to an account: the selector is looked up in
 * the account's bound feature set and handed to the module that serves it.
 * Only ever runs inside a read-only execution context.
 */
public final class ReadOnlyRouter {

    private final AuthorizationGate gate;
    private final ModuleRegistry registry;

    public ReadOnlyRouter(AuthorizationGate gate, ModuleRegistry registry) {
        this.gate = Objects.requireNonNull(gate, "gate");
        this.registry = Objects.requireNonNull(registry, "registry");
    }

    public byte[] staticCall(Address account, CallData call, CallContext execution) {
        if (account == null || call == null || execution == null) {
            throw new IllegalArgumentException("account, call and execution are required");
        }
        if (!execution.isReadOnly()) {
            throw new RejectionException(RejectionReason.STATIC_CALL_REQUIRED, "Not in a read-only call");
        }
        FeatureSet featureSet = gate.effectiveFeatureSet(account).orElseThrow(() -> new RejectionException(
                RejectionReason.ACCOUNT_NOT_UPGRADED, "Account " + account + " is not bound to any version"));
        String selector = call.length() < CallData.SELECTOR_LENGTH ? null : call.selectorHex();
        Address target = featureSet.staticCallTarget(selector).orElseThrow(() -> new RejectionException(
                RejectionReason.STATIC_CALL_NOT_SUPPORTED,
                "Static call " + selector + " not supported for v" + featureSet.version()));
        gate.authorize(account, target, CallContext.READ_ONLY, execution);
        Module module = registry.lookup(target).orElseThrow(() -> new RejectionException(
                RejectionReason.MODULE_NOT_AUTHORIZED, "No module deployed at " + target));
        byte[] result = module.handleStaticCall(account, call);
        ManagerMetrics.incrementStaticCalls();
        return result == null ? new byte[0] : result;
    }
}
