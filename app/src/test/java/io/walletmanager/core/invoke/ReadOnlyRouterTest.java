package io.walletmanager.core.invoke;

import io.walletmanager.core.Fixtures;
import io.walletmanager.core.Fixtures.CountingModule;
import io.walletmanager.core.manager.VersionManager;
import io.walletmanager.core.protocol.Address;
import io.walletmanager.core.protocol.CallContext;
import io.walletmanager.core.protocol.CallData;
import io.walletmanager.core.protocol.RejectionException;
import io.walletmanager.core.protocol.RejectionReason;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ReadOnlyRouterTest {
    private static final String IS_GUARDIAN = "isGuardian(address,address)";

    private Fixtures fx;
    private VersionManager manager;
    private Address wallet;
    private CountingModule guardian;
    private CountingModule relayer;

    @BeforeEach
    void setUp() {
        fx = new Fixtures();
        manager = fx.manager;
        wallet = fx.aliceWallet;
        guardian = fx.module("guardian-manager")
                .serves(IS_GUARDIAN, (account, call) -> new byte[] {(byte) (call.addressAt(1).isPresent() ? 1 : 0)});
        relayer = fx.module("relayer-manager");
        manager.addFeatureSet(fx.catalogOwner, List.of(guardian.address(), relayer.address()), List.of());
        manager.addFeatureSet(fx.catalogOwner, List.of(relayer.address()), List.of());
    }

    private CallData lockQuery() {
        return CallData.builder(IS_GUARDIAN).address(wallet).address(fx.alice).build();
    }

    @Test
    void routesSelectorToServingModule() {
        manager.upgradeAccount(wallet, 1, fx.alice);
        assertArrayEquals(new byte[] {1}, manager.staticCall(wallet, lockQuery(), CallContext.READ_ONLY));
    }

    @Test
    void requiresReadOnlyContext() {
        manager.upgradeAccount(wallet, 1, fx.alice);
        RejectionException ex = assertThrows(RejectionException.class,
                () -> manager.staticCall(wallet, lockQuery(), CallContext.MUTATING));
        assertEquals(RejectionReason.STATIC_CALL_REQUIRED, ex.reason());
    }

    @Test
    void unversionedAccountHasNoRoutes() {
        RejectionException ex = assertThrows(RejectionException.class,
                () -> manager.staticCall(wallet, lockQuery(), CallContext.READ_ONLY));
        assertEquals(RejectionReason.ACCOUNT_NOT_UPGRADED, ex.reason());
    }

    @Test
    void unknownSelectorIsNotSupported() {
        manager.upgradeAccount(wallet, 1, fx.alice);
        CallData other = CallData.builder("getNonce(address)").address(wallet).build();
        RejectionException ex = assertThrows(RejectionException.class,
                () -> manager.staticCall(wallet, other, CallContext.READ_ONLY));
        assertEquals(RejectionReason.STATIC_CALL_NOT_SUPPORTED, ex.reason());

        CallData tooShort = CallData.of(new byte[] {1, 2});
        assertEquals(RejectionReason.STATIC_CALL_NOT_SUPPORTED, assertThrows(RejectionException.class,
                () -> manager.staticCall(wallet, tooShort, CallContext.READ_ONLY)).reason());
    }

    @Test
    void routesFollowTheBoundVersion() {
        manager.upgradeAccount(wallet, 1, fx.alice);
        manager.upgradeAccount(wallet, 2, fx.alice);
        RejectionException ex = assertThrows(RejectionException.class,
                () -> manager.staticCall(wallet, lockQuery(), CallContext.READ_ONLY));
        assertEquals(RejectionReason.STATIC_CALL_NOT_SUPPORTED, ex.reason());
    }

    @Test
    void revokedModuleNoLongerAnswers() {
        manager.upgradeAccount(wallet, 1, fx.alice);
        fx.registry.revoke(guardian.address());
        RejectionException ex = assertThrows(RejectionException.class,
                () -> manager.staticCall(wallet, lockQuery(), CallContext.READ_ONLY));
        assertEquals(RejectionReason.MODULE_NOT_AUTHORIZED, ex.reason());
    }
}
