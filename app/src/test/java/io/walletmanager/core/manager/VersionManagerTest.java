package io.walletmanager.core.manager;

import io.walletmanager.core.Fixtures;
import io.walletmanager.core.Fixtures.CountingModule;
import io.walletmanager.core.account.BaseAccount;
import io.walletmanager.core.auth.AuthorizationResult;
import io.walletmanager.core.lock.LockStorage;
import io.walletmanager.core.metrics.ManagerMetrics;
import io.walletmanager.core.protocol.Address;
import io.walletmanager.core.protocol.CallContext;
import io.walletmanager.core.protocol.RejectionException;
import io.walletmanager.core.protocol.RejectionReason;
import io.walletmanager.core.state.AccountState;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.List;

import static io.walletmanager.core.Fixtures.addr;
import static org.junit.jupiter.api.Assertions.*;

class VersionManagerTest {

    private Fixtures fx;
    private VersionManager manager;
    private Address wallet;
    private CountingModule transfer;

    @BeforeEach
    void setUp() {
        fx = new Fixtures();
        manager = fx.manager;
        wallet = fx.aliceWallet;
        transfer = fx.module("transfer-manager");
        manager.addFeatureSet(fx.catalogOwner, List.of(transfer.address()), List.of());
        fx.wallet.credit(1_000);
    }

    @Test
    void authorizedModuleCallsThroughAccount() {
        manager.upgradeAccount(wallet, 1, fx.alice);
        Address bob = addr("bob");
        byte[] memo = "rent".getBytes(StandardCharsets.UTF_8);

        manager.invokeAccount(wallet, transfer.address(), bob, 250, memo);

        assertEquals(750, fx.wallet.balance());
        List<BaseAccount.Invocation> calls = fx.wallet.invocations();
        assertEquals(1, calls.size());
        assertEquals(bob, calls.get(0).to);
        assertEquals(250, calls.get(0).value);
        assertArrayEquals(memo, calls.get(0).data);
    }

    @Test
    void failingAccountCallIsWrapped() {
        manager.upgradeAccount(wallet, 1, fx.alice);
        RejectionException ex = assertThrows(RejectionException.class,
                () -> manager.invokeAccount(wallet, transfer.address(), addr("bob"), 5_000, new byte[0]));
        assertEquals(RejectionReason.ACCOUNT_CALL_FAILED, ex.reason());
        assertEquals(1_000, fx.wallet.balance());
    }

    @Test
    void unauthorizedModuleCannotCallAccount() {
        double before = ManagerMetrics.rejections(RejectionReason.ACCOUNT_NOT_UPGRADED);
        RejectionException ex = assertThrows(RejectionException.class,
                () -> manager.invokeAccount(wallet, transfer.address(), addr("bob"), 1, new byte[0]));
        assertEquals(RejectionReason.ACCOUNT_NOT_UPGRADED, ex.reason());
        assertEquals(before + 1, ManagerMetrics.rejections(RejectionReason.ACCOUNT_NOT_UPGRADED));
        assertTrue(fx.wallet.invocations().isEmpty());
    }

    @Test
    void setOwnerMovesUpgradeAuthority() {
        manager.upgradeAccount(wallet, 1, fx.alice);
        Address carol = addr("carol");
        manager.setOwner(wallet, transfer.address(), carol);
        assertEquals(carol, fx.wallet.owner());

        manager.addFeatureSet(fx.catalogOwner, List.of(transfer.address()), List.of());
        assertEquals(RejectionReason.NOT_OWNER_AUTHORITY, assertThrows(RejectionException.class,
                () -> manager.upgradeAccount(wallet, 2, fx.alice)).reason());
        assertEquals(2, manager.upgradeAccount(wallet, 2, carol).toVersion());
    }

    @Test
    void setOwnerRejectsZeroOwner() {
        manager.upgradeAccount(wallet, 1, fx.alice);
        assertThrows(IllegalArgumentException.class, () -> manager.setOwner(wallet, transfer.address(), Address.ZERO));
        assertEquals(fx.alice, fx.wallet.owner());
    }

    @Test
    void unknownAccountCallFails() {
        Address ghost = addr("ghost-wallet");
        manager.store().commitUpgrade(ghost, 1, List.of());
        RejectionException ex = assertThrows(RejectionException.class,
                () -> manager.invokeAccount(ghost, transfer.address(), addr("bob"), 1, new byte[0]));
        assertEquals(RejectionReason.ACCOUNT_CALL_FAILED, ex.reason());
    }

    @Test
    void accountSnapshotReflectsBindingAndLock() {
        AccountState before = manager.account(wallet);
        assertFalse(before.isVersioned());
        assertTrue(before.authorizedModules().isEmpty());

        manager.upgradeAccount(wallet, 1, fx.alice);
        manager.invokeStorage(wallet, fx.lockStorage.address(),
                LockStorage.setLockCall(wallet, Fixtures.NOW.getEpochSecond() + 10), transfer.address());

        AccountState after = manager.account(wallet);
        assertEquals(1, after.currentVersion());
        assertTrue(after.locked());
        assertEquals(AccountState.Status.IDLE, after.status());
        assertEquals(List.of(transfer.address()), after.authorizedModules());
    }

    @Test
    void checkReportsWithoutThrowing() {
        AuthorizationResult result = manager.check(wallet, transfer.address(), CallContext.MUTATING, CallContext.MUTATING);
        assertFalse(result.ok);
        assertEquals(RejectionReason.ACCOUNT_NOT_UPGRADED, result.reason);

        manager.upgradeAccount(wallet, 1, fx.alice);
        manager.authorize(wallet, transfer.address(), CallContext.READ_ONLY, CallContext.READ_ONLY);
        assertThrows(RejectionException.class,
                () -> manager.authorize(wallet, transfer.address(), CallContext.MUTATING, CallContext.READ_ONLY));
    }

    @Test
    void attachStorageRebindsRegisteredStorage() {
        LockStorage replacement = new LockStorage(fx.lockStorage.address());
        manager.attachStorage(fx.catalogOwner, replacement);
        manager.upgradeAccount(wallet, 1, fx.alice);
        manager.invokeStorage(wallet, replacement.address(), LockStorage.setLockCall(wallet, 42), transfer.address());
        assertEquals(42, replacement.getLock(wallet));
        assertEquals(0, fx.lockStorage.getLock(wallet));
    }

    @Test
    void nonOwnerCannotRegisterStorage() {
        RejectionException ex = assertThrows(RejectionException.class,
                () -> manager.registerStorage(fx.alice, new LockStorage(addr("other-lock"))));
        assertEquals(RejectionReason.NOT_CATALOG_OWNER, ex.reason());
    }
}
