package io.walletmanager.core.invoke;

import io.walletmanager.core.account.AccountDirectory;
import io.walletmanager.core.account.AccountProxy;
import io.walletmanager.core.metrics.ManagerMetrics;
import io.walletmanager.core.protocol.Address;
import io.walletmanager.core.protocol.RejectionException;
import io.walletmanager.core.protocol.RejectionReason;

import java.util.Objects;

/** Forwards already-authorized calls to the account's proxy. */
public final class AccountInvoker {

    private final AccountDirectory accounts;

    public AccountInvoker(AccountDirectory accounts) {
        this.accounts = Objects.requireNonNull(accounts, "accounts");
    }

    public byte[] invoke(Address account, Address to, long value, byte[] data) {
        return invoke(resolve(account), account, to, value, data);
    }

    public byte[] invoke(AccountProxy proxy, Address account, Address to, long value, byte[] data) {
        try {
            byte[] result = proxy.invoke(to, value, data);
            ManagerMetrics.incrementAccountInvocations();
            return result == null ? new byte[0] : result;
        } catch (RuntimeException e) {
            throw new RejectionException(RejectionReason.ACCOUNT_CALL_FAILED,
                    "Call from " + account + " to " + to + " failed: " + e.getMessage(), null, e);
        }
    }

    public void setOwner(Address account, Address newOwner) {
        setOwner(resolve(account), account, newOwner);
    }

    public void setOwner(AccountProxy proxy, Address account, Address newOwner) {
        try {
            proxy.setOwner(newOwner);
        } catch (RuntimeException e) {
            throw new RejectionException(RejectionReason.ACCOUNT_CALL_FAILED,
                    "setOwner on " + account + " failed: " + e.getMessage(), null, e);
        }
    }

    public AccountProxy resolve(Address account) {
        return accounts.lookup(account).orElseThrow(() -> new RejectionException(
                RejectionReason.ACCOUNT_CALL_FAILED, "No account proxy for " + account));
    }
}
