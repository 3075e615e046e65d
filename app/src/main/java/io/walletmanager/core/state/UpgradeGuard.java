package io.walletmanager.core.state;

import io.walletmanager.core.protocol.Address;
import io.walletmanager.core.protocol.RejectionException;
import io.walletmanager.core.protocol.RejectionReason;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.OptionalLong;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Per-account IDLE / UPGRADING flag. Entering is check-and-set; the returned scope
 * clears the flag on close, so use it with try-with-resources.
 *
 * A scope starts out reserved: the account is UPGRADING and no second upgrade can
 * enter, but authorization still uses the bound version until {@link Scope#activate()}.
 * Once active, writes issued for the account are queued on the scope and only
 * applied if the upgrade commits.
 */
public final class UpgradeGuard {

    private final Map<Address, Scope> inProgress = new ConcurrentHashMap<>();

    public Scope enter(Address account, long toVersion) {
        Scope scope = new Scope(account, toVersion);
        if (inProgress.putIfAbsent(account, scope) != null) {
            throw new RejectionException(RejectionReason.UPGRADE_IN_PROGRESS,
                    "Upgrade already in progress for " + account);
        }
        return scope;
    }

    public boolean isUpgrading(Address account) {
        return account != null && inProgress.containsKey(account);
    }

    /** Target version of the upgrade currently running hooks for the account, if any. */
    public OptionalLong pendingVersion(Address account) {
        Scope scope = account == null ? null : inProgress.get(account);
        return scope == null || !scope.isActive() ? OptionalLong.empty() : OptionalLong.of(scope.toVersion);
    }

    /**
     * Queue the effect on the account's active upgrade, or run it now when there is none.
     *
     * @return true if the effect was queued
     */
    public boolean deferOrRun(Address account, Runnable effect) {
        Scope scope = account == null ? null : inProgress.get(account);
        if (scope != null && scope.enqueue(effect)) {
            return true;
        }
        effect.run();
        return false;
    }

    public AccountState.Status status(Address account) {
        return isUpgrading(account) ? AccountState.Status.UPGRADING : AccountState.Status.IDLE;
    }

    public final class Scope implements AutoCloseable {
        private final Address account;
        private final long toVersion;
        private final List<Runnable> pending = new ArrayList<>();
        private boolean active;

        private Scope(Address account, long toVersion) {
            this.account = account;
            this.toVersion = toVersion;
        }

        /** Switch the account's effective version to the target and start queueing writes. */
        public synchronized void activate() {
            active = true;
        }

        public synchronized boolean isActive() {
            return active;
        }

        synchronized boolean enqueue(Runnable effect) {
            if (!active) return false;
            pending.add(effect);
            return true;
        }

        /** Stop queueing and hand back everything queued so far, in issue order. */
        public synchronized List<Runnable> drain() {
            active = false;
            List<Runnable> effects = new ArrayList<>(pending);
            pending.clear();
            return effects;
        }

        @Override
        public void close() {
            synchronized (this) {
                active = false;
                pending.clear();
            }
            inProgress.remove(account, this);
        }
    }
}
