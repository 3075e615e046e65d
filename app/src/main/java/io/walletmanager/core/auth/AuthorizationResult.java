package io.walletmanager.core.auth;

import io.walletmanager.core.protocol.RejectionException;
import io.walletmanager.core.protocol.RejectionReason;

public final class AuthorizationResult {
    private static final AuthorizationResult OK = new AuthorizationResult(true, null, null);

    public final boolean ok;
    public final RejectionReason reason;
    public final String message;

    private AuthorizationResult(boolean ok, RejectionReason reason, String message) {
        this.ok = ok; this.reason = reason; this.message = message;
    }
    public static AuthorizationResult authorized() { return OK; }
    public static AuthorizationResult rejected(RejectionReason reason, String msg) { return new AuthorizationResult(false, reason, msg); }

    public void orThrow() {
        if (!ok) throw new RejectionException(reason, message);
    }

    @Override public String toString() {
        return ok ? "AUTHORIZED" : ("REJECTED["+reason+"]: "+message);
    }
}
