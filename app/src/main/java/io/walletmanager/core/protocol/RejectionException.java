package io.walletmanager.core.protocol;

import java.util.Objects;
import java.util.Optional;

/**
 * Thrown by every privileged entry point that refuses to act. Never retried internally.
 */
public class RejectionException extends RuntimeException {
    private final RejectionReason reason;
    private final Address module;

    public RejectionException(RejectionReason reason, String message) {
        this(reason, message, null, null);
    }

    public RejectionException(RejectionReason reason, String message, Address module, Throwable cause) {
        super(message, cause);
        this.reason = Objects.requireNonNull(reason, "reason");
        this.module = module;
    }

    public static RejectionException initializationFailed(Address module, Throwable cause) {
        String detail = cause != null && cause.getMessage() != null ? ": " + cause.getMessage() : "";
        return new RejectionException(RejectionReason.INITIALIZATION_FAILED,
                "Initialization failed for module " + module + detail, module, cause);
    }

    public RejectionReason reason() { return reason; }
    public ErrorKind kind() { return reason.kind(); }

    /** Module whose setup hook failed, for INITIALIZATION_FAILED. */
    public Optional<Address> module() { return Optional.ofNullable(module); }

    @Override
    public String toString() {
        return "ERR[" + reason + "]: " + getMessage();
    }
}
