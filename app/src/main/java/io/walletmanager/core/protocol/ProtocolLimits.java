package io.walletmanager.core.protocol;

public final class ProtocolLimits {
    private ProtocolLimits(){}

    public static final int MAX_CALL_DATA_BYTES = 8 * 1024;
    public static final int MAX_FEATURES_PER_SET = 256;
    public static final int MAX_SIGNATURE_BYTES = 72;      // DER-encoded ECDSA upper bound
}
