package io.walletmanager.core.protocol;

import org.bouncycastle.jcajce.provider.digest.Keccak;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Arrays;

public final class Hashes {
    private Hashes(){}

    public static byte[] sha256(byte[] in){
        try {
            return MessageDigest.getInstance("SHA-256").digest(in);
        } catch (NoSuchAlgorithmException e) {
            throw new RuntimeException("SHA-256 not available", e);
        }
    }

    /** Original Keccak-256 (pre-NIST padding), the hash account contracts use for selectors and digests. */
    public static byte[] keccak256(byte[] in) {
        return new Keccak.Digest256().digest(in);
    }

    /** First 4 bytes of Keccak-256 over the canonical method signature, e.g. "setLock(address,uint256)". */
    public static byte[] selector(String signature) {
        if (signature == null || signature.isBlank()) {
            throw new IllegalArgumentException("Method signature required");
        }
        return Arrays.copyOf(keccak256(signature.getBytes(StandardCharsets.US_ASCII)), CallData.SELECTOR_LENGTH);
    }

    public static String selectorHex(String signature) {
        return "0x" + Hex.encode(selector(signature));
    }
}
