package io.walletmanager.core.protocol;

import java.math.BigInteger;
import java.nio.ByteBuffer;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;

/**
 * Encoded call: a 4-byte selector followed by 32-byte argument words.
 * By convention the first word of a storage call names the account it targets.
 */
public final class CallData {
    public static final int SELECTOR_LENGTH = 4;
    public static final int WORD = 32;

    private final byte[] raw;

    private CallData(byte[] raw) {
        this.raw = raw;
    }

    public static CallData of(byte[] raw) {
        if (raw == null) {
            throw new IllegalArgumentException("Call data required");
        }
        if (raw.length > ProtocolLimits.MAX_CALL_DATA_BYTES) {
            throw new IllegalArgumentException("Call data exceeds " + ProtocolLimits.MAX_CALL_DATA_BYTES + " bytes");
        }
        return new CallData(raw.clone());
    }

    public static CallData fromHex(String hex) {
        return of(Hex.decode(hex));
    }

    public static Builder builder(String signature) { return new Builder(Hashes.selector(signature)); }

    public static final class Builder {
        private final byte[] selector;
        private final List<byte[]> words = new ArrayList<>();

        private Builder(byte[] selector) { this.selector = selector; }

        public Builder address(Address a) { words.add(a.toWord()); return this; }
        public Builder uint(long v) { return uint(BigInteger.valueOf(v)); }
        public Builder uint(BigInteger v) {
            if (v == null || v.signum() < 0) throw new IllegalArgumentException("uint must be >= 0");
            if (v.bitLength() > WORD * 8) throw new IllegalArgumentException("uint exceeds 256 bits");
            // toByteArray may carry a leading sign byte; keep the low 32 bytes
            byte[] b = v.toByteArray();
            byte[] word = new byte[WORD];
            int len = Math.min(b.length, WORD);
            System.arraycopy(b, b.length - len, word, WORD - len, len);
            words.add(word);
            return this;
        }
        public Builder bool(boolean v) { return uint(v ? 1 : 0); }

        public CallData build() {
            ByteBuffer buf = ByteBuffer.allocate(SELECTOR_LENGTH + words.size() * WORD);
            buf.put(selector);
            for (byte[] w : words) buf.put(w);
            return of(buf.array());
        }
    }

    public byte[] raw() { return raw.clone(); }
    public int length() { return raw.length; }

    public byte[] selector() {
        if (raw.length < SELECTOR_LENGTH) {
            throw new IllegalArgumentException("Call data shorter than a selector");
        }
        return Arrays.copyOf(raw, SELECTOR_LENGTH);
    }

    public String selectorHex() { return "0x" + Hex.encode(selector()); }

    public boolean hasSelector(String signature) {
        return raw.length >= SELECTOR_LENGTH && Arrays.equals(selector(), Hashes.selector(signature));
    }

    public int wordCount() {
        return raw.length < SELECTOR_LENGTH ? 0 : (raw.length - SELECTOR_LENGTH) / WORD;
    }

    public byte[] word(int index) {
        if (index < 0 || index >= wordCount()) {
            throw new IllegalArgumentException("No argument word at index " + index);
        }
        int start = SELECTOR_LENGTH + index * WORD;
        return Arrays.copyOfRange(raw, start, start + WORD);
    }

    /** Empty when the word is missing or carries bits above the 20 address bytes. */
    public Optional<Address> addressAt(int index) {
        if (index < 0 || index >= wordCount()) {
            return Optional.empty();
        }
        byte[] w = word(index);
        for (int i = 0; i < WORD - Address.LENGTH; i++) {
            if (w[i] != 0) return Optional.empty();
        }
        return Optional.of(Address.fromWord(w));
    }

    public BigInteger uintAt(int index) {
        return new BigInteger(1, word(index));
    }

    public long longAt(int index) {
        BigInteger v = uintAt(index);
        if (v.bitLength() > 63) {
            throw new IllegalArgumentException("Argument " + index + " does not fit in a long");
        }
        return v.longValue();
    }

    public boolean boolAt(int index) {
        return uintAt(index).signum() != 0;
    }

    public String hex() { return "0x" + Hex.encode(raw); }

    @Override public boolean equals(Object o){ return o instanceof CallData && Arrays.equals(raw, ((CallData)o).raw); }
    @Override public int hashCode(){ return Arrays.hashCode(raw); }
    @Override public String toString(){ return raw.length <= SELECTOR_LENGTH ? hex() : "CallData(" + selectorHex() + ", " + wordCount() + " words)"; }
}
