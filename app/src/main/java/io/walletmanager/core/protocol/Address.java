package io.walletmanager.core.protocol;

import java.util.Arrays;

/**
 * 20-byte account / module / storage address. Rendered as 0x-prefixed lowercase hex.
 */
public final class Address implements Comparable<Address> {
    public static final int LENGTH = 20;
    public static final Address ZERO = new Address(new byte[LENGTH]);

    private final byte[] bytes;

    public Address(byte[] bytes) {
        if (bytes == null || bytes.length != LENGTH) {
            throw new IllegalArgumentException("Address must be 20 bytes");
        }
        this.bytes = bytes.clone();
    }

    public static Address fromHex(String hex) {
        if (!isValid(hex)) {
            throw new IllegalArgumentException("Invalid address: " + hex);
        }
        return new Address(Hex.decode(hex));
    }

    /** Lowest 20 bytes of a 32-byte ABI word. */
    public static Address fromWord(byte[] word) {
        if (word == null || word.length != CallData.WORD) {
            throw new IllegalArgumentException("Word must be 32 bytes");
        }
        return new Address(Arrays.copyOfRange(word, CallData.WORD - LENGTH, CallData.WORD));
    }

    public static boolean isValid(String addr) {
        if (addr == null) return false;
        String body = addr.startsWith("0x") || addr.startsWith("0X") ? addr.substring(2) : addr;
        if (body.length() != LENGTH * 2) return false;
        for (int i = 0; i < body.length(); i++) {
            if (Character.digit(body.charAt(i), 16) < 0) return false;
        }
        return true;
    }

    public byte[] bytes() { return bytes.clone(); }
    public String hex() { return "0x" + Hex.encode(bytes); }
    public boolean isZero() { return equals(ZERO); }

    /** Left-pads to a 32-byte word, the way addresses are laid out in call data. */
    public byte[] toWord() {
        byte[] word = new byte[CallData.WORD];
        System.arraycopy(bytes, 0, word, CallData.WORD - LENGTH, LENGTH);
        return word;
    }

    @Override
    public int compareTo(Address other) {
        return Arrays.compareUnsigned(bytes, other.bytes);
    }

    @Override public boolean equals(Object o){ return o instanceof Address && Arrays.equals(bytes, ((Address)o).bytes); }
    @Override public int hashCode(){ return Arrays.hashCode(bytes); }
    @Override public String toString(){ return hex(); }
}
