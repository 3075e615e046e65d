package io.walletmanager.core.multisig;

import io.walletmanager.core.protocol.Address;
import io.walletmanager.core.protocol.CallData;
import io.walletmanager.core.protocol.Hashes;

import java.math.BigInteger;
import java.nio.ByteBuffer;

/**
 * Digest that co-signers approve for one privileged transaction:
 * keccak256(0x19 | 0x00 | account | target | value(32) | data | nonce(32)).
 * The nonce is per-account and strictly increasing, so a digest is never valid twice.
 */
public final class MultisigDigest {
    private MultisigDigest(){}

    public static byte[] signHash(Address account, Address target, BigInteger value, byte[] data, long nonce) {
        if (account == null || target == null) {
            throw new IllegalArgumentException("account and target are required");
        }
        if (nonce < 0) {
            throw new IllegalArgumentException("nonce must be >= 0");
        }
        byte[] body = data == null ? new byte[0] : data;
        ByteBuffer buf = ByteBuffer.allocate(2 + Address.LENGTH * 2 + CallData.WORD + body.length + CallData.WORD);
        buf.put((byte) 0x19);
        buf.put((byte) 0x00);
        buf.put(account.bytes());
        buf.put(target.bytes());
        buf.put(word(value == null ? BigInteger.ZERO : value));
        buf.put(body);
        buf.put(word(BigInteger.valueOf(nonce)));
        return Hashes.keccak256(buf.array());
    }

    public static byte[] signHash(Address account, Address target, long value, byte[] data, long nonce) {
        return signHash(account, target, BigInteger.valueOf(value), data, nonce);
    }

    private static byte[] word(BigInteger v) {
        if (v.signum() < 0 || v.bitLength() > CallData.WORD * 8) {
            throw new IllegalArgumentException("value must fit in an unsigned 256-bit word");
        }
        byte[] raw = v.toByteArray();
        byte[] out = new byte[CallData.WORD];
        int len = Math.min(raw.length, CallData.WORD);
        System.arraycopy(raw, raw.length - len, out, CallData.WORD - len, len);
        return out;
    }
}
