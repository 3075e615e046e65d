package io.walletmanager.core.multisig;

import io.walletmanager.core.protocol.Address;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SignatureBundleTest {

    private final Address low = Address.fromHex("0x0100000000000000000000000000000000000000");
    private final Address high = Address.fromHex("0xf000000000000000000000000000000000000000");

    @Test
    void ordersSignaturesBySigner() {
        SignatureBundle bundle = SignatureBundle.assemble(2, List.of(
                new SignatureBundle.Approval(high, new byte[] {(byte) 0xbb}),
                new SignatureBundle.Approval(low, new byte[] {(byte) 0xaa})));

        assertEquals(List.of(low, high), bundle.signers());
        assertArrayEquals(new byte[] {(byte) 0xaa, (byte) 0xbb}, bundle.encoded());
        assertEquals("0xaabb", bundle.hex());
    }

    @Test
    void enforcesThresholdAndDistinctSigners() {
        SignatureBundle.Approval one = new SignatureBundle.Approval(low, new byte[] {1});
        assertThrows(IllegalArgumentException.class, () -> SignatureBundle.assemble(2, List.of(one)));
        assertThrows(IllegalArgumentException.class, () -> SignatureBundle.assemble(0, List.of(one)));
        assertThrows(IllegalArgumentException.class, () -> SignatureBundle.assemble(2,
                List.of(one, new SignatureBundle.Approval(low, new byte[] {2}))));
        assertThrows(IllegalArgumentException.class, () -> new SignatureBundle.Approval(low, new byte[73]));
    }
}
