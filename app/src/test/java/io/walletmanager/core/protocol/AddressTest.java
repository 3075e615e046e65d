package io.walletmanager.core.protocol;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class AddressTest {

    @Test
    void parsesAndPrintsHex() {
        String hex = "0x00112233445566778899aabbccddeeff00112233";
        Address address = Address.fromHex(hex);
        assertEquals(hex, address.hex());
        assertEquals(address, Address.fromHex(hex.substring(2).toUpperCase()));
        assertTrue(Address.isValid(hex));
        assertFalse(Address.isValid("0x1234"));
        assertFalse(Address.isValid("not-an-address"));
        assertThrows(IllegalArgumentException.class, () -> Address.fromHex("0x12"));
    }

    @Test
    void wordConversionPadsOnTheLeft() {
        Address address = Address.fromHex("0xffffffffffffffffffffffffffffffffffffffff");
        byte[] word = address.toWord();
        assertEquals(32, word.length);
        for (int i = 0; i < 12; i++) {
            assertEquals(0, word[i]);
        }
        assertEquals(address, Address.fromWord(word));
    }

    @Test
    void ordersAsUnsignedBytes() {
        Address low = Address.fromHex("0x0100000000000000000000000000000000000000");
        Address high = Address.fromHex("0xff00000000000000000000000000000000000000");
        List<Address> list = new ArrayList<>(List.of(high, Address.ZERO, low));
        Collections.sort(list);
        assertEquals(List.of(Address.ZERO, low, high), list);
        assertTrue(Address.ZERO.isZero());
    }
}
