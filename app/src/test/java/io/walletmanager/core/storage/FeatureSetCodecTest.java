package io.walletmanager.core.storage;

import io.walletmanager.core.catalog.FeatureSet;
import io.walletmanager.core.protocol.Hashes;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;
import java.util.Map;

import static io.walletmanager.core.Fixtures.addr;
import static org.junit.jupiter.api.Assertions.*;

class FeatureSetCodecTest {

    @Test
    void decodesWhatItEncodes() {
        String selector = Hashes.selectorHex("isGuardian(address,address)");
        FeatureSet fs = new FeatureSet(7,
                List.of(addr("a"), addr("b"), addr("c")),
                List.of(addr("c")),
                Map.of(selector, addr("b")));

        FeatureSet decoded = FeatureSetCodec.fromBytes(FeatureSetCodec.toBytes(fs));
        assertEquals(fs, decoded);
        assertEquals(addr("b"), decoded.staticCallTarget(selector).orElseThrow());
    }

    @Test
    void rejectsTruncatedBytes() {
        byte[] bytes = FeatureSetCodec.toBytes(new FeatureSet(1, List.of(addr("a")), List.of(), Map.of()));
        byte[] truncated = Arrays.copyOf(bytes, bytes.length - 5);
        assertThrows(IllegalArgumentException.class, () -> FeatureSetCodec.fromBytes(truncated));
    }
}
