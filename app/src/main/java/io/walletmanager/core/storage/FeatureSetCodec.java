package io.walletmanager.core.storage;

import io.walletmanager.core.catalog.FeatureSet;
import io.walletmanager.core.protocol.Address;
import io.walletmanager.core.protocol.CallData;
import io.walletmanager.core.protocol.Hex;
import io.walletmanager.core.protocol.ProtocolLimits;

import java.nio.ByteBuffer;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Binary layout:
 * version(8) | nFeatures(4) | feature(20)* | nInit(4) | init(20)* | nRoutes(4) | (selector(4) module(20))*
 */
public final class FeatureSetCodec {
    private FeatureSetCodec(){}

    public static byte[] toBytes(FeatureSet fs) {
        int size = 8
                + 4 + fs.features().size() * Address.LENGTH
                + 4 + fs.toInitialize().size() * Address.LENGTH
                + 4 + fs.staticCallRoutes().size() * (CallData.SELECTOR_LENGTH + Address.LENGTH);
        ByteBuffer buf = ByteBuffer.allocate(size);
        buf.putLong(fs.version());
        buf.putInt(fs.features().size());
        for (Address a : fs.features()) buf.put(a.bytes());
        buf.putInt(fs.toInitialize().size());
        for (Address a : fs.toInitialize()) buf.put(a.bytes());
        buf.putInt(fs.staticCallRoutes().size());
        for (Map.Entry<String, Address> route : fs.staticCallRoutes().entrySet()) {
            buf.put(Hex.decode(route.getKey()));
            buf.put(route.getValue().bytes());
        }
        return buf.array();
    }

    public static FeatureSet fromBytes(byte[] bytes) {
        try {
            ByteBuffer buf = ByteBuffer.wrap(bytes);
            long version = buf.getLong();
            List<Address> features = readAddresses(buf);
            List<Address> init = readAddresses(buf);
            int routes = buf.getInt();
            if (routes < 0 || routes > ProtocolLimits.MAX_FEATURES_PER_SET * 64) {
                throw new IllegalArgumentException("bad route count: " + routes);
            }
            Map<String, Address> staticCallRoutes = new LinkedHashMap<>();
            for (int i = 0; i < routes; i++) {
                byte[] selector = new byte[CallData.SELECTOR_LENGTH];
                buf.get(selector);
                staticCallRoutes.put("0x" + Hex.encode(selector), readAddress(buf));
            }
            return new FeatureSet(version, features, init, staticCallRoutes);
        } catch (RuntimeException ex) {
            throw new IllegalArgumentException("Malformed FeatureSet bytes", ex);
        }
    }

    private static List<Address> readAddresses(ByteBuffer buf) {
        int count = buf.getInt();
        if (count < 0 || count > ProtocolLimits.MAX_FEATURES_PER_SET) {
            throw new IllegalArgumentException("bad address count: " + count);
        }
        List<Address> out = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            out.add(readAddress(buf));
        }
        return out;
    }

    private static Address readAddress(ByteBuffer buf) {
        byte[] a = new byte[Address.LENGTH];
        buf.get(a);
        return new Address(a);
    }
}
