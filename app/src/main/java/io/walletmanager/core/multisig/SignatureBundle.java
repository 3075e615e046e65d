package io.walletmanager.core.multisig;

import io.walletmanager.core.protocol.Address;
import io.walletmanager.core.protocol.Hex;
import io.walletmanager.core.protocol.ProtocolLimits;

import java.io.ByteArrayOutputStream;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Threshold-many signatures over one digest, ordered by signer address ascending and
 * concatenated. Signatures are not verified here; the executing account does that.
 */
public final class SignatureBundle {

    public static final class Approval {
        public final Address signer;
        private final byte[] signature;

        public Approval(Address signer, byte[] signature) {
            if (signer == null || signature == null || signature.length == 0) {
                throw new IllegalArgumentException("signer and signature are required");
            }
            if (signature.length > ProtocolLimits.MAX_SIGNATURE_BYTES) {
                throw new IllegalArgumentException("signature exceeds " + ProtocolLimits.MAX_SIGNATURE_BYTES + " bytes");
            }
            this.signer = signer;
            this.signature = signature.clone();
        }

        public byte[] signature() { return signature.clone(); }
    }

    private final List<Approval> approvals;

    private SignatureBundle(List<Approval> approvals) {
        this.approvals = approvals;
    }

    public static SignatureBundle assemble(int threshold, List<Approval> approvals) {
        if (threshold < 1) {
            throw new IllegalArgumentException("threshold must be >= 1");
        }
        if (approvals == null || approvals.size() < threshold) {
            throw new IllegalArgumentException("Need " + threshold + " signatures, got "
                    + (approvals == null ? 0 : approvals.size()));
        }
        Set<Address> seen = new HashSet<>();
        for (Approval approval : approvals) {
            if (!seen.add(approval.signer)) {
                throw new IllegalArgumentException("Duplicate signer " + approval.signer);
            }
        }
        List<Approval> sorted = new ArrayList<>(approvals);
        sorted.sort(Comparator.comparing(a -> a.signer));
        return new SignatureBundle(List.copyOf(sorted));
    }

    public List<Address> signers() {
        List<Address> out = new ArrayList<>(approvals.size());
        for (Approval a : approvals) out.add(a.signer);
        return out;
    }

    public byte[] encoded() {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        for (Approval a : approvals) {
            out.writeBytes(a.signature);
        }
        return out.toByteArray();
    }

    public String hex() {
        return "0x" + Hex.encode(encoded());
    }
}
