package dao.tron.claim.service;

import dao.tron.claim.config.ClaimProperties;
import dao.tron.claim.util.CryptoUtil;
import org.springframework.stereotype.Service;

import java.security.MessageDigest;
import java.util.ArrayList;
import java.util.List;

import static dao.tron.claim.util.CryptoUtil.DIGEST_LENGTH;

/**
 * Stateless Merkle membership check over keccak256 sorted-pair trees.
 *
 * Interior node = keccak256(0x01 || min(a, b) || max(a, b)), with min/max by unsigned byte order.
 * The 0x01 prefix keeps interior nodes apart from leaves, which {@link LeafEncoder} prefixes with 0x00.
 * Because pairs are sorted, proofs carry no left/right direction bits.
 *
 * Any malformed input (null, wrong width, too deep) verifies as false; nothing here throws.
 */
@Service
public class MerkleVerifier {

    static final byte NODE_PREFIX = 0x01;

    private final int maxDepth;

    public MerkleVerifier(ClaimProperties claimProps) {
        this.maxDepth = Math.max(0, claimProps.getMaxProofDepth());
    }

    public boolean verify(byte[] leaf, List<byte[]> proof, byte[] root) {
        if (!isDigest(leaf) || !isDigest(root) || proof == null) {
            return false;
        }
        if (proof.size() > maxDepth) {
            return false;
        }

        byte[] computed = leaf;
        for (byte[] sibling : proof) {
            if (!isDigest(sibling)) {
                return false;
            }
            computed = hashPair(computed, sibling);
        }
        return MessageDigest.isEqual(computed, root);
    }

    /**
     * Same as {@link #verify} with 0x-prefixed hex inputs. Unparseable hex fails verification.
     */
    public boolean verifyHex(String leafHex, List<String> proofHex, String rootHex) {
        return verify(CryptoUtil.parseBytes32OrNull(leafHex), decodeProof(proofHex), CryptoUtil.parseBytes32OrNull(rootHex));
    }

    public int getMaxDepth() {
        return maxDepth;
    }

    /**
     * Decode hex proof elements; an element that is not a bytes32 becomes null and fails verification later.
     */
    public static List<byte[]> decodeProof(List<String> proofHex) {
        if (proofHex == null) {
            return null;
        }
        List<byte[]> out = new ArrayList<>(proofHex.size());
        for (String hex : proofHex) {
            out.add(CryptoUtil.parseBytes32OrNull(hex));
        }
        return out;
    }

    /**
     * Hash a pair of 32-byte nodes with sorted-pair keccak.
     */
    public static byte[] hashPair(byte[] a, byte[] b) {
        if (!isDigest(a) || !isDigest(b)) {
            throw new IllegalArgumentException("hashPair requires two 32-byte inputs");
        }
        byte[] prefix = { NODE_PREFIX };
        if (compareBytes(a, b) <= 0) {
            return CryptoUtil.keccak256(prefix, a, b);
        } else {
            return CryptoUtil.keccak256(prefix, b, a);
        }
    }

    private static boolean isDigest(byte[] value) {
        return value != null && value.length == DIGEST_LENGTH;
    }

    private static int compareBytes(byte[] a, byte[] b) {
        int len = Math.min(a.length, b.length);
        for (int i = 0; i < len; i++) {
            int ai = a[i] & 0xff;
            int bi = b[i] & 0xff;
            if (ai != bi) return ai - bi;
        }
        return a.length - b.length;
    }
}
