package dao.tron.claim.service;

import dao.tron.claim.util.CryptoUtil;
import org.springframework.stereotype.Component;

import java.math.BigInteger;

/**
 * Leaf = keccak256(0x00 || recipient (20 bytes) || amount (uint256, 32 bytes big-endian)).
 *
 * All fields are fixed width, so no two (recipient, amount) pairs share an encoding.
 */
@Component
public class LeafEncoder {

    static final byte LEAF_PREFIX = 0x00;

    private static final BigInteger UINT256_MAX = BigInteger.ONE.shiftLeft(256).subtract(BigInteger.ONE);

    /**
     * @throws IllegalArgumentException if the address is not a TRON address or the amount is outside uint256
     */
    public byte[] encodeLeaf(String recipient, BigInteger amount) {
        byte[] address = CryptoUtil.tronAddressToAddressBytes(recipient);
        byte[] amountBytes = uint256ToBytes(amount);
        return CryptoUtil.keccak256(new byte[]{ LEAF_PREFIX }, address, amountBytes);
    }

    static byte[] uint256ToBytes(BigInteger value) {
        if (value == null) {
            throw new IllegalArgumentException("uint256 value is null");
        }
        if (value.signum() < 0) {
            throw new IllegalArgumentException("uint256 cannot be negative");
        }
        if (value.compareTo(UINT256_MAX) > 0) {
            throw new IllegalArgumentException("uint256 value too large");
        }
        byte[] raw = value.toByteArray();
        // toByteArray may carry a leading sign byte
        int offset = raw.length > 32 ? raw.length - 32 : 0;
        int length = raw.length - offset;
        byte[] out = new byte[32];
        System.arraycopy(raw, offset, out, 32 - length, length);
        return out;
    }
}
