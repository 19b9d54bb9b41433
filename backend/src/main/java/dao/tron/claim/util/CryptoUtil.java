package dao.tron.claim.util;

import org.bouncycastle.jcajce.provider.digest.Keccak;
import org.tron.trident.core.ApiWrapper;
import org.tron.trident.utils.Numeric;

import java.util.regex.Pattern;

/**
 * Hashing, hex and address helpers shared by the leaf encoder, verifier and ledger.
 *
 * IMPORTANT:
 * - Every digest handled by the claim engine is exactly 32 bytes (keccak256).
 * - TRON addresses are reduced to their 20-byte EVM form; the 0x41 network prefix is checked and dropped.
 */
public final class CryptoUtil {
    private CryptoUtil() {}

    public static final int DIGEST_LENGTH = 32;
    public static final int ADDRESS_LENGTH = 20;

    private static final byte TRON_ADDRESS_PREFIX = 0x41;
    private static final Pattern BYTES32_HEX = Pattern.compile("[0-9a-fA-F]{64}");

    public static byte[] keccak256(byte[]... parts) {
        Keccak.Digest256 digest = new Keccak.Digest256();
        for (byte[] part : parts) {
            digest.update(part, 0, part.length);
        }
        return digest.digest();
    }

    public static String toHex0x(byte[] bytes) {
        return "0x" + Numeric.toHexStringNoPrefix(bytes);
    }

    public static String cleanHex(String value) {
        if (value == null) return "";
        return (value.startsWith("0x") || value.startsWith("0X"))
                ? value.substring(2)
                : value;
    }

    /**
     * Parse a 0x-prefixed (or bare) 64-char hex string.
     *
     * @return the 32 bytes, or null if the value is not exactly one bytes32 in hex
     */
    public static byte[] parseBytes32OrNull(String hex) {
        String clean = cleanHex(hex);
        if (!BYTES32_HEX.matcher(clean).matches()) {
            return null;
        }
        return Numeric.hexStringToByteArray(clean);
    }

    public static byte[] parseBytes32(String hex) {
        byte[] out = parseBytes32OrNull(hex);
        if (out == null) {
            throw new IllegalArgumentException("Expected 32-byte hex value, got: " + hex);
        }
        return out;
    }

    /**
     * Convert a TRON address (base58 "T..." or hex "41...") to its 20-byte EVM address.
     */
    public static byte[] tronAddressToAddressBytes(String address) {
        if (address == null || address.isBlank()) {
            throw new IllegalArgumentException("Address is blank");
        }
        byte[] raw;
        try {
            raw = ApiWrapper.parseAddress(address.trim()).toByteArray();
        } catch (RuntimeException e) {
            throw new IllegalArgumentException("Invalid TRON address: " + address, e);
        }
        if (raw.length != ADDRESS_LENGTH + 1 || raw[0] != TRON_ADDRESS_PREFIX) {
            throw new IllegalArgumentException("Invalid TRON address: " + address);
        }
        byte[] out = new byte[ADDRESS_LENGTH];
        System.arraycopy(raw, 1, out, 0, ADDRESS_LENGTH);
        return out;
    }

    /**
     * Canonical key for an address, so that base58 and hex spellings of one account collide.
     */
    public static String addressKey(String address) {
        return Numeric.toHexStringNoPrefix(tronAddressToAddressBytes(address));
    }

    public static boolean isValidAddress(String address) {
        try {
            tronAddressToAddressBytes(address);
            return true;
        } catch (IllegalArgumentException e) {
            return false;
        }
    }
}
