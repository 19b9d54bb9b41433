package dao.tron.claim.model;

import dao.tron.claim.util.CryptoUtil;

/**
 * One committed Merkle root and the rotation that activated it.
 */
public record RootEpoch(
        long epoch,
        String rootHex,
        long activatedAt, // unix seconds
        String activatedBy
) {

    public byte[] rootBytes() {
        return CryptoUtil.parseBytes32(rootHex);
    }
}
