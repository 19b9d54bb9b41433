package dao.tron.claim.model;

import java.math.BigInteger;

/**
 * Result of a successful claim.
 */
public record ClaimReceipt(
        String recipient,
        BigInteger amount,
        long rootEpoch,
        String merkleRootHex,
        long claimedAt,
        String transferReference
) {}
