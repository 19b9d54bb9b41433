package dao.tron.claim.model;

import java.math.BigInteger;

/**
 * A recipient's redemption. {@code addressKey} is the canonical 20-byte hex form of {@code recipient}.
 */
public record RedemptionRecord(
        String recipient,
        String addressKey,
        BigInteger amount,
        long rootEpoch,
        long claimedAt // unix seconds
) {}
