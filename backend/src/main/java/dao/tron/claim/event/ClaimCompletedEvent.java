package dao.tron.claim.event;

import java.math.BigInteger;

/**
 * Published once a claim is fully settled: redemption recorded and transfer accepted by the ledger.
 */
public record ClaimCompletedEvent(
        String recipient,
        BigInteger amount,
        long rootEpoch,
        String transferReference,
        long claimedAt
) {}
