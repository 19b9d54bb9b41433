package dao.tron.claim.model;

public enum TransferStatus {
    /** Transfer executed; for TRON the receipt reported SUCCESS. */
    CONFIRMED,
    /** Transfer definitely did not move funds: refused before broadcast, or reverted on-chain. */
    REJECTED,
    /** Transaction was broadcast but no receipt was obtained; it may still confirm. */
    UNCONFIRMED
}
