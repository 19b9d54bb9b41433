package dao.tron.claim.exception;

public enum ClaimErrorKind {
    /** Proof path does not reconstruct the current root (includes malformed input). */
    INVALID_PROOF,
    /** Recipient already redeemed its entitlement. */
    ALREADY_CLAIMED,
    /** Claims are paused. */
    CLAIMS_PAUSED,
    /** Caller lacks authority for an administrative action. */
    UNAUTHORIZED,
    /** Token ledger rejected the transfer. */
    TRANSFER_FAILED,
    /** Transfer was broadcast but not confirmed; the redemption stays recorded until reconciled. */
    TRANSFER_UNCONFIRMED
}
