package dao.tron.claim.model;

/**
 * Outcome of a token ledger call. {@code reference} is the TRON txId (or a local id for the in-memory ledger);
 * it is set for confirmed transfers and for unconfirmed ones.
 */
public record TransferResult(TransferStatus status, String reference, String message) {

    public static TransferResult ok(String reference) {
        return new TransferResult(TransferStatus.CONFIRMED, reference, null);
    }

    public static TransferResult failed(String message) {
        return new TransferResult(TransferStatus.REJECTED, null, message);
    }

    public static TransferResult failed(String reference, String message) {
        return new TransferResult(TransferStatus.REJECTED, reference, message);
    }

    public static TransferResult unconfirmed(String reference, String message) {
        return new TransferResult(TransferStatus.UNCONFIRMED, reference, message);
    }

    public boolean success() {
        return status == TransferStatus.CONFIRMED;
    }

    public boolean outcomeUnknown() {
        return status == TransferStatus.UNCONFIRMED;
    }
}
