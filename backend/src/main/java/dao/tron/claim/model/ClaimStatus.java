package dao.tron.claim.model;

public enum ClaimStatus {
    UNCLAIMED,
    CLAIMED
}
