package dao.tron.claim.model;

import java.math.BigInteger;

/**
 * Payout handed to the token ledger after a claim passed verification.
 */
public record TransferInstruction(String to, BigInteger amount) {}
