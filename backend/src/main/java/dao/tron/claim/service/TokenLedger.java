package dao.tron.claim.service;

import dao.tron.claim.model.TransferInstruction;
import dao.tron.claim.model.TransferResult;

import java.math.BigInteger;

/**
 * Fungible-token ledger the claim engine pays out through. Implementations report the outcome through
 * {@link TransferResult#status()}; callers must check it. A transfer that may have been executed is never
 * reported as rejected.
 */
public interface TokenLedger {

    /**
     * Pay a claim in the claim token.
     */
    TransferResult transfer(TransferInstruction instruction);

    /**
     * Move a foreign asset held by the distributor to {@code to}.
     */
    TransferResult sweep(String asset, String to, BigInteger amount);

    BigInteger balanceOf(String asset, String holder);

    /**
     * Account claims and sweeps are paid from.
     */
    String getDistributorAddress();
}
