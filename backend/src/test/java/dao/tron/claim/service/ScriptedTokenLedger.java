package dao.tron.claim.service;

import dao.tron.claim.model.TransferInstruction;
import dao.tron.claim.model.TransferResult;

import java.math.BigInteger;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Token ledger whose outcome tests can script: succeed, report failure, throw, or broadcast without a receipt.
 */
class ScriptedTokenLedger implements TokenLedger {

    enum Mode { SUCCEED, REJECT, THROW, UNCONFIRMED }

    private volatile Mode mode = Mode.SUCCEED;
    private volatile long delayMs = 0;
    private final List<TransferInstruction> paid = new CopyOnWriteArrayList<>();
    private int attempts;

    void setMode(Mode mode) {
        this.mode = mode;
    }

    void setDelayMs(long delayMs) {
        this.delayMs = delayMs;
    }

    List<TransferInstruction> paid() {
        return paid;
    }

    synchronized int attempts() {
        return attempts;
    }

    @Override
    public TransferResult transfer(TransferInstruction instruction) {
        synchronized (this) {
            attempts++;
        }
        if (delayMs > 0) {
            try {
                Thread.sleep(delayMs);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
        switch (mode) {
            case REJECT:
                return TransferResult.failed("rejected by test ledger");
            case THROW:
                throw new IllegalStateException("node unreachable");
            case UNCONFIRMED:
                // broadcast happened, so the funds may still arrive
                paid.add(instruction);
                return TransferResult.unconfirmed("pending-" + paid.size(), "no receipt before timeout");
            default:
                paid.add(instruction);
                return TransferResult.ok("test-" + paid.size());
        }
    }

    @Override
    public TransferResult sweep(String asset, String to, BigInteger amount) {
        return mode == Mode.SUCCEED ? TransferResult.ok("sweep") : TransferResult.failed("rejected by test ledger");
    }

    @Override
    public BigInteger balanceOf(String asset, String holder) {
        return BigInteger.ZERO;
    }

    @Override
    public String getDistributorAddress() {
        return "distributor";
    }
}
