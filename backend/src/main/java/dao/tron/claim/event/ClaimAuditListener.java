package dao.tron.claim.event;

import lombok.extern.slf4j.Slf4j;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.math.BigInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Audit log of settled claims and root rotations, plus running totals for monitoring.
 */
@Slf4j
@Component
public class ClaimAuditListener {

    private final AtomicLong claimsCompleted = new AtomicLong();
    private final AtomicReference<BigInteger> amountClaimed = new AtomicReference<>(BigInteger.ZERO);
    private final AtomicLong rotations = new AtomicLong();

    @EventListener
    public void onClaimCompleted(ClaimCompletedEvent event) {
        claimsCompleted.incrementAndGet();
        amountClaimed.accumulateAndGet(event.amount(), BigInteger::add);
        log.info("ClaimCompleted: recipient={}, amount={}, epoch={}, transferRef={}",
                event.recipient(), event.amount(), event.rootEpoch(), event.transferReference());
    }

    @EventListener
    public void onRootRotated(RootRotatedEvent event) {
        rotations.incrementAndGet();
        log.info("RootRotated: epoch {} -> {}, root {} -> {}, by={}",
                event.previous().epoch(), event.current().epoch(),
                event.previous().rootHex(), event.current().rootHex(),
                event.current().activatedBy());
    }

    public long getClaimsCompleted() {
        return claimsCompleted.get();
    }

    public BigInteger getAmountClaimed() {
        return amountClaimed.get();
    }

    public long getRotations() {
        return rotations.get();
    }
}
