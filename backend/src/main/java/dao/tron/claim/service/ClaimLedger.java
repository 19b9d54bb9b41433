package dao.tron.claim.service;

import dao.tron.claim.config.ClaimProperties;
import dao.tron.claim.event.ClaimCompletedEvent;
import dao.tron.claim.event.RootRotatedEvent;
import dao.tron.claim.exception.ClaimErrorKind;
import dao.tron.claim.exception.ClaimException;
import dao.tron.claim.model.AdminAction;
import dao.tron.claim.model.ClaimReceipt;
import dao.tron.claim.model.ClaimStatus;
import dao.tron.claim.model.RedemptionRecord;
import dao.tron.claim.model.RootEpoch;
import dao.tron.claim.model.TransferInstruction;
import dao.tron.claim.model.TransferResult;
import dao.tron.claim.repository.RedemptionRepository;
import dao.tron.claim.util.CryptoUtil;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

import java.math.BigInteger;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Owns the active Merkle root and the redemption records, and runs the claim protocol:
 * pause check, leaf derivation, proof verification, one-time redemption, payout, notification.
 *
 * A recipient is marked claimed before the transfer is issued, under a per-recipient lock; if the
 * ledger rejects the transfer the mark is rolled back before the lock is released, so the recipient
 * is never left marked but unpaid. A transfer whose outcome is unknown (broadcast, no receipt) keeps
 * the mark: it may still confirm, and a second payout must not be possible. A ledger that throws is
 * treated as a rejection, so ledgers report post-broadcast failures as
 * {@link dao.tron.claim.model.TransferStatus#UNCONFIRMED} instead of throwing.
 * Root rotation never clears redemption records.
 */
@Slf4j
@Service
public class ClaimLedger {

    private static final String CONFIG_ACTOR = "config";

    private final MerkleVerifier verifier;
    private final LeafEncoder leafEncoder;
    private final RedemptionRepository redemptions;
    private final TokenLedger tokenLedger;
    private final AccessControl accessControl;
    private final ApplicationEventPublisher events;

    private final AtomicReference<RootEpoch> currentRoot = new AtomicReference<>();
    private final List<RootEpoch> rootHistory = new CopyOnWriteArrayList<>();
    private final Object rotationLock = new Object();

    // key: 20-byte address hex
    private final Map<String, Object> recipientLocks = new ConcurrentHashMap<>();

    public ClaimLedger(MerkleVerifier verifier,
                       LeafEncoder leafEncoder,
                       RedemptionRepository redemptions,
                       TokenLedger tokenLedger,
                       AccessControl accessControl,
                       ApplicationEventPublisher events,
                       ClaimProperties claimProps) {
        this.verifier = verifier;
        this.leafEncoder = leafEncoder;
        this.redemptions = redemptions;
        this.tokenLedger = tokenLedger;
        this.accessControl = accessControl;
        this.events = events;

        String initialRoot = claimProps.getInitialRoot();
        byte[] root;
        if (initialRoot == null || initialRoot.isBlank()) {
            log.warn("No initial Merkle root configured. No claim will verify until the root is rotated.");
            root = new byte[CryptoUtil.DIGEST_LENGTH];
        } else {
            root = CryptoUtil.parseBytes32(initialRoot);
        }
        RootEpoch first = new RootEpoch(1, CryptoUtil.toHex0x(root), nowSeconds(), CONFIG_ACTOR);
        currentRoot.set(first);
        rootHistory.add(first);
        log.info("ClaimLedger initialized: epoch={}, root={}, maxProofDepth={}",
                first.epoch(), first.rootHex(), verifier.getMaxDepth());
    }

    /**
     * Claim with a hex-encoded proof and a decimal amount, as received over HTTP.
     * An unparseable amount or proof element is reported as {@link ClaimErrorKind#INVALID_PROOF}.
     */
    public ClaimReceipt claim(String caller, String amountDecimal, List<String> proofHex) {
        if (!accessControl.isAcceptingClaims()) {
            throw paused(caller);
        }
        BigInteger amount;
        try {
            amount = new BigInteger(amountDecimal.trim());
        } catch (RuntimeException e) {
            throw new ClaimException(ClaimErrorKind.INVALID_PROOF, "Amount is not a decimal integer: " + amountDecimal);
        }
        return claim(caller, amount, MerkleVerifier.decodeProof(proofHex));
    }

    public ClaimReceipt claim(String caller, BigInteger amount, List<byte[]> proof) {
        if (!accessControl.isAcceptingClaims()) {
            throw paused(caller);
        }

        RootEpoch epoch = currentRoot.get();

        String key;
        byte[] leaf;
        try {
            key = CryptoUtil.addressKey(caller);
            leaf = leafEncoder.encodeLeaf(caller, amount);
        } catch (IllegalArgumentException e) {
            log.warn("Claim rejected, entitlement not encodable: caller={}, amount={}, reason={}", caller, amount, e.getMessage());
            throw new ClaimException(ClaimErrorKind.INVALID_PROOF, "Entitlement cannot be encoded: " + e.getMessage(), e);
        }

        if (!verifier.verify(leaf, proof, epoch.rootBytes())) {
            log.warn("Claim rejected, invalid proof: caller={}, amount={}, epoch={}", caller, amount, epoch.epoch());
            throw new ClaimException(ClaimErrorKind.INVALID_PROOF,
                    "Proof does not match Merkle root of epoch " + epoch.epoch());
        }

        ClaimReceipt receipt;
        Object lock = recipientLocks.computeIfAbsent(key, k -> new Object());
        synchronized (lock) {
            RedemptionRecord record = new RedemptionRecord(caller, key, amount, epoch.epoch(), nowSeconds());
            if (!redemptions.markClaimed(record)) {
                log.warn("Claim rejected, already claimed: caller={}", caller);
                throw new ClaimException(ClaimErrorKind.ALREADY_CLAIMED, "Entitlement already claimed by " + caller);
            }

            TransferResult result;
            try {
                result = tokenLedger.transfer(new TransferInstruction(caller, amount));
            } catch (RuntimeException e) {
                log.error("Token ledger threw during claim payout: caller={}, amount={}", caller, amount, e);
                result = TransferResult.failed(e.getMessage());
            }

            if (result != null && result.outcomeUnknown()) {
                log.error("Claim payout unconfirmed, redemption kept for reconciliation: caller={}, amount={}, txId={}",
                        caller, amount, result.reference());
                throw new ClaimException(ClaimErrorKind.TRANSFER_UNCONFIRMED,
                        "Transfer not confirmed, txId=" + result.reference() + "; entitlement stays redeemed");
            }
            if (result == null || !result.success()) {
                redemptions.rollback(record);
                String reason = result == null ? "no result" : result.message();
                log.error("Claim payout failed, redemption rolled back: caller={}, amount={}, reason={}", caller, amount, reason);
                throw new ClaimException(ClaimErrorKind.TRANSFER_FAILED, "Transfer failed: " + reason);
            }

            receipt = new ClaimReceipt(caller, amount, epoch.epoch(), epoch.rootHex(), record.claimedAt(), result.reference());
        }

        events.publishEvent(new ClaimCompletedEvent(
                receipt.recipient(), receipt.amount(), receipt.rootEpoch(), receipt.transferReference(), receipt.claimedAt()));
        return receipt;
    }

    /**
     * Replace the active root. The new root is opaque beyond being 32 bytes; redemption records are kept.
     */
    public RootEpoch rotateRoot(String caller, String newRootHex) {
        accessControl.requireAuthority(AdminAction.ROTATE_ROOT, caller);
        return rotateRoot(caller, CryptoUtil.parseBytes32(newRootHex));
    }

    public RootEpoch rotateRoot(String caller, byte[] newRoot) {
        accessControl.requireAuthority(AdminAction.ROTATE_ROOT, caller);
        if (newRoot == null || newRoot.length != CryptoUtil.DIGEST_LENGTH) {
            throw new IllegalArgumentException("Merkle root must be 32 bytes");
        }

        RootEpoch previous;
        RootEpoch next;
        synchronized (rotationLock) {
            previous = currentRoot.get();
            next = new RootEpoch(previous.epoch() + 1, CryptoUtil.toHex0x(newRoot), nowSeconds(), caller);
            currentRoot.set(next);
            rootHistory.add(next);
        }
        events.publishEvent(new RootRotatedEvent(previous, next));
        return next;
    }

    public RootEpoch currentRoot() {
        return currentRoot.get();
    }

    public List<RootEpoch> rootHistory() {
        return List.copyOf(rootHistory);
    }

    public ClaimStatus status(String recipient) {
        return findRedemption(recipient).isPresent() ? ClaimStatus.CLAIMED : ClaimStatus.UNCLAIMED;
    }

    public Optional<RedemptionRecord> findRedemption(String recipient) {
        return redemptions.findByAddressKey(CryptoUtil.addressKey(recipient));
    }

    public List<RedemptionRecord> redemptions() {
        return redemptions.findAll();
    }

    public int redemptionCount() {
        return redemptions.count();
    }

    private static ClaimException paused(String caller) {
        log.warn("Claim rejected while paused: caller={}", caller);
        return new ClaimException(ClaimErrorKind.CLAIMS_PAUSED, "Claims are paused");
    }

    private static long nowSeconds() {
        return System.currentTimeMillis() / 1000L;
    }
}
