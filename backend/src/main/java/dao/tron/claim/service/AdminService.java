package dao.tron.claim.service;

import dao.tron.claim.config.TokenProperties;
import dao.tron.claim.exception.ClaimErrorKind;
import dao.tron.claim.exception.ClaimException;
import dao.tron.claim.model.AdminAction;
import dao.tron.claim.model.RootEpoch;
import dao.tron.claim.model.TransferResult;
import dao.tron.claim.util.CryptoUtil;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigInteger;

/**
 * Administrative surface: every action is a capability check against {@link AccessControl} followed by a
 * direct delegation.
 */
@Slf4j
@Service
public class AdminService {

    private final AccessControl accessControl;
    private final ClaimLedger claimLedger;
    private final TokenLedger tokenLedger;
    private final TokenProperties tokenProps;

    public AdminService(AccessControl accessControl,
                        ClaimLedger claimLedger,
                        TokenLedger tokenLedger,
                        TokenProperties tokenProps) {
        this.accessControl = accessControl;
        this.claimLedger = claimLedger;
        this.tokenLedger = tokenLedger;
        this.tokenProps = tokenProps;
    }

    public RootEpoch setRoot(String caller, String merkleRootHex) {
        RootEpoch epoch = claimLedger.rotateRoot(caller, merkleRootHex);
        log.info("Merkle root set: epoch={}, root={}, by={}", epoch.epoch(), epoch.rootHex(), caller);
        return epoch;
    }

    public void pause(String caller) {
        accessControl.requireAuthority(AdminAction.PAUSE, caller);
        accessControl.setAcceptingClaims(false);
        log.info("Claims paused by {}", caller);
    }

    public void unpause(String caller) {
        accessControl.requireAuthority(AdminAction.UNPAUSE, caller);
        accessControl.setAcceptingClaims(true);
        log.info("Claims unpaused by {}", caller);
    }

    /**
     * Recover a foreign asset sent to the distributor by mistake. The claim token itself cannot be swept.
     */
    public TransferResult sweepForeignAsset(String caller, String asset, String to, BigInteger amount) {
        accessControl.requireAuthority(AdminAction.SWEEP, caller);
        if (!CryptoUtil.isValidAddress(asset) || !CryptoUtil.isValidAddress(to)) {
            throw new IllegalArgumentException("Sweep asset and recipient must be TRON addresses");
        }
        if (tokenProps.getAddress() != null
                && CryptoUtil.addressKey(asset).equals(CryptoUtil.addressKey(tokenProps.getAddress()))) {
            throw new IllegalArgumentException("Claim token cannot be swept");
        }
        if (amount == null || amount.signum() <= 0) {
            throw new IllegalArgumentException("Sweep amount must be positive");
        }

        TransferResult result = tokenLedger.sweep(asset, to, amount);
        if (result.outcomeUnknown()) {
            log.error("Sweep unconfirmed: asset={}, to={}, amount={}, txId={}", asset, to, amount, result.reference());
            throw new ClaimException(ClaimErrorKind.TRANSFER_UNCONFIRMED,
                    "Sweep not confirmed, txId=" + result.reference());
        }
        if (!result.success()) {
            log.error("Sweep failed: asset={}, to={}, amount={}, reason={}", asset, to, amount, result.message());
            throw new ClaimException(ClaimErrorKind.TRANSFER_FAILED, "Sweep failed: " + result.message());
        }
        log.info("Swept foreign asset: asset={}, to={}, amount={}, ref={}", asset, to, amount, result.reference());
        return result;
    }

    public void nominateAuthority(String caller, String nominee) {
        accessControl.requireAuthority(AdminAction.NOMINATE_AUTHORITY, caller);
        accessControl.nominate(nominee);
        log.info("Authority handoff started: current={}, nominee={}", caller, nominee);
    }

    public String acceptAuthority(String caller) {
        String authority = accessControl.completeHandoff(caller);
        log.info("Authority handoff completed: new authority={}", authority);
        return authority;
    }

    public void cancelNomination(String caller) {
        accessControl.requireAuthority(AdminAction.CANCEL_NOMINATION, caller);
        accessControl.clearNomination();
        log.info("Authority nomination cancelled by {}", caller);
    }
}
