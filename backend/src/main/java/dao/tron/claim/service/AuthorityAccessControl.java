package dao.tron.claim.service;

import dao.tron.claim.config.ClaimProperties;
import dao.tron.claim.exception.ClaimErrorKind;
import dao.tron.claim.exception.ClaimException;
import dao.tron.claim.model.AdminAction;
import dao.tron.claim.util.CryptoUtil;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * One authority address holds every administrative capability; a pending nominee holds only
 * {@link AdminAction#ACCEPT_AUTHORITY}.
 */
@Slf4j
@Component
public class AuthorityAccessControl implements AccessControl {

    private volatile String authority;
    private volatile String pendingAuthority;
    private volatile boolean acceptingClaims;

    public AuthorityAccessControl(ClaimProperties claimProps) {
        String configured = claimProps.getAuthority();
        if (configured == null || configured.isBlank()) {
            log.warn("No claim authority configured. Root rotation and admin actions disabled.");
            this.authority = null;
        } else if (!CryptoUtil.isValidAddress(configured)) {
            throw new IllegalArgumentException("claim.authority is not a valid TRON address: " + configured);
        } else {
            this.authority = configured.trim();
        }
        this.acceptingClaims = !claimProps.isPaused();
        log.info("AccessControl initialized: authority={}, acceptingClaims={}", authority, acceptingClaims);
    }

    @Override
    public boolean isAcceptingClaims() {
        return acceptingClaims;
    }

    @Override
    public boolean isAuthorityFor(AdminAction action, String caller) {
        if (action == AdminAction.ACCEPT_AUTHORITY) {
            return sameAddress(pendingAuthority, caller);
        }
        return sameAddress(authority, caller);
    }

    @Override
    public void setAcceptingClaims(boolean accepting) {
        this.acceptingClaims = accepting;
    }

    @Override
    public synchronized void nominate(String nominee) {
        if (!CryptoUtil.isValidAddress(nominee)) {
            throw new IllegalArgumentException("Nominee is not a valid TRON address: " + nominee);
        }
        this.pendingAuthority = nominee.trim();
    }

    @Override
    public synchronized String completeHandoff(String caller) {
        if (!sameAddress(pendingAuthority, caller)) {
            throw new ClaimException(ClaimErrorKind.UNAUTHORIZED,
                    "Caller " + caller + " is not the pending authority");
        }
        this.authority = pendingAuthority;
        this.pendingAuthority = null;
        return authority;
    }

    @Override
    public synchronized void clearNomination() {
        this.pendingAuthority = null;
    }

    @Override
    public Optional<String> authority() {
        return Optional.ofNullable(authority);
    }

    @Override
    public Optional<String> pendingAuthority() {
        return Optional.ofNullable(pendingAuthority);
    }

    private static boolean sameAddress(String holder, String caller) {
        if (holder == null || caller == null || !CryptoUtil.isValidAddress(caller)) {
            return false;
        }
        return CryptoUtil.addressKey(holder).equals(CryptoUtil.addressKey(caller));
    }
}
