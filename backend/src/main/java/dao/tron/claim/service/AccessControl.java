package dao.tron.claim.service;

import dao.tron.claim.exception.ClaimErrorKind;
import dao.tron.claim.exception.ClaimException;
import dao.tron.claim.model.AdminAction;

import java.util.Optional;

/**
 * Single capability check consulted by every privileged operation, plus the pause switch.
 */
public interface AccessControl {

    boolean isAcceptingClaims();

    boolean isAuthorityFor(AdminAction action, String caller);

    void setAcceptingClaims(boolean accepting);

    /**
     * First phase of an authority handoff. The current authority stays in place until the nominee accepts.
     */
    void nominate(String nominee);

    /**
     * Second phase: {@code caller} becomes the authority if, at that moment, it is the pending nominee.
     * The check and the promotion are one atomic step.
     *
     * @return the new authority
     * @throws ClaimException with {@link ClaimErrorKind#UNAUTHORIZED} if {@code caller} is not the pending nominee
     */
    String completeHandoff(String caller);

    void clearNomination();

    Optional<String> authority();

    Optional<String> pendingAuthority();

    default void requireAuthority(AdminAction action, String caller) {
        if (!isAuthorityFor(action, caller)) {
            throw new ClaimException(ClaimErrorKind.UNAUTHORIZED,
                    "Caller " + caller + " is not authorized for " + action);
        }
    }
}
