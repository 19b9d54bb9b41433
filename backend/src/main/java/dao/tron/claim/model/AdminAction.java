package dao.tron.claim.model;

/**
 * Privileged operations gated by {@link dao.tron.claim.service.AccessControl}.
 */
public enum AdminAction {
    ROTATE_ROOT,
    PAUSE,
    UNPAUSE,
    SWEEP,
    NOMINATE_AUTHORITY,
    CANCEL_NOMINATION,
    /** Held by the pending nominee only, not by the current authority. */
    ACCEPT_AUTHORITY
}
