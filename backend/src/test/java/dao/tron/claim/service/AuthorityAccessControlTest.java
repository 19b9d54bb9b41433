package dao.tron.claim.service;

import dao.tron.claim.config.ClaimProperties;
import dao.tron.claim.exception.ClaimErrorKind;
import dao.tron.claim.exception.ClaimException;
import dao.tron.claim.model.AdminAction;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

class AuthorityAccessControlTest {

    private static final String ADMIN = "TVKAAcqpQxz3J4waayePr8dQjSQ2XHkdbF";
    private static final String ADMIN_HEX = "41d43057aa40d69cf6281db374f1acaafd904329c1";
    private static final String NOMINEE = "TKWvD71EMFTpFVGZyqqX9fC6MQgcR9H76M";
    private static final String STRANGER = "TToEDBXQkGuYGsnyJASTM5JZweb7Rvrnfn";

    private AuthorityAccessControl accessControl;

    @BeforeEach
    void setUp() {
        accessControl = new AuthorityAccessControl(props(ADMIN));
    }

    private static ClaimProperties props(String authority) {
        ClaimProperties props = new ClaimProperties();
        props.setAuthority(authority);
        return props;
    }

    private static void awaitQuietly(CountDownLatch latch) {
        try {
            latch.await();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    @Test
    @DisplayName("Authority holds every admin capability; any address spelling matches")
    void testAuthorityCapabilities() {
        for (AdminAction action : AdminAction.values()) {
            if (action == AdminAction.ACCEPT_AUTHORITY) continue;
            assertTrue(accessControl.isAuthorityFor(action, ADMIN), action.name());
            assertTrue(accessControl.isAuthorityFor(action, ADMIN_HEX), action.name());
            assertFalse(accessControl.isAuthorityFor(action, STRANGER), action.name());
        }
        assertFalse(accessControl.isAuthorityFor(AdminAction.PAUSE, null));
        assertFalse(accessControl.isAuthorityFor(AdminAction.PAUSE, "garbage"));
    }

    @Test
    @DisplayName("Handoff is two-phase: nominee gains nothing until accepting")
    void testTwoPhaseHandoff() {
        accessControl.nominate(NOMINEE);

        assertEquals(ADMIN, accessControl.authority().orElseThrow());
        assertEquals(NOMINEE, accessControl.pendingAuthority().orElseThrow());
        assertFalse(accessControl.isAuthorityFor(AdminAction.ROTATE_ROOT, NOMINEE));
        assertTrue(accessControl.isAuthorityFor(AdminAction.ACCEPT_AUTHORITY, NOMINEE));
        assertFalse(accessControl.isAuthorityFor(AdminAction.ACCEPT_AUTHORITY, ADMIN));

        assertEquals(NOMINEE, accessControl.completeHandoff(NOMINEE));
        assertTrue(accessControl.isAuthorityFor(AdminAction.ROTATE_ROOT, NOMINEE));
        assertFalse(accessControl.isAuthorityFor(AdminAction.ROTATE_ROOT, ADMIN));
        assertTrue(accessControl.pendingAuthority().isEmpty());
    }

    @Test
    @DisplayName("Invalid nominee is refused and handoff without nominee fails")
    void testNominationValidation() {
        assertThrows(IllegalArgumentException.class, () -> accessControl.nominate("TKWvD71EMFTpFVGZyqqX9fC6MQgcR9H76N"));
        ClaimException e = assertThrows(ClaimException.class, () -> accessControl.completeHandoff(NOMINEE));
        assertEquals(ClaimErrorKind.UNAUTHORIZED, e.getKind());

        accessControl.nominate(NOMINEE);
        accessControl.clearNomination();
        assertFalse(accessControl.isAuthorityFor(AdminAction.ACCEPT_AUTHORITY, NOMINEE));
    }

    @Test
    @DisplayName("A replaced nominee cannot complete the handoff, and the current nominee is not promoted on its behalf")
    void testStaleNomineeRefused() {
        accessControl.nominate(NOMINEE);
        accessControl.nominate(STRANGER);

        ClaimException e = assertThrows(ClaimException.class, () -> accessControl.completeHandoff(NOMINEE));
        assertEquals(ClaimErrorKind.UNAUTHORIZED, e.getKind());
        assertEquals(ADMIN, accessControl.authority().orElseThrow());
        assertEquals(STRANGER, accessControl.pendingAuthority().orElseThrow());

        assertEquals(STRANGER, accessControl.completeHandoff(STRANGER));
        assertTrue(accessControl.pendingAuthority().isEmpty());
    }

    @Test
    @DisplayName("Concurrent re-nomination never lets the earlier nominee's accept promote someone else")
    void testAcceptRacingRenomination() throws Exception {
        for (int round = 0; round < 200; round++) {
            AuthorityAccessControl control = new AuthorityAccessControl(props(ADMIN));
            control.nominate(NOMINEE);
            CountDownLatch start = new CountDownLatch(1);
            AtomicReference<String> accepted = new AtomicReference<>();

            Thread acceptor = new Thread(() -> {
                awaitQuietly(start);
                try {
                    accepted.set(control.completeHandoff(NOMINEE));
                } catch (ClaimException e) {
                    accepted.set(null);
                }
            });
            Thread renominator = new Thread(() -> {
                awaitQuietly(start);
                control.nominate(STRANGER);
            });
            acceptor.start();
            renominator.start();
            start.countDown();
            acceptor.join();
            renominator.join();

            String authority = control.authority().orElseThrow();
            if (accepted.get() != null) {
                assertEquals(NOMINEE, accepted.get());
                assertEquals(NOMINEE, authority);
            } else {
                assertEquals(ADMIN, authority);
            }
        }
    }

    @Test
    @DisplayName("requireAuthority throws UNAUTHORIZED")
    void testRequireAuthority() {
        accessControl.requireAuthority(AdminAction.SWEEP, ADMIN);
        ClaimException e = assertThrows(ClaimException.class,
                () -> accessControl.requireAuthority(AdminAction.SWEEP, STRANGER));
        assertEquals(ClaimErrorKind.UNAUTHORIZED, e.getKind());
    }

    @Test
    @DisplayName("Without configured authority nobody can administer; paused flag comes from config")
    void testUnconfigured() {
        ClaimProperties props = new ClaimProperties();
        props.setPaused(true);
        AuthorityAccessControl locked = new AuthorityAccessControl(props);

        assertFalse(locked.isAcceptingClaims());
        assertTrue(locked.authority().isEmpty());
        assertFalse(locked.isAuthorityFor(AdminAction.UNPAUSE, ADMIN));
    }

    @Test
    @DisplayName("Malformed configured authority fails fast")
    void testInvalidConfiguredAuthority() {
        ClaimProperties props = new ClaimProperties();
        props.setAuthority("not-an-address");
        assertThrows(IllegalArgumentException.class, () -> new AuthorityAccessControl(props));
    }
}
