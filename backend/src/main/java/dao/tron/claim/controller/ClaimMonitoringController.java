package dao.tron.claim.controller;

import dao.tron.claim.config.TokenProperties;
import dao.tron.claim.event.ClaimAuditListener;
import dao.tron.claim.model.RedemptionRecord;
import dao.tron.claim.model.RootEpoch;
import dao.tron.claim.service.AccessControl;
import dao.tron.claim.service.ClaimLedger;
import dao.tron.claim.service.TokenLedger;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.*;

/**
 * Monitoring endpoint for the active root, its history and recorded redemptions.
 */
@RestController
@RequestMapping("/api/monitor")
public class ClaimMonitoringController {

    private final ClaimLedger claimLedger;
    private final AccessControl accessControl;
    private final ClaimAuditListener audit;
    private final TokenLedger tokenLedger;
    private final TokenProperties tokenProps;

    public ClaimMonitoringController(ClaimLedger claimLedger,
                                     AccessControl accessControl,
                                     ClaimAuditListener audit,
                                     TokenLedger tokenLedger,
                                     TokenProperties tokenProps) {
        this.claimLedger = claimLedger;
        this.accessControl = accessControl;
        this.audit = audit;
        this.tokenLedger = tokenLedger;
        this.tokenProps = tokenProps;
    }

    /**
     * GET /api/monitor/stats
     */
    @GetMapping("/stats")
    public ResponseEntity<Map<String, Object>> getStats() {
        Map<String, Object> response = new LinkedHashMap<>();
        RootEpoch root = claimLedger.currentRoot();

        response.put("status", "SUCCESS");
        response.put("acceptingClaims", accessControl.isAcceptingClaims());
        response.put("root", Map.of(
                "epoch", root.epoch(),
                "merkleRoot", root.rootHex(),
                "activatedAt", root.activatedAt()
        ));
        response.put("redemptions", claimLedger.redemptionCount());
        response.put("claimsCompleted", audit.getClaimsCompleted());
        response.put("amountClaimed", audit.getAmountClaimed().toString());
        response.put("rotations", audit.getRotations());
        return ResponseEntity.ok(response);
    }

    /**
     * GET /api/monitor/roots
     * Every root the ledger has committed to, oldest first.
     */
    @GetMapping("/roots")
    public ResponseEntity<Map<String, Object>> getRoots() {
        Map<String, Object> response = new LinkedHashMap<>();
        List<RootEpoch> history = claimLedger.rootHistory();
        response.put("status", "SUCCESS");
        response.put("currentEpoch", claimLedger.currentRoot().epoch());
        response.put("roots", history);
        return ResponseEntity.ok(response);
    }

    /**
     * GET /api/monitor/balance?asset=...
     * Distributor balance of the claim token, or of {@code asset} when given.
     */
    @GetMapping("/balance")
    public ResponseEntity<Map<String, Object>> getDistributorBalance(@RequestParam(required = false) String asset) {
        String target = (asset == null || asset.isBlank()) ? tokenProps.getAddress() : asset;
        String distributor = tokenLedger.getDistributorAddress();

        Map<String, Object> response = new LinkedHashMap<>();
        response.put("status", "SUCCESS");
        response.put("asset", target);
        response.put("distributor", distributor);
        response.put("balance", tokenLedger.balanceOf(target, distributor).toString());
        return ResponseEntity.ok(response);
    }

    /**
     * GET /api/monitor/redemptions
     */
    @GetMapping("/redemptions")
    public ResponseEntity<Map<String, Object>> getRedemptions() {
        Map<String, Object> response = new LinkedHashMap<>();

        List<Map<String, Object>> rows = new ArrayList<>();
        for (RedemptionRecord r : claimLedger.redemptions()) {
            Map<String, Object> row = new LinkedHashMap<>();
            row.put("recipient", r.recipient());
            row.put("amount", r.amount().toString());
            row.put("rootEpoch", r.rootEpoch());
            row.put("claimedAt", r.claimedAt());
            rows.add(row);
        }

        response.put("status", "SUCCESS");
        response.put("total", rows.size());
        response.put("redemptions", rows);
        return ResponseEntity.ok(response);
    }
}
