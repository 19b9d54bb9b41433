package dao.tron.claim.controller;

import dao.tron.claim.model.ClaimReceipt;
import dao.tron.claim.model.ClaimRequest;
import dao.tron.claim.model.RedemptionRecord;
import dao.tron.claim.model.RootEpoch;
import dao.tron.claim.service.ClaimLedger;
import jakarta.validation.Valid;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

@RestController
@RequestMapping("/api/claims")
public class ClaimController {

    public static final String CALLER_HEADER = "X-Caller";

    private final ClaimLedger claimLedger;

    public ClaimController(ClaimLedger claimLedger) {
        this.claimLedger = claimLedger;
    }

    @PostMapping
    public ResponseEntity<ClaimReceipt> claim(@RequestHeader(CALLER_HEADER) String caller,
                                              @Valid @RequestBody ClaimRequest req) {
        return ResponseEntity.ok(claimLedger.claim(caller, req.getAmount(), req.getProof()));
    }

    @GetMapping("/root")
    public ResponseEntity<RootEpoch> currentRoot() {
        return ResponseEntity.ok(claimLedger.currentRoot());
    }

    @GetMapping("/{recipient}")
    public ResponseEntity<Map<String, Object>> status(@PathVariable String recipient) {
        Map<String, Object> response = new LinkedHashMap<>();
        Optional<RedemptionRecord> record = claimLedger.findRedemption(recipient);
        response.put("recipient", recipient);
        response.put("status", claimLedger.status(recipient).name());
        record.ifPresent(r -> {
            response.put("amount", r.amount().toString());
            response.put("rootEpoch", r.rootEpoch());
            response.put("claimedAt", r.claimedAt());
        });
        return ResponseEntity.ok(response);
    }
}
