package dao.tron.claim.controller;

import dao.tron.claim.model.AuthorityNominationRequest;
import dao.tron.claim.model.RootEpoch;
import dao.tron.claim.model.RootRotationRequest;
import dao.tron.claim.model.SweepRequest;
import dao.tron.claim.model.TransferResult;
import dao.tron.claim.service.AccessControl;
import dao.tron.claim.service.AdminService;
import jakarta.validation.Valid;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.math.BigInteger;
import java.util.LinkedHashMap;
import java.util.Map;

import static dao.tron.claim.controller.ClaimController.CALLER_HEADER;

@RestController
@RequestMapping("/api/admin")
public class AdminController {

    private final AdminService adminService;
    private final AccessControl accessControl;

    public AdminController(AdminService adminService, AccessControl accessControl) {
        this.adminService = adminService;
        this.accessControl = accessControl;
    }

    @PutMapping("/root")
    public ResponseEntity<RootEpoch> setRoot(@RequestHeader(CALLER_HEADER) String caller,
                                             @Valid @RequestBody RootRotationRequest req) {
        return ResponseEntity.ok(adminService.setRoot(caller, req.getMerkleRoot()));
    }

    @PostMapping("/pause")
    public ResponseEntity<Map<String, Object>> pause(@RequestHeader(CALLER_HEADER) String caller) {
        adminService.pause(caller);
        return ResponseEntity.ok(authorityState());
    }

    @PostMapping("/unpause")
    public ResponseEntity<Map<String, Object>> unpause(@RequestHeader(CALLER_HEADER) String caller) {
        adminService.unpause(caller);
        return ResponseEntity.ok(authorityState());
    }

    @PostMapping("/sweep")
    public ResponseEntity<TransferResult> sweep(@RequestHeader(CALLER_HEADER) String caller,
                                                @Valid @RequestBody SweepRequest req) {
        BigInteger amount;
        try {
            amount = new BigInteger(req.getAmount().trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Amount is not a decimal integer: " + req.getAmount(), e);
        }
        return ResponseEntity.ok(adminService.sweepForeignAsset(caller, req.getAsset(), req.getTo(), amount));
    }

    @GetMapping("/authority")
    public ResponseEntity<Map<String, Object>> authority() {
        return ResponseEntity.ok(authorityState());
    }

    @PostMapping("/authority/nominate")
    public ResponseEntity<Map<String, Object>> nominate(@RequestHeader(CALLER_HEADER) String caller,
                                                        @Valid @RequestBody AuthorityNominationRequest req) {
        adminService.nominateAuthority(caller, req.getNominee());
        return ResponseEntity.ok(authorityState());
    }

    @PostMapping("/authority/accept")
    public ResponseEntity<Map<String, Object>> accept(@RequestHeader(CALLER_HEADER) String caller) {
        adminService.acceptAuthority(caller);
        return ResponseEntity.ok(authorityState());
    }

    @PostMapping("/authority/cancel")
    public ResponseEntity<Map<String, Object>> cancel(@RequestHeader(CALLER_HEADER) String caller) {
        adminService.cancelNomination(caller);
        return ResponseEntity.ok(authorityState());
    }

    private Map<String, Object> authorityState() {
        Map<String, Object> state = new LinkedHashMap<>();
        state.put("authority", accessControl.authority().orElse(null));
        state.put("pendingAuthority", accessControl.pendingAuthority().orElse(null));
        state.put("acceptingClaims", accessControl.isAcceptingClaims());
        return state;
    }
}
