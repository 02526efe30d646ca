package dao.ore.bmine.controller;

import dao.ore.bmine.config.ClaimProperties;
import dao.ore.bmine.model.ClaimReport;
import dao.ore.bmine.model.ClaimRequest;
import dao.ore.bmine.model.PublicKey;
import dao.ore.bmine.service.ClaimService;
import dao.ore.bmine.util.OreUnits;
import jakarta.validation.Valid;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;

@Slf4j
@RestController
@RequestMapping("/api/claim")
public class ClaimController {

    private final ClaimService claimService;
    private final ClaimProperties claimProps;

    public ClaimController(ClaimService claimService, ClaimProperties claimProps) {
        this.claimService = claimService;
        this.claimProps = claimProps;
    }

    @PostMapping
    public ResponseEntity<Map<String, Object>> claim(@Valid @RequestBody(required = false) ClaimRequest req) {
        Map<String, Object> response = new LinkedHashMap<>();
        String beneficiary = req != null && req.getBeneficiary() != null && !req.getBeneficiary().isBlank()
                ? req.getBeneficiary() : claimProps.getBeneficiary();
        if (beneficiary == null || beneficiary.isBlank()) {
            response.put("status", "ERROR");
            response.put("message", "no beneficiary given and claim.beneficiary is not set");
            return ResponseEntity.badRequest().body(response);
        }
        double threshold = req != null && req.getThreshold() != null ? req.getThreshold() : claimProps.getThreshold();

        try {
            ClaimReport report = claimService.claimOnce(PublicKey.fromBase58(beneficiary),
                    OreUnits.fromUiAmount(threshold));
            response.put("status", "SUCCESS");
            response.put("claimed", OreUnits.format(report.claimed()));
            response.put("rejected", OreUnits.format(report.rejected()));
            response.put("remaining", OreUnits.format(report.remaining()));
            response.put("bundlesLanded", report.bundlesLanded());
            return ResponseEntity.ok(response);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            response.put("status", "ERROR");
            response.put("message", "interrupted");
            return ResponseEntity.internalServerError().body(response);
        } catch (RuntimeException e) {
            log.error("Claim failed: {}", e.getMessage());
            response.put("status", "ERROR");
            response.put("message", e.getMessage());
            return ResponseEntity.internalServerError().body(response);
        }
    }
}
