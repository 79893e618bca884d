package com.flagship.celebration_ledger.celebration;

import com.flagship.celebration_ledger.celebration.dto.RemainingLimitResponse;
import com.flagship.celebration_ledger.compliance.ComplianceTier;
import com.flagship.celebration_ledger.compliance.LimitCalculation;
import com.flagship.celebration_ledger.compliance.Recipient;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.math.BigDecimal;

@RestController
@RequestMapping("/api/contributors")
@RequiredArgsConstructor
public class ContributorController {

    private final CelebrationQueryService queryService;

    /**
     * Remaining limit toward a recipient.
     *
     * {@code tier} defaults to the contributor's recorded tier. With
     * {@code proposed_amount} the response also says whether that amount
     * would be accepted and, if not, why.
     */
    @GetMapping("/{contributorId}/remaining-limit")
    public ResponseEntity<RemainingLimitResponse> getRemainingLimit(
            @PathVariable("contributorId") String contributorId,
            @RequestParam("recipient_id") String recipientId,
            @RequestParam("jurisdiction") String jurisdiction,
            @RequestParam(value = "tier", required = false) ComplianceTier tier,
            @RequestParam(value = "proposed_amount", required = false) BigDecimal proposedAmount) {
        LimitCalculation calculation = queryService.remainingLimit(contributorId, tier,
                Recipient.of(recipientId, jurisdiction), proposedAmount);
        return ResponseEntity.ok(RemainingLimitResponse.from(contributorId, recipientId, calculation));
    }
}
