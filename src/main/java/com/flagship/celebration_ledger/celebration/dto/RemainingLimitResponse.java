package com.flagship.celebration_ledger.celebration.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.celebration_ledger.compliance.ComplianceTier;
import com.flagship.celebration_ledger.compliance.LimitCalculation;
import com.flagship.celebration_ledger.compliance.RejectionReason;
import com.flagship.celebration_ledger.election.BoundarySource;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Response DTO for a contributor's remaining limit toward one recipient.
 * {@code boundary_source} is null for the base tier, which uses calendar years.
 * {@code allowed} and {@code rejection_reason} are only set when a proposed
 * amount was checked.
 */
@Value
@Builder
public class RemainingLimitResponse {

    @JsonProperty("contributor_id")
    String contributorId;

    @JsonProperty("recipient_id")
    String recipientId;

    @JsonProperty("tier")
    ComplianceTier tier;

    @JsonProperty("remaining")
    BigDecimal remaining;

    @JsonProperty("per_contribution_cap")
    BigDecimal perContributionCap;

    @JsonProperty("cumulative_cap")
    BigDecimal cumulativeCap;

    @JsonProperty("counted_total")
    BigDecimal countedTotal;

    @JsonProperty("window_start")
    Instant windowStart;

    @JsonProperty("window_end")
    Instant windowEnd;

    @JsonProperty("boundary_source")
    BoundarySource boundarySource;

    @JsonProperty("proposed_amount")
    BigDecimal proposedAmount;

    @JsonProperty("allowed")
    Boolean allowed;

    @JsonProperty("rejection_reason")
    RejectionReason rejectionReason;

    public static RemainingLimitResponse from(String contributorId, String recipientId, LimitCalculation calculation) {
        return RemainingLimitResponse.builder()
            .contributorId(contributorId)
            .recipientId(recipientId)
            .tier(calculation.getTier())
            .remaining(calculation.getRemaining())
            .perContributionCap(calculation.getPerContributionCap())
            .cumulativeCap(calculation.getCumulativeCap())
            .countedTotal(calculation.getCountedTotal())
            .windowStart(calculation.getWindowStart())
            .windowEnd(calculation.getWindowEnd())
            .boundarySource(calculation.getBoundarySource())
            .proposedAmount(calculation.getProposedAmount())
            .allowed(calculation.getProposedAmount() != null ? calculation.isAllowed() : null)
            .rejectionReason(calculation.rejectionReason().orElse(null))
            .build();
    }
}
