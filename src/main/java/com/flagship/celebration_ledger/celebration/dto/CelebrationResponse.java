package com.flagship.celebration_ledger.celebration.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.celebration_ledger.celebration.CelebrationStatus;
import com.flagship.celebration_ledger.celebration.ContributionRecord;
import com.flagship.celebration_ledger.compliance.ComplianceTier;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * Response DTO for a celebration. The donor snapshot itself is not exposed,
 * only the tier it was committed under.
 */
@Value
@Builder
public class CelebrationResponse {

    @JsonProperty("id")
    UUID id;

    @JsonProperty("contributor_id")
    String contributorId;

    @JsonProperty("recipient_id")
    String recipientId;

    @JsonProperty("recipient_jurisdiction")
    String recipientJurisdiction;

    @JsonProperty("condition_id")
    String conditionId;

    @JsonProperty("amount")
    BigDecimal amount;

    @JsonProperty("tip")
    BigDecimal tip;

    @JsonProperty("processing_fee")
    BigDecimal processingFee;

    @JsonProperty("total_charged")
    BigDecimal totalCharged;

    @JsonProperty("status")
    CelebrationStatus status;

    @JsonProperty("compliance_tier")
    ComplianceTier complianceTier;

    @JsonProperty("ledger_length")
    int ledgerLength;

    @JsonProperty("created_at")
    Instant createdAt;

    @JsonProperty("updated_at")
    Instant updatedAt;

    public static CelebrationResponse from(ContributionRecord record) {
        return CelebrationResponse.builder()
            .id(record.getId())
            .contributorId(record.getContributorId())
            .recipientId(record.getRecipientId())
            .recipientJurisdiction(record.getRecipientJurisdiction())
            .conditionId(record.getConditionId())
            .amount(record.getAmount())
            .tip(record.getTip())
            .processingFee(record.getProcessingFee())
            .totalCharged(record.getTotalCharged())
            .status(record.getCurrentStatus())
            .complianceTier(record.snapshotTier().orElse(null))
            .ledgerLength(record.getVersion())
            .createdAt(record.getCreatedAt())
            .updatedAt(record.getUpdatedAt())
            .build();
    }
}
