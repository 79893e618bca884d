package com.flagship.celebration_ledger.celebration.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.celebration_ledger.celebration.CelebrationStatus;
import com.flagship.celebration_ledger.celebration.StatusChangeEntry;
import com.flagship.celebration_ledger.celebration.StatusMetadata;
import com.flagship.celebration_ledger.celebration.TriggeredBy;
import com.flagship.celebration_ledger.compliance.ComplianceTier;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

@Value
@Builder
public class StatusChangeResponse {

    @JsonProperty("status_change_id")
    UUID statusChangeId;

    @JsonProperty("sequence_number")
    int sequenceNumber;

    @JsonProperty("previous_status")
    CelebrationStatus previousStatus;

    @JsonProperty("new_status")
    CelebrationStatus newStatus;

    @JsonProperty("change_timestamp")
    Instant changeTimestamp;

    @JsonProperty("reason")
    String reason;

    @JsonProperty("triggered_by")
    TriggeredBy triggeredBy;

    @JsonProperty("triggered_by_id")
    String triggeredById;

    @JsonProperty("triggered_by_name")
    String triggeredByName;

    @JsonProperty("metadata")
    StatusMetadata metadata;

    @JsonProperty("compliance_tier_at_time")
    ComplianceTier complianceTierAtTime;

    @JsonProperty("fec_compliant")
    boolean compliant;

    public static StatusChangeResponse from(StatusChangeEntry entry) {
        return StatusChangeResponse.builder()
            .statusChangeId(entry.getStatusChangeId())
            .sequenceNumber(entry.getSequenceNumber())
            .previousStatus(entry.getPreviousStatus())
            .newStatus(entry.getNewStatus())
            .changeTimestamp(entry.getChangeTimestamp())
            .reason(entry.getReason())
            .triggeredBy(entry.getTriggeredBy())
            .triggeredById(entry.getTriggeredById())
            .triggeredByName(entry.getTriggeredByName())
            .metadata(entry.getMetadata())
            .complianceTierAtTime(entry.getComplianceTierAtTime())
            .compliant(entry.isCompliant())
            .build();
    }
}
