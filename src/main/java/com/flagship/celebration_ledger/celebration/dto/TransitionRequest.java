package com.flagship.celebration_ledger.celebration.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.celebration_ledger.celebration.CelebrationStatus;
import com.flagship.celebration_ledger.celebration.TriggeredBy;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Value;

/**
 * Request DTO for a status change.
 */
@Value
public class TransitionRequest {

    @NotNull(message = "Target status is required")
    @JsonProperty("target_status")
    CelebrationStatus targetStatus;

    @NotBlank(message = "Reason is required")
    @JsonProperty("reason")
    String reason;

    @NotNull(message = "Triggered by is required")
    @JsonProperty("triggered_by")
    TriggeredBy triggeredBy;

    @JsonProperty("triggered_by_id")
    String triggeredById;

    @JsonProperty("triggered_by_name")
    String triggeredByName;

    @Valid
    @JsonProperty("metadata")
    StatusMetadataRequest metadata;
}
