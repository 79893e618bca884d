package com.flagship.celebration_ledger.celebration.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.celebration_ledger.celebration.CelebrationStatus;
import lombok.Value;

import java.util.UUID;

@Value
public class StatusResponse {

    @JsonProperty("celebration_id")
    UUID celebrationId;

    @JsonProperty("status")
    CelebrationStatus status;
}
