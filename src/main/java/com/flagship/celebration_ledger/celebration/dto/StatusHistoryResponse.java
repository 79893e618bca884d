package com.flagship.celebration_ledger.celebration.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.celebration_ledger.celebration.CelebrationStatus;
import com.flagship.celebration_ledger.celebration.StatusHistory;
import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.UUID;

/**
 * Ledger view, most recent entry first. Durations are in seconds.
 */
@Value
@Builder
public class StatusHistoryResponse {

    @JsonProperty("celebration_id")
    UUID celebrationId;

    @JsonProperty("current_status")
    CelebrationStatus currentStatus;

    @JsonProperty("total_changes")
    int totalChanges;

    @JsonProperty("seconds_in_current_status")
    long secondsInCurrentStatus;

    @JsonProperty("lifetime_seconds")
    long lifetimeSeconds;

    @JsonProperty("recent_changes")
    List<StatusChangeResponse> recentChanges;

    public static StatusHistoryResponse from(StatusHistory history) {
        return StatusHistoryResponse.builder()
            .celebrationId(history.getRecordId())
            .currentStatus(history.getCurrentStatus())
            .totalChanges(history.getTotalChanges())
            .secondsInCurrentStatus(history.getTimeInCurrentStatus().getSeconds())
            .lifetimeSeconds(history.getLifetime().getSeconds())
            .recentChanges(history.getRecentChanges().stream().map(StatusChangeResponse::from).toList())
            .build();
    }
}
