package com.flagship.celebration_ledger.celebration.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.celebration_ledger.celebration.ActivationDetails;
import com.flagship.celebration_ledger.celebration.CelebrationStatus;
import com.flagship.celebration_ledger.celebration.DefunctCause;
import com.flagship.celebration_ledger.celebration.DefunctDetails;
import com.flagship.celebration_ledger.celebration.PauseDetails;
import com.flagship.celebration_ledger.celebration.ResolutionDetails;
import com.flagship.celebration_ledger.celebration.StatusMetadata;
import lombok.Value;

import java.time.LocalDate;

/**
 * Flat wire form of the status-specific details. Only the fields belonging to
 * the target status are read.
 */
@Value
public class StatusMetadataRequest {

    @JsonProperty("note")
    String note;

    @JsonProperty("pause_reason")
    String pauseReason;

    @JsonProperty("expected_resume_date")
    LocalDate expectedResumeDate;

    @JsonProperty("bill_id")
    String billId;

    @JsonProperty("bill_action")
    String billAction;

    @JsonProperty("action_date")
    LocalDate actionDate;

    @JsonProperty("provider_ref")
    String providerRef;

    @JsonProperty("defunct_cause")
    DefunctCause defunctCause;

    @JsonProperty("session_number")
    Integer sessionNumber;

    @JsonProperty("session_end_date")
    LocalDate sessionEndDate;

    @JsonProperty("session_type")
    String sessionType;

    public StatusMetadata toMetadata(CelebrationStatus target) {
        return switch (target) {
            case ACTIVE -> new ActivationDetails(note);
            case PAUSED -> new PauseDetails(pauseReason, expectedResumeDate, note);
            case RESOLVED -> ResolutionDetails.builder()
                    .billId(billId)
                    .billAction(billAction)
                    .actionDate(actionDate)
                    .providerRef(providerRef)
                    .note(note)
                    .build();
            case DEFUNCT -> DefunctDetails.builder()
                    .cause(defunctCause)
                    .sessionNumber(sessionNumber)
                    .sessionEndDate(sessionEndDate)
                    .sessionType(sessionType)
                    .providerRef(providerRef)
                    .note(note)
                    .build();
        };
    }
}
