package com.flagship.celebration_ledger.celebration.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import lombok.Value;

import java.math.BigDecimal;

/**
 * Request DTO for committing a new celebration.
 */
@Value
public class CreateCelebrationRequest {

    @NotBlank(message = "Contributor ID is required")
    @JsonProperty("contributor_id")
    String contributorId;

    @NotBlank(message = "Recipient ID is required")
    @JsonProperty("recipient_id")
    String recipientId;

    @NotBlank(message = "Recipient jurisdiction is required")
    @Pattern(regexp = "^[A-Za-z]{2}$", message = "Jurisdiction must be a 2-letter state code")
    @JsonProperty("recipient_jurisdiction")
    String recipientJurisdiction;

    @NotBlank(message = "Condition ID is required")
    @JsonProperty("condition_id")
    String conditionId;

    @NotNull(message = "Amount is required")
    @DecimalMin(value = "0.01", message = "Amount must be greater than 0")
    @JsonProperty("amount")
    BigDecimal amount;

    @DecimalMin(value = "0.00", message = "Tip cannot be negative")
    @JsonProperty("tip")
    BigDecimal tip;

    @DecimalMin(value = "0.00", message = "Processing fee cannot be negative")
    @JsonProperty("processing_fee")
    BigDecimal processingFee;

    @Valid
    @JsonProperty("donor")
    DonorProfileRequest donor;
}
