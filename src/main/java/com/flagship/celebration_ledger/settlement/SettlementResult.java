package com.flagship.celebration_ledger.settlement;

import com.flagship.celebration_ledger.celebration.CelebrationStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Value;

import java.util.UUID;

/**
 * Stored outcome of an event, returned unchanged for every redelivery.
 */
@Value
@Builder
@AllArgsConstructor
public class SettlementResult {
    SettlementDisposition disposition;
    UUID recordId;
    CelebrationStatus status;
    Integer sequenceNumber;
    String message;
}
