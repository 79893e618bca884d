package com.flagship.celebration_ledger.celebration;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Value;

import java.time.LocalDate;

/**
 * Why a celebration can no longer resolve. Session fields are filled when the
 * congressional session that held the bill has ended.
 */
@Value
@Builder
@AllArgsConstructor
public class DefunctDetails implements StatusMetadata {
    DefunctCause cause;
    Integer sessionNumber;
    LocalDate sessionEndDate;
    String sessionType;
    String providerRef;
    String note;

    @Override
    public CelebrationStatus appliesTo() {
        return CelebrationStatus.DEFUNCT;
    }
}
