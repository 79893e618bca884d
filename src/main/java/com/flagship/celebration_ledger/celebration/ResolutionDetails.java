package com.flagship.celebration_ledger.celebration;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Value;

import java.time.LocalDate;

/**
 * How the watched condition was met: the bill, the action taken on it and,
 * once funds move, the payment provider's reference.
 */
@Value
@Builder
@AllArgsConstructor
public class ResolutionDetails implements StatusMetadata {
    String billId;
    String billAction;
    LocalDate actionDate;
    String providerRef;
    String note;

    @Override
    public CelebrationStatus appliesTo() {
        return CelebrationStatus.RESOLVED;
    }
}
