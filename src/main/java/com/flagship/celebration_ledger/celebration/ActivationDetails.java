package com.flagship.celebration_ledger.celebration;

import lombok.Value;

@Value
public class ActivationDetails implements StatusMetadata {
    String note;

    @Override
    public CelebrationStatus appliesTo() {
        return CelebrationStatus.ACTIVE;
    }
}
