package com.flagship.celebration_ledger.celebration;

import lombok.Value;

import java.time.LocalDate;

@Value
public class PauseDetails implements StatusMetadata {
    String pauseReason;
    LocalDate expectedResumeDate;
    String note;

    @Override
    public CelebrationStatus appliesTo() {
        return CelebrationStatus.PAUSED;
    }
}
