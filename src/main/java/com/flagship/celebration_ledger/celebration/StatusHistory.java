package com.flagship.celebration_ledger.celebration;

import lombok.Builder;
import lombok.Value;

import java.time.Duration;
import java.util.List;
import java.util.UUID;

/**
 * Read model of a celebration's ledger: most recent entries first, plus how
 * long the celebration has been in its current status and in total.
 */
@Value
@Builder
public class StatusHistory {
    UUID recordId;
    int totalChanges;
    List<StatusChangeEntry> recentChanges;
    CelebrationStatus currentStatus;
    Duration timeInCurrentStatus;
    Duration lifetime;
}
