package com.flagship.celebration_ledger.celebration;

import com.flagship.celebration_ledger.compliance.ComplianceTier;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * One immutable fact in a celebration's status ledger.
 *
 * {@code previousStatus} is null only for the creation entry.
 * {@code compliant} is false whenever the contributor's tier at the time of the
 * change could not be established.
 */
@Value
@Builder
public class StatusChangeEntry {
    UUID statusChangeId;
    int sequenceNumber;
    CelebrationStatus previousStatus;
    CelebrationStatus newStatus;
    Instant changeTimestamp;
    String reason;
    TriggeredBy triggeredBy;
    String triggeredById;
    String triggeredByName;
    StatusMetadata metadata;
    ComplianceTier complianceTierAtTime;
    boolean compliant;
    AuditTrail auditTrail;

    public boolean isInitial() {
        return previousStatus == null;
    }
}
