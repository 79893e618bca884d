package com.flagship.celebration_ledger.celebration;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Value;

/**
 * Who or what requested a status change.
 */
@Value
@Builder
@AllArgsConstructor
public class TransitionTrigger {
    TriggeredBy triggeredBy;
    String id;
    String name;
    AuditTrail auditTrail;

    public static TransitionTrigger system(String name) {
        return TransitionTrigger.builder()
                .triggeredBy(TriggeredBy.SYSTEM)
                .name(name)
                .build();
    }
}
