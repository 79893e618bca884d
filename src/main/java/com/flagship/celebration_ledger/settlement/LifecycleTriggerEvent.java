package com.flagship.celebration_ledger.settlement;

import com.flagship.celebration_ledger.celebration.CelebrationStatus;
import com.flagship.celebration_ledger.celebration.StatusMetadata;
import com.flagship.celebration_ledger.celebration.TransitionTrigger;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Value;

import java.util.UUID;

/**
 * Lifecycle trigger from a condition watcher or an operator.
 *
 * Without an {@code eventKey} the event is applied without deduplication.
 */
@Value
@Builder
@AllArgsConstructor
public class LifecycleTriggerEvent {
    String eventKey;
    UUID recordId;
    LifecycleTriggerKind kind;
    CelebrationStatus targetStatus;
    String reason;
    TransitionTrigger trigger;
    StatusMetadata metadata;
}
