package com.flagship.celebration_ledger.settlement;

import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * Settlement notice from the payment provider.
 *
 * {@code idempotencyKey} identifies the payment; a provider may redeliver the
 * same notice any number of times. {@code recordId} may be absent, in which
 * case the celebration is found through the idempotency key.
 */
@Value
public class SettlementEvent {
    String idempotencyKey;
    UUID recordId;
    SettlementOutcome outcome;
    String providerRef;
    Instant occurredAt;
}
