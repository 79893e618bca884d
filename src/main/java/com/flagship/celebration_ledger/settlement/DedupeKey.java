package com.flagship.celebration_ledger.settlement;

import lombok.Value;

/**
 * Deduplication key: the event's idempotency key qualified by outcome (or
 * trigger kind), so a capture and a failure for one payment are distinct.
 */
@Value
public class DedupeKey {
    String key;
    String qualifier;

    public static DedupeKey of(String key, String qualifier) {
        if (key == null || key.isBlank()) {
            throw new IllegalArgumentException("Dedupe key cannot be blank");
        }
        if (qualifier == null || qualifier.isBlank()) {
            throw new IllegalArgumentException("Dedupe qualifier cannot be blank");
        }
        return new DedupeKey(key, qualifier);
    }

    @Override
    public String toString() {
        return key + "/" + qualifier;
    }
}
