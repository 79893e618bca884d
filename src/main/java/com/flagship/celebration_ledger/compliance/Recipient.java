package com.flagship.celebration_ledger.compliance;

import lombok.Value;

/**
 * Recipient of a contribution and the jurisdiction whose election calendar applies.
 */
@Value
public class Recipient {
    String recipientId;
    String jurisdiction;

    public static Recipient of(String recipientId, String jurisdiction) {
        if (recipientId == null || recipientId.isBlank()) {
            throw new IllegalArgumentException("Recipient ID is required");
        }
        if (jurisdiction == null || jurisdiction.isBlank()) {
            throw new IllegalArgumentException("Recipient jurisdiction is required");
        }
        return new Recipient(recipientId, jurisdiction.trim().toUpperCase());
    }
}
