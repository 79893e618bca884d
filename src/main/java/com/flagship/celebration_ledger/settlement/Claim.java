package com.flagship.celebration_ledger.settlement;

import lombok.Value;

import java.util.UUID;

/**
 * A held claim on a dedupe key. The token identifies this holder, so a claim
 * that was taken over after going stale can no longer complete or release the key.
 */
@Value
public class Claim {
    DedupeKey key;
    String token;

    public static Claim newClaim(DedupeKey key) {
        return new Claim(key, UUID.randomUUID().toString());
    }

    @Override
    public String toString() {
        return key.toString();
    }
}
