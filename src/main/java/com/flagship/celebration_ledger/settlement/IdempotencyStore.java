package com.flagship.celebration_ledger.settlement;

import java.util.Optional;

/**
 * Keyed store of processed events.
 *
 * A key moves from absent to claimed to completed. Only one caller can hold
 * the claim on a key; a released claim returns the key to absent.
 */
public interface IdempotencyStore {

    /**
     * Result of a completed key; empty while absent or claimed.
     */
    Optional<SettlementResult> getResult(DedupeKey key);

    /**
     * Atomically claims an absent key.
     *
     * @return the claim if this caller now owns the key
     */
    Optional<Claim> tryClaim(DedupeKey key);

    /**
     * Stores the result under the claimed key.
     *
     * @return false if the claim had been taken over and nothing was stored
     */
    boolean complete(Claim claim, SettlementResult result);

    /**
     * Drops the claim if it is still held by this claimant and not yet completed.
     */
    void release(Claim claim);
}
