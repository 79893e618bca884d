package com.flagship.celebration_ledger.settlement;

/**
 * What the coordinator did with an event.
 */
public enum SettlementDisposition {
    /** A new ledger entry was written. */
    APPLIED,
    /** Capture for a celebration that is already resolved; nothing written. */
    CONFIRMED,
    DROPPED_INVALID_TRANSITION,
    /** Not stored: a later delivery may find the record. */
    DROPPED_UNKNOWN_RECORD,
    /** Not stored: the idempotency key belongs to a different record than the record ID. */
    DROPPED_KEY_MISMATCH,
    SKIPPED_CAP_EXHAUSTED,
    /** Reactivation refused because it would break a limit. */
    REJECTED
}
