package com.flagship.celebration_ledger.celebration;

import lombok.Value;

/**
 * Created record, or the existing one when the idempotency key was replayed.
 */
@Value
public class IntakeResult {
    ContributionRecord record;
    boolean created;
}
