package com.flagship.celebration_ledger.compliance;

/**
 * Machine-readable reasons a proposed contribution is refused.
 */
public enum RejectionReason {
    BELOW_MINIMUM("Below minimum contribution"),
    EXCEEDS_PER_CONTRIBUTION_CAP("Exceeds per-donation limit"),
    EXCEEDS_CUMULATIVE_CAP("Exceeds cumulative limit for the current window"),
    EXCEEDS_TIP_CAP("Exceeds annual tip limit"),
    LIMIT_UNDETERMINED("Contribution limit could not be determined");

    private final String description;

    RejectionReason(String description) {
        this.description = description;
    }

    public String getDescription() {
        return description;
    }
}
