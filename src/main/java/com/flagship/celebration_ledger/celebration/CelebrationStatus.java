package com.flagship.celebration_ledger.celebration;

/**
 * Escrow status of a celebration.
 *
 * ACTIVE: funds held, waiting on the condition
 * PAUSED: held, temporarily not eligible to resolve
 * RESOLVED: condition met, funds released to the recipient (terminal)
 * DEFUNCT: condition can no longer be met or payment failed (terminal)
 */
public enum CelebrationStatus {
    ACTIVE,
    PAUSED,
    RESOLVED,
    DEFUNCT;

    public boolean isTerminal() {
        return this == RESOLVED || this == DEFUNCT;
    }
}
