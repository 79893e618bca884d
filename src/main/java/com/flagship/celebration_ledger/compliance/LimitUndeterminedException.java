package com.flagship.celebration_ledger.compliance;

import lombok.Getter;

/**
 * Thrown when a contribution limit cannot be computed, typically because no
 * election dates are available for the recipient's jurisdiction.
 *
 * Callers fail closed: the contribution or reactivation is blocked.
 */
@Getter
public class LimitUndeterminedException extends RuntimeException {

    private final String jurisdiction;

    public LimitUndeterminedException(String jurisdiction, String message) {
        super(message);
        this.jurisdiction = jurisdiction;
    }
}
