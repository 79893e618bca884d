package com.flagship.celebration_ledger.compliance;

import lombok.Getter;

import java.math.BigDecimal;

/**
 * Raised at intake when a contribution would break a limit. No ledger entry
 * exists for a rejected contribution.
 */
@Getter
public class ContributionRejectedException extends RuntimeException {

    private final RejectionReason reason;
    private final BigDecimal remaining;

    public ContributionRejectedException(RejectionReason reason, BigDecimal remaining) {
        super(reason.getDescription() + (remaining != null ? " (remaining: " + remaining.toPlainString() + ")" : ""));
        this.reason = reason;
        this.remaining = remaining;
    }
}
