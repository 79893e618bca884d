package com.flagship.celebration_ledger.compliance;

import com.flagship.celebration_ledger.election.BoundarySource;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Optional;

/**
 * Outcome of a limit evaluation.
 *
 * {@code remaining} is what the contributor may still give in the active
 * window, capped by the per-contribution limit and never negative. When a
 * proposed amount was supplied, {@code rejection} is null if it fits.
 */
@Value
@Builder
public class LimitCalculation {
    ComplianceTier tier;
    BigDecimal remaining;
    BigDecimal perContributionCap;
    BigDecimal cumulativeCap;
    BigDecimal countedTotal;
    Instant windowStart;
    Instant windowEnd;
    BoundarySource boundarySource;
    BigDecimal proposedAmount;
    RejectionReason rejection;

    public boolean isAllowed() {
        return proposedAmount != null && rejection == null;
    }

    public Optional<RejectionReason> rejectionReason() {
        return Optional.ofNullable(rejection);
    }

    public boolean isExhausted() {
        return remaining.signum() == 0;
    }
}
