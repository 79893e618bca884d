package com.flagship.celebration_ledger.compliance;

import com.flagship.celebration_ledger.celebration.ContributionRecord;
import com.flagship.celebration_ledger.election.AnnualWindow;
import com.flagship.celebration_ledger.election.ElectionWindow;
import com.flagship.celebration_ledger.election.ResetBoundary;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Collection;

/**
 * Computes what a contributor may still give.
 *
 * BASE tier: calendar-year window in the reference offset, all recipients.
 * ELEVATED tier: current election window (primary or general) of the
 * recipient's jurisdiction, same recipient only.
 *
 * Every status except DEFUNCT counts toward the window total. Pure: the
 * caller supplies the history, the boundary and the evaluation instant.
 */
@Component
public class DonationLimitCalculator {

    private final ComplianceLimits limits;

    public DonationLimitCalculator(ComplianceLimits limits) {
        this.limits = limits;
    }

    /**
     * @param tier Effective tier of the contributor
     * @param history Contributor's existing records (any status)
     * @param recipientId Recipient of the proposed contribution
     * @param boundary Election reset boundary; required for ELEVATED, ignored for BASE
     * @param asOf Instant the proposed contribution would be made
     * @param newAmount Proposed amount, or null to only compute the remaining limit
     * @throws LimitUndeterminedException if ELEVATED and no usable boundary is given
     */
    public LimitCalculation remainingLimit(ComplianceTier tier, Collection<ContributionRecord> history,
                                           String recipientId, ResetBoundary boundary, Instant asOf,
                                           BigDecimal newAmount) {
        if (tier == null) {
            throw new IllegalArgumentException("Tier is required");
        }
        return tier == ComplianceTier.ELEVATED
                ? electionCycleLimit(history, recipientId, boundary, asOf, newAmount)
                : annualLimit(history, asOf, newAmount);
    }

    /**
     * Remaining annual tip allowance. Tips are pooled across all recipients
     * and reset with the calendar year regardless of tier.
     */
    public BigDecimal remainingTipAllowance(Collection<ContributionRecord> history, Instant asOf) {
        AnnualWindow window = AnnualWindow.containing(asOf, limits.getReferenceOffset());
        BigDecimal used = history.stream()
                .filter(ContributionRecord::countsTowardLimits)
                .filter(r -> window.contains(r.getCreatedAt()))
                .map(ContributionRecord::getTip)
                .reduce(BigDecimal.ZERO, BigDecimal::add);
        return floorAtZero(limits.getTipAnnual().subtract(used));
    }

    private LimitCalculation annualLimit(Collection<ContributionRecord> history, Instant asOf, BigDecimal newAmount) {
        AnnualWindow window = AnnualWindow.containing(asOf, limits.getReferenceOffset());
        BigDecimal counted = history.stream()
                .filter(ContributionRecord::countsTowardLimits)
                .filter(r -> window.contains(r.getCreatedAt()))
                .map(ContributionRecord::getAmount)
                .reduce(BigDecimal.ZERO, BigDecimal::add);

        return decide(ComplianceTier.BASE, counted, window.getStart(), window.getEnd(), null, newAmount);
    }

    private LimitCalculation electionCycleLimit(Collection<ContributionRecord> history, String recipientId,
                                                ResetBoundary boundary, Instant asOf, BigDecimal newAmount) {
        if (boundary == null) {
            throw new LimitUndeterminedException(null, "Election boundary is required for the elevated tier");
        }
        ElectionWindow window = boundary.windowOf(asOf);
        if (window == ElectionWindow.PRIOR_CYCLE || window == ElectionWindow.NEXT_CYCLE) {
            throw new LimitUndeterminedException(boundary.getJurisdiction(), String.format(
                "Boundary for cycle %d does not cover %s", boundary.getCycleYear(), asOf));
        }

        BigDecimal counted = history.stream()
                .filter(ContributionRecord::countsTowardLimits)
                .filter(r -> r.getRecipientId().equals(recipientId))
                .filter(r -> boundary.windowOf(r.getCreatedAt()) == window)
                .map(ContributionRecord::getAmount)
                .reduce(BigDecimal.ZERO, BigDecimal::add);

        return decide(ComplianceTier.ELEVATED, counted, boundary.windowStart(window), boundary.windowEnd(window),
                boundary, newAmount);
    }

    private LimitCalculation decide(ComplianceTier tier, BigDecimal counted, Instant windowStart, Instant windowEnd,
                                    ResetBoundary boundary, BigDecimal newAmount) {
        BigDecimal perContribution = limits.perContributionCap(tier);
        BigDecimal cumulative = limits.cumulativeCap(tier);
        BigDecimal remaining = floorAtZero(perContribution.min(cumulative.subtract(counted)));

        RejectionReason rejection = null;
        if (newAmount != null) {
            if (newAmount.compareTo(limits.getMinimumContribution()) < 0) {
                rejection = RejectionReason.BELOW_MINIMUM;
            } else if (newAmount.compareTo(perContribution) > 0) {
                rejection = RejectionReason.EXCEEDS_PER_CONTRIBUTION_CAP;
            } else if (newAmount.compareTo(remaining) > 0) {
                rejection = RejectionReason.EXCEEDS_CUMULATIVE_CAP;
            }
        }

        return LimitCalculation.builder()
                .tier(tier)
                .remaining(remaining)
                .perContributionCap(perContribution)
                .cumulativeCap(cumulative)
                .countedTotal(counted)
                .windowStart(windowStart)
                .windowEnd(windowEnd)
                .boundarySource(boundary != null ? boundary.getSource() : null)
                .proposedAmount(newAmount)
                .rejection(rejection)
                .build();
    }

    private static BigDecimal floorAtZero(BigDecimal value) {
        return value.signum() < 0 ? BigDecimal.ZERO : value;
    }
}
