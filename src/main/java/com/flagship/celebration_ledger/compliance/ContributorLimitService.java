package com.flagship.celebration_ledger.compliance;

import com.flagship.celebration_ledger.celebration.ContributionRecord;
import com.flagship.celebration_ledger.celebration.ContributionRecordStore;
import com.flagship.celebration_ledger.election.ElectionCycleResolver;
import com.flagship.celebration_ledger.election.ResetBoundary;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.util.Collection;
import java.util.List;

/**
 * Limit queries over a contributor's stored history.
 *
 * Resolves the election boundary only when the tier needs one, so base-tier
 * contributions never depend on election data.
 */
@Service
@Slf4j
public class ContributorLimitService {

    private final ContributionRecordStore recordStore;
    private final ElectionCycleResolver cycleResolver;
    private final DonationLimitCalculator calculator;
    private final Clock clock;

    public ContributorLimitService(ContributionRecordStore recordStore,
                                   ElectionCycleResolver cycleResolver,
                                   DonationLimitCalculator calculator,
                                   Clock clock) {
        this.recordStore = recordStore;
        this.cycleResolver = cycleResolver;
        this.calculator = calculator;
        this.clock = clock;
    }

    /**
     * Remaining limit for a proposed contribution made now.
     *
     * @param proposedAmount Amount to check, or null for the remaining limit only
     * @throws LimitUndeterminedException if the tier needs election dates that are unavailable
     */
    public LimitCalculation remainingLimit(String contributorId, ComplianceTier tier,
                                           Recipient recipient, BigDecimal proposedAmount) {
        List<ContributionRecord> history = recordStore.findByContributor(contributorId);
        return evaluate(history, tier, recipient, proposedAmount, clock.instant());
    }

    /**
     * Evaluates against an already-loaded history at an arbitrary instant.
     */
    public LimitCalculation evaluate(Collection<ContributionRecord> history, ComplianceTier tier,
                                     Recipient recipient, BigDecimal proposedAmount, Instant asOf) {
        ResetBoundary boundary = tier == ComplianceTier.ELEVATED
                ? cycleResolver.resolveResetBoundary(recipient.getJurisdiction(), asOf)
                : null;
        return calculator.remainingLimit(tier, history, recipient.getRecipientId(), boundary, asOf, proposedAmount);
    }

    /**
     * Re-checks a paused record before it becomes active again: its own amount
     * against the window it was committed in, with the record itself excluded
     * from the counted total. A record without a snapshot tier is held to BASE.
     */
    public LimitCalculation revalidateForReactivation(ContributionRecord record) {
        List<ContributionRecord> others = recordStore.findByContributor(record.getContributorId()).stream()
                .filter(r -> !r.getId().equals(record.getId()))
                .toList();
        ComplianceTier tier = record.snapshotTier().orElse(ComplianceTier.BASE);
        LimitCalculation calculation = evaluate(others, tier,
                Recipient.of(record.getRecipientId(), record.getRecipientJurisdiction()),
                record.getAmount(), record.getCreatedAt());
        log.debug("Reactivation check for {}: tier={}, remaining={}, rejection={}",
                record.getId(), tier, calculation.getRemaining(), calculation.getRejection());
        return calculation;
    }

    /**
     * Whether the contributor has nothing left to give toward the record's
     * recipient in the current window.
     */
    public boolean isCapExhausted(ContributionRecord record) {
        ComplianceTier tier = record.snapshotTier().orElse(ComplianceTier.BASE);
        LimitCalculation calculation = remainingLimit(record.getContributorId(), tier,
                Recipient.of(record.getRecipientId(), record.getRecipientJurisdiction()), null);
        return calculation.isExhausted();
    }

    /**
     * Remaining annual tip allowance for the contributor as of now.
     */
    public BigDecimal remainingTipAllowance(Collection<ContributionRecord> history) {
        return calculator.remainingTipAllowance(history, clock.instant());
    }
}
