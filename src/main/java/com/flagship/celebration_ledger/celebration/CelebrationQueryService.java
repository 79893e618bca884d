package com.flagship.celebration_ledger.celebration;

import com.flagship.celebration_ledger.celebration.exception.UnknownRecordException;
import com.flagship.celebration_ledger.compliance.ComplianceTier;
import com.flagship.celebration_ledger.compliance.ComplianceTierEngine;
import com.flagship.celebration_ledger.compliance.ContributorLimitService;
import com.flagship.celebration_ledger.compliance.LimitCalculation;
import com.flagship.celebration_ledger.compliance.Recipient;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;

/**
 * Read side: records, their ledgers and the contributor's remaining limit.
 */
@Service
@RequiredArgsConstructor
public class CelebrationQueryService {

    private static final Set<CelebrationStatus> WATCHED_STATUSES =
            EnumSet.of(CelebrationStatus.ACTIVE, CelebrationStatus.PAUSED);

    static final int DEFAULT_HISTORY_LIMIT = 10;

    private final ContributionRecordStore recordStore;
    private final StatusLedger statusLedger;
    private final ContributorLimitService limitService;
    private final ComplianceTierEngine tierEngine;

    public ContributionRecord getRecord(UUID id) {
        return recordStore.findById(id)
                .orElseThrow(() -> new UnknownRecordException(String.valueOf(id)));
    }

    public CelebrationStatus getCurrentStatus(UUID id) {
        return getRecord(id).getCurrentStatus();
    }

    /**
     * @param limit Number of most recent entries to include; non-positive means the default
     */
    public StatusHistory getStatusHistory(UUID id, int limit) {
        return statusLedger.getStatusHistory(getRecord(id), limit > 0 ? limit : DEFAULT_HISTORY_LIMIT);
    }

    /**
     * Celebrations whose condition still has to be watched, oldest first.
     */
    public List<ContributionRecord> findNeedingUpdate(int limit) {
        if (limit <= 0) {
            throw new IllegalArgumentException("Limit must be positive");
        }
        return recordStore.findByStatuses(WATCHED_STATUSES, limit);
    }

    /**
     * Remaining limit toward a recipient, and a decision on {@code proposedAmount}
     * when one is given.
     *
     * The tier is the ratchet of the requested tier and the highest tier on
     * record, so a quote never drops below a tier already earned. With neither,
     * the contributor is BASE.
     *
     * @param tier Tier the contributor is quoting at, or null for the recorded tier
     * @param proposedAmount Amount to check, or null for the remaining limit only
     */
    public LimitCalculation remainingLimit(String contributorId, ComplianceTier tier,
                                           Recipient recipient, BigDecimal proposedAmount) {
        if (contributorId == null || contributorId.isBlank()) {
            throw new IllegalArgumentException("Contributor ID is required");
        }
        List<ContributionRecord> history = recordStore.findByContributor(contributorId);
        ComplianceTier recorded = tierEngine.recordedTier(
                history.stream().map(r -> r.snapshotTier().orElse(null)).toList());
        return limitService.remainingLimit(contributorId, tierEngine.effectiveTier(recorded, tier),
                recipient, proposedAmount);
    }
}
