package com.flagship.celebration_ledger.celebration;

import com.flagship.celebration_ledger.celebration.exception.DuplicateIdempotencyKeyException;
import com.flagship.celebration_ledger.compliance.ComplianceTier;
import com.flagship.celebration_ledger.compliance.ComplianceTierEngine;
import com.flagship.celebration_ledger.compliance.ContributionRejectedException;
import com.flagship.celebration_ledger.compliance.ContributorLimitService;
import com.flagship.celebration_ledger.compliance.LimitCalculation;
import com.flagship.celebration_ledger.compliance.LimitUndeterminedException;
import com.flagship.celebration_ledger.compliance.Recipient;
import com.flagship.celebration_ledger.compliance.RejectionReason;
import com.flagship.celebration_ledger.observability.CelebrationMetrics;
import com.flagship.celebration_ledger.observability.CorrelationContext;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Creates celebrations behind the limit gate.
 *
 * Steps:
 * 1. Replayed idempotency key: return the existing record, nothing else happens
 * 2. Effective tier = max(highest tier on record, tier the profile achieves)
 * 3. Amount and tip checked against the tier's limits; rejection writes nothing
 * 4. Donor snapshot frozen and the creation entry (none -> ACTIVE) written
 */
@Service
@Slf4j
public class ContributionIntakeService {

    private final ContributionRecordStore recordStore;
    private final StatusLedger statusLedger;
    private final ComplianceTierEngine tierEngine;
    private final ContributorLimitService limitService;
    private final CelebrationMetrics metrics;
    private final Clock clock;

    public ContributionIntakeService(ContributionRecordStore recordStore,
                                     StatusLedger statusLedger,
                                     ComplianceTierEngine tierEngine,
                                     ContributorLimitService limitService,
                                     CelebrationMetrics metrics,
                                     Clock clock) {
        this.recordStore = recordStore;
        this.statusLedger = statusLedger;
        this.tierEngine = tierEngine;
        this.limitService = limitService;
        this.metrics = metrics;
        this.clock = clock;
    }

    /**
     * @throws ContributionRejectedException if a limit would be exceeded or cannot be determined
     * @throws IllegalArgumentException for malformed commands
     */
    public IntakeResult create(CreateCelebrationCommand command) {
        validate(command);
        MDC.put(CorrelationContext.CONTRIBUTOR_ID_MDC_KEY, command.getContributorId());
        try {
            Optional<ContributionRecord> existing = recordStore.findByIdempotencyKey(command.getIdempotencyKey());
            if (existing.isPresent()) {
                metrics.recordIdempotencyHit("intake");
                log.info("Idempotency key already used, returning celebration {}", existing.get().getId());
                return new IntakeResult(existing.get(), false);
            }
            metrics.recordIdempotencyMiss("intake");

            return createNew(command);
        } finally {
            MDC.remove(CorrelationContext.CONTRIBUTOR_ID_MDC_KEY);
        }
    }

    private IntakeResult createNew(CreateCelebrationCommand command) {
        Instant now = clock.instant();
        List<ContributionRecord> history = recordStore.findByContributor(command.getContributorId());

        ComplianceTier recorded = tierEngine.recordedTier(
                history.stream().map(r -> r.snapshotTier().orElse(null)).toList());
        ComplianceTier achievable = tierEngine.achievableTier(command.getProfile());
        ComplianceTier tier = tierEngine.effectiveTier(recorded, achievable);
        if (recorded != null && achievable.compareTo(recorded) < 0) {
            log.info("Profile only achieves {}, keeping recorded tier {}", achievable, recorded);
        }

        Recipient recipient = Recipient.of(command.getRecipientId(), command.getRecipientJurisdiction());
        LimitCalculation calculation;
        try {
            calculation = limitService.evaluate(history, tier, recipient, command.getAmount(), now);
        } catch (LimitUndeterminedException e) {
            reject(tier, RejectionReason.LIMIT_UNDETERMINED, null);
            throw new ContributionRejectedException(RejectionReason.LIMIT_UNDETERMINED, null);
        }
        if (!calculation.isAllowed()) {
            reject(tier, calculation.getRejection(), calculation.getRemaining());
            throw new ContributionRejectedException(calculation.getRejection(), calculation.getRemaining());
        }

        BigDecimal tip = command.getTip() != null ? command.getTip() : BigDecimal.ZERO;
        if (tip.signum() > 0) {
            BigDecimal tipRemaining = limitService.remainingTipAllowance(history);
            if (tip.compareTo(tipRemaining) > 0) {
                reject(tier, RejectionReason.EXCEEDS_TIP_CAP, tipRemaining);
                throw new ContributionRejectedException(RejectionReason.EXCEEDS_TIP_CAP, tipRemaining);
            }
        }

        DonorSnapshot snapshot = new DonorSnapshot(command.getProfile(), tier);
        StatusChangeEntry initial = statusLedger.createInitialEntry(
                snapshot, "Celebration created", command.getTrigger(), new ActivationDetails(null));
        BigDecimal fee = command.getProcessingFee() != null ? command.getProcessingFee() : BigDecimal.ZERO;

        ContributionRecord record = ContributionRecord.builder()
                .id(UUID.randomUUID())
                .contributorId(command.getContributorId())
                .recipientId(recipient.getRecipientId())
                .recipientJurisdiction(recipient.getJurisdiction())
                .conditionId(command.getConditionId())
                .amount(command.getAmount())
                .tip(tip)
                .processingFee(fee)
                .totalCharged(command.getAmount().add(tip).add(fee))
                .idempotencyKey(command.getIdempotencyKey())
                .currentStatus(CelebrationStatus.ACTIVE)
                .statusLedger(List.of(initial))
                .donorSnapshot(snapshot)
                .createdAt(now)
                .build();

        try {
            ContributionRecord saved = recordStore.create(record);
            metrics.recordCelebrationCreated(tier.name(), "created");
            log.info("Celebration created: id={}, recipient={}, amount={}, tier={}, remainingAfter={}",
                    saved.getId(), saved.getRecipientId(), saved.getAmount(), tier,
                    calculation.getRemaining().subtract(saved.getAmount()));
            return new IntakeResult(saved, true);
        } catch (DuplicateIdempotencyKeyException e) {
            // Lost a race with a concurrent request carrying the same key
            ContributionRecord winner = recordStore.findByIdempotencyKey(command.getIdempotencyKey())
                    .orElseThrow(() -> new IllegalStateException(
                        "Idempotency key conflict but no record found: " + command.getIdempotencyKey(), e));
            metrics.recordIdempotencyHit("intake");
            return new IntakeResult(winner, false);
        }
    }

    private void reject(ComplianceTier tier, RejectionReason reason, BigDecimal remaining) {
        metrics.recordLimitRejection(reason.name());
        metrics.recordCelebrationCreated(tier.name(), "rejected");
        log.info("Contribution rejected: tier={}, reason={}, remaining={}", tier, reason, remaining);
    }

    private void validate(CreateCelebrationCommand command) {
        if (command == null) {
            throw new IllegalArgumentException("Command cannot be null");
        }
        if (command.getIdempotencyKey() == null || command.getIdempotencyKey().isBlank()) {
            throw new IllegalArgumentException("Idempotency key is required");
        }
        if (command.getContributorId() == null || command.getContributorId().isBlank()) {
            throw new IllegalArgumentException("Contributor ID is required");
        }
        if (command.getConditionId() == null || command.getConditionId().isBlank()) {
            throw new IllegalArgumentException("Condition ID is required");
        }
        if (command.getAmount() == null || command.getAmount().signum() <= 0) {
            throw new IllegalArgumentException("Contribution amount must be positive");
        }
        if (command.getTip() != null && command.getTip().signum() < 0) {
            throw new IllegalArgumentException("Tip cannot be negative");
        }
        if (command.getProcessingFee() != null && command.getProcessingFee().signum() < 0) {
            throw new IllegalArgumentException("Processing fee cannot be negative");
        }
        if (command.getTrigger() == null) {
            throw new IllegalArgumentException("Trigger is required");
        }
    }
}
