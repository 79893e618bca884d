package com.flagship.celebration_ledger.celebration;

import com.flagship.celebration_ledger.celebration.exception.ConcurrentLedgerModificationException;
import com.flagship.celebration_ledger.celebration.exception.InvalidTransitionException;
import com.flagship.celebration_ledger.celebration.exception.UnknownRecordException;
import com.flagship.celebration_ledger.compliance.ContributorLimitService;
import com.flagship.celebration_ledger.compliance.LimitCalculation;
import com.flagship.celebration_ledger.compliance.LimitUndeterminedException;
import com.flagship.celebration_ledger.observability.CelebrationMetrics;
import com.flagship.celebration_ledger.observability.CorrelationContext;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.Optional;
import java.util.UUID;

/**
 * Entry point for every status change, whether requested over the API, by a
 * condition watcher or by the settlement coordinator.
 *
 * Each attempt reads the record, validates the move against the current
 * projection and appends with a version check. A lost race is retried from a
 * fresh read up to {@code celebration.transition.max-attempts} times; a move
 * that became invalid in the meantime surfaces as INVALID_TRANSITION.
 *
 * Not transactional: each attempt reads committed state.
 */
@Service
@Slf4j
public class CelebrationTransitionService {

    private final ContributionRecordStore recordStore;
    private final StatusLedger statusLedger;
    private final ContributorLimitService limitService;
    private final CelebrationMetrics metrics;
    private final int maxAttempts;
    private final boolean revalidateOnReactivation;

    public CelebrationTransitionService(ContributionRecordStore recordStore,
                                        StatusLedger statusLedger,
                                        ContributorLimitService limitService,
                                        CelebrationMetrics metrics,
                                        @Value("${celebration.transition.max-attempts:3}") int maxAttempts,
                                        @Value("${celebration.reactivation.revalidate-limit:true}") boolean revalidateOnReactivation) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("max-attempts must be at least 1");
        }
        this.recordStore = recordStore;
        this.statusLedger = statusLedger;
        this.limitService = limitService;
        this.metrics = metrics;
        this.maxAttempts = maxAttempts;
        this.revalidateOnReactivation = revalidateOnReactivation;
    }

    /**
     * Requests a status change.
     *
     * @param recordId Celebration to change
     * @param targetStatus Desired status
     * @param reason Free-text reason stored on the ledger entry
     * @param trigger Who or what asked for the change
     * @param metadata Status-specific details, may be null
     * @return Success with the updated record, or the error that stopped it
     * @throws IllegalArgumentException for malformed requests (missing reason, mismatched metadata)
     */
    public TransitionResult requestTransition(UUID recordId, CelebrationStatus targetStatus, String reason,
                                              TransitionTrigger trigger, StatusMetadata metadata) {
        long startTime = System.currentTimeMillis();
        MDC.put(CorrelationContext.CELEBRATION_ID_MDC_KEY, String.valueOf(recordId));
        try {
            TransitionResult result = attemptTransition(recordId, targetStatus, reason, trigger, metadata);
            metrics.recordLatency("transition", System.currentTimeMillis() - startTime);
            return result;
        } finally {
            MDC.remove(CorrelationContext.CELEBRATION_ID_MDC_KEY);
        }
    }

    private TransitionResult attemptTransition(UUID recordId, CelebrationStatus targetStatus, String reason,
                                               TransitionTrigger trigger, StatusMetadata metadata) {
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            Optional<ContributionRecord> loaded = recordStore.findById(recordId);
            if (loaded.isEmpty()) {
                log.warn("Transition to {} requested for unknown celebration", targetStatus);
                metrics.recordTransition("none", name(targetStatus), "unknown_record");
                return TransitionResult.failure(TransitionError.UNKNOWN_RECORD,
                        "Celebration not found: " + recordId, attempt);
            }
            ContributionRecord current = loaded.get();

            ContributionRecord updated;
            try {
                updated = statusLedger.changeStatus(current, targetStatus, reason, trigger, metadata);
            } catch (InvalidTransitionException e) {
                log.info("Rejected transition {} -> {}: {}", current.getCurrentStatus(), targetStatus, e.getMessage());
                metrics.recordTransition(current.getCurrentStatus().name(), name(targetStatus), "invalid");
                return TransitionResult.failure(current, TransitionError.INVALID_TRANSITION, e.getMessage(), attempt);
            }

            if (requiresLimitCheck(current, targetStatus)) {
                Optional<TransitionResult> blocked = checkReactivationLimit(current, attempt);
                if (blocked.isPresent()) {
                    return blocked.get();
                }
            }

            try {
                ContributionRecord saved = recordStore.appendEntry(updated, current.getVersion());
                metrics.recordTransition(current.getCurrentStatus().name(), targetStatus.name(), "applied");
                log.info("Celebration status changed: {} -> {}, reason={}, triggeredBy={}, attempt={}",
                        current.getCurrentStatus(), targetStatus, reason, trigger.getTriggeredBy(), attempt);
                return TransitionResult.success(saved, attempt);
            } catch (ConcurrentLedgerModificationException e) {
                metrics.recordTransitionConflict();
                log.info("Concurrent ledger modification on attempt {}/{}, re-reading", attempt, maxAttempts);
            } catch (UnknownRecordException e) {
                return TransitionResult.failure(TransitionError.UNKNOWN_RECORD, e.getMessage(), attempt);
            }
        }

        metrics.recordTransition("unknown", name(targetStatus), "conflict_exhausted");
        log.warn("Giving up transition to {} after {} conflicting attempts", targetStatus, maxAttempts);
        return TransitionResult.failure(TransitionError.CONCURRENT_MODIFICATION,
                "Ledger kept changing under concurrent writers; retry later", maxAttempts);
    }

    private boolean requiresLimitCheck(ContributionRecord current, CelebrationStatus targetStatus) {
        return revalidateOnReactivation
                && current.getCurrentStatus() == CelebrationStatus.PAUSED
                && targetStatus == CelebrationStatus.ACTIVE;
    }

    private Optional<TransitionResult> checkReactivationLimit(ContributionRecord current, int attempt) {
        try {
            LimitCalculation calculation = limitService.revalidateForReactivation(current);
            if (!calculation.isAllowed()) {
                metrics.recordTransition(current.getCurrentStatus().name(), CelebrationStatus.ACTIVE.name(), "limit_exceeded");
                return Optional.of(TransitionResult.failure(current, TransitionError.LIMIT_EXCEEDED,
                        "Reactivation would exceed limit: " + calculation.getRejection().getDescription(), attempt));
            }
            return Optional.empty();
        } catch (LimitUndeterminedException e) {
            log.warn("Cannot reactivate while limit is undetermined: {}", e.getMessage());
            metrics.recordTransition(current.getCurrentStatus().name(), CelebrationStatus.ACTIVE.name(), "limit_undetermined");
            return Optional.of(TransitionResult.failure(current, TransitionError.LIMIT_UNDETERMINED, e.getMessage(), attempt));
        }
    }

    private static String name(CelebrationStatus status) {
        return status != null ? status.name() : "none";
    }
}
