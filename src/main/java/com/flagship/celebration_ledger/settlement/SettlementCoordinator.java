package com.flagship.celebration_ledger.settlement;

import com.flagship.celebration_ledger.celebration.CelebrationStatus;
import com.flagship.celebration_ledger.celebration.CelebrationTransitionService;
import com.flagship.celebration_ledger.celebration.ContributionRecord;
import com.flagship.celebration_ledger.celebration.ContributionRecordStore;
import com.flagship.celebration_ledger.celebration.DefunctCause;
import com.flagship.celebration_ledger.celebration.DefunctDetails;
import com.flagship.celebration_ledger.celebration.ResolutionDetails;
import com.flagship.celebration_ledger.celebration.StatusMetadata;
import com.flagship.celebration_ledger.celebration.TransitionResult;
import com.flagship.celebration_ledger.celebration.TransitionTrigger;
import com.flagship.celebration_ledger.celebration.TriggeredBy;
import com.flagship.celebration_ledger.compliance.ContributorLimitService;
import com.flagship.celebration_ledger.compliance.LimitUndeterminedException;
import com.flagship.celebration_ledger.observability.CelebrationMetrics;
import com.flagship.celebration_ledger.observability.CorrelationContext;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * Applies settlement and lifecycle events to celebrations exactly once.
 *
 * Every event with a dedupe key is claimed in the {@link IdempotencyStore}
 * before it touches the ledger. Once the event is handled its result is stored
 * and every later delivery gets that same result back. Outcomes that a later
 * delivery could change (unknown record, a key naming another record,
 * conflicts, undetermined limits) release the claim instead.
 */
@Service
@Slf4j
public class SettlementCoordinator {

    private static final String COORDINATOR = "settlement-coordinator";
    private static final String SETTLEMENT_FAMILY = "settlement";
    private static final String LIFECYCLE_FAMILY = "lifecycle";
    private static final long CLAIM_POLL_INTERVAL_MS = 25;

    private final ContributionRecordStore recordStore;
    private final CelebrationTransitionService transitionService;
    private final ContributorLimitService limitService;
    private final IdempotencyStore idempotencyStore;
    private final CelebrationMetrics metrics;
    private final long claimWaitMs;

    public SettlementCoordinator(ContributionRecordStore recordStore,
                                 CelebrationTransitionService transitionService,
                                 ContributorLimitService limitService,
                                 IdempotencyStore idempotencyStore,
                                 CelebrationMetrics metrics,
                                 @Value("${settlement.claim-wait-ms:2000}") long claimWaitMs) {
        this.recordStore = recordStore;
        this.transitionService = transitionService;
        this.limitService = limitService;
        this.idempotencyStore = idempotencyStore;
        this.metrics = metrics;
        this.claimWaitMs = claimWaitMs;
    }

    /**
     * Applies a payment provider settlement.
     *
     * @throws RetryableSettlementException if the event should be redelivered later
     * @throws IllegalArgumentException if the event is malformed
     */
    public SettlementResult apply(SettlementEvent event) {
        if (event == null || event.getOutcome() == null) {
            throw new IllegalArgumentException("Settlement event must carry an outcome");
        }
        if (event.getRecordId() == null && (event.getIdempotencyKey() == null || event.getIdempotencyKey().isBlank())) {
            throw new IllegalArgumentException("Settlement event must carry a record ID or an idempotency key");
        }

        if (event.getIdempotencyKey() == null || event.getIdempotencyKey().isBlank()) {
            return handle(SETTLEMENT_FAMILY, () -> handleSettlement(event));
        }
        DedupeKey key = DedupeKey.of(event.getIdempotencyKey(), event.getOutcome().getWireName());
        return processOnce(key, SETTLEMENT_FAMILY, () -> handleSettlement(event));
    }

    /**
     * Applies a lifecycle trigger.
     *
     * @throws RetryableSettlementException if the event should be redelivered later
     * @throws IllegalArgumentException if the event is malformed
     */
    public SettlementResult apply(LifecycleTriggerEvent event) {
        if (event == null || event.getKind() == null || event.getRecordId() == null) {
            throw new IllegalArgumentException("Lifecycle event must carry a kind and a record ID");
        }
        CelebrationStatus target = event.getKind().resolveTarget(event.getTargetStatus());

        if (event.getEventKey() == null || event.getEventKey().isBlank()) {
            return handle(LIFECYCLE_FAMILY, () -> handleLifecycle(event, target));
        }
        DedupeKey key = DedupeKey.of(event.getEventKey(), event.getKind().name());
        return processOnce(key, LIFECYCLE_FAMILY, () -> handleLifecycle(event, target));
    }

    private SettlementResult processOnce(DedupeKey key, String family, Supplier<SettlementResult> handler) {
        Optional<SettlementResult> stored = idempotencyStore.getResult(key);
        if (stored.isPresent()) {
            metrics.recordIdempotencyHit(family);
            log.info("Event {} already processed with {}, returning stored result", key, stored.get().getDisposition());
            return stored.get();
        }

        Optional<Claim> claim = idempotencyStore.tryClaim(key);
        if (claim.isEmpty()) {
            metrics.recordIdempotencyHit(family);
            return awaitConcurrentDelivery(key);
        }
        metrics.recordIdempotencyMiss(family);

        SettlementResult result;
        try {
            result = handle(family, handler);
        } catch (RuntimeException e) {
            idempotencyStore.release(claim.get());
            throw e;
        }

        if (result.getDisposition() == SettlementDisposition.DROPPED_UNKNOWN_RECORD
                || result.getDisposition() == SettlementDisposition.DROPPED_KEY_MISMATCH) {
            idempotencyStore.release(claim.get());
            return result;
        }
        if (!idempotencyStore.complete(claim.get(), result)) {
            // Another consumer took the stale claim over; its result is the one on record
            return idempotencyStore.getResult(key).orElse(result);
        }
        return result;
    }

    private SettlementResult handle(String family, Supplier<SettlementResult> handler) {
        SettlementResult result = handler.get();
        metrics.recordSettlementDisposition(family, result.getDisposition().name());
        return result;
    }

    private SettlementResult awaitConcurrentDelivery(DedupeKey key) {
        long deadline = System.currentTimeMillis() + claimWaitMs;
        while (System.currentTimeMillis() < deadline) {
            Optional<SettlementResult> stored = idempotencyStore.getResult(key);
            if (stored.isPresent()) {
                log.info("Concurrent delivery of {} finished with {}", key, stored.get().getDisposition());
                return stored.get();
            }
            try {
                Thread.sleep(CLAIM_POLL_INTERVAL_MS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new RetryableSettlementException("Interrupted while waiting for " + key, e);
            }
        }
        return idempotencyStore.getResult(key).orElseThrow(() ->
                new RetryableSettlementException("Event " + key + " is being processed by another consumer"));
    }

    private SettlementResult handleSettlement(SettlementEvent event) {
        Optional<ContributionRecord> found = findRecord(event);
        if (found.isEmpty()) {
            log.warn("Settlement {} for unknown celebration: recordId={}, idempotencyKey={}",
                    event.getOutcome().getWireName(), event.getRecordId(), event.getIdempotencyKey());
            return dropped(event.getRecordId());
        }
        ContributionRecord record = found.get();
        MDC.put(CorrelationContext.CELEBRATION_ID_MDC_KEY, record.getId().toString());
        try {
            if (hasForeignKey(event, record)) {
                log.warn("Settlement {} carries idempotencyKey={} but celebration {} was created with another key, dropping",
                        event.getOutcome().getWireName(), event.getIdempotencyKey(), record.getId());
                return SettlementResult.builder()
                        .disposition(SettlementDisposition.DROPPED_KEY_MISMATCH)
                        .recordId(record.getId())
                        .status(record.getCurrentStatus())
                        .sequenceNumber(record.getVersion())
                        .message("Idempotency key does not belong to celebration " + record.getId())
                        .build();
            }

            if (event.getOutcome() == SettlementOutcome.CAPTURED && record.getCurrentStatus() == CelebrationStatus.RESOLVED) {
                log.info("Capture confirmed for already resolved celebration, providerRef={}", event.getProviderRef());
                return SettlementResult.builder()
                        .disposition(SettlementDisposition.CONFIRMED)
                        .recordId(record.getId())
                        .status(record.getCurrentStatus())
                        .sequenceNumber(record.getVersion())
                        .message("Payment captured; celebration already resolved")
                        .build();
            }

            TransitionTrigger trigger = TransitionTrigger.builder()
                    .triggeredBy(TriggeredBy.API)
                    .id(event.getProviderRef())
                    .name(COORDINATOR)
                    .build();

            TransitionResult transition = event.getOutcome() == SettlementOutcome.CAPTURED
                    ? transitionService.requestTransition(record.getId(), CelebrationStatus.RESOLVED,
                        "Payment captured", trigger,
                        ResolutionDetails.builder()
                                .providerRef(event.getProviderRef())
                                .actionDate(dateOf(event))
                                .build())
                    : transitionService.requestTransition(record.getId(), CelebrationStatus.DEFUNCT,
                        "Payment failed", trigger,
                        DefunctDetails.builder()
                                .cause(DefunctCause.PAYMENT_FAILED)
                                .providerRef(event.getProviderRef())
                                .build());
            return toResult(record.getId(), transition);
        } finally {
            MDC.remove(CorrelationContext.CELEBRATION_ID_MDC_KEY);
        }
    }

    private SettlementResult handleLifecycle(LifecycleTriggerEvent event, CelebrationStatus target) {
        Optional<ContributionRecord> found = recordStore.findById(event.getRecordId());
        if (found.isEmpty()) {
            log.warn("Lifecycle trigger {} for unknown celebration {}", event.getKind(), event.getRecordId());
            return dropped(event.getRecordId());
        }
        ContributionRecord record = found.get();
        MDC.put(CorrelationContext.CELEBRATION_ID_MDC_KEY, record.getId().toString());
        try {
            if (!event.getKind().isEssential() && capExhausted(record)) {
                log.info("Skipping {}: contributor has no limit left toward {}", event.getKind(), record.getRecipientId());
                return SettlementResult.builder()
                        .disposition(SettlementDisposition.SKIPPED_CAP_EXHAUSTED)
                        .recordId(record.getId())
                        .status(record.getCurrentStatus())
                        .sequenceNumber(record.getVersion())
                        .message("Contributor cap exhausted")
                        .build();
            }

            TransitionTrigger trigger = event.getTrigger() != null
                    ? event.getTrigger()
                    : defaultTrigger(event.getKind());
            String reason = event.getReason() != null && !event.getReason().isBlank()
                    ? event.getReason()
                    : defaultReason(event.getKind());
            StatusMetadata metadata = event.getMetadata() != null
                    ? event.getMetadata()
                    : defaultMetadata(event.getKind(), target);

            return toResult(record.getId(),
                    transitionService.requestTransition(record.getId(), target, reason, trigger, metadata));
        } finally {
            MDC.remove(CorrelationContext.CELEBRATION_ID_MDC_KEY);
        }
    }

    private boolean capExhausted(ContributionRecord record) {
        try {
            return limitService.isCapExhausted(record);
        } catch (LimitUndeterminedException e) {
            // Let the transition itself decide; reactivation re-checks the limit anyway
            log.warn("Cap check undetermined for {}: {}", record.getId(), e.getMessage());
            return false;
        }
    }

    private Optional<ContributionRecord> findRecord(SettlementEvent event) {
        if (event.getRecordId() != null) {
            Optional<ContributionRecord> byId = recordStore.findById(event.getRecordId());
            if (byId.isPresent()) {
                return byId;
            }
        }
        if (event.getIdempotencyKey() != null && !event.getIdempotencyKey().isBlank()) {
            return recordStore.findByIdempotencyKey(event.getIdempotencyKey());
        }
        return Optional.empty();
    }

    // The dedupe key is the payment's key, so it must name the same record as the ID
    private static boolean hasForeignKey(SettlementEvent event, ContributionRecord record) {
        return event.getIdempotencyKey() != null
                && !event.getIdempotencyKey().isBlank()
                && !event.getIdempotencyKey().equals(record.getIdempotencyKey());
    }

    private SettlementResult toResult(UUID recordId, TransitionResult transition) {
        if (transition.isSuccess()) {
            ContributionRecord updated = transition.getRecord();
            return SettlementResult.builder()
                    .disposition(SettlementDisposition.APPLIED)
                    .recordId(updated.getId())
                    .status(updated.getCurrentStatus())
                    .sequenceNumber(updated.getVersion())
                    .build();
        }

        CelebrationStatus current = transition.getRecord() != null ? transition.getRecord().getCurrentStatus() : null;
        Integer version = transition.getRecord() != null ? transition.getRecord().getVersion() : null;
        switch (transition.getError()) {
            case INVALID_TRANSITION:
                log.info("Dropping event: {}", transition.getMessage());
                return SettlementResult.builder()
                        .disposition(SettlementDisposition.DROPPED_INVALID_TRANSITION)
                        .recordId(recordId)
                        .status(current)
                        .sequenceNumber(version)
                        .message(transition.getMessage())
                        .build();
            case LIMIT_EXCEEDED:
                return SettlementResult.builder()
                        .disposition(SettlementDisposition.REJECTED)
                        .recordId(recordId)
                        .status(current)
                        .sequenceNumber(version)
                        .message(transition.getMessage())
                        .build();
            case UNKNOWN_RECORD:
                return dropped(recordId);
            case CONCURRENT_MODIFICATION:
            case LIMIT_UNDETERMINED:
            default:
                log.warn("Event for {} not applied ({}), will be redelivered", recordId, transition.getError());
                throw new RetryableSettlementException(transition.getMessage());
        }
    }

    private static SettlementResult dropped(UUID recordId) {
        return SettlementResult.builder()
                .disposition(SettlementDisposition.DROPPED_UNKNOWN_RECORD)
                .recordId(recordId)
                .message("Celebration not found")
                .build();
    }

    private static LocalDate dateOf(SettlementEvent event) {
        return event.getOccurredAt() != null ? LocalDate.ofInstant(event.getOccurredAt(), ZoneOffset.UTC) : null;
    }

    private static TransitionTrigger defaultTrigger(LifecycleTriggerKind kind) {
        TriggeredBy triggeredBy = switch (kind) {
            case CONDITION_RESOLVED, SESSION_ENDED -> TriggeredBy.SCHEDULED_CONDITION;
            case ADMIN_OVERRIDE -> TriggeredBy.ADMIN;
            case PAUSE_REQUESTED, REACTIVATION_REQUESTED -> TriggeredBy.USER;
        };
        return TransitionTrigger.builder()
                .triggeredBy(triggeredBy)
                .name(COORDINATOR)
                .build();
    }

    private static String defaultReason(LifecycleTriggerKind kind) {
        return switch (kind) {
            case PAUSE_REQUESTED -> "Pause requested";
            case REACTIVATION_REQUESTED -> "Reactivation requested";
            case CONDITION_RESOLVED -> "Condition resolved";
            case SESSION_ENDED -> "Congressional session ended";
            case ADMIN_OVERRIDE -> "Administrative override";
        };
    }

    private static StatusMetadata defaultMetadata(LifecycleTriggerKind kind, CelebrationStatus target) {
        if (target != CelebrationStatus.DEFUNCT) {
            return null;
        }
        DefunctCause cause = kind == LifecycleTriggerKind.SESSION_ENDED
                ? DefunctCause.SESSION_ENDED
                : DefunctCause.ADMIN_OVERRIDE;
        return DefunctDetails.builder().cause(cause).build();
    }
}
