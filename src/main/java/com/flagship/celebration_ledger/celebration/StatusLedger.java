package com.flagship.celebration_ledger.celebration;

import com.flagship.celebration_ledger.celebration.exception.InvalidTransitionException;
import com.flagship.celebration_ledger.compliance.ComplianceTier;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

/**
 * Celebration status state machine and ledger entry factory.
 *
 * Allowed transitions:
 * <pre>
 *   ACTIVE -> PAUSED | RESOLVED | DEFUNCT
 *   PAUSED -> ACTIVE | DEFUNCT
 *   RESOLVED, DEFUNCT: terminal
 * </pre>
 * Self-transitions are not edges and are rejected like any other invalid move.
 *
 * Pure: builds new records, performs no I/O. Atomicity against concurrent
 * writers is the store's job (compare-and-append on the ledger length).
 */
@Component
public class StatusLedger {

    private static final Map<CelebrationStatus, Set<CelebrationStatus>> ALLOWED_TRANSITIONS;

    static {
        Map<CelebrationStatus, Set<CelebrationStatus>> table = new EnumMap<>(CelebrationStatus.class);
        table.put(CelebrationStatus.ACTIVE,
                EnumSet.of(CelebrationStatus.PAUSED, CelebrationStatus.RESOLVED, CelebrationStatus.DEFUNCT));
        table.put(CelebrationStatus.PAUSED,
                EnumSet.of(CelebrationStatus.ACTIVE, CelebrationStatus.DEFUNCT));
        table.put(CelebrationStatus.RESOLVED, EnumSet.noneOf(CelebrationStatus.class));
        table.put(CelebrationStatus.DEFUNCT, EnumSet.noneOf(CelebrationStatus.class));
        ALLOWED_TRANSITIONS = Collections.unmodifiableMap(table);
    }

    private final Clock clock;

    public StatusLedger(Clock clock) {
        this.clock = clock;
    }

    public boolean isTransitionAllowed(CelebrationStatus from, CelebrationStatus to) {
        if (from == null || to == null) {
            return false;
        }
        return ALLOWED_TRANSITIONS.get(from).contains(to);
    }

    public Set<CelebrationStatus> allowedTargets(CelebrationStatus from) {
        return Collections.unmodifiableSet(ALLOWED_TRANSITIONS.get(from));
    }

    /**
     * Builds the creation entry: previous status none, new status ACTIVE.
     */
    public StatusChangeEntry createInitialEntry(DonorSnapshot snapshot, String reason,
                                                TransitionTrigger trigger, ActivationDetails details) {
        return buildEntry(1, null, CelebrationStatus.ACTIVE, reason, trigger, details, snapshot);
    }

    /**
     * Validates the transition and returns a new record with one more entry.
     *
     * @throws InvalidTransitionException if the edge is not in the table
     * @throws IllegalArgumentException if the metadata belongs to another status
     */
    public ContributionRecord changeStatus(ContributionRecord record, CelebrationStatus newStatus, String reason,
                                           TransitionTrigger trigger, StatusMetadata metadata) {
        if (record == null) {
            throw new IllegalArgumentException("Record cannot be null");
        }
        if (newStatus == null) {
            throw new IllegalArgumentException("Target status is required");
        }
        if (!isTransitionAllowed(record.getCurrentStatus(), newStatus)) {
            throw new InvalidTransitionException(record.getId(), record.getCurrentStatus(), newStatus);
        }

        StatusChangeEntry entry = buildEntry(
                record.getVersion() + 1,
                record.getCurrentStatus(),
                newStatus,
                reason,
                trigger,
                metadata,
                record.getDonorSnapshot());
        return record.withAppendedEntry(entry);
    }

    /**
     * Most recent {@code limit} entries, newest first, with duration figures
     * measured against the ledger's clock.
     */
    public StatusHistory getStatusHistory(ContributionRecord record, int limit) {
        if (limit <= 0) {
            throw new IllegalArgumentException("History limit must be positive");
        }
        List<StatusChangeEntry> ledger = record.getStatusLedger();
        List<StatusChangeEntry> recent = new ArrayList<>(ledger.subList(Math.max(0, ledger.size() - limit), ledger.size()));
        Collections.reverse(recent);

        Instant now = clock.instant();
        return StatusHistory.builder()
                .recordId(record.getId())
                .totalChanges(ledger.size())
                .recentChanges(List.copyOf(recent))
                .currentStatus(record.getCurrentStatus())
                .timeInCurrentStatus(nonNegative(Duration.between(record.getLastEntry().getChangeTimestamp(), now)))
                .lifetime(nonNegative(Duration.between(ledger.get(0).getChangeTimestamp(), now)))
                .build();
    }

    private StatusChangeEntry buildEntry(int sequenceNumber, CelebrationStatus previous, CelebrationStatus next,
                                         String reason, TransitionTrigger trigger, StatusMetadata metadata,
                                         DonorSnapshot snapshot) {
        if (reason == null || reason.isBlank()) {
            throw new IllegalArgumentException("A reason is required for every status change");
        }
        if (trigger == null || trigger.getTriggeredBy() == null) {
            throw new IllegalArgumentException("Trigger source is required for every status change");
        }
        if (metadata != null && metadata.appliesTo() != next) {
            throw new IllegalArgumentException(String.format(
                "%s cannot be attached to a change into %s", metadata.getClass().getSimpleName(), next));
        }

        ComplianceTier tierAtTime = snapshot != null ? snapshot.getComplianceTier() : null;

        return StatusChangeEntry.builder()
                .statusChangeId(UUID.randomUUID())
                .sequenceNumber(sequenceNumber)
                .previousStatus(previous)
                .newStatus(next)
                .changeTimestamp(clock.instant())
                .reason(reason)
                .triggeredBy(trigger.getTriggeredBy())
                .triggeredById(trigger.getId())
                .triggeredByName(trigger.getName())
                .metadata(metadata)
                .complianceTierAtTime(tierAtTime)
                .compliant(tierAtTime != null)
                .auditTrail(trigger.getAuditTrail())
                .build();
    }

    private static Duration nonNegative(Duration duration) {
        return duration.isNegative() ? Duration.ZERO : duration;
    }
}
