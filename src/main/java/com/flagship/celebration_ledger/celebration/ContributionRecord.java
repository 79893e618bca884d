package com.flagship.celebration_ledger.celebration;

import com.flagship.celebration_ledger.compliance.ComplianceTier;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * A celebration: an escrowed, conditional contribution and its status ledger.
 *
 * Key principles:
 * - Immutable: a status change produces a new record with one more ledger entry
 * - {@code currentStatus} always equals the last ledger entry's new status
 * - The ledger is never empty and never rewritten
 * - {@code version} is the ledger length and drives optimistic appends
 */
@Value
@Builder(toBuilder = true)
public class ContributionRecord {
    UUID id;
    String contributorId;
    String recipientId;
    String recipientJurisdiction;
    String conditionId;
    BigDecimal amount;
    BigDecimal tip;
    BigDecimal processingFee;
    BigDecimal totalCharged;
    String idempotencyKey;
    CelebrationStatus currentStatus;
    List<StatusChangeEntry> statusLedger;
    DonorSnapshot donorSnapshot;
    Instant createdAt;

    public ContributionRecord(UUID id, String contributorId, String recipientId, String recipientJurisdiction,
                              String conditionId, BigDecimal amount, BigDecimal tip, BigDecimal processingFee,
                              BigDecimal totalCharged, String idempotencyKey, CelebrationStatus currentStatus,
                              List<StatusChangeEntry> statusLedger, DonorSnapshot donorSnapshot, Instant createdAt) {
        if (statusLedger == null || statusLedger.isEmpty()) {
            throw new IllegalArgumentException("Status ledger must contain at least the creation entry");
        }
        CelebrationStatus projected = statusLedger.get(statusLedger.size() - 1).getNewStatus();
        if (currentStatus != projected) {
            throw new IllegalStateException(String.format(
                "Current status %s does not match last ledger entry %s for record %s", currentStatus, projected, id));
        }
        this.id = id;
        this.contributorId = contributorId;
        this.recipientId = recipientId;
        this.recipientJurisdiction = recipientJurisdiction;
        this.conditionId = conditionId;
        this.amount = amount;
        this.tip = tip != null ? tip : BigDecimal.ZERO;
        this.processingFee = processingFee != null ? processingFee : BigDecimal.ZERO;
        this.totalCharged = totalCharged;
        this.idempotencyKey = idempotencyKey;
        this.currentStatus = currentStatus;
        this.statusLedger = List.copyOf(statusLedger);
        this.donorSnapshot = donorSnapshot;
        this.createdAt = createdAt;
    }

    /**
     * Returns a copy of this record with the entry appended and the status
     * projection moved to the entry's new status.
     */
    public ContributionRecord withAppendedEntry(StatusChangeEntry entry) {
        if (entry.getSequenceNumber() != getVersion() + 1) {
            throw new IllegalStateException(String.format(
                "Entry sequence %d does not follow ledger length %d for record %s",
                entry.getSequenceNumber(), getVersion(), id));
        }
        if (entry.getPreviousStatus() != currentStatus) {
            throw new IllegalStateException(String.format(
                "Entry previous status %s does not match current status %s for record %s",
                entry.getPreviousStatus(), currentStatus, id));
        }
        List<StatusChangeEntry> ledger = new ArrayList<>(statusLedger);
        ledger.add(entry);
        return toBuilder()
                .currentStatus(entry.getNewStatus())
                .statusLedger(ledger)
                .build();
    }

    public int getVersion() {
        return statusLedger.size();
    }

    public StatusChangeEntry getLastEntry() {
        return statusLedger.get(statusLedger.size() - 1);
    }

    public Instant getUpdatedAt() {
        return getLastEntry().getChangeTimestamp();
    }

    /**
     * Tier frozen in the donor snapshot, if one was captured.
     */
    public Optional<ComplianceTier> snapshotTier() {
        return Optional.ofNullable(donorSnapshot).map(DonorSnapshot::getComplianceTier);
    }

    // Legacy boolean view of the status, derived from the projection.

    public boolean isPaused() {
        return currentStatus == CelebrationStatus.PAUSED;
    }

    public boolean isResolved() {
        return currentStatus == CelebrationStatus.RESOLVED;
    }

    public boolean isDefunct() {
        return currentStatus == CelebrationStatus.DEFUNCT;
    }

    /**
     * Whether this record still counts against the contributor's limits.
     * Everything except DEFUNCT counts, including resolved contributions.
     */
    public boolean countsTowardLimits() {
        return currentStatus != CelebrationStatus.DEFUNCT;
    }
}
