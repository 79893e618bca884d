package com.flagship.celebration_ledger.celebration;

import com.flagship.celebration_ledger.compliance.ComplianceTier;
import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

/**
 * JPA entity for one ledger entry. Insert-only: every column is
 * {@code updatable = false} and a database trigger rejects UPDATE and DELETE.
 *
 * The unique (contribution_id, sequence_number) constraint is the last line
 * against two writers appending the same position.
 */
@Entity
@Table(
    name = "status_change_entries",
    uniqueConstraints = @UniqueConstraint(
        name = "uq_status_change_entries_sequence",
        columnNames = {"contribution_id", "sequence_number"}
    ),
    indexes = @Index(name = "idx_status_change_entries_contribution", columnList = "contribution_id")
)
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class StatusChangeEntryEntity {

    static final String NO_PREVIOUS_STATUS = "none";

    @Id
    @Column(name = "status_change_id", nullable = false, updatable = false)
    private UUID statusChangeId;

    @Column(name = "contribution_id", nullable = false, updatable = false)
    private UUID contributionId;

    @Column(name = "sequence_number", nullable = false, updatable = false)
    private int sequenceNumber;

    @Column(name = "previous_status", nullable = false, updatable = false, length = 16)
    private String previousStatus;

    @Enumerated(EnumType.STRING)
    @Column(name = "new_status", nullable = false, updatable = false, length = 16)
    private CelebrationStatus newStatus;

    @Column(name = "change_datetime", nullable = false, updatable = false)
    private Instant changeDatetime;

    @Column(nullable = false, updatable = false, length = 1024)
    private String reason;

    @Enumerated(EnumType.STRING)
    @Column(name = "triggered_by", nullable = false, updatable = false, length = 32)
    private TriggeredBy triggeredBy;

    @Column(name = "triggered_by_id", updatable = false)
    private String triggeredById;

    @Column(name = "triggered_by_name", updatable = false)
    private String triggeredByName;

    @Column(updatable = false, columnDefinition = "TEXT")
    private String metadata;

    @Enumerated(EnumType.STRING)
    @Column(name = "compliance_tier_at_time", updatable = false, length = 16)
    private ComplianceTier complianceTierAtTime;

    @Column(name = "fec_compliant", nullable = false, updatable = false)
    private boolean fecCompliant;

    @Column(name = "audit_trail", updatable = false, columnDefinition = "TEXT")
    private String auditTrail;

    static StatusChangeEntryEntity fromDomain(UUID contributionId, StatusChangeEntry entry,
                                              String metadataJson, String auditTrailJson) {
        return new StatusChangeEntryEntity(
            entry.getStatusChangeId(),
            contributionId,
            entry.getSequenceNumber(),
            entry.getPreviousStatus() != null ? entry.getPreviousStatus().name() : NO_PREVIOUS_STATUS,
            entry.getNewStatus(),
            entry.getChangeTimestamp(),
            entry.getReason(),
            entry.getTriggeredBy(),
            entry.getTriggeredById(),
            entry.getTriggeredByName(),
            metadataJson,
            entry.getComplianceTierAtTime(),
            entry.isCompliant(),
            auditTrailJson
        );
    }

    StatusChangeEntry toDomain(StatusMetadata decodedMetadata, AuditTrail decodedAuditTrail) {
        return StatusChangeEntry.builder()
            .statusChangeId(statusChangeId)
            .sequenceNumber(sequenceNumber)
            .previousStatus(NO_PREVIOUS_STATUS.equals(previousStatus) ? null : CelebrationStatus.valueOf(previousStatus))
            .newStatus(newStatus)
            .changeTimestamp(changeDatetime)
            .reason(reason)
            .triggeredBy(triggeredBy)
            .triggeredById(triggeredById)
            .triggeredByName(triggeredByName)
            .metadata(decodedMetadata)
            .complianceTierAtTime(complianceTierAtTime)
            .compliant(fecCompliant)
            .auditTrail(decodedAuditTrail)
            .build();
    }
}
