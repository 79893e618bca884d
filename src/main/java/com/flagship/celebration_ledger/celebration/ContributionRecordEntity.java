package com.flagship.celebration_ledger.celebration;

import com.flagship.celebration_ledger.compliance.ComplianceTier;
import com.flagship.celebration_ledger.compliance.ContributorProfile;
import com.flagship.celebration_ledger.compliance.EmploymentStatus;
import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * JPA entity for a celebration's header row.
 *
 * Key design principles:
 * - No setters: the only mutation is {@link #applyTransition}, which moves the
 *   status projection and the legacy flags together
 * - Donor snapshot columns are written once and never updated
 * - {@code @Version} turns a lost race between two appenders into an
 *   optimistic locking failure instead of a silent overwrite
 */
@Entity
@Table(
    name = "contribution_records",
    indexes = {
        @Index(name = "idx_contribution_records_contributor", columnList = "contributor_id"),
        @Index(name = "idx_contribution_records_status", columnList = "current_status")
    }
)
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class ContributionRecordEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(name = "contributor_id", nullable = false, updatable = false)
    private String contributorId;

    @Column(name = "recipient_id", nullable = false, updatable = false)
    private String recipientId;

    @Column(name = "recipient_jurisdiction", nullable = false, updatable = false, length = 2)
    private String recipientJurisdiction;

    @Column(name = "condition_id", nullable = false, updatable = false)
    private String conditionId;

    @Column(nullable = false, updatable = false, precision = 19, scale = 4)
    private BigDecimal amount;

    @Column(nullable = false, updatable = false, precision = 19, scale = 4)
    private BigDecimal tip;

    @Column(name = "processing_fee", nullable = false, updatable = false, precision = 19, scale = 4)
    private BigDecimal processingFee;

    @Column(name = "total_charged", nullable = false, updatable = false, precision = 19, scale = 4)
    private BigDecimal totalCharged;

    @Column(name = "idempotency_key", nullable = false, unique = true, updatable = false)
    private String idempotencyKey;

    @Enumerated(EnumType.STRING)
    @Column(name = "current_status", nullable = false, length = 16)
    private CelebrationStatus currentStatus;

    @Column(nullable = false)
    private boolean paused;

    @Column(nullable = false)
    private boolean resolved;

    @Column(nullable = false)
    private boolean defunct;

    @Column(name = "ledger_length", nullable = false)
    private int ledgerLength;

    @Column(name = "donor_first_name", updatable = false)
    private String donorFirstName;

    @Column(name = "donor_last_name", updatable = false)
    private String donorLastName;

    @Column(name = "donor_address_line", updatable = false)
    private String donorAddressLine;

    @Column(name = "donor_city", updatable = false)
    private String donorCity;

    @Column(name = "donor_state", updatable = false, length = 2)
    private String donorState;

    @Column(name = "donor_zip", updatable = false)
    private String donorZip;

    @Column(name = "donor_country", updatable = false)
    private String donorCountry;

    @Column(name = "donor_passport_number", updatable = false)
    private String donorPassportNumber;

    @Enumerated(EnumType.STRING)
    @Column(name = "donor_employment_status", updatable = false)
    private EmploymentStatus donorEmploymentStatus;

    @Column(name = "donor_occupation", updatable = false)
    private String donorOccupation;

    @Column(name = "donor_employer", updatable = false)
    private String donorEmployer;

    @Enumerated(EnumType.STRING)
    @Column(name = "donor_compliance_tier", updatable = false)
    private ComplianceTier donorComplianceTier;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @Version
    @Column(nullable = false)
    private Long version;

    @PreUpdate
    void onUpdate() {
        this.updatedAt = Instant.now();
    }

    static ContributionRecordEntity fromDomain(ContributionRecord record) {
        DonorSnapshot snapshot = record.getDonorSnapshot();
        ContributorProfile profile = snapshot != null && snapshot.getProfile() != null
                ? snapshot.getProfile()
                : ContributorProfile.empty();
        CelebrationStatus status = record.getCurrentStatus();

        return new ContributionRecordEntity(
            record.getId(),
            record.getContributorId(),
            record.getRecipientId(),
            record.getRecipientJurisdiction(),
            record.getConditionId(),
            record.getAmount(),
            record.getTip(),
            record.getProcessingFee(),
            record.getTotalCharged(),
            record.getIdempotencyKey(),
            status,
            status == CelebrationStatus.PAUSED,
            status == CelebrationStatus.RESOLVED,
            status == CelebrationStatus.DEFUNCT,
            record.getVersion(),
            profile.getFirstName(),
            profile.getLastName(),
            profile.getAddressLine(),
            profile.getCity(),
            profile.getState(),
            profile.getZip(),
            profile.getCountry(),
            profile.getPassportNumber(),
            profile.getEmploymentStatus(),
            profile.getOccupation(),
            profile.getEmployer(),
            snapshot != null ? snapshot.getComplianceTier() : null,
            record.getCreatedAt(),
            record.getUpdatedAt(),
            null  // version - assigned on persist
        );
    }

    /**
     * Rebuilds the domain record from this row and its ordered ledger entries.
     */
    ContributionRecord toDomain(List<StatusChangeEntry> ledger) {
        ContributorProfile profile = ContributorProfile.builder()
            .firstName(donorFirstName)
            .lastName(donorLastName)
            .addressLine(donorAddressLine)
            .city(donorCity)
            .state(donorState)
            .zip(donorZip)
            .country(donorCountry)
            .passportNumber(donorPassportNumber)
            .employmentStatus(donorEmploymentStatus)
            .occupation(donorOccupation)
            .employer(donorEmployer)
            .build();

        return new ContributionRecord(
            id,
            contributorId,
            recipientId,
            recipientJurisdiction,
            conditionId,
            amount,
            tip,
            processingFee,
            totalCharged,
            idempotencyKey,
            currentStatus,
            ledger,
            new DonorSnapshot(profile, donorComplianceTier),
            createdAt
        );
    }

    /**
     * Moves the projection to the record's new status. Legacy flags are
     * derived here so they can never disagree with {@code current_status}.
     */
    void applyTransition(ContributionRecord updated) {
        CelebrationStatus status = updated.getCurrentStatus();
        this.currentStatus = status;
        this.paused = status == CelebrationStatus.PAUSED;
        this.resolved = status == CelebrationStatus.RESOLVED;
        this.defunct = status == CelebrationStatus.DEFUNCT;
        this.ledgerLength = updated.getVersion();
    }
}
