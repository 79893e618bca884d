package com.flagship.celebration_ledger.compliance;

import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.Objects;

/**
 * Determines a contributor's compliance tier.
 *
 * Key principles:
 * - The achievable tier is computed from the profile alone
 * - The effective tier never drops below the highest tier already on record,
 *   so deleting profile data later cannot revoke an earned tier
 */
@Component
public class ComplianceTierEngine {

    private static final String UNITED_STATES = "United States";
    private static final int MIN_ZIP_DIGITS = 5;

    /**
     * Highest tier the profile qualifies for on its own.
     */
    public ComplianceTier achievableTier(ContributorProfile profile) {
        if (profile == null) {
            return ComplianceTier.BASE;
        }
        boolean qualifies = hasName(profile) && hasMailingAddress(profile) && hasEmploymentInfo(profile);
        return qualifies ? ComplianceTier.ELEVATED : ComplianceTier.BASE;
    }

    /**
     * Ratchet: the effective tier is the maximum of the recorded and achievable tiers.
     */
    public ComplianceTier effectiveTier(ComplianceTier recorded, ComplianceTier achievable) {
        ComplianceTier effective = ComplianceTier.max(recorded, achievable);
        return effective != null ? effective : ComplianceTier.BASE;
    }

    /**
     * High-water mark over every tier previously recorded for a contributor.
     * Unknown entries are ignored; an empty history yields {@code null}.
     */
    public ComplianceTier recordedTier(Collection<ComplianceTier> history) {
        return history.stream()
                .filter(Objects::nonNull)
                .reduce(null, ComplianceTier::max);
    }

    private boolean hasName(ContributorProfile profile) {
        return notBlank(profile.getFirstName()) && notBlank(profile.getLastName());
    }

    private boolean hasMailingAddress(ContributorProfile profile) {
        boolean zipComplete = profile.getZip() != null
                && profile.getZip().replaceAll("\\D", "").length() >= MIN_ZIP_DIGITS;
        boolean residencyShown = UNITED_STATES.equalsIgnoreCase(trim(profile.getCountry()))
                || notBlank(profile.getPassportNumber());
        return notBlank(profile.getAddressLine())
                && notBlank(profile.getCity())
                && notBlank(profile.getState())
                && zipComplete
                && residencyShown;
    }

    private boolean hasEmploymentInfo(ContributorProfile profile) {
        EmploymentStatus status = profile.getEmploymentStatus();
        if (status == null) {
            return false;
        }
        if (status.requiresOccupation() && !notBlank(profile.getOccupation())) {
            return false;
        }
        return !status.requiresEmployer() || notBlank(profile.getEmployer());
    }

    private static boolean notBlank(String value) {
        return value != null && !value.isBlank();
    }

    private static String trim(String value) {
        return value == null ? null : value.trim();
    }
}
