package com.flagship.celebration_ledger.compliance;

import com.flagship.celebration_ledger.celebration.ContributionRecordFixtures;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for tier qualification and the ratchet.
 */
class ComplianceTierEngineTest {

    private final ComplianceTierEngine engine = new ComplianceTierEngine();

    private void printTestHeader(String testName) {
        System.out.println("\n" + "=".repeat(80));
        System.out.println("TEST: " + testName);
        System.out.println("=".repeat(80));
    }

    private void printOutput(String label, Object value) {
        System.out.println("OUTPUT - " + label + ": " + value);
    }

    private void printSuccess(String message) {
        System.out.println("✓ SUCCESS: " + message);
    }

    @Test
    @DisplayName("Complete profile should achieve ELEVATED")
    void testAchievableTier_CompleteProfile() {
        printTestHeader("Complete Profile");

        ComplianceTier tier = engine.achievableTier(ContributionRecordFixtures.elevatedProfile());
        printOutput("Tier", tier);

        assertEquals(ComplianceTier.ELEVATED, tier);
        printSuccess("Elevated");
    }

    @Test
    @DisplayName("Missing pieces should keep the profile at BASE")
    void testAchievableTier_IncompleteProfiles() {
        printTestHeader("Incomplete Profiles");

        ContributorProfile full = ContributionRecordFixtures.elevatedProfile();

        assertEquals(ComplianceTier.BASE, engine.achievableTier(null));
        assertEquals(ComplianceTier.BASE, engine.achievableTier(ContributorProfile.empty()));
        assertEquals(ComplianceTier.BASE, engine.achievableTier(full.toBuilder().lastName(" ").build()));
        assertEquals(ComplianceTier.BASE, engine.achievableTier(full.toBuilder().zip("6270").build()));
        assertEquals(ComplianceTier.BASE, engine.achievableTier(full.toBuilder().city(null).build()));
        assertEquals(ComplianceTier.BASE, engine.achievableTier(full.toBuilder().country("Canada").build()));
        assertEquals(ComplianceTier.BASE, engine.achievableTier(full.toBuilder().employer(null).build()));
        assertEquals(ComplianceTier.BASE, engine.achievableTier(full.toBuilder().employmentStatus(null).build()));
        printSuccess("Every missing piece keeps BASE");
    }

    @Test
    @DisplayName("Employment rules should depend on employment status")
    void testAchievableTier_EmploymentRules() {
        printTestHeader("Employment Rules");

        ContributorProfile base = ContributionRecordFixtures.elevatedProfile().toBuilder()
                .occupation(null)
                .employer(null)
                .build();

        assertEquals(ComplianceTier.ELEVATED,
                engine.achievableTier(base.toBuilder().employmentStatus(EmploymentStatus.RETIRED).build()));
        assertEquals(ComplianceTier.ELEVATED,
                engine.achievableTier(base.toBuilder().employmentStatus(EmploymentStatus.NOT_EMPLOYED).build()));
        assertEquals(ComplianceTier.BASE,
                engine.achievableTier(base.toBuilder().employmentStatus(EmploymentStatus.SELF_EMPLOYED).build()));
        assertEquals(ComplianceTier.ELEVATED,
                engine.achievableTier(base.toBuilder().employmentStatus(EmploymentStatus.SELF_EMPLOYED)
                        .occupation("Consultant").build()));
        printSuccess("Employment rules applied per status");
    }

    @Test
    @DisplayName("Foreign address with a passport should qualify")
    void testAchievableTier_PassportHolder() {
        printTestHeader("Passport Holder");

        ContributorProfile abroad = ContributionRecordFixtures.elevatedProfile().toBuilder()
                .country("France")
                .passportNumber("X1234567")
                .zip("75001-000")
                .build();

        assertEquals(ComplianceTier.ELEVATED, engine.achievableTier(abroad));
    }

    @Test
    @DisplayName("Effective tier should never drop below the recorded tier")
    void testEffectiveTier_Ratchet() {
        printTestHeader("Ratchet");

        for (ComplianceTier recorded : Arrays.asList(null, ComplianceTier.BASE, ComplianceTier.ELEVATED)) {
            for (ComplianceTier achievable : ComplianceTier.values()) {
                ComplianceTier effective = engine.effectiveTier(recorded, achievable);
                printOutput(recorded + " + " + achievable, effective);
                assertTrue(effective.isAtLeast(achievable));
                if (recorded != null) {
                    assertTrue(effective.isAtLeast(recorded));
                }
            }
        }
        assertEquals(ComplianceTier.BASE, engine.effectiveTier(null, null));
        printSuccess("Ratchet holds for every combination");
    }

    @Test
    @DisplayName("Recorded tier should be the high-water mark of the history")
    void testRecordedTier_HighWaterMark() {
        printTestHeader("High-water Mark");

        assertNull(engine.recordedTier(List.of()));
        assertEquals(ComplianceTier.BASE, engine.recordedTier(Arrays.asList(null, ComplianceTier.BASE)));
        assertEquals(ComplianceTier.ELEVATED,
                engine.recordedTier(Arrays.asList(ComplianceTier.BASE, ComplianceTier.ELEVATED, ComplianceTier.BASE)));
        printSuccess("Highest recorded tier wins");
    }
}
