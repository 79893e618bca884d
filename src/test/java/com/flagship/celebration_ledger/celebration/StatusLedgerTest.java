package com.flagship.celebration_ledger.celebration;

import com.flagship.celebration_ledger.celebration.exception.InvalidTransitionException;
import com.flagship.celebration_ledger.compliance.ComplianceTier;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.EnumSet;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for the celebration status transition table and ledger appends.
 *
 * These tests verify that:
 * - Only the table's edges are accepted; terminal states have none
 * - Every change appends exactly one entry and moves the projection
 * - Earlier entries are never touched
 * - Metadata must match the target status
 */
class StatusLedgerTest {

    private static final Instant NOW = Instant.parse("2024-04-01T15:00:00Z");

    private StatusLedger statusLedger;
    private ContributionRecord active;

    private void printTestHeader(String testName) {
        System.out.println("\n" + "=".repeat(80));
        System.out.println("TEST: " + testName);
        System.out.println("=".repeat(80));
    }

    private void printInput(String label, Object value) {
        System.out.println("INPUT  - " + label + ": " + value);
    }

    private void printOutput(String label, Object value) {
        System.out.println("OUTPUT - " + label + ": " + value);
    }

    private void printSuccess(String message) {
        System.out.println("✓ SUCCESS: " + message);
    }

    private void printExpectedException(String exceptionType, String reason) {
        System.out.println("⚠ EXPECTED EXCEPTION: " + exceptionType);
        System.out.println("  Reason: " + reason);
    }

    @BeforeEach
    void setUp() {
        statusLedger = new StatusLedger(Clock.fixed(NOW, ZoneOffset.UTC));
        active = ContributionRecordFixtures.record("contributor-1", "recipient-1", "25.00",
                CelebrationStatus.ACTIVE, NOW.minus(Duration.ofDays(3)), ComplianceTier.BASE);
    }

    @Test
    @DisplayName("Transition table should allow exactly the lifecycle edges")
    void testTransitionTable_AllowedEdges() {
        printTestHeader("Transition Table");

        assertEquals(EnumSet.of(CelebrationStatus.PAUSED, CelebrationStatus.RESOLVED, CelebrationStatus.DEFUNCT),
                statusLedger.allowedTargets(CelebrationStatus.ACTIVE));
        assertEquals(EnumSet.of(CelebrationStatus.ACTIVE, CelebrationStatus.DEFUNCT),
                statusLedger.allowedTargets(CelebrationStatus.PAUSED));
        assertTrue(statusLedger.allowedTargets(CelebrationStatus.RESOLVED).isEmpty());
        assertTrue(statusLedger.allowedTargets(CelebrationStatus.DEFUNCT).isEmpty());

        for (CelebrationStatus status : CelebrationStatus.values()) {
            assertFalse(statusLedger.isTransitionAllowed(status, status), "self transition for " + status);
        }
        assertFalse(statusLedger.isTransitionAllowed(CelebrationStatus.PAUSED, CelebrationStatus.RESOLVED));

        printSuccess("Only lifecycle edges are allowed");
    }

    @Test
    @DisplayName("Pause should append one entry and move the projection")
    void testChangeStatus_PauseAppendsEntry() {
        printTestHeader("Pause Appends Entry");

        PauseDetails details = new PauseDetails("Traveling", LocalDate.of(2024, 5, 1), null);
        ContributionRecord paused = statusLedger.changeStatus(active, CelebrationStatus.PAUSED,
                "Donor asked to pause", TransitionTrigger.system("test"), details);

        printInput("Before", active.getCurrentStatus());
        printOutput("After", paused.getCurrentStatus());
        printOutput("Ledger length", paused.getVersion());

        assertEquals(CelebrationStatus.PAUSED, paused.getCurrentStatus());
        assertTrue(paused.isPaused());
        assertEquals(2, paused.getVersion());
        assertEquals(active.getStatusLedger().get(0), paused.getStatusLedger().get(0));

        StatusChangeEntry last = paused.getLastEntry();
        assertEquals(2, last.getSequenceNumber());
        assertEquals(CelebrationStatus.ACTIVE, last.getPreviousStatus());
        assertEquals(CelebrationStatus.PAUSED, last.getNewStatus());
        assertEquals(NOW, last.getChangeTimestamp());
        assertEquals(ComplianceTier.BASE, last.getComplianceTierAtTime());
        assertTrue(last.isCompliant());
        assertEquals(details, last.getMetadata());

        assertEquals(CelebrationStatus.ACTIVE, active.getCurrentStatus(), "original record must not change");
        assertEquals(1, active.getVersion());

        printSuccess("Entry appended and projection moved");
    }

    @Test
    @DisplayName("Terminal statuses should reject every transition")
    void testChangeStatus_TerminalStatusIsFinal() {
        printTestHeader("Terminal Finality");

        ContributionRecord resolved = statusLedger.changeStatus(active, CelebrationStatus.RESOLVED,
                "Bill passed", TransitionTrigger.system("watcher"), null);

        for (CelebrationStatus target : CelebrationStatus.values()) {
            InvalidTransitionException e = assertThrows(InvalidTransitionException.class,
                    () -> statusLedger.changeStatus(resolved, target, "Try again", TransitionTrigger.system("test"), null));
            assertEquals(CelebrationStatus.RESOLVED, e.getFrom());
            assertEquals(target, e.getTo());
        }
        printExpectedException("InvalidTransitionException", "RESOLVED has no outgoing edges");
        printSuccess("Resolved celebration is final");
    }

    @Test
    @DisplayName("Metadata for another status should be rejected")
    void testChangeStatus_MismatchedMetadataRejected() {
        printTestHeader("Mismatched Metadata");

        DefunctDetails defunct = DefunctDetails.builder().cause(DefunctCause.SESSION_ENDED).build();

        assertThrows(IllegalArgumentException.class,
                () -> statusLedger.changeStatus(active, CelebrationStatus.PAUSED, "Pause",
                        TransitionTrigger.system("test"), defunct));
        printExpectedException("IllegalArgumentException", "DefunctDetails cannot describe a pause");
    }

    @Test
    @DisplayName("Reason and trigger should be required")
    void testChangeStatus_ReasonAndTriggerRequired() {
        printTestHeader("Reason And Trigger Required");

        assertThrows(IllegalArgumentException.class,
                () -> statusLedger.changeStatus(active, CelebrationStatus.PAUSED, " ",
                        TransitionTrigger.system("test"), null));
        assertThrows(IllegalArgumentException.class,
                () -> statusLedger.changeStatus(active, CelebrationStatus.PAUSED, "Pause", null, null));
        printSuccess("Malformed requests rejected");
    }

    @Test
    @DisplayName("Entries without a known tier should be marked non-compliant")
    void testChangeStatus_UnknownTierIsNotCompliant() {
        printTestHeader("Fail-safe Compliance Flag");

        ContributionRecord legacy = ContributionRecordFixtures.record("contributor-1", "recipient-1", "25.00",
                CelebrationStatus.ACTIVE, NOW.minus(Duration.ofDays(1)), null);

        ContributionRecord defunct = statusLedger.changeStatus(legacy, CelebrationStatus.DEFUNCT,
                "Session ended", TransitionTrigger.system("watcher"),
                DefunctDetails.builder().cause(DefunctCause.SESSION_ENDED).sessionNumber(118).build());

        printOutput("Tier at time", defunct.getLastEntry().getComplianceTierAtTime());
        printOutput("Compliant", defunct.getLastEntry().isCompliant());

        assertNull(defunct.getLastEntry().getComplianceTierAtTime());
        assertFalse(defunct.getLastEntry().isCompliant());
        printSuccess("Unknown tier never claims compliance");
    }

    @Test
    @DisplayName("Creation entry should start the ledger as ACTIVE")
    void testCreateInitialEntry() {
        printTestHeader("Creation Entry");

        DonorSnapshot snapshot = new DonorSnapshot(ContributionRecordFixtures.elevatedProfile(), ComplianceTier.ELEVATED);
        StatusChangeEntry entry = statusLedger.createInitialEntry(snapshot, "Celebration created",
                TransitionTrigger.system("intake"), new ActivationDetails("first"));

        assertTrue(entry.isInitial());
        assertEquals(1, entry.getSequenceNumber());
        assertEquals(CelebrationStatus.ACTIVE, entry.getNewStatus());
        assertEquals(ComplianceTier.ELEVATED, entry.getComplianceTierAtTime());
        assertTrue(entry.isCompliant());
        printSuccess("Creation entry is none -> ACTIVE");
    }

    @Test
    @DisplayName("History should list recent entries newest first with durations")
    void testGetStatusHistory() {
        printTestHeader("Status History");

        ContributionRecord paused = statusLedger.changeStatus(active, CelebrationStatus.PAUSED,
                "Pause", TransitionTrigger.system("test"), null);

        StatusHistory history = statusLedger.getStatusHistory(paused, 1);

        printOutput("Total changes", history.getTotalChanges());
        printOutput("Lifetime", history.getLifetime());

        assertEquals(2, history.getTotalChanges());
        assertEquals(1, history.getRecentChanges().size());
        assertEquals(CelebrationStatus.PAUSED, history.getRecentChanges().get(0).getNewStatus());
        assertEquals(Duration.ZERO, history.getTimeInCurrentStatus());
        assertEquals(Duration.ofDays(3), history.getLifetime());

        Set<CelebrationStatus> seen = EnumSet.noneOf(CelebrationStatus.class);
        statusLedger.getStatusHistory(paused, 10).getRecentChanges().forEach(e -> seen.add(e.getNewStatus()));
        assertEquals(EnumSet.of(CelebrationStatus.ACTIVE, CelebrationStatus.PAUSED), seen);
        printSuccess("History reflects the ledger");
    }
}
