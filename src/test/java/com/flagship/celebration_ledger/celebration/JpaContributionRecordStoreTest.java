package com.flagship.celebration_ledger.celebration;

import com.flagship.celebration_ledger.celebration.exception.ConcurrentLedgerModificationException;
import com.flagship.celebration_ledger.celebration.exception.DuplicateIdempotencyKeyException;
import com.flagship.celebration_ledger.celebration.exception.UnknownRecordException;
import com.flagship.celebration_ledger.compliance.ComplianceTier;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.ValueOperations;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Set;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.when;

/**
 * Persistence tests against a real PostgreSQL.
 *
 * These tests verify that:
 * - A record and its creation entry survive a round trip, metadata included
 * - Appends are accepted only at the expected ledger length
 * - Idempotency keys are unique
 * - Ledger rows cannot be updated or deleted
 */
@SpringBootTest
@Testcontainers(disabledWithoutDocker = true)
class JpaContributionRecordStoreTest {

    @Container
    static PostgreSQLContainer<?> postgres = new PostgreSQLContainer<>("postgres:16")
            .withDatabaseName("celebration_ledger_test")
            .withUsername("test")
            .withPassword("test");

    @DynamicPropertySource
    static void configureProperties(DynamicPropertyRegistry registry) {
        registry.add("spring.datasource.url", postgres::getJdbcUrl);
        registry.add("spring.datasource.username", postgres::getUsername);
        registry.add("spring.datasource.password", postgres::getPassword);
        // No broker in these tests
        registry.add("spring.kafka.bootstrap-servers", () -> "localhost:9999");
        registry.add("settlement.consumer.enabled", () -> "false");
        registry.add("election.live-source.enabled", () -> "false");
    }

    @Autowired
    private JpaContributionRecordStore store;

    @Autowired
    private JdbcTemplate jdbcTemplate;

    @MockBean
    private StringRedisTemplate redisTemplate;

    @MockBean
    private ValueOperations<String, String> valueOperations;

    private final StatusLedger statusLedger = new StatusLedger(Clock.systemUTC());

    @BeforeEach
    void setUp() {
        when(redisTemplate.opsForValue()).thenReturn(valueOperations);
    }

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

    private void printExpectedException(Exception e) {
        System.out.println("✓ EXPECTED EXCEPTION: " + e.getClass().getSimpleName() + " - " + e.getMessage());
    }

    private static ContributionRecord newRecord(String contributorId, ComplianceTier tier) {
        return ContributionRecordFixtures.record(contributorId, "recipient-1", "25.00",
                CelebrationStatus.ACTIVE, Instant.parse("2024-06-01T12:00:00Z"), tier);
    }

    private static String contributor() {
        return "contributor-" + UUID.randomUUID();
    }

    @Test
    @DisplayName("Created record should load back with its ledger and donor snapshot")
    void testCreate_RoundTrip() {
        printTestHeader("Create Round Trip");

        ContributionRecord record = newRecord(contributor(), ComplianceTier.ELEVATED);
        store.create(record);

        ContributionRecord loaded = store.findById(record.getId()).orElseThrow();
        printOutput("Loaded", loaded.getId());

        assertEquals(record.getContributorId(), loaded.getContributorId());
        assertEquals(0, new BigDecimal("25.00").compareTo(loaded.getAmount()));
        assertEquals(CelebrationStatus.ACTIVE, loaded.getCurrentStatus());
        assertEquals(1, loaded.getVersion());
        assertNull(loaded.getLastEntry().getPreviousStatus());
        assertInstanceOf(ActivationDetails.class, loaded.getLastEntry().getMetadata());
        assertEquals(ComplianceTier.ELEVATED, loaded.snapshotTier().orElseThrow());
        assertEquals("Lovelace", loaded.getDonorSnapshot().getProfile().getLastName());
        assertEquals(record.getId(), store.findByIdempotencyKey(record.getIdempotencyKey()).orElseThrow().getId());
        printSuccess("Record, entry and snapshot persisted");
    }

    @Test
    @DisplayName("Append at the current length should move the status projection")
    void testAppendEntry_Success() {
        printTestHeader("Append Entry");

        ContributionRecord record = store.create(newRecord(contributor(), ComplianceTier.BASE));
        ContributionRecord paused = statusLedger.changeStatus(record, CelebrationStatus.PAUSED,
                "Donor request", TransitionTrigger.system("test"),
                new PauseDetails("Donor request", null, "vacation"));

        store.appendEntry(paused, 1);

        ContributionRecord loaded = store.findById(record.getId()).orElseThrow();
        assertEquals(CelebrationStatus.PAUSED, loaded.getCurrentStatus());
        assertEquals(2, loaded.getVersion());
        assertEquals(CelebrationStatus.ACTIVE, loaded.getLastEntry().getPreviousStatus());
        assertEquals("vacation", loaded.getLastEntry().getMetadata().getNote());
    }

    @Test
    @DisplayName("Append against a stale length should be refused")
    void testAppendEntry_StaleVersion() {
        printTestHeader("Stale Append");

        ContributionRecord record = store.create(newRecord(contributor(), ComplianceTier.BASE));
        store.appendEntry(statusLedger.changeStatus(record, CelebrationStatus.PAUSED,
                "Donor request", TransitionTrigger.system("first"), null), 1);

        ContributionRecord stale = statusLedger.changeStatus(record, CelebrationStatus.RESOLVED,
                "Bill passed", TransitionTrigger.system("second"), null);

        ConcurrentLedgerModificationException e = assertThrows(ConcurrentLedgerModificationException.class,
                () -> store.appendEntry(stale, 1));
        printExpectedException(e);

        assertEquals(CelebrationStatus.PAUSED, store.findById(record.getId()).orElseThrow().getCurrentStatus());
    }

    @Test
    @DisplayName("Append to a missing record should report it unknown")
    void testAppendEntry_UnknownRecord() {
        printTestHeader("Unknown Record");

        ContributionRecord neverSaved = newRecord(contributor(), ComplianceTier.BASE);
        ContributionRecord changed = statusLedger.changeStatus(neverSaved, CelebrationStatus.PAUSED,
                "Donor request", TransitionTrigger.system("test"), null);

        assertThrows(UnknownRecordException.class, () -> store.appendEntry(changed, 1));
    }

    @Test
    @DisplayName("Second record with the same idempotency key should be refused")
    void testCreate_DuplicateIdempotencyKey() {
        printTestHeader("Duplicate Idempotency Key");

        ContributionRecord first = store.create(newRecord(contributor(), ComplianceTier.BASE));
        ContributionRecord second = newRecord(contributor(), ComplianceTier.BASE).toBuilder()
                .idempotencyKey(first.getIdempotencyKey())
                .build();

        DuplicateIdempotencyKeyException e = assertThrows(DuplicateIdempotencyKeyException.class,
                () -> store.create(second));
        printExpectedException(e);

        assertTrue(store.findById(second.getId()).isEmpty());
    }

    @Test
    @DisplayName("Contributor and status queries should return records oldest first")
    void testQueries() {
        printTestHeader("Queries");

        String contributorId = contributor();
        ContributionRecord older = store.create(ContributionRecordFixtures.record(contributorId, "recipient-1",
                "10.00", CelebrationStatus.ACTIVE, Instant.parse("2024-01-01T12:00:00Z"), ComplianceTier.BASE));
        ContributionRecord newer = store.create(ContributionRecordFixtures.record(contributorId, "recipient-2",
                "20.00", CelebrationStatus.ACTIVE, Instant.parse("2024-02-01T12:00:00Z"), ComplianceTier.BASE));

        List<ContributionRecord> history = store.findByContributor(contributorId);
        assertEquals(List.of(older.getId(), newer.getId()), history.stream().map(ContributionRecord::getId).toList());
        history.forEach(r -> assertEquals(1, r.getStatusLedger().size()));

        List<ContributionRecord> active = store.findByStatuses(Set.of(CelebrationStatus.ACTIVE), 1000);
        assertTrue(active.stream().anyMatch(r -> r.getId().equals(newer.getId())));
    }

    @Test
    @DisplayName("Ledger rows should reject updates and deletes")
    void testLedgerIsAppendOnly() {
        printTestHeader("Append Only");

        ContributionRecord record = store.create(newRecord(contributor(), ComplianceTier.BASE));

        assertThrows(DataAccessException.class, () -> jdbcTemplate.update(
                "UPDATE status_change_entries SET reason = 'rewritten' WHERE contribution_id = ?", record.getId()));
        assertThrows(DataAccessException.class, () -> jdbcTemplate.update(
                "DELETE FROM status_change_entries WHERE contribution_id = ?", record.getId()));

        assertEquals("Celebration created",
                store.findById(record.getId()).orElseThrow().getLastEntry().getReason());
        printSuccess("History cannot be rewritten");
    }
}
