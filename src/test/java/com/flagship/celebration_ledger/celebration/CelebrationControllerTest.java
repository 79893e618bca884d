package com.flagship.celebration_ledger.celebration;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.ValueOperations;
import org.springframework.http.MediaType;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

/**
 * REST API tests.
 *
 * These tests verify:
 * - Same creation request sent twice returns the same celebration
 * - Concurrent duplicate requests create one celebration
 * - Idempotency key is required
 * - Limit rejections map to 422, undetermined limits to 503
 * - Transition failures map to 404 and 409 with a machine-readable code
 */
@SpringBootTest
@AutoConfigureMockMvc
@Testcontainers(disabledWithoutDocker = true)
class CelebrationControllerTest {

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
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @MockBean
    private StringRedisTemplate redisTemplate;

    @MockBean
    private ValueOperations<String, String> valueOperations;

    @BeforeEach
    void setUp() {
        when(redisTemplate.opsForValue()).thenReturn(valueOperations);
    }

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

    private static String createBody(String contributorId, String jurisdiction, String amount) {
        return """
                {
                  "contributor_id": "%s",
                  "recipient_id": "rep-ca-12",
                  "recipient_jurisdiction": "%s",
                  "condition_id": "hr-1234-118",
                  "amount": %s,
                  "tip": 5.00,
                  "processing_fee": 1.50
                }
                """.formatted(contributorId, jurisdiction, amount);
    }

    private static String elevatedBody(String contributorId, String jurisdiction) {
        return """
                {
                  "contributor_id": "%s",
                  "recipient_id": "rep-zz-1",
                  "recipient_jurisdiction": "%s",
                  "condition_id": "hr-1234-118",
                  "amount": 500.00,
                  "donor": {
                    "first_name": "Ada", "last_name": "Lovelace",
                    "address_line": "1 Main St", "city": "Springfield", "state": "IL", "zip": "62701",
                    "country": "United States", "employment_status": "EMPLOYED",
                    "occupation": "Engineer", "employer": "Analytical Engines"
                  }
                }
                """.formatted(contributorId, jurisdiction);
    }

    private static String transitionBody(String target) {
        return """
                {"target_status": "%s", "reason": "Donor request", "triggered_by": "USER"}
                """.formatted(target);
    }

    private static String contributor() {
        return "contributor-" + UUID.randomUUID();
    }

    private String create(String body) throws Exception {
        MvcResult result = mockMvc.perform(post("/api/celebrations")
                        .header("Idempotency-Key", "idem-" + UUID.randomUUID())
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(body))
                .andExpect(status().isCreated())
                .andReturn();
        return objectMapper.readTree(result.getResponse().getContentAsString()).get("id").asText();
    }

    @Test
    @DisplayName("Same creation request twice should return the same celebration")
    void testCreateCelebration_Idempotent() throws Exception {
        printTestHeader("Idempotent Create");

        String key = "idem-" + UUID.randomUUID();
        String body = createBody(contributor(), "CA", "40.00");
        printInput("Idempotency-Key", key);

        MvcResult first = mockMvc.perform(post("/api/celebrations")
                        .header("Idempotency-Key", key)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(body))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.status").value("ACTIVE"))
                .andExpect(jsonPath("$.total_charged").value(46.5))
                .andExpect(jsonPath("$.compliance_tier").value("BASE"))
                .andExpect(jsonPath("$.ledger_length").value(1))
                .andReturn();

        MvcResult second = mockMvc.perform(post("/api/celebrations")
                        .header("Idempotency-Key", key)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(body))
                .andExpect(status().isOk())
                .andReturn();

        String firstId = objectMapper.readTree(first.getResponse().getContentAsString()).get("id").asText();
        String secondId = objectMapper.readTree(second.getResponse().getContentAsString()).get("id").asText();
        printOutput("First ID", firstId);
        printOutput("Replay ID", secondId);

        assertEquals(firstId, secondId);
        printSuccess("Replay returned the original celebration");
    }

    @Test
    @DisplayName("Concurrent duplicate requests should create one celebration")
    void testCreateCelebration_ConcurrentDuplicates() throws Exception {
        printTestHeader("Concurrent Duplicates");

        String key = "idem-" + UUID.randomUUID();
        String body = createBody(contributor(), "CA", "10.00");
        int requests = 5;
        CountDownLatch start = new CountDownLatch(1);
        ExecutorService executor = Executors.newFixedThreadPool(requests);
        List<Future<MvcResult>> futures = new ArrayList<>();
        for (int i = 0; i < requests; i++) {
            futures.add(executor.submit(() -> {
                start.await();
                return mockMvc.perform(post("/api/celebrations")
                                .header("Idempotency-Key", key)
                                .contentType(MediaType.APPLICATION_JSON)
                                .content(body))
                        .andReturn();
            }));
        }
        start.countDown();

        List<String> ids = new ArrayList<>();
        int created = 0;
        for (Future<MvcResult> future : futures) {
            MvcResult result = future.get(30, TimeUnit.SECONDS);
            int status = result.getResponse().getStatus();
            assertTrue(status == 201 || status == 200, "unexpected status " + status);
            if (status == 201) {
                created++;
            }
            ids.add(objectMapper.readTree(result.getResponse().getContentAsString()).get("id").asText());
        }
        executor.shutdown();

        printOutput("Created responses", created);
        assertEquals(1, created);
        assertEquals(1, ids.stream().distinct().count());
    }

    @Test
    @DisplayName("Missing Idempotency-Key should be rejected")
    void testCreateCelebration_MissingIdempotencyKey() throws Exception {
        printTestHeader("Missing Idempotency Key");

        mockMvc.perform(post("/api/celebrations")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(createBody(contributor(), "CA", "10.00")))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("Missing Required Header"));
    }

    @Test
    @DisplayName("Invalid body should fail validation")
    void testCreateCelebration_ValidationFailure() throws Exception {
        printTestHeader("Validation Failure");

        mockMvc.perform(post("/api/celebrations")
                        .header("Idempotency-Key", "idem-" + UUID.randomUUID())
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(createBody(contributor(), "California", "0")))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("Validation Failed"));
    }

    @Test
    @DisplayName("Base-tier amount over $50 should be rejected with 422")
    void testCreateCelebration_OverPerContributionCap() throws Exception {
        printTestHeader("Over Per-Contribution Cap");

        mockMvc.perform(post("/api/celebrations")
                        .header("Idempotency-Key", "idem-" + UUID.randomUUID())
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(createBody(contributor(), "CA", "60.00")))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.details.reason").value("EXCEEDS_PER_CONTRIBUTION_CAP"));
    }

    @Test
    @DisplayName("Elevated contribution without election dates should be refused with 503")
    void testCreateCelebration_LimitUndetermined() throws Exception {
        printTestHeader("Limit Undetermined");

        mockMvc.perform(post("/api/celebrations")
                        .header("Idempotency-Key", "idem-" + UUID.randomUUID())
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(elevatedBody(contributor(), "ZZ")))
                .andExpect(status().isServiceUnavailable())
                .andExpect(jsonPath("$.details.reason").value("LIMIT_UNDETERMINED"));
    }

    @Test
    @DisplayName("Unknown celebration should return 404")
    void testGetCelebration_NotFound() throws Exception {
        printTestHeader("Not Found");

        mockMvc.perform(get("/api/celebrations/" + UUID.randomUUID()))
                .andExpect(status().isNotFound());
        mockMvc.perform(post("/api/celebrations/" + UUID.randomUUID() + "/transitions")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(transitionBody("PAUSED")))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.details.code").value("UNKNOWN_RECORD"));
    }

    @Test
    @DisplayName("Pause then resolve should give 200 then 409, with history to match")
    void testRequestTransition_PauseThenInvalidResolve() throws Exception {
        printTestHeader("Pause Then Resolve");

        String id = create(createBody(contributor(), "CA", "25.00"));

        mockMvc.perform(post("/api/celebrations/" + id + "/transitions")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(transitionBody("PAUSED")))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("PAUSED"))
                .andExpect(jsonPath("$.ledger_length").value(2));

        mockMvc.perform(post("/api/celebrations/" + id + "/transitions")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(transitionBody("RESOLVED")))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.details.code").value("INVALID_TRANSITION"))
                .andExpect(jsonPath("$.details.current_status").value("PAUSED"));

        mockMvc.perform(get("/api/celebrations/" + id + "/status"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("PAUSED"));

        MvcResult history = mockMvc.perform(get("/api/celebrations/" + id + "/history").param("limit", "1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.total_changes").value(2))
                .andReturn();

        JsonNode changes = objectMapper.readTree(history.getResponse().getContentAsString()).get("recent_changes");
        printOutput("Recent changes", changes);
        assertEquals(1, changes.size());
        assertEquals("PAUSED", changes.get(0).get("new_status").asText());
        assertEquals("ACTIVE", changes.get(0).get("previous_status").asText());
        printSuccess("Rejected move left no trace in the ledger");
    }

    @Test
    @DisplayName("Remaining limit should reflect what the contributor has already given")
    void testRemainingLimit() throws Exception {
        printTestHeader("Remaining Limit");

        String contributorId = contributor();
        create(createBody(contributorId, "CA", "50.00"));
        create(createBody(contributorId, "CA", "50.00"));
        create(createBody(contributorId, "CA", "50.00"));

        mockMvc.perform(get("/api/contributors/" + contributorId + "/remaining-limit")
                        .param("recipient_id", "rep-ca-12")
                        .param("jurisdiction", "CA"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.tier").value("BASE"))
                .andExpect(jsonPath("$.counted_total").value(150.0))
                .andExpect(jsonPath("$.remaining").value(50.0))
                .andExpect(jsonPath("$.allowed").doesNotExist());

        mockMvc.perform(get("/api/contributors/" + contributorId + "/remaining-limit")
                        .param("recipient_id", "rep-ca-12")
                        .param("jurisdiction", "CA")
                        .param("proposed_amount", "50.00"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.allowed").value(true))
                .andExpect(jsonPath("$.rejection_reason").doesNotExist());

        create(createBody(contributorId, "CA", "40.00"));

        mockMvc.perform(get("/api/contributors/" + contributorId + "/remaining-limit")
                        .param("recipient_id", "rep-ca-12")
                        .param("jurisdiction", "CA")
                        .param("proposed_amount", "20.00"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.remaining").value(10.0))
                .andExpect(jsonPath("$.proposed_amount").value(20.0))
                .andExpect(jsonPath("$.allowed").value(false))
                .andExpect(jsonPath("$.rejection_reason").value("EXCEEDS_CUMULATIVE_CAP"));
        printSuccess("Proposed amounts beyond the annual cap are refused with a reason");
    }

    @Test
    @DisplayName("First-time contributor quoting at the elevated tier should get elevated caps")
    void testRemainingLimit_ElevatedQuote() throws Exception {
        printTestHeader("Remaining Limit Elevated Quote");

        String contributorId = contributor();
        printInput("Contributor", contributorId + " (no history)");

        mockMvc.perform(get("/api/contributors/" + contributorId + "/remaining-limit")
                        .param("recipient_id", "rep-ca-12")
                        .param("jurisdiction", "CA")
                        .param("tier", "ELEVATED")
                        .param("proposed_amount", "4000.00"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.tier").value("ELEVATED"))
                .andExpect(jsonPath("$.remaining").value(3500.0))
                .andExpect(jsonPath("$.boundary_source").value("DEFAULT"))
                .andExpect(jsonPath("$.allowed").value(false))
                .andExpect(jsonPath("$.rejection_reason").value("EXCEEDS_PER_CONTRIBUTION_CAP"));

        mockMvc.perform(get("/api/contributors/" + contributorId + "/remaining-limit")
                        .param("recipient_id", "rep-ca-12")
                        .param("jurisdiction", "CA")
                        .param("tier", "GOLD"))
                .andExpect(status().isBadRequest());
        printSuccess("Elevated caps quoted without any recorded history");
    }
}
