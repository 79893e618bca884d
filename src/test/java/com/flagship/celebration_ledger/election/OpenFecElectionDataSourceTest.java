package com.flagship.celebration_ledger.election;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.web.client.RestTemplate;

import java.time.LocalDate;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for OpenFEC response handling.
 *
 * These tests verify that:
 * - The earliest House primary for the state is picked
 * - The general date is always statutory
 * - States with no listed elections yield no answer
 * - A source without an API key never calls out
 */
class OpenFecElectionDataSourceTest {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final OpenFecElectionDataSource source =
            new OpenFecElectionDataSource(new RestTemplate(), "https://api.open.fec.gov/v1", "test-key", true);

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

    private JsonNode results(String json) throws Exception {
        return objectMapper.readTree(json);
    }

    @Test
    @DisplayName("Earliest House primary should be used with the statutory general")
    void testParse_EarliestPrimary() throws Exception {
        printTestHeader("Earliest Primary");

        JsonNode results = results("""
                [
                  {"election_state": "CA", "election_type_id": "G", "election_date": "2024-11-04"},
                  {"election_state": "CA", "election_type_id": "P", "election_date": "2024-06-04"},
                  {"election_state": "CA", "election_type_id": "P", "election_date": "2024-03-05T00:00:00"},
                  {"election_state": "NV", "election_type_id": "P", "election_date": "2024-01-02"}
                ]
                """);

        Optional<ElectionDates> dates = source.parse(results, "CA", 2024);

        printOutput("Dates", dates);
        assertTrue(dates.isPresent());
        assertEquals(LocalDate.of(2024, 3, 5), dates.get().getPrimaryDate());
        assertEquals(LocalDate.of(2024, 11, 5), dates.get().getGeneralDate());
        printSuccess("API general date ignored in favor of the statutory one");
    }

    @Test
    @DisplayName("Listed state without a primary should give a general-only answer")
    void testParse_NoPrimary() throws Exception {
        printTestHeader("No Primary");

        JsonNode results = results("""
                [
                  {"election_state": "LA", "election_type_id": "G", "election_date": "2024-11-05"},
                  {"election_state": "LA", "election_type_id": "P", "election_date": "not-a-date"},
                  {"election_state": "LA", "election_type_id": "P", "election_date": "2022-11-08"}
                ]
                """);

        ElectionDates dates = source.parse(results, "LA", 2024).orElseThrow();

        assertNull(dates.getPrimaryDate());
        assertEquals(LocalDate.of(2024, 11, 5), dates.getGeneralDate());
    }

    @Test
    @DisplayName("State absent from the results should give no answer")
    void testParse_StateNotListed() throws Exception {
        printTestHeader("State Not Listed");

        JsonNode results = results("""
                [{"election_state": "NV", "election_type_id": "P", "election_date": "2024-06-11"}]
                """);

        assertTrue(source.parse(results, "CA", 2024).isEmpty());
    }

    @Test
    @DisplayName("Missing API key should report the source unconfigured")
    void testFetch_NoApiKey() {
        printTestHeader("No API Key");

        OpenFecElectionDataSource unkeyed =
                new OpenFecElectionDataSource(new RestTemplate(), "http://localhost:1", "", true);
        OpenFecElectionDataSource disabled =
                new OpenFecElectionDataSource(new RestTemplate(), "http://localhost:1", "key", false);

        assertFalse(unkeyed.isConfigured());
        assertFalse(disabled.isConfigured());
        assertTrue(unkeyed.fetchElectionDates("CA", 2024).isEmpty());
        assertTrue(source.isConfigured());
    }
}
