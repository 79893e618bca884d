package com.flagship.celebration_ledger.election;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.ClassPathResource;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.time.LocalDate;
import java.time.MonthDay;
import java.util.HashMap;
import java.util.Iterator;
import java.util.Map;
import java.util.Optional;

/**
 * Static fallback table of primary dates, keyed by jurisdiction.
 *
 * Primaries are stored as month-day and projected onto the requested year.
 * General dates are statutory. Jurisdictions missing from the table have no
 * default and resolve to empty.
 */
@Slf4j
public class DefaultElectionDateTable {

    private final Map<String, MonthDay> primaries;

    public DefaultElectionDateTable(Map<String, MonthDay> primaries) {
        Map<String, MonthDay> normalized = new HashMap<>();
        primaries.forEach((state, monthDay) -> normalized.put(state.toUpperCase(), monthDay));
        this.primaries = Map.copyOf(normalized);
    }

    /**
     * Loads the table from a classpath JSON resource of the form
     * {@code {"primaries": {"CA": "--03-05", ...}}}.
     */
    public static DefaultElectionDateTable fromClasspath(String resourcePath, ObjectMapper objectMapper) {
        try (InputStream in = new ClassPathResource(resourcePath).getInputStream()) {
            JsonNode root = objectMapper.readTree(in);
            Map<String, MonthDay> primaries = new HashMap<>();
            Iterator<Map.Entry<String, JsonNode>> fields = root.path("primaries").fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                primaries.put(field.getKey(), MonthDay.parse(field.getValue().asText()));
            }
            log.info("Loaded default election dates for {} jurisdictions from {}", primaries.size(), resourcePath);
            return new DefaultElectionDateTable(primaries);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to load default election dates from " + resourcePath, e);
        }
    }

    public Optional<ElectionDates> lookup(String jurisdiction, int electionYear) {
        MonthDay primary = primaries.get(jurisdiction.toUpperCase());
        if (primary == null) {
            return Optional.empty();
        }
        LocalDate general = StatutoryElectionCalendar.generalElectionDate(electionYear);
        // February 29 falls back to February 28 outside leap years
        LocalDate primaryDate = primary.atYear(electionYear);
        // Runoff-style primaries scheduled on or after the general (e.g. Louisiana) collapse into GENERAL.
        if (primaryDate != null && !primaryDate.isBefore(general)) {
            primaryDate = null;
        }
        return Optional.of(ElectionDates.of(primaryDate, general));
    }

    public int size() {
        return primaries.size();
    }
}
