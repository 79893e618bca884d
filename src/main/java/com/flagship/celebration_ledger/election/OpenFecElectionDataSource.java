package com.flagship.celebration_ledger.election;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.util.UriComponentsBuilder;

import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.Optional;

/**
 * Election dates from the OpenFEC {@code /election-dates/} endpoint.
 *
 * Only House primaries ({@code election_type_id = P}) are taken from the API.
 * The general election date is always the statutory one, since it is fixed by
 * federal law and the API sometimes lags behind.
 *
 * Without an API key the source reports itself unavailable.
 */
@Component
@Slf4j
public class OpenFecElectionDataSource implements ElectionDataSource {

    static final String PRIMARY_TYPE = "P";
    private static final String HOUSE_OFFICE = "H";
    private static final int PAGE_SIZE = 100;

    private final RestTemplate restTemplate;
    private final String baseUrl;
    private final String apiKey;
    private final boolean enabled;

    public OpenFecElectionDataSource(
            RestTemplate electionRestTemplate,
            @Value("${election.live-source.base-url:https://api.open.fec.gov/v1}") String baseUrl,
            @Value("${election.live-source.api-key:}") String apiKey,
            @Value("${election.live-source.enabled:true}") boolean enabled) {
        this.restTemplate = electionRestTemplate;
        this.baseUrl = baseUrl;
        this.apiKey = apiKey;
        this.enabled = enabled;
    }

    @Override
    public boolean isConfigured() {
        return enabled && apiKey != null && !apiKey.isBlank();
    }

    @Override
    public Optional<ElectionDates> fetchElectionDates(String jurisdiction, int electionYear) {
        if (!isConfigured()) {
            log.debug("OpenFEC source not configured, skipping live lookup for {} {}", jurisdiction, electionYear);
            return Optional.empty();
        }

        String url = UriComponentsBuilder.fromHttpUrl(baseUrl)
                .path("/election-dates/")
                .queryParam("api_key", apiKey)
                .queryParam("election_year", electionYear)
                .queryParam("election_state", jurisdiction)
                .queryParam("office", HOUSE_OFFICE)
                .queryParam("per_page", PAGE_SIZE)
                .toUriString();

        JsonNode body;
        try {
            body = restTemplate.getForObject(url, JsonNode.class);
        } catch (RestClientException e) {
            log.warn("OpenFEC lookup failed for {} {}: {}", jurisdiction, electionYear, e.getMessage());
            return Optional.empty();
        }

        if (body == null || !body.has("results")) {
            log.warn("OpenFEC returned no results payload for {} {}", jurisdiction, electionYear);
            return Optional.empty();
        }

        return parse(body.get("results"), jurisdiction, electionYear);
    }

    /**
     * Picks the earliest House primary reported for the jurisdiction.
     * Returns empty when the state has no elections listed at all.
     */
    Optional<ElectionDates> parse(JsonNode results, String jurisdiction, int electionYear) {
        boolean stateListed = false;
        Optional<LocalDate> primary = Optional.empty();

        for (JsonNode election : results) {
            if (!jurisdiction.equalsIgnoreCase(election.path("election_state").asText())) {
                continue;
            }
            stateListed = true;
            if (!PRIMARY_TYPE.equals(election.path("election_type_id").asText())) {
                continue;
            }
            Optional<LocalDate> date = parseDate(election.path("election_date").asText());
            if (date.isPresent() && date.get().getYear() == electionYear) {
                if (primary.isEmpty() || date.get().isBefore(primary.get())) {
                    primary = date;
                }
            }
        }

        if (!stateListed) {
            log.info("OpenFEC lists no House elections for {} in {}", jurisdiction, electionYear);
            return Optional.empty();
        }

        LocalDate general = StatutoryElectionCalendar.generalElectionDate(electionYear);
        LocalDate primaryDate = primary.filter(p -> p.isBefore(general)).orElse(null);
        return Optional.of(ElectionDates.of(primaryDate, general));
    }

    private Optional<LocalDate> parseDate(String value) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        try {
            return Optional.of(LocalDate.parse(value.length() > 10 ? value.substring(0, 10) : value));
        } catch (DateTimeParseException e) {
            log.debug("Ignoring unparseable election date '{}'", value);
            return Optional.empty();
        }
    }
}
