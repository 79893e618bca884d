package com.flagship.celebration_ledger.election;

import java.util.Optional;

/**
 * External source of election dates.
 *
 * Implementations return an empty result when the source is unavailable or
 * has nothing for the jurisdiction; they should not throw for ordinary
 * outages. Callers bound the call with their own timeout.
 */
public interface ElectionDataSource {

    Optional<ElectionDates> fetchElectionDates(String jurisdiction, int electionYear);

    /**
     * Whether the source is configured to answer at all (e.g. has credentials).
     */
    default boolean isConfigured() {
        return true;
    }
}
