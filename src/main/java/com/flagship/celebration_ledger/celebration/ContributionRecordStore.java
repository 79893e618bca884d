package com.flagship.celebration_ledger.celebration;

import com.flagship.celebration_ledger.celebration.exception.ConcurrentLedgerModificationException;
import com.flagship.celebration_ledger.celebration.exception.DuplicateIdempotencyKeyException;
import com.flagship.celebration_ledger.celebration.exception.UnknownRecordException;

import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

/**
 * Persistence port for celebrations and their ledgers.
 *
 * A record has a single logical owner; concurrent writers are reconciled by
 * {@link #appendEntry} comparing the stored ledger length with the length the
 * writer read.
 */
public interface ContributionRecordStore {

    Optional<ContributionRecord> findById(UUID id);

    Optional<ContributionRecord> findByIdempotencyKey(String idempotencyKey);

    List<ContributionRecord> findByContributor(String contributorId);

    /**
     * Records in any of the given statuses, oldest first, at most {@code limit}.
     */
    List<ContributionRecord> findByStatuses(Set<CelebrationStatus> statuses, int limit);

    /**
     * Persists a new record together with its creation entry.
     *
     * @throws DuplicateIdempotencyKeyException if the key is already taken
     */
    ContributionRecord create(ContributionRecord record);

    /**
     * Appends the new last entry of {@code updated} and moves the status
     * projection, but only if the stored ledger still has
     * {@code expectedVersion} entries.
     *
     * @throws ConcurrentLedgerModificationException if another writer got there first
     * @throws UnknownRecordException if the record does not exist
     */
    ContributionRecord appendEntry(ContributionRecord updated, int expectedVersion);
}
