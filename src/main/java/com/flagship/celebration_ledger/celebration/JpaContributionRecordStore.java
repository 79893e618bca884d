package com.flagship.celebration_ledger.celebration;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.celebration_ledger.celebration.exception.ConcurrentLedgerModificationException;
import com.flagship.celebration_ledger.celebration.exception.DuplicateIdempotencyKeyException;
import com.flagship.celebration_ledger.celebration.exception.UnknownRecordException;
import jakarta.persistence.EntityManager;
import jakarta.persistence.PersistenceContext;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.data.domain.PageRequest;
import org.springframework.orm.ObjectOptimisticLockingFailureException;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * PostgreSQL-backed store. Header rows and ledger entries live in separate
 * tables; an append inserts one entry row and updates the header in the same
 * transaction.
 */
@Repository
@Slf4j
public class JpaContributionRecordStore implements ContributionRecordStore {

    private final ContributionRecordRepository recordRepository;
    private final StatusChangeEntryRepository entryRepository;
    private final ObjectMapper objectMapper;

    @PersistenceContext
    private EntityManager entityManager;

    public JpaContributionRecordStore(ContributionRecordRepository recordRepository,
                                      StatusChangeEntryRepository entryRepository,
                                      ObjectMapper objectMapper) {
        this.recordRepository = recordRepository;
        this.entryRepository = entryRepository;
        this.objectMapper = objectMapper;
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<ContributionRecord> findById(UUID id) {
        return recordRepository.findById(id).map(this::load);
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<ContributionRecord> findByIdempotencyKey(String idempotencyKey) {
        return recordRepository.findByIdempotencyKey(idempotencyKey).map(this::load);
    }

    @Override
    @Transactional(readOnly = true)
    public List<ContributionRecord> findByContributor(String contributorId) {
        return loadAll(recordRepository.findByContributorIdOrderByCreatedAtAsc(contributorId));
    }

    @Override
    @Transactional(readOnly = true)
    public List<ContributionRecord> findByStatuses(Set<CelebrationStatus> statuses, int limit) {
        return loadAll(recordRepository.findByCurrentStatusInOrderByCreatedAtAsc(statuses, PageRequest.of(0, limit)));
    }

    @Override
    @Transactional
    public ContributionRecord create(ContributionRecord record) {
        if (record.getVersion() != 1) {
            throw new IllegalArgumentException("New records must carry exactly the creation entry");
        }
        try {
            recordRepository.saveAndFlush(ContributionRecordEntity.fromDomain(record));
            persistEntry(record.getId(), record.getLastEntry());
            entityManager.flush();
        } catch (DataIntegrityViolationException e) {
            throw new DuplicateIdempotencyKeyException(record.getIdempotencyKey(), e);
        }
        log.debug("Created celebration {} with idempotency key {}", record.getId(), record.getIdempotencyKey());
        return record;
    }

    @Override
    @Transactional
    public ContributionRecord appendEntry(ContributionRecord updated, int expectedVersion) {
        ContributionRecordEntity entity = recordRepository.findById(updated.getId())
            .orElseThrow(() -> new UnknownRecordException(updated.getId().toString()));

        if (entity.getLedgerLength() != expectedVersion) {
            throw new ConcurrentLedgerModificationException(updated.getId(), expectedVersion);
        }
        if (updated.getVersion() != expectedVersion + 1) {
            throw new IllegalArgumentException(String.format(
                "Record %s carries %d entries, expected exactly one more than %d",
                updated.getId(), updated.getVersion(), expectedVersion));
        }

        try {
            persistEntry(updated.getId(), updated.getLastEntry());
            entity.applyTransition(updated);
            recordRepository.saveAndFlush(entity);
        } catch (ObjectOptimisticLockingFailureException | DataIntegrityViolationException e) {
            log.debug("Lost append race on {} at version {}", updated.getId(), expectedVersion);
            throw new ConcurrentLedgerModificationException(updated.getId(), expectedVersion, e);
        }
        return updated;
    }

    private void persistEntry(UUID contributionId, StatusChangeEntry entry) {
        entityManager.persist(StatusChangeEntryEntity.fromDomain(
            contributionId, entry,
            toJson(entry.getMetadata(), StatusMetadata.class),
            toJson(entry.getAuditTrail(), AuditTrail.class)));
    }

    private ContributionRecord load(ContributionRecordEntity entity) {
        List<StatusChangeEntry> ledger = entryRepository.findByContributionIdOrderBySequenceNumberAsc(entity.getId())
            .stream()
            .map(this::toEntry)
            .toList();
        return entity.toDomain(ledger);
    }

    private List<ContributionRecord> loadAll(List<ContributionRecordEntity> entities) {
        if (entities.isEmpty()) {
            return Collections.emptyList();
        }
        Map<UUID, List<StatusChangeEntry>> ledgers = entryRepository
            .findByContributionIdInOrderByContributionIdAscSequenceNumberAsc(
                entities.stream().map(ContributionRecordEntity::getId).toList())
            .stream()
            .collect(Collectors.groupingBy(
                StatusChangeEntryEntity::getContributionId,
                Collectors.mapping(this::toEntry, Collectors.toList())));

        return entities.stream()
            .map(e -> e.toDomain(ledgers.getOrDefault(e.getId(), List.of())))
            .toList();
    }

    private StatusChangeEntry toEntry(StatusChangeEntryEntity entity) {
        return entity.toDomain(
            fromJson(entity.getMetadata(), StatusMetadata.class),
            fromJson(entity.getAuditTrail(), AuditTrail.class));
    }

    private <T> String toJson(T value, Class<T> type) {
        if (value == null) {
            return null;
        }
        try {
            // Written through the declared type so polymorphic metadata keeps its type tag
            return objectMapper.writerFor(type).writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize " + value.getClass().getSimpleName(), e);
        }
    }

    private <T> T fromJson(String json, Class<T> type) {
        if (json == null || json.isBlank()) {
            return null;
        }
        try {
            return objectMapper.readValue(json, type);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Corrupt " + type.getSimpleName() + " in ledger: " + e.getMessage(), e);
        }
    }
}
