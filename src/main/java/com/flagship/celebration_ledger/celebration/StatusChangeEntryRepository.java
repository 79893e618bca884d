package com.flagship.celebration_ledger.celebration;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;
import java.util.UUID;

@Repository
public interface StatusChangeEntryRepository extends JpaRepository<StatusChangeEntryEntity, UUID> {

    List<StatusChangeEntryEntity> findByContributionIdOrderBySequenceNumberAsc(UUID contributionId);

    List<StatusChangeEntryEntity> findByContributionIdInOrderByContributionIdAscSequenceNumberAsc(
            Collection<UUID> contributionIds);
}
