package com.flagship.celebration_ledger.celebration;

import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface ContributionRecordRepository extends JpaRepository<ContributionRecordEntity, UUID> {

    Optional<ContributionRecordEntity> findByIdempotencyKey(String idempotencyKey);

    List<ContributionRecordEntity> findByContributorIdOrderByCreatedAtAsc(String contributorId);

    List<ContributionRecordEntity> findByCurrentStatusInOrderByCreatedAtAsc(
            Collection<CelebrationStatus> statuses, Pageable pageable);
}
