package io.tenderbridge.backend.ledger.job;

import jakarta.persistence.LockModeType;
import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface LedgerJobRepository extends JpaRepository<LedgerJob, UUID> {

  @Lock(LockModeType.PESSIMISTIC_WRITE)
  @Query(
      """
      SELECT j FROM LedgerJob j
      WHERE j.status = io.tenderbridge.backend.ledger.job.LedgerJobStatus.ENQUEUED
        AND j.nextAttemptAt <= :now
      ORDER BY j.nextAttemptAt ASC
      """)
  List<LedgerJob> findDueForUpdate(@Param("now") Instant now, Pageable pageable);

  @Lock(LockModeType.PESSIMISTIC_WRITE)
  @Query(
      """
      SELECT j FROM LedgerJob j
      WHERE j.status = io.tenderbridge.backend.ledger.job.LedgerJobStatus.RUNNING
        AND j.startedAt < :cutoff
      """)
  List<LedgerJob> findStaleRunningForUpdate(@Param("cutoff") Instant cutoff);

  @Lock(LockModeType.PESSIMISTIC_WRITE)
  @Query("SELECT j FROM LedgerJob j WHERE j.id = :id")
  Optional<LedgerJob> findByIdForUpdate(@Param("id") UUID id);

  Optional<LedgerJob> findFirstByTenderIdAndStatusInOrderByCreatedAtDesc(
      UUID tenderId, Collection<LedgerJobStatus> statuses);

  List<LedgerJob> findByTenderIdOrderByCreatedAtDesc(UUID tenderId);

  @Query(
      """
      SELECT j FROM LedgerJob j
      WHERE (:status IS NULL OR j.status = :status)
      ORDER BY j.createdAt DESC
      """)
  Page<LedgerJob> findFiltered(@Param("status") LedgerJobStatus status, Pageable pageable);
}
