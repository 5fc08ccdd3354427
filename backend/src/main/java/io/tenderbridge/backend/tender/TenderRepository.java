package io.tenderbridge.backend.tender;

import jakarta.persistence.LockModeType;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface TenderRepository extends JpaRepository<Tender, UUID> {

  @Lock(LockModeType.PESSIMISTIC_WRITE)
  @Query("SELECT t FROM Tender t WHERE t.id = :id")
  Optional<Tender> findByIdForUpdate(@Param("id") UUID id);

  @Query(
      """
      SELECT t FROM Tender t
      WHERE (:status IS NULL OR t.status = :status)
        AND (:ownerCompanyId IS NULL OR t.ownerCompanyId = :ownerCompanyId)
      ORDER BY t.createdAt DESC
      """)
  Page<Tender> findFiltered(
      @Param("status") TenderStatus status,
      @Param("ownerCompanyId") UUID ownerCompanyId,
      Pageable pageable);

  @Query(
      """
      SELECT t.id FROM Tender t
      WHERE t.status = :status AND t.publishAt IS NOT NULL AND t.publishAt <= :now
      """)
  List<UUID> findIdsDueForPublication(
      @Param("status") TenderStatus status, @Param("now") Instant now);

  @Query("SELECT t.id FROM Tender t WHERE t.status = :status AND t.closingDate <= :now")
  List<UUID> findIdsPastClosingDate(
      @Param("status") TenderStatus status, @Param("now") Instant now);

  @Query(
      """
      SELECT t.id FROM Tender t
      WHERE t.status = io.tenderbridge.backend.tender.TenderStatus.AWARDED
        AND t.ledgerContentHash IS NULL
        AND NOT EXISTS (SELECT j.id FROM LedgerJob j WHERE j.tenderId = t.id)
      """)
  List<UUID> findAwardedIdsWithoutLedgerJob();
}
