package io.tenderbridge.backend.qa;

import jakarta.persistence.LockModeType;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface TenderQuestionRepository extends JpaRepository<TenderQuestion, UUID> {

  @Lock(LockModeType.PESSIMISTIC_WRITE)
  @Query("SELECT q FROM TenderQuestion q WHERE q.id = :id")
  Optional<TenderQuestion> findByIdForUpdate(@Param("id") UUID id);

  List<TenderQuestion> findByTenderIdOrderByAskedAtDesc(UUID tenderId);
}
