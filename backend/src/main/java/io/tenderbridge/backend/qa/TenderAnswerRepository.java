package io.tenderbridge.backend.qa;

import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;

public interface TenderAnswerRepository extends JpaRepository<TenderAnswer, UUID> {

  Optional<TenderAnswer> findByQuestionId(UUID questionId);

  Optional<TenderAnswer> findByIdAndQuestionId(UUID id, UUID questionId);

  List<TenderAnswer> findByQuestionIdIn(Collection<UUID> questionIds);
}
