package io.tenderbridge.backend.event;

import java.time.Instant;
import java.util.UUID;

/** Addressed to the asker; {@code askedByCompanyId} is null for askers without a company. */
public record QuestionAnsweredEvent(
    UUID questionId,
    UUID tenderId,
    String tenderTitle,
    UUID askedById,
    UUID askedByCompanyId,
    UUID actorId,
    Instant occurredAt)
    implements TenderDomainEvent {

  @Override
  public String eventType() {
    return "question_answered";
  }
}
