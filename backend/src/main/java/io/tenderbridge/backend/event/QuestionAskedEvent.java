package io.tenderbridge.backend.event;

import java.time.Instant;
import java.util.UUID;

public record QuestionAskedEvent(
    UUID questionId,
    UUID tenderId,
    String tenderTitle,
    UUID ownerCompanyId,
    UUID actorId,
    Instant occurredAt)
    implements TenderDomainEvent {

  @Override
  public String eventType() {
    return "question_asked";
  }
}
