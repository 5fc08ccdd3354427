package io.tenderbridge.backend.event;

import java.time.Instant;
import java.util.UUID;

public record TenderStatusChangedEvent(
    UUID tenderId,
    String tenderTitle,
    UUID ownerCompanyId,
    String oldStatus,
    String newStatus,
    UUID actorId,
    String actorType,
    String reason,
    Instant occurredAt)
    implements TenderDomainEvent {

  @Override
  public String eventType() {
    return "tender_status_changed";
  }
}
