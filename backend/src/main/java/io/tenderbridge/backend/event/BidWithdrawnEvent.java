package io.tenderbridge.backend.event;

import java.time.Instant;
import java.util.UUID;

public record BidWithdrawnEvent(
    UUID bidId, UUID tenderId, UUID companyId, String reason, UUID actorId, Instant occurredAt)
    implements TenderDomainEvent {

  @Override
  public String eventType() {
    return "bid_withdrawn";
  }
}
