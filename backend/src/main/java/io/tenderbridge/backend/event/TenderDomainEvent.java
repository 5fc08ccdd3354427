package io.tenderbridge.backend.event;

import java.time.Instant;
import java.util.UUID;

/**
 * Base interface for events published via Spring's ApplicationEventPublisher by the tender core.
 * Implementations are records holding ids and values only, never JPA entities, so they remain valid
 * after the publishing transaction commits.
 *
 * <p>Events carry the facts a notification sink needs to render a message (ids, old/new status,
 * actor, amounts); they carry no user-facing text beyond a short machine-readable reason.
 */
public sealed interface TenderDomainEvent
    permits TenderStatusChangedEvent,
        TenderAwardedEvent,
        BidSubmittedEvent,
        BidWithdrawnEvent,
        BidRevisedEvent,
        QuestionAskedEvent,
        QuestionAnsweredEvent {

  /** Stable machine-readable name, e.g. {@code tender_status_changed}. */
  String eventType();

  UUID tenderId();

  /** Acting user, or null for system-initiated changes. */
  UUID actorId();

  Instant occurredAt();
}
