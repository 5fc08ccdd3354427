package io.tenderbridge.backend.notification;

import java.time.Instant;
import java.util.UUID;

/**
 * A rendered notification about a tender or bid.
 *
 * @param audienceCompanyId company whose members should see the notice, or null for the tender
 *     owner's followers
 * @param audienceUserId single user the notice is addressed to, or null
 */
public record TenderNotice(
    String type,
    UUID tenderId,
    UUID audienceCompanyId,
    UUID audienceUserId,
    String title,
    Instant occurredAt) {

  public TenderNotice(
      String type, UUID tenderId, UUID audienceCompanyId, String title, Instant occurredAt) {
    this(type, tenderId, audienceCompanyId, null, title, occurredAt);
  }
}
