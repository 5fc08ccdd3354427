package io.tenderbridge.backend.tender;

import java.util.Locale;

/** Lifecycle status of a tender. */
public enum TenderStatus {
  /** Initial state; details are being authored by the owning company. */
  DRAFT,

  /** Visible to bidders but not yet accepting bids. */
  PUBLISHED,

  /** Accepting, withdrawing and revising bids until the closing deadline. */
  OPEN,

  /** Bidding has stopped and bids are being evaluated. */
  EVALUATION,

  /** Bidding closed; evaluation not yet started. */
  CLOSED,

  /** Terminal: a winning bid has been named. */
  AWARDED,

  /** Terminal: withdrawn by the owning company with a recorded reason. */
  CANCELLED;

  /** Lower-case wire value ("draft", "open", ...). */
  public String value() {
    return name().toLowerCase(Locale.ROOT);
  }

  /**
   * Parses a wire value case-insensitively.
   *
   * @throws IllegalArgumentException if the value names no status
   */
  public static TenderStatus fromValue(String value) {
    if (value == null || value.isBlank()) {
      throw new IllegalArgumentException("Tender status must not be blank");
    }
    return TenderStatus.valueOf(value.trim().toUpperCase(Locale.ROOT));
  }
}
