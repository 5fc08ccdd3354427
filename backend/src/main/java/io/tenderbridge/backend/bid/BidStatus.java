package io.tenderbridge.backend.bid;

import java.util.Locale;

/** Status of a single bid revision. */
public enum BidStatus {
  PENDING,
  /** Marked by the tender owner during evaluation; still live and still eligible to win. */
  SHORTLISTED,
  ACCEPTED,
  REJECTED,
  /** Terminal: withdrawn by the bidding company while bidding was open. */
  WITHDRAWN,
  /** Terminal: replaced by a newer revision that points back to this row. */
  SUPERSEDED;

  public String value() {
    return name().toLowerCase(Locale.ROOT);
  }
}
