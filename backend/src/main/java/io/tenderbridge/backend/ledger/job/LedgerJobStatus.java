package io.tenderbridge.backend.ledger.job;

import java.util.Locale;

/**
 * ENQUEUED → RUNNING → COMMITTED, or back to ENQUEUED for a retry, or FAILED once retries are
 * exhausted. An admin can move a FAILED job back to ENQUEUED.
 */
public enum LedgerJobStatus {
  ENQUEUED,
  RUNNING,
  COMMITTED,
  FAILED;

  public String value() {
    return name().toLowerCase(Locale.ROOT);
  }
}
