package io.tenderbridge.backend.exception;

import org.springframework.http.HttpStatus;

/**
 * Thrown by award ledger clients when the external ledger cannot be reached or rejects a call.
 * The award job worker treats it as retryable.
 */
public class LedgerUnavailableException extends TenderProblemException {

  public LedgerUnavailableException(String detail, Throwable cause) {
    super(
        HttpStatus.SERVICE_UNAVAILABLE,
        "LEDGER_UNAVAILABLE",
        "Award ledger unavailable",
        detail,
        cause);
  }

  public LedgerUnavailableException(String detail) {
    this(detail, null);
  }
}
