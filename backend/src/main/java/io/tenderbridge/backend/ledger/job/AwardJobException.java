package io.tenderbridge.backend.ledger.job;

/** Raised by {@link AwardJobWorker} for failures that retrying cannot fix. */
public class AwardJobException extends RuntimeException {

  public AwardJobException(String message) {
    super(message);
  }
}
