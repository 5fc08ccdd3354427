package io.tenderbridge.backend.ledger.job;

/** Durable queue of award ledger commits. */
public interface AwardJobQueue {

  String AWARD_COMMIT_JOB = "award-ledger-commit";

  /**
   * Enqueues a commit for the tender in the payload. Enqueuing a tender that already has a pending
   * or committed job returns that job instead of adding another one.
   */
  LedgerJob enqueue(String jobName, AwardCommitPayload payload);
}
