package io.tenderbridge.backend.ledger.job;

/**
 * @param submitted false when the award was already on the ledger and no new write was made
 */
public record AwardCommitOutcome(String contentHash, String commitRef, boolean submitted) {}
