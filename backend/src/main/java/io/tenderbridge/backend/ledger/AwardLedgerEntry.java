package io.tenderbridge.backend.ledger;

/** What is written to the ledger for one award. {@code contentHash} covers the full facts. */
public record AwardLedgerEntry(
    String tenderId,
    String winningBidId,
    String winningCompanyId,
    long awardAmount,
    String contentHash) {}
