package io.tenderbridge.backend.ledger;

/**
 * Returned by {@link AwardLedgerClient#recordAward}.
 *
 * @param commitRef ledger-specific reference, a transaction hash for EVM ledgers
 * @param blockNumber block that included the commit, or null when the ledger has no blocks
 */
public record LedgerCommitReceipt(String contentHash, String commitRef, Long blockNumber) {}
