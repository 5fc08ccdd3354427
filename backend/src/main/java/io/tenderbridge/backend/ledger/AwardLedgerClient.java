package io.tenderbridge.backend.ledger;

import java.util.Optional;

/**
 * Port to the append-only ledger that stores award proofs. Implementations are selected with
 * {@code tenderbridge.ledger.provider}.
 */
public interface AwardLedgerClient {

  /** Short identifier of the backing ledger, e.g. "local" or "web3j". */
  String providerId();

  /**
   * Writes an award entry and waits until the ledger has accepted it.
   *
   * @throws io.tenderbridge.backend.exception.LedgerUnavailableException if the ledger cannot be
   *     reached or rejects the write
   */
  LedgerCommitReceipt recordAward(AwardLedgerEntry entry);

  /** Reads the award recorded for a tender, if any, from ledger storage. */
  Optional<OnChainAward> getAward(String tenderId);

  /** Reads the award emitted by the given commit, if it emitted one. */
  Optional<OnChainAward> getAwardByCommitRef(String commitRef);
}
