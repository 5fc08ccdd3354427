package io.tenderbridge.backend.ledger;

import java.math.BigInteger;

/**
 * An award as stored on the ledger.
 *
 * @param awardDate ledger timestamp, seconds since the epoch
 * @param awardedBy account that submitted the award
 * @param commitRef transaction reference, only known when read from logs
 * @param blockNumber block of the commit, only known when read from logs
 */
public record OnChainAward(
    String tenderId,
    String winningBidId,
    String winningCompanyId,
    BigInteger awardAmount,
    long awardDate,
    String awardedBy,
    String contentHash,
    LedgerQueryMethod method,
    String commitRef,
    Long blockNumber) {}
