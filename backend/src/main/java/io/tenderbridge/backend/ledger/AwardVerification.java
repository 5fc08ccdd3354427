package io.tenderbridge.backend.ledger;

import java.math.BigInteger;
import java.util.UUID;

/**
 * Result of reading an award back from the ledger and checking it against the database.
 *
 * @param verified true when the ledger holds an award for the tender
 * @param matchesRecord true when the ledger hash equals the hash recomputed from the current
 *     database state
 * @param reason why the award could not be verified, or null
 */
public record AwardVerification(
    UUID tenderId,
    boolean verified,
    boolean matchesRecord,
    String method,
    String winningBidId,
    String winningCompanyId,
    BigInteger awardAmount,
    Long awardDate,
    String awardedBy,
    String contentHash,
    String commitRef,
    Long blockNumber,
    String reason) {

  static AwardVerification notVerified(UUID tenderId, String reason) {
    return new AwardVerification(
        tenderId, false, false, null, null, null, null, null, null, null, null, null, reason);
  }

  static AwardVerification of(UUID tenderId, OnChainAward award, boolean matchesRecord) {
    return new AwardVerification(
        tenderId,
        true,
        matchesRecord,
        award.method().value(),
        award.winningBidId(),
        award.winningCompanyId(),
        award.awardAmount(),
        award.awardDate(),
        award.awardedBy(),
        award.contentHash(),
        award.commitRef(),
        award.blockNumber(),
        matchesRecord ? null : "Ledger hash does not match the stored award");
  }
}
