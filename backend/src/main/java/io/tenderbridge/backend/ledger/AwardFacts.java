package io.tenderbridge.backend.ledger;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * The award facts that are hashed and committed to the ledger. Field names are part of the hash
 * input and must not change once awards have been committed.
 *
 * @param awardAmount award amount in integer minor units
 * @param awardedAt ISO-8601 instant, truncated to microseconds
 * @param postedBy id of the company that posted the tender
 */
public record AwardFacts(
    String tenderId,
    String tenderTitle,
    String winningBidId,
    String winningCompanyId,
    long awardAmount,
    String awardedAt,
    String postedBy) {

  public AwardFacts {
    Objects.requireNonNull(tenderId, "tenderId must not be null");
    Objects.requireNonNull(winningBidId, "winningBidId must not be null");
    Objects.requireNonNull(winningCompanyId, "winningCompanyId must not be null");
    Objects.requireNonNull(awardedAt, "awardedAt must not be null");
  }

  Map<String, Object> toMap() {
    var map = new LinkedHashMap<String, Object>();
    map.put("tender_id", tenderId);
    map.put("tender_title", tenderTitle);
    map.put("winning_bid_id", winningBidId);
    map.put("winning_company_id", winningCompanyId);
    map.put("award_amount", awardAmount);
    map.put("awarded_at", awardedAt);
    map.put("posted_by", postedBy);
    return map;
  }
}
