package io.tenderbridge.backend.ledger;

import io.tenderbridge.backend.exception.LedgerUnavailableException;
import java.math.BigInteger;
import java.time.Clock;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * In-process ledger used for development and tests. Keeps one award per tender, like the award
 * contract, and hands out sequential pseudo block numbers. State is lost on restart.
 */
@Component
@ConditionalOnProperty(
    name = "tenderbridge.ledger.provider",
    havingValue = "local",
    matchIfMissing = true)
public class LocalAwardLedgerClient implements AwardLedgerClient {

  private static final Logger log = LoggerFactory.getLogger(LocalAwardLedgerClient.class);

  static final String LOCAL_ACCOUNT = "local-ledger";

  private final Map<String, OnChainAward> awardsByTender = new ConcurrentHashMap<>();
  private final Map<String, String> tenderByCommitRef = new ConcurrentHashMap<>();
  private final AtomicLong blockHeight = new AtomicLong();
  private final Clock clock;

  public LocalAwardLedgerClient(Clock clock) {
    this.clock = clock;
  }

  @Override
  public String providerId() {
    return "local";
  }

  @Override
  public synchronized LedgerCommitReceipt recordAward(AwardLedgerEntry entry) {
    var existing = awardsByTender.get(entry.tenderId());
    if (existing != null) {
      if (existing.contentHash().equals(entry.contentHash())) {
        return new LedgerCommitReceipt(
            existing.contentHash(), existing.commitRef(), existing.blockNumber());
      }
      throw new LedgerUnavailableException(
          "Award for tender " + entry.tenderId() + " is already recorded with another hash");
    }

    long block = blockHeight.incrementAndGet();
    var commitRef =
        AwardPayloadHasher.sha256Hex(entry.tenderId() + "|" + entry.contentHash() + "|" + block);
    var award =
        new OnChainAward(
            entry.tenderId(),
            entry.winningBidId(),
            entry.winningCompanyId(),
            BigInteger.valueOf(entry.awardAmount()),
            clock.instant().getEpochSecond(),
            LOCAL_ACCOUNT,
            entry.contentHash(),
            LedgerQueryMethod.CONTRACT_STORAGE,
            commitRef,
            block);
    awardsByTender.put(entry.tenderId(), award);
    tenderByCommitRef.put(commitRef, entry.tenderId());

    log.info("Recorded award for tender {} in local ledger block {}", entry.tenderId(), block);
    return new LedgerCommitReceipt(entry.contentHash(), commitRef, block);
  }

  @Override
  public Optional<OnChainAward> getAward(String tenderId) {
    return Optional.ofNullable(awardsByTender.get(tenderId));
  }

  @Override
  public Optional<OnChainAward> getAwardByCommitRef(String commitRef) {
    return Optional.ofNullable(tenderByCommitRef.get(commitRef))
        .map(awardsByTender::get)
        .map(
            award ->
                new OnChainAward(
                    award.tenderId(),
                    award.winningBidId(),
                    award.winningCompanyId(),
                    award.awardAmount(),
                    award.awardDate(),
                    award.awardedBy(),
                    award.contentHash(),
                    LedgerQueryMethod.TRANSACTION_LOGS,
                    award.commitRef(),
                    award.blockNumber()));
  }
}
