package io.tenderbridge.backend.ledger;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import io.tenderbridge.backend.bid.BidRepository;
import io.tenderbridge.backend.exception.ResourceNotFoundException;
import io.tenderbridge.backend.tender.Tender;
import io.tenderbridge.backend.tender.TenderRepository;
import io.tenderbridge.backend.tender.TenderStatus;
import java.time.Duration;
import java.util.Optional;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Reads awards back from the ledger and checks them against the database. Ledger entries are
 * immutable, so verified results that match the record are cached for a while.
 */
@Service
public class AwardVerificationService {

  private static final Logger log = LoggerFactory.getLogger(AwardVerificationService.class);

  private final TenderRepository tenderRepository;
  private final BidRepository bidRepository;
  private final AwardLedgerClient ledgerClient;
  private final AwardPayloadHasher hasher;

  private final Cache<UUID, AwardVerification> verifiedCache =
      Caffeine.newBuilder().expireAfterWrite(Duration.ofMinutes(10)).maximumSize(1000).build();

  public AwardVerificationService(
      TenderRepository tenderRepository,
      BidRepository bidRepository,
      AwardLedgerClient ledgerClient,
      AwardPayloadHasher hasher) {
    this.tenderRepository = tenderRepository;
    this.bidRepository = bidRepository;
    this.ledgerClient = ledgerClient;
    this.hasher = hasher;
  }

  /**
   * Looks the award up in contract storage first and falls back to the logs of the stored commit
   * reference.
   */
  @Transactional(readOnly = true)
  public AwardVerification verifyAward(UUID tenderId) {
    var cached = verifiedCache.getIfPresent(tenderId);
    if (cached != null) {
      return cached;
    }

    var tender =
        tenderRepository
            .findById(tenderId)
            .orElseThrow(() -> new ResourceNotFoundException("Tender", tenderId));
    if (tender.getStatus() != TenderStatus.AWARDED) {
      return AwardVerification.notVerified(
          tenderId, "Tender is '%s', not awarded".formatted(tender.getStatus().value()));
    }

    Optional<OnChainAward> award = ledgerClient.getAward(tenderId.toString());
    if (award.isEmpty() && tender.getLedgerCommitRef() != null) {
      award = ledgerClient.getAwardByCommitRef(tender.getLedgerCommitRef());
    }
    if (award.isEmpty()) {
      return AwardVerification.notVerified(tenderId, "No award recorded on the ledger yet");
    }

    var result = AwardVerification.of(tenderId, award.get(), matchesRecord(tender, award.get()));
    if (result.matchesRecord()) {
      verifiedCache.put(tenderId, result);
    } else {
      log.warn(
          "Ledger award for tender {} does not match the stored award (ledger hash {})",
          tenderId,
          award.get().contentHash());
    }
    return result;
  }

  /** Verifies the award emitted by a specific ledger commit. */
  @Transactional(readOnly = true)
  public AwardVerification verifyCommit(String commitRef) {
    var found = ledgerClient.getAwardByCommitRef(commitRef);
    if (found.isEmpty()) {
      return AwardVerification.notVerified(null, "No award was recorded by commit " + commitRef);
    }
    var award = found.get();

    UUID tenderId;
    try {
      tenderId = UUID.fromString(award.tenderId());
    } catch (IllegalArgumentException e) {
      return AwardVerification.of(null, award, false);
    }
    var matches =
        tenderRepository.findById(tenderId).map(t -> matchesRecord(t, award)).orElse(false);
    return AwardVerification.of(tenderId, award, matches);
  }

  private boolean matchesRecord(Tender tender, OnChainAward award) {
    if (tender.getWinningBidId() == null) {
      return false;
    }
    return bidRepository
        .findById(tender.getWinningBidId())
        .map(bid -> hasher.contentHash(hasher.factsFor(tender, bid)))
        .map(expected -> expected.equals(award.contentHash()))
        .orElse(false);
  }
}
