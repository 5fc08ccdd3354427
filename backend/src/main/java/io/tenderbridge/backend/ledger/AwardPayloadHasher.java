package io.tenderbridge.backend.ledger;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import io.tenderbridge.backend.bid.Bid;
import io.tenderbridge.backend.tender.Tender;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.HexFormat;
import org.springframework.stereotype.Component;

/**
 * Canonical encoding and hashing of {@link AwardFacts}. The canonical form is compact JSON with
 * keys sorted lexicographically, encoded as UTF-8; the content hash is its SHA-256 digest written
 * as {@code 0x} followed by 64 lower-case hex digits. Equal facts always give the same hash.
 */
@Component
public class AwardPayloadHasher {

  private final ObjectMapper canonicalMapper =
      new ObjectMapper()
          .configure(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS, true)
          .configure(SerializationFeature.INDENT_OUTPUT, false);

  private final int minorUnitScale;

  public AwardPayloadHasher(LedgerProperties properties) {
    this.minorUnitScale = properties.minorUnitScale();
  }

  /** Builds the facts of an awarded tender from its persisted state. */
  public AwardFacts factsFor(Tender tender, Bid winningBid) {
    if (tender.getAwardedAt() == null || !winningBid.getId().equals(tender.getWinningBidId())) {
      throw new IllegalArgumentException(
          "Bid " + winningBid.getId() + " is not the winning bid of tender " + tender.getId());
    }
    return new AwardFacts(
        tender.getId().toString(),
        tender.getTitle(),
        winningBid.getId().toString(),
        winningBid.getCompanyId().toString(),
        toMinorUnits(winningBid.getAmount()),
        formatInstant(tender.getAwardedAt()),
        tender.getOwnerCompanyId().toString());
  }

  public String canonicalJson(AwardFacts facts) {
    try {
      return canonicalMapper.writeValueAsString(facts.toMap());
    } catch (JsonProcessingException e) {
      throw new IllegalStateException("Failed to encode award facts", e);
    }
  }

  public String contentHash(AwardFacts facts) {
    return sha256Hex(canonicalJson(facts));
  }

  /** Converts a decimal amount to integer minor units, rounding half-up. */
  public long toMinorUnits(BigDecimal amount) {
    return amount
        .setScale(minorUnitScale, RoundingMode.HALF_UP)
        .movePointRight(minorUnitScale)
        .longValueExact();
  }

  public static String formatInstant(Instant instant) {
    return instant.truncatedTo(ChronoUnit.MICROS).toString();
  }

  static String sha256Hex(String input) {
    try {
      var digest = MessageDigest.getInstance("SHA-256");
      return "0x" + HexFormat.of().formatHex(digest.digest(input.getBytes(StandardCharsets.UTF_8)));
    } catch (NoSuchAlgorithmException e) {
      throw new IllegalStateException("SHA-256 not available", e);
    }
  }
}
