package io.tenderbridge.backend.exception;

import java.util.UUID;
import org.springframework.http.HttpStatus;

/** Thrown when a company attempts to bid on a tender it posted itself. */
public class SelfBiddingException extends TenderProblemException {

  public SelfBiddingException(UUID tenderId) {
    super(
        HttpStatus.BAD_REQUEST,
        "SELF_BIDDING",
        "Cannot bid on own tender",
        "Tender " + tenderId + " was posted by the bidding company");
  }
}
