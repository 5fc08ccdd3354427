package io.tenderbridge.backend.exception;

import java.util.UUID;
import org.springframework.http.HttpStatus;

public class BidAlreadyWithdrawnException extends TenderProblemException {

  public BidAlreadyWithdrawnException(UUID bidId) {
    super(
        HttpStatus.CONFLICT,
        "ALREADY_WITHDRAWN",
        "Bid already withdrawn",
        "Bid " + bidId + " is already withdrawn");
  }
}
