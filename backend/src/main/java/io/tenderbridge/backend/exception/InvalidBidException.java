package io.tenderbridge.backend.exception;

import org.springframework.http.HttpStatus;

/** Thrown when the bid named as award winner cannot win (e.g. it was withdrawn). */
public class InvalidBidException extends TenderProblemException {

  public InvalidBidException(String detail) {
    super(HttpStatus.BAD_REQUEST, "INVALID_BID", "Invalid winning bid", detail);
  }
}
