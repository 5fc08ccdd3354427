package io.tenderbridge.backend.exception;

import org.springframework.http.HttpStatus;

public class ForbiddenException extends TenderProblemException {

  public ForbiddenException(String title, String detail) {
    super(HttpStatus.FORBIDDEN, "FORBIDDEN", title, detail);
  }
}
