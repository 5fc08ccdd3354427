package io.tenderbridge.backend.exception;

import org.springframework.http.HttpStatus;

public class ResourceNotFoundException extends TenderProblemException {

  public ResourceNotFoundException(String resourceType, Object id) {
    this(
        resourceType + " not found", "No " + resourceType.toLowerCase() + " found with id " + id);
  }

  private ResourceNotFoundException(String title, String detail) {
    super(HttpStatus.NOT_FOUND, "NOT_FOUND", title, detail);
  }

  /** For lookups scoped to a parent, such as a bid within one tender. */
  public static ResourceNotFoundException withDetail(String title, String detail) {
    return new ResourceNotFoundException(title, detail);
  }
}
