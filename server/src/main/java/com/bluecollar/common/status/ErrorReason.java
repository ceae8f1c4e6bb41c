package com.bluecollar.common.status;

/**
 * Machine-readable error codes returned to API clients in the {@code error.code} field.
 *
 * <p>Each reason fixes the {@link StatusCode} (and therefore the HTTP status) it is reported
 * with, so two failures with the same reason always look the same on the wire.
 */
public enum ErrorReason {
  VALIDATION_ERROR(StatusCode.INVALID_ARGUMENT),
  UNAUTHORIZED(StatusCode.UNAUTHENTICATED),
  FORBIDDEN(StatusCode.PERMISSION_DENIED),
  USER_NOT_FOUND(StatusCode.NOT_FOUND),
  PROFILE_NOT_FOUND(StatusCode.NOT_FOUND),
  DUPLICATE_PROFILE(StatusCode.ALREADY_EXISTS),
  INVALID_USER_REFERENCE(StatusCode.FAILED_PRECONDITION),
  INTERNAL_ERROR(StatusCode.INTERNAL);

  private final StatusCode statusCode;

  ErrorReason(StatusCode statusCode) {
    this.statusCode = statusCode;
  }

  public StatusCode statusCode() {
    return statusCode;
  }
}
