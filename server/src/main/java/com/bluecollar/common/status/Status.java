package com.bluecollar.common.status;

import com.google.common.collect.ImmutableList;
import java.util.List;
import java.util.Objects;
import javax.annotation.Nonnull;
import javax.annotation.Nullable;

/**
 * Represents the outcome of an operation: either OK, or a failure with an {@link ErrorReason},
 * a stable client-facing message and optional supporting detail.
 *
 * <p>The message never contains text produced by the database driver. Driver errors travel in
 * {@link #getCause()} so they can be logged on the server and nowhere else.
 */
public class Status {
  private static final Status OK = new Status(null, null, null, ImmutableList.of(), null, null);

  private final ErrorReason reason;
  private final String message;
  private final String identifier;
  private final ImmutableList<Violation> violations;
  private final String details;
  private final Throwable cause;

  private Status(
      ErrorReason reason,
      String message,
      String identifier,
      ImmutableList<Violation> violations,
      String details,
      Throwable cause) {
    this.reason = reason;
    this.message = message;
    this.identifier = identifier;
    this.violations = Objects.requireNonNull(violations);
    this.details = details;
    this.cause = cause;
  }

  /** Creates a new status with the given reason and message. */
  public static Status of(@Nonnull ErrorReason reason, String message) {
    return new Status(Objects.requireNonNull(reason), message, null, ImmutableList.of(), null, null);
  }

  /** Creates a new status with the given reason, message, and cause. */
  public static Status of(@Nonnull ErrorReason reason, String message, Throwable cause) {
    return new Status(Objects.requireNonNull(reason), message, null, ImmutableList.of(), null, cause);
  }

  /** Returns the OK status. */
  public static Status ok() {
    return OK;
  }

  /** Creates a VALIDATION_ERROR status with the given message and no field detail. */
  public static Status invalidArgument(String message) {
    return of(ErrorReason.VALIDATION_ERROR, message);
  }

  /** Creates a VALIDATION_ERROR status listing every failed field. */
  public static Status invalid(String message, List<Violation> violations) {
    return new Status(
        ErrorReason.VALIDATION_ERROR,
        message,
        null,
        ImmutableList.copyOf(violations),
        null,
        null);
  }

  /** Creates a not-found status. The reason says what was missing. */
  public static Status notFound(ErrorReason reason, String message, String identifier) {
    return of(reason, message).withIdentifier(identifier);
  }

  /** Creates a conflict status. The reason says what already exists. */
  public static Status alreadyExists(ErrorReason reason, String message) {
    return of(reason, message);
  }

  /** Creates an UNAUTHORIZED status with the given message. */
  public static Status unauthenticated(String message) {
    return of(ErrorReason.UNAUTHORIZED, message);
  }

  /** Creates a FORBIDDEN status with the given message. */
  public static Status permissionDenied(String message) {
    return of(ErrorReason.FORBIDDEN, message);
  }

  /** Creates an INTERNAL_ERROR status with the given message and cause. */
  public static Status internal(String message, Throwable cause) {
    return of(ErrorReason.INTERNAL_ERROR, message, cause);
  }

  /** Returns a copy of this status that names the identifier the failure concerns. */
  public Status withIdentifier(@Nullable String identifier) {
    return new Status(reason, message, identifier, violations, details, cause);
  }

  /** Returns a copy of this status with a fixed, human-written hint for the caller. */
  public Status withDetails(@Nullable String details) {
    return new Status(reason, message, identifier, violations, details, cause);
  }

  /** Returns the code for this status. */
  @Nonnull
  public StatusCode getCode() {
    return reason == null ? StatusCode.OK : reason.statusCode();
  }

  /** Returns the HTTP status code corresponding to this status. */
  public int getHttpCode() {
    return getCode().getHttpCode();
  }

  /** Returns the error reason, or null for an OK status. */
  @Nullable
  public ErrorReason getReason() {
    return reason;
  }

  /** Returns the message for this status, or null if there is no message. */
  public String getMessage() {
    return message;
  }

  /** Returns the user id, phone number or other identifier the failure is about, if any. */
  @Nullable
  public String getIdentifier() {
    return identifier;
  }

  /** Returns the failed field constraints, empty unless this is a validation failure. */
  @Nonnull
  public List<Violation> getViolations() {
    return violations;
  }

  @Nullable
  public String getDetails() {
    return details;
  }

  /** Returns the cause of this status, or null if there is no cause. */
  public Throwable getCause() {
    return cause;
  }

  /** Returns true if this status represents an error. */
  public boolean isError() {
    return reason != null;
  }

  /** Returns true if this status is OK. */
  public boolean isOk() {
    return reason == null;
  }

  @Override
  public String toString() {
    if (reason == null) {
      return StatusCode.OK.toString();
    }
    StringBuilder sb = new StringBuilder().append(reason);
    if (message != null) {
      sb.append(": ").append(message);
    }
    if (identifier != null) {
      sb.append(" [").append(identifier).append(']');
    }
    if (!violations.isEmpty()) {
      sb.append(' ').append(violations);
    }
    return sb.toString();
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (obj == null || getClass() != obj.getClass()) {
      return false;
    }
    Status other = (Status) obj;
    return reason == other.reason
        && Objects.equals(message, other.message)
        && Objects.equals(identifier, other.identifier)
        && violations.equals(other.violations)
        && Objects.equals(details, other.details)
        && Objects.equals(cause, other.cause);
  }

  @Override
  public int hashCode() {
    return Objects.hash(reason, message, identifier, violations, details, cause);
  }
}
