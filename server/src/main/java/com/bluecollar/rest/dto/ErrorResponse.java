package com.bluecollar.rest.dto;

import com.bluecollar.common.status.Status;
import com.bluecollar.common.status.Violation;
import com.fasterxml.jackson.annotation.JsonInclude;
import io.javalin.openapi.OpenApiByFields;
import io.javalin.openapi.OpenApiDescription;
import io.javalin.openapi.OpenApiExample;
import io.javalin.openapi.OpenApiName;
import io.javalin.openapi.OpenApiNullable;
import io.javalin.openapi.OpenApiRequired;
import io.javalin.openapi.Visibility;
import java.util.List;

/**
 * The body of every failed request.
 *
 * <p>{@code errors} is present only for validation failures, {@code details} only when there is a
 * fixed hint for the caller. Neither ever carries database error text.
 */
@OpenApiDescription("Error response")
@OpenApiName("Error")
@OpenApiByFields(Visibility.PUBLIC)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ErrorResponse(
    @OpenApiExample("false") @OpenApiRequired boolean success,

    @OpenApiExample("Validation error") @OpenApiRequired String message,

    @OpenApiRequired ErrorDetail error,

    @OpenApiDescription("Every failed field, for validation errors")
    @OpenApiNullable
    List<Violation> errors,

    @OpenApiDescription("Hint on how to fix the request")
    @OpenApiNullable
    String details
) {

  /** Builds the response body for a failed status. */
  public static ErrorResponse from(Status status) {
    if (status.isOk()) {
      throw new IllegalArgumentException("Cannot build an error response from an OK status");
    }
    List<Violation> errors = status.getViolations().isEmpty() ? null : status.getViolations();
    return new ErrorResponse(
        false,
        status.getMessage(),
        new ErrorDetail(status.getReason().name(), status.getIdentifier()),
        errors,
        status.getDetails());
  }

  /**
   * Machine-readable part of an error.
   *
   * @param code one of the {@link com.bluecollar.common.status.ErrorReason} names
   * @param identifier the user id or phone number the failure concerns, when there is one
   */
  @OpenApiName("ErrorDetail")
  @OpenApiByFields(Visibility.PUBLIC)
  @JsonInclude(JsonInclude.Include.NON_NULL)
  public record ErrorDetail(
      @OpenApiExample("USER_NOT_FOUND") @OpenApiRequired String code,
      @OpenApiExample("+1234567890") @OpenApiNullable String identifier
  ) {}
}
