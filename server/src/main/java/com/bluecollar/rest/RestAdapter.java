package com.bluecollar.rest;

import com.bluecollar.common.status.Status;
import com.bluecollar.common.status.StatusOr;
import com.bluecollar.common.status.Violation;
import com.bluecollar.rest.dto.ErrorResponse;
import com.bluecollar.security.BearerTokenAuthenticator;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.exc.MismatchedInputException;
import com.google.common.base.Strings;
import io.javalin.http.Context;
import io.javalin.http.Header;
import java.util.List;
import org.tinylog.Logger;

/**
 * Base interface for REST adapters that handle REST API endpoints.
 *
 * <p>Provides the pieces every handler shares: writing a failed {@link Status} as an
 * {@link ErrorResponse}, checking the bearer token, and reading a JSON body into a request record.
 */
public interface RestAdapter {

  /**
   * Writes a failed status as the response. Client errors are logged at warn, server errors at
   * error together with their cause; the cause itself is never sent to the client.
   *
   * @param ctx The Javalin context to set the error on
   * @param status The failed status
   * @return the body that was written
   */
  default ErrorResponse setError(Context ctx, Status status) {
    ErrorResponse body = ErrorResponse.from(status);
    int httpCode = status.getHttpCode();
    if (status.getCode().isClientError()) {
      Logger.warn("Error response: {} - {}", httpCode, status);
    } else {
      Logger.error(status.getCause(), "Error response: {} - {}", httpCode, status);
    }
    ctx.status(httpCode).json(body);
    return body;
  }

  /**
   * Checks the Authorization header and writes the 401/403 response if it is rejected.
   *
   * @return true if the request may proceed
   */
  default boolean authorize(Context ctx, BearerTokenAuthenticator authenticator) {
    Status status = authenticator.authenticate(ctx.header(Header.AUTHORIZATION));
    if (status.isError()) {
      setError(ctx, status);
      return false;
    }
    return true;
  }

  /**
   * Reads the JSON request body. An absent body reads as an empty object so that it fails
   * validation field by field rather than as unreadable JSON.
   *
   * @param validationMessage the message used if the body cannot be read
   * @return the request, or a VALIDATION_ERROR naming the unreadable field
   */
  default <T> StatusOr<T> parseBody(Context ctx, Class<T> type, String validationMessage) {
    String body = ctx.body();
    if (Strings.isNullOrEmpty(body) || body.isBlank() || body.trim().equals("null")) {
      body = "{}";
    }
    try {
      return StatusOr.ofValue(JsonMappers.shared().readValue(body, type));
    } catch (MismatchedInputException e) {
      String field = fieldOf(e);
      Violation violation = field.isEmpty()
          ? new Violation("body", "Request body must be a JSON object")
          : new Violation(field, field + " has an invalid type");
      return StatusOr.ofStatus(Status.invalid(validationMessage, List.of(violation)));
    } catch (JsonProcessingException e) {
      return StatusOr.ofStatus(
          Status.invalid(
              validationMessage, List.of(new Violation("body", "Request body must be valid JSON"))));
    }
  }

  private static String fieldOf(JsonMappingException e) {
    StringBuilder sb = new StringBuilder();
    for (JsonMappingException.Reference ref : e.getPath()) {
      if (ref.getFieldName() != null) {
        if (sb.length() > 0) {
          sb.append('.');
        }
        sb.append(ref.getFieldName());
      } else if (ref.getIndex() >= 0) {
        sb.append('[').append(ref.getIndex()).append(']');
      }
    }
    return sb.toString();
  }
}
