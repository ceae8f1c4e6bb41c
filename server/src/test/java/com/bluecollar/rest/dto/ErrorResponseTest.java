package com.bluecollar.rest.dto;

import static org.junit.jupiter.api.Assertions.*;

import com.bluecollar.common.status.ErrorReason;
import com.bluecollar.common.status.Status;
import com.bluecollar.common.status.Violation;
import com.bluecollar.rest.JsonMappers;
import com.fasterxml.jackson.databind.JsonNode;
import java.sql.SQLException;
import java.util.List;
import org.junit.jupiter.api.Test;

class ErrorResponseTest {

  private static JsonNode toJson(ErrorResponse response) {
    return JsonMappers.shared().valueToTree(response);
  }

  @Test
  void testNotFoundShape() {
    ErrorResponse response =
        ErrorResponse.from(
            Status.notFound(ErrorReason.USER_NOT_FOUND, "User not found", "+1234567890"));

    JsonNode json = toJson(response);

    assertFalse(json.get("success").asBoolean());
    assertEquals("User not found", json.get("message").asText());
    assertEquals("USER_NOT_FOUND", json.get("error").get("code").asText());
    assertEquals("+1234567890", json.get("error").get("identifier").asText());
    assertFalse(json.has("errors"));
    assertFalse(json.has("details"));
  }

  @Test
  void testValidationShape() {
    ErrorResponse response =
        ErrorResponse.from(
            Status.invalid("Validation error", List.of(new Violation("skills[0]", "bad"))));

    JsonNode json = toJson(response);

    assertEquals("skills[0]", json.get("errors").get(0).get("field").asText());
    assertEquals("bad", json.get("errors").get(0).get("message").asText());
    assertFalse(json.get("error").has("identifier"));
  }

  @Test
  void testInternalErrorNeverCarriesCause() {
    ErrorResponse response =
        ErrorResponse.from(
            Status.internal("Failed to create feed entry", new SQLException("disk full")));

    assertFalse(toJson(response).toString().contains("disk full"));
  }

  @Test
  void testOkStatusIsRejected() {
    assertThrows(IllegalArgumentException.class, () -> ErrorResponse.from(Status.ok()));
  }
}
