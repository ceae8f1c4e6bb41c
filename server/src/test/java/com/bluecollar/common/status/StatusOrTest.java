package com.bluecollar.common.status;

import static org.junit.jupiter.api.Assertions.*;

import java.sql.SQLException;
import org.junit.jupiter.api.Test;

class StatusOrTest {

  @Test
  void testOfValue() {
    StatusOr<String> result = StatusOr.ofValue("profile");

    assertTrue(result.isOk());
    assertFalse(result.isNotOk());
    assertEquals("profile", result.getValue());
    assertEquals("profile", result.asOptional().orElseThrow());
  }

  @Test
  void testOfStatusRejectsOk() {
    assertThrows(IllegalArgumentException.class, () -> StatusOr.ofStatus(Status.ok()));
  }

  @Test
  void testGetValueOnFailureThrows() {
    StatusOr<String> result = StatusOr.ofStatus(Status.invalidArgument("bad"));

    assertTrue(result.isNotOk());
    assertTrue(result.asOptional().isEmpty());
    assertThrows(IllegalStateException.class, result::getValue);
  }

  @Test
  void testOfExceptionHidesDriverMessage() {
    SQLException e = new SQLException("connection refused");

    StatusOr<Integer> result = StatusOr.ofException(e);

    assertEquals(ErrorReason.INTERNAL_ERROR, result.getStatus().getReason());
    assertEquals("Unexpected datastore error", result.getStatus().getMessage());
    assertSame(e, result.getStatus().getCause());
  }

  @Test
  void testMapAndFlatMap() {
    StatusOr<Integer> ok = StatusOr.ofValue(20);
    Status failure = Status.invalidArgument("bad");
    StatusOr<Integer> failed = StatusOr.ofStatus(failure);

    assertEquals(21, ok.map(v -> v + 1).getValue());
    assertEquals(failure, failed.map(v -> v + 1).getStatus());
    assertEquals(failure, ok.flatMap(v -> StatusOr.<Integer>ofStatus(failure)).getStatus());
    assertEquals("20", ok.flatMap(v -> StatusOr.ofValue(v.toString())).getValue());
  }
}
