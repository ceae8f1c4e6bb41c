package com.bluecollar.common.status;

import java.util.Objects;

/**
 * A single failed input constraint.
 *
 * @param field dotted path of the offending input, with list positions in brackets (for example
 *     {@code skills[2]})
 * @param message human-readable description of the failure
 */
public record Violation(String field, String message) {

  public Violation {
    Objects.requireNonNull(field, "field");
    Objects.requireNonNull(message, "message");
  }
}
