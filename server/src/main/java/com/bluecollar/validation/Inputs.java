package com.bluecollar.validation;

import com.google.common.base.Strings;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import javax.annotation.Nullable;

/** Normalization applied to request fields before they are validated. */
public final class Inputs {

  /** International phone number: optional '+', a non-zero digit, then 6 to 14 more digits. */
  public static final String PHONE_NUMBER_REGEX = "^[+]?[1-9]\\d{6,14}$";

  private Inputs() {
    // Utility class, no instances
  }

  /** Trims a string; a blank or absent value becomes null. */
  @Nullable
  public static String trimToNull(@Nullable String value) {
    return value == null ? null : Strings.emptyToNull(value.trim());
  }

  /**
   * Trims every element of a list. Null elements stay null so validation can report them; the
   * result is unmodifiable.
   */
  @Nullable
  public static List<String> trimEach(@Nullable List<String> values) {
    if (values == null) {
      return null;
    }
    List<String> trimmed = new ArrayList<>(values.size());
    for (String value : values) {
      trimmed.add(value == null ? null : value.trim());
    }
    return Collections.unmodifiableList(trimmed);
  }

  /** Drops trailing fractional zeros, never leaving a negative scale ({@code 100.00} is 100). */
  @Nullable
  public static BigDecimal stripTrailingZeros(@Nullable BigDecimal value) {
    if (value == null) {
      return null;
    }
    BigDecimal stripped = value.stripTrailingZeros();
    return stripped.scale() < 0 ? stripped.setScale(0) : stripped;
  }
}
