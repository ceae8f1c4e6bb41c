package com.bluecollar.db.util;

import com.bluecollar.common.status.Status;
import com.bluecollar.common.status.StatusOr;
import java.util.UUID;
import java.util.regex.Pattern;
import javax.annotation.Nonnull;

/** Utility methods for working with UUIDs. */
public final class UuidUtil {

  /** Canonical 8-4-4-4-12 hexadecimal form. {@link UUID#fromString} alone is more lenient. */
  public static final String UUID_REGEX =
      "^[0-9a-fA-F]{8}-[0-9a-fA-F]{4}-[0-9a-fA-F]{4}-[0-9a-fA-F]{4}-[0-9a-fA-F]{12}$";

  private static final Pattern UUID_PATTERN = Pattern.compile(UUID_REGEX);

  private UuidUtil() {
    // Utility class, no instances
  }

  /** Returns true if the string is a UUID in canonical form. */
  public static boolean isValid(String str) {
    return str != null && UUID_PATTERN.matcher(str).matches();
  }

  /**
   * Converts a string to a UUID.
   *
   * @param str The string representation of the UUID
   * @return StatusOr containing the UUID or a VALIDATION_ERROR status
   */
  @Nonnull
  public static StatusOr<UUID> fromString(String str) {
    if (str == null || str.isEmpty()) {
      return StatusOr.ofStatus(Status.invalidArgument("UUID string cannot be null or empty"));
    }
    if (!isValid(str)) {
      return StatusOr.ofStatus(Status.invalidArgument("Invalid UUID format").withIdentifier(str));
    }
    return StatusOr.ofValue(UUID.fromString(str));
  }
}
