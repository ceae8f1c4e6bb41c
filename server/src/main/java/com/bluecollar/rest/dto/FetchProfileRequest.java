package com.bluecollar.rest.dto;

import com.bluecollar.common.status.Violation;
import com.bluecollar.db.util.UuidUtil;
import com.bluecollar.validation.Inputs;
import com.google.common.collect.ImmutableList;
import jakarta.validation.constraints.Pattern;
import java.util.List;

/**
 * Query parameters of {@code GET /api/profiles}. Exactly one of the two must be given.
 */
public record FetchProfileRequest(
    @Pattern(regexp = UuidUtil.UUID_REGEX, message = "Invalid UUID format")
    String userId,

    @Pattern(regexp = Inputs.PHONE_NUMBER_REGEX, message = "Invalid phone number format")
    String phoneNumber
) {

  static final String EXACTLY_ONE = "Must provide either phoneNumber or userId (not both)";

  public FetchProfileRequest {
    userId = Inputs.trimToNull(userId);
    phoneNumber = Inputs.trimToNull(phoneNumber);
  }

  /** Reports a request that names both identifiers, or neither. */
  public List<Violation> identifierViolations() {
    if ((userId == null) == (phoneNumber == null)) {
      return ImmutableList.of(new Violation("userId", EXACTLY_ONE));
    }
    return ImmutableList.of();
  }
}
