package com.bluecollar.rest.dto;

import com.bluecollar.common.status.Violation;
import com.bluecollar.db.util.UuidUtil;
import com.bluecollar.validation.Inputs;
import com.google.common.collect.ImmutableList;
import io.javalin.openapi.OpenApiByFields;
import io.javalin.openapi.OpenApiDescription;
import io.javalin.openapi.OpenApiExample;
import io.javalin.openapi.OpenApiName;
import io.javalin.openapi.OpenApiNullable;
import io.javalin.openapi.OpenApiPropertyType;
import io.javalin.openapi.OpenApiStringValidation;
import io.javalin.openapi.Visibility;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Digits;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;
import java.math.BigDecimal;
import java.util.List;
import org.hibernate.validator.constraints.URL;
import org.hibernate.validator.constraints.UniqueElements;

/**
 * Request body for {@code POST /api/profiles}.
 *
 * <p>The owner is identified by {@code userId} or, failing that, {@code phoneNumber}; at least
 * one is required. Every profile attribute is optional. Strings and list elements are trimmed on
 * construction and blank strings become absent. The score loses trailing zeros, so {@code 5.000}
 * counts as having no decimal places.
 */
@OpenApiDescription("Request body for creating a profile for an existing user.")
@OpenApiName("ProfileCreationRequest")
@OpenApiByFields(Visibility.PUBLIC)
public record CreateProfileRequest(
    @OpenApiDescription("UUID of the user. Takes precedence over phoneNumber when both are given.")
    @OpenApiExample("123e4567-e89b-12d3-a456-426614174000")
    @OpenApiStringValidation(format = "uuid")
    @OpenApiNullable
    @Pattern(regexp = UuidUtil.UUID_REGEX, message = "userId must be a valid UUID format")
    String userId,

    @OpenApiDescription("Phone number of the user in international format.")
    @OpenApiExample("+1234567890")
    @OpenApiNullable
    @Pattern(
        regexp = Inputs.PHONE_NUMBER_REGEX,
        message = "Phone number must be in valid international format")
    String phoneNumber,

    @OpenApiDescription("Short professional headline.")
    @OpenApiExample("Licensed electrician with 10 years of experience")
    @OpenApiStringValidation(maxLength = "200")
    @OpenApiNullable
    @Size(max = 200, message = "Headline cannot exceed 200 characters")
    String headline,

    @OpenApiDescription("Longer description of the worker's background.")
    @OpenApiStringValidation(maxLength = "3000")
    @OpenApiNullable
    @Size(max = 3000, message = "Summary cannot exceed 3000 characters")
    String summary,

    @OpenApiDescription("Distinct skills, at most 50, each up to 100 characters.")
    @OpenApiExample("[\"Wiring\", \"Panel upgrades\"]")
    @OpenApiNullable
    @Size(max = 50, message = "Skills array cannot exceed 50 items")
    @UniqueElements(message = "Duplicate values not allowed in skills array")
    List<
            @NotBlank(message = "Each skill must be a non-empty string")
            @Size(max = 100, message = "Each skill cannot exceed 100 characters") String>
        skills,

    @OpenApiDescription("Distinct certifications, at most 30, each up to 200 characters.")
    @OpenApiNullable
    @Size(max = 30, message = "Certifications array cannot exceed 30 items")
    @UniqueElements(message = "Duplicate values not allowed in certifications array")
    List<
            @NotBlank(message = "Each certification must be a non-empty string")
            @Size(max = 200, message = "Each certification cannot exceed 200 characters") String>
        certifications,

    @OpenApiDescription("Distinct spoken languages, at most 20, each up to 50 characters.")
    @OpenApiExample("[\"English\", \"Spanish\"]")
    @OpenApiNullable
    @Size(max = 20, message = "Languages array cannot exceed 20 items")
    @UniqueElements(message = "Duplicate values not allowed in languages array")
    List<
            @NotBlank(message = "Each language must be a non-empty string")
            @Size(max = 50, message = "Each language cannot exceed 50 characters") String>
        languages,

    @OpenApiDescription("Profile score between 0 and 100 with at most two decimal places.")
    @OpenApiExample("87.5")
    @OpenApiPropertyType(definedBy = Double.class)
    @OpenApiNullable
    @DecimalMin(value = "0", message = "Score must be between 0 and 100")
    @DecimalMax(value = "100", message = "Score must be between 0 and 100")
    @Digits(integer = 10, fraction = 2, message = "Score can have at most 2 decimal places")
    BigDecimal score,

    @OpenApiDescription("Public link to the profile.")
    @OpenApiExample("https://example.com/profiles/jane")
    @OpenApiStringValidation(maxLength = "500", format = "uri")
    @OpenApiNullable
    @URL(message = "shareUrl must be a valid URL format")
    @Size(max = 500, message = "shareUrl cannot exceed 500 characters")
    String shareUrl
) {

  public CreateProfileRequest {
    userId = Inputs.trimToNull(userId);
    phoneNumber = Inputs.trimToNull(phoneNumber);
    headline = Inputs.trimToNull(headline);
    summary = Inputs.trimToNull(summary);
    skills = Inputs.trimEach(skills);
    certifications = Inputs.trimEach(certifications);
    languages = Inputs.trimEach(languages);
    score = Inputs.stripTrailingZeros(score);
    shareUrl = Inputs.trimToNull(shareUrl);
  }

  /** Creates a request that only identifies the owner by user id. */
  public static CreateProfileRequest forUser(String userId) {
    return new CreateProfileRequest(userId, null, null, null, null, null, null, null, null);
  }

  /** Creates a request that only identifies the owner by phone number. */
  public static CreateProfileRequest forPhoneNumber(String phoneNumber) {
    return new CreateProfileRequest(null, phoneNumber, null, null, null, null, null, null, null);
  }

  /** Reports a request that names neither {@code userId} nor {@code phoneNumber}. */
  public List<Violation> identifierViolations() {
    if (userId == null && phoneNumber == null) {
      return ImmutableList.of(
          new Violation("userId", "Either userId or phoneNumber is required"));
    }
    return ImmutableList.of();
  }
}
