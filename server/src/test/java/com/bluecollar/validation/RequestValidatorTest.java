package com.bluecollar.validation;

import static org.junit.jupiter.api.Assertions.*;

import com.bluecollar.common.status.Violation;
import com.bluecollar.rest.dto.CreateFeedRequest;
import com.bluecollar.rest.dto.CreateProfileRequest;
import com.bluecollar.rest.dto.FetchProfileRequest;
import com.google.common.base.Strings;
import java.math.BigDecimal;
import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

/** Tests for {@link RequestValidator} against the request records it validates. */
class RequestValidatorTest {

  private static final String USER_ID = "123e4567-e89b-12d3-a456-426614174000";

  private static RequestValidator validator;

  @BeforeAll
  static void setUp() {
    validator = new RequestValidator();
  }

  @AfterAll
  static void tearDown() {
    validator.close();
  }

  private static CreateProfileRequest profile(
      String headline,
      List<String> skills,
      BigDecimal score,
      String shareUrl) {
    return new CreateProfileRequest(
        USER_ID, null, headline, null, skills, null, null, score, shareUrl);
  }

  private static List<String> fields(List<Violation> violations) {
    return violations.stream().map(Violation::field).collect(Collectors.toList());
  }

  @Test
  void testValidProfileRequest() {
    CreateProfileRequest request =
        new CreateProfileRequest(
            USER_ID,
            "+1234567890",
            "Licensed electrician",
            "Ten years of residential wiring.",
            List.of("Wiring", "Conduit bending"),
            List.of("Journeyman license"),
            List.of("English", "Spanish"),
            new BigDecimal("87.50"),
            "https://example.com/profiles/1");

    assertTrue(validator.validate(request).isEmpty());
  }

  @Test
  void testHeadlineTooLongReportsLength() {
    List<Violation> violations = validator.validate(profile(Strings.repeat("a", 201), null, null, null));

    assertEquals(
        List.of(new Violation(
            "headline", "Headline cannot exceed 200 characters (received 201 characters)")),
        violations);
  }

  @Test
  void testSkillElementsUseBracketPaths() {
    List<String> skills = Arrays.asList("Welding", "  ", Strings.repeat("x", 101));

    List<Violation> violations = validator.validate(profile(null, skills, null, null));

    assertEquals(
        List.of(
            new Violation("skills[1]", "Each skill must be a non-empty string"),
            new Violation("skills[2]", "Each skill cannot exceed 100 characters")),
        violations);
  }

  @Test
  void testDuplicateSkills() {
    List<Violation> violations =
        validator.validate(profile(null, List.of("Welding", "Welding"), null, null));

    assertEquals(
        List.of(new Violation("skills", "Duplicate values not allowed in skills array")),
        violations);
  }

  @Test
  void testScoreRangeAndScale() {
    assertEquals(
        List.of(new Violation("score", "Score must be between 0 and 100 (received 100.5)")),
        validator.validate(profile(null, null, new BigDecimal("100.5"), null)));
    assertEquals(
        List.of(new Violation("score", "Score can have at most 2 decimal places")),
        validator.validate(profile(null, null, new BigDecimal("50.123"), null)));
    assertTrue(validator.validate(profile(null, null, BigDecimal.ZERO, null)).isEmpty());
  }

  @Test
  void testShareUrlFormat() {
    List<Violation> violations = validator.validate(profile(null, null, null, "not a url"));

    assertEquals(List.of(new Violation("shareUrl", "shareUrl must be a valid URL format")), violations);
  }

  @Test
  void testViolationsFollowFieldOrder() {
    CreateProfileRequest request =
        new CreateProfileRequest(
            "nope",
            "12",
            Strings.repeat("h", 250),
            null,
            null,
            null,
            null,
            new BigDecimal("-1"),
            null);

    assertEquals(
        List.of("userId", "phoneNumber", "headline", "score"), fields(validator.validate(request)));
  }

  @Test
  void testProfileRequestTrimsInput() {
    CreateProfileRequest request =
        new CreateProfileRequest(
            "  " + USER_ID + " ", "   ", "  Welder ", null, List.of(" MIG "), null, null, null, " ");

    assertEquals(USER_ID, request.userId());
    assertNull(request.phoneNumber());
    assertEquals("Welder", request.headline());
    assertEquals(List.of("MIG"), request.skills());
    assertNull(request.shareUrl());
  }

  @Test
  void testFetchRequestIdentifierRules() {
    assertEquals(1, new FetchProfileRequest(null, null).identifierViolations().size());
    assertEquals(1, new FetchProfileRequest(USER_ID, "+1234567890").identifierViolations().size());
    assertTrue(new FetchProfileRequest(USER_ID, null).identifierViolations().isEmpty());
    assertTrue(new FetchProfileRequest(null, " +1234567890 ").identifierViolations().isEmpty());
  }

  @Test
  void testFetchRequestFormats() {
    assertEquals(
        List.of(new Violation("userId", "Invalid UUID format")),
        validator.validate(new FetchProfileRequest("invalid-uuid", null)));
    assertEquals(
        List.of(new Violation("phoneNumber", "Invalid phone number format")),
        validator.validate(new FetchProfileRequest(null, "0123")));
  }

  @Test
  void testFeedRequiredGroupIgnoresLengths() {
    CreateFeedRequest request =
        new CreateFeedRequest(Strings.repeat("t", 600), null, "news", "https://example.com");

    List<Violation> missing = validator.validate(request, RequiredChecks.class);

    assertEquals(List.of(new Violation("summary", "summary is required")), missing);
  }

  @Test
  void testFeedDefaultGroupChecksLengths() {
    CreateFeedRequest request =
        new CreateFeedRequest(Strings.repeat("t", 501), "body", "news", "https://example.com");

    assertEquals(
        List.of(new Violation(
            "title", "Title too long (max 500 characters) (received 501 characters)")),
        validator.validate(request));
  }

  @Test
  void testFeedTitleLengthCountsSurroundingWhitespace() {
    CreateFeedRequest request = new CreateFeedRequest(
        "  " + Strings.repeat("t", 499) + "  ", "body", "news", "https://example.com");

    assertEquals(
        List.of(new Violation(
            "title", "Title too long (max 500 characters) (received 503 characters)")),
        validator.validate(request));
  }

  @Test
  void testValidFeedHasNoViolations() {
    CreateFeedRequest request =
        new CreateFeedRequest("Title", "Summary", "news", "https://example.com");

    assertTrue(validator.validate(request).isEmpty());
  }

  @Test
  void testScoreTrailingZerosDoNotCountAsDecimalPlaces() {
    assertTrue(validator.validate(profile(null, null, new BigDecimal("5.000"), null)).isEmpty());
    assertTrue(validator.validate(profile(null, null, new BigDecimal("87.50"), null)).isEmpty());
    assertTrue(validator.validate(profile(null, null, new BigDecimal("100.00"), null)).isEmpty());
  }

  @Test
  void testScoreWithThreeSignificantDecimalsIsRejected() {
    assertEquals(
        List.of(new Violation("score", "Score can have at most 2 decimal places")),
        validator.validate(profile(null, null, new BigDecimal("87.505"), null)));
  }
}
