package com.bluecollar.pagination;

import com.bluecollar.common.status.Status;
import com.bluecollar.common.status.StatusOr;
import com.bluecollar.common.status.Violation;
import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableList;
import java.util.List;
import java.util.OptionalInt;
import javax.annotation.Nonnull;
import javax.annotation.Nullable;

/**
 * Turns the raw {@code page} and {@code limit} query parameters of a listing into a bounded
 * {@link PageRequest}, and a row count into {@link PaginationMetadata}.
 *
 * <p>Parameters are read the way a lenient integer parse reads them: leading whitespace and an
 * optional sign, then digits up to the first non-digit, so {@code "20.7"} is 20 and
 * {@code "12abc"} is 12. A parameter with no leading digits falls back to its default. A number
 * outside the allowed range is rejected, never clamped.
 */
public final class PaginationResolver {

  public static final int DEFAULT_PAGE = 1;
  public static final int DEFAULT_LIMIT = 20;
  public static final int MIN_PAGE = 1;
  public static final int MIN_LIMIT = 1;
  public static final int MAX_LIMIT = 100;

  static final String PAGE_MESSAGE = "Page must be greater than or equal to " + MIN_PAGE;
  static final String LIMIT_MESSAGE =
      "Limit must be between " + MIN_LIMIT + " and " + MAX_LIMIT;
  static final String DETAILS = "Please check your page and limit parameters";

  private PaginationResolver() {
    // Utility class, no instances
  }

  /**
   * Validates raw page and limit parameters.
   *
   * @param rawPage the {@code page} query parameter, or null if absent
   * @param rawLimit the {@code limit} query parameter, or null if absent
   * @return the page request, or a VALIDATION_ERROR listing every out-of-range parameter
   */
  @Nonnull
  public static StatusOr<PageRequest> resolve(@Nullable String rawPage, @Nullable String rawLimit) {
    int page = parseLeadingInt(rawPage).orElse(DEFAULT_PAGE);
    int limit = parseLeadingInt(rawLimit).orElse(DEFAULT_LIMIT);

    ImmutableList.Builder<Violation> violations = ImmutableList.builder();
    if (page < MIN_PAGE) {
      violations.add(new Violation("page", PAGE_MESSAGE));
    }
    if (limit < MIN_LIMIT || limit > MAX_LIMIT) {
      violations.add(new Violation("limit", LIMIT_MESSAGE));
    }

    List<Violation> failed = violations.build();
    if (!failed.isEmpty()) {
      String message = Joiner.on("; ").join(failed.stream().map(Violation::message).iterator());
      return StatusOr.ofStatus(Status.invalid(message, failed).withDetails(DETAILS));
    }

    return StatusOr.ofValue(new PageRequest(page, limit, (long) (page - 1) * limit));
  }

  /**
   * Describes a page of a listing with {@code totalCount} matching rows. Inputs are assumed to
   * have come from {@link #resolve}.
   */
  @Nonnull
  public static PaginationMetadata describe(long totalCount, int page, int limit) {
    long totalPages = (totalCount + limit - 1) / limit;
    return new PaginationMetadata(
        page, totalPages, totalCount, page < totalPages, page > 1, limit);
  }

  /**
   * Reads an optionally signed integer prefix. Returns empty when there are no leading digits.
   * Values beyond the int range saturate, which keeps them out of range for validation.
   */
  @VisibleForTesting
  static OptionalInt parseLeadingInt(@Nullable String raw) {
    if (raw == null) {
      return OptionalInt.empty();
    }
    int i = 0;
    int n = raw.length();
    while (i < n && Character.isWhitespace(raw.charAt(i))) {
      i++;
    }
    boolean negative = false;
    if (i < n && (raw.charAt(i) == '+' || raw.charAt(i) == '-')) {
      negative = raw.charAt(i) == '-';
      i++;
    }
    int start = i;
    long value = 0;
    while (i < n && raw.charAt(i) >= '0' && raw.charAt(i) <= '9') {
      if (value <= Integer.MAX_VALUE) {
        value = value * 10 + (raw.charAt(i) - '0');
      }
      i++;
    }
    if (i == start) {
      return OptionalInt.empty();
    }
    long signed = negative ? -value : value;
    if (signed > Integer.MAX_VALUE) {
      return OptionalInt.of(Integer.MAX_VALUE);
    }
    if (signed < Integer.MIN_VALUE) {
      return OptionalInt.of(Integer.MIN_VALUE);
    }
    return OptionalInt.of((int) signed);
  }
}
