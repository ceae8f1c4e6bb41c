package com.bluecollar.security;

import com.bluecollar.common.status.Status;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.util.Objects;
import javax.annotation.Nullable;
import org.tinylog.Logger;

/**
 * Checks the {@code Authorization} header of privileged requests against the shared internal
 * API token.
 */
public class BearerTokenAuthenticator {
  static final String BEARER_PREFIX = "Bearer ";

  static final String MISSING_HEADER =
      "Missing or invalid authorization header. Use: Bearer <token>";
  static final String INVALID_TOKEN = "Invalid authentication token";

  private final byte[] expectedToken;

  public BearerTokenAuthenticator(String expectedToken) {
    this.expectedToken =
        Objects.requireNonNull(expectedToken, "expectedToken").getBytes(StandardCharsets.UTF_8);
  }

  /**
   * Authenticates a request.
   *
   * @param authorizationHeader the raw header value, or null if absent
   * @return OK; UNAUTHORIZED when the header is missing or not a bearer credential; FORBIDDEN
   *     when the token does not match
   */
  public Status authenticate(@Nullable String authorizationHeader) {
    if (authorizationHeader == null || !authorizationHeader.startsWith(BEARER_PREFIX)) {
      Logger.warn("Authentication failed: {}", "no bearer credential");
      return Status.unauthenticated(MISSING_HEADER);
    }
    byte[] token =
        authorizationHeader.substring(BEARER_PREFIX.length()).getBytes(StandardCharsets.UTF_8);
    if (!MessageDigest.isEqual(expectedToken, token)) {
      Logger.warn("Authentication failed: {}", "token mismatch");
      return Status.permissionDenied(INVALID_TOKEN);
    }
    return Status.ok();
  }
}
