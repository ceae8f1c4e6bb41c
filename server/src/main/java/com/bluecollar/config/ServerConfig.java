package com.bluecollar.config;

import com.google.common.base.MoreObjects;
import com.google.common.base.Strings;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/**
 * Process-wide settings, read once from the environment at startup and passed explicitly to
 * whatever needs them.
 *
 * @param port The HTTP port the REST server listens on
 * @param dbUrl JDBC URL of the PostgreSQL database
 * @param dbUser Database user name
 * @param dbPassword Database password
 * @param systemUserId Owner of the public feed set, and of every ingested feed
 * @param internalApiToken Shared bearer token required by the profile and ingestion endpoints
 */
public record ServerConfig(
    int port,
    String dbUrl,
    String dbUser,
    String dbPassword,
    UUID systemUserId,
    String internalApiToken
) {

  public static final int DEFAULT_PORT = 3000;
  public static final UUID DEFAULT_SYSTEM_USER_ID =
      UUID.fromString("b42558e8-6c12-4eb2-9ee1-172cee858ca1");
  public static final String DEFAULT_INTERNAL_API_TOKEN = "your-secret-token-here";

  public ServerConfig {
    Objects.requireNonNull(systemUserId, "systemUserId");
    Objects.requireNonNull(internalApiToken, "internalApiToken");
  }

  /**
   * Reads the configuration from environment variables, falling back to defaults for PORT,
   * SYSTEM_USER_ID and INTERNAL_API_TOKEN.
   *
   * @param env the environment, usually {@link System#getenv()}
   * @throws IllegalArgumentException if PORT is not a number or SYSTEM_USER_ID is not a UUID
   */
  public static ServerConfig fromEnvironment(Map<String, String> env) {
    String rawPort = Strings.emptyToNull(env.get("PORT"));
    int port;
    try {
      port = rawPort == null ? DEFAULT_PORT : Integer.parseInt(rawPort.trim());
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException("PORT must be a number: " + rawPort, e);
    }

    String rawSystemUserId = Strings.emptyToNull(env.get("SYSTEM_USER_ID"));
    UUID systemUserId =
        rawSystemUserId == null ? DEFAULT_SYSTEM_USER_ID : UUID.fromString(rawSystemUserId.trim());

    String token =
        MoreObjects.firstNonNull(
            Strings.emptyToNull(env.get("INTERNAL_API_TOKEN")), DEFAULT_INTERNAL_API_TOKEN);

    return new ServerConfig(
        port, env.get("DB_URL"), env.get("DB_USER"), env.get("DB_PASSWORD"), systemUserId, token);
  }

  /** Returns true if the bearer token was left at its well-known default. */
  public boolean usesDefaultToken() {
    return DEFAULT_INTERNAL_API_TOKEN.equals(internalApiToken);
  }

  /**
   * Returns a string representation of this object without the database password or the API
   * token, safe to write to the startup log.
   */
  public String toSecureString() {
    return MoreObjects.toStringHelper(this)
        .add("port", port())
        .add("dbUrl", dbUrl())
        .add("dbUser", dbUser())
        .add("systemUserId", systemUserId())
        .toString();
  }

  @Override
  public String toString() {
    return toSecureString();
  }
}
