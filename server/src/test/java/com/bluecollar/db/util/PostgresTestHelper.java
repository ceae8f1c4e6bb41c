package com.bluecollar.db.util;

import com.bluecollar.db.User;
import com.bluecollar.db.Users;
import com.google.common.io.Resources;
import java.net.URL;
import java.nio.charset.StandardCharsets;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Instant;
import java.util.UUID;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.utility.DockerImageName;

/**
 * Helper class for setting up PostgreSQL test containers. Provides consistent initialization for
 * all database tests.
 */
public class PostgresTestHelper {

  private static final String SCHEMA_SQL_PATH = "db/01-schema.sql";

  /**
   * Creates a PostgreSQL container for the given database. The container is not started.
   *
   * @param databaseName The name to use for the test database
   * @return A configured PostgreSQLContainer ready to start
   */
  public static PostgreSQLContainer<?> createPostgresContainer(String databaseName) {
    return new PostgreSQLContainer<>(DockerImageName.parse("postgres:16-alpine"))
        .withDatabaseName(databaseName)
        .withUsername("bluecollar")
        .withPassword("bluecollar");
  }

  /**
   * Creates a JDBC connection to the PostgreSQL container.
   *
   * @param container The PostgreSQL container to connect to
   * @return A JDBC Connection to the database
   * @throws SQLException If connection fails
   */
  public static Connection createConnection(PostgreSQLContainer<?> container) throws SQLException {
    return DriverManager.getConnection(
        container.getJdbcUrl(), container.getUsername(), container.getPassword());
  }

  /**
   * Runs the schema shipped with the server against a fresh database.
   *
   * @throws RuntimeException If the schema cannot be read or executed
   */
  public static void initializeSchema(Connection connection) {
    try (Statement stmt = connection.createStatement()) {
      URL schemaUrl = Resources.getResource(SCHEMA_SQL_PATH);
      stmt.execute(Resources.toString(schemaUrl, StandardCharsets.UTF_8));
    } catch (Exception e) {
      throw new RuntimeException("Failed to initialize database schema", e);
    }
  }

  /**
   * Starts a PostgreSQL container, creates a connection, and initializes the schema.
   *
   * @param databaseName The name to use for the test database
   * @return A PostgresContext containing the container and connection
   * @throws SQLException If database connection fails
   */
  public static PostgresContext setupPostgres(String databaseName) throws SQLException {
    PostgreSQLContainer<?> container = createPostgresContainer(databaseName);
    container.start();

    Connection connection = createConnection(container);
    initializeSchema(connection);

    return new PostgresContext(container, connection);
  }

  /** Removes every row, children first. */
  public static void clearTables(Connection connection) throws SQLException {
    try (Statement stmt = connection.createStatement()) {
      stmt.execute("DELETE FROM feed");
      stmt.execute("DELETE FROM profile");
      stmt.execute("DELETE FROM \"user\"");
    }
  }

  /** Saves a user with the given phone number (which may be null) and returns it. */
  public static User insertUser(Connection connection, String phoneNumber) {
    User user = new User(UUID.randomUUID(), phoneNumber, Instant.now());
    if (Users.save(connection, user).isNotOk()) {
      throw new IllegalStateException("Could not save test user " + user.userId());
    }
    return user;
  }

  /**
   * Context object that holds the PostgreSQL container and connection.
   */
  public static class PostgresContext {
    private final PostgreSQLContainer<?> container;
    private final Connection connection;

    public PostgresContext(PostgreSQLContainer<?> container, Connection connection) {
      this.container = container;
      this.connection = connection;
    }

    public PostgreSQLContainer<?> getContainer() {
      return container;
    }

    public Connection getConnection() {
      return connection;
    }

    /**
     * Closes the connection and stops the container. This should be called in test tearDown
     * methods.
     */
    public void close() {
      try {
        if (connection != null && !connection.isClosed()) {
          connection.close();
        }
      } catch (SQLException e) {
        System.err.println("Error closing connection: " + e.getMessage());
      }

      if (container != null && container.isRunning()) {
        container.stop();
      }
    }
  }
}
