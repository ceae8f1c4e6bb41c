package com.bluecollar.db.util;

import com.bluecollar.common.status.Status;
import com.bluecollar.common.status.StatusOr;
import com.google.common.collect.ImmutableList;
import java.math.BigDecimal;
import java.sql.Array;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Types;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import javax.annotation.Nonnull;
import javax.annotation.Nullable;

/** Utility methods for database operations. */
public final class DbUtil {

  /** SQLState PostgreSQL reports for a unique constraint violation. */
  public static final String UNIQUE_VIOLATION = "23505";

  /** SQLState PostgreSQL reports for a foreign key violation. */
  public static final String FOREIGN_KEY_VIOLATION = "23503";

  private DbUtil() {
    // Utility class, no instances
  }

  /** Converts a java.time.Instant to java.sql.Timestamp. */
  @Nonnull
  public static java.sql.Timestamp toSqlTimestamp(Instant instant) {
    if (instant == null) {
      throw new IllegalArgumentException("Instant cannot be null");
    }
    return java.sql.Timestamp.from(instant);
  }

  /** Gets a UUID from a ResultSet column using column name. */
  @Nonnull
  public static StatusOr<UUID> getUuid(ResultSet rs, String columnName) {
    try {
      UUID uuid = rs.getObject(columnName, UUID.class);
      if (rs.wasNull() || uuid == null) {
        return StatusOr.ofStatus(Status.internal("Column " + columnName + " is null", null));
      }
      return StatusOr.ofValue(uuid);
    } catch (SQLException e) {
      return StatusOr.ofStatus(Status.internal("Failed to get UUID", e));
    }
  }

  /** Gets an Instant from a ResultSet column using column name. */
  @Nonnull
  public static StatusOr<Instant> getInstant(ResultSet rs, String columnName) {
    try {
      java.sql.Timestamp timestamp = rs.getTimestamp(columnName);
      if (rs.wasNull() || timestamp == null) {
        return StatusOr.ofStatus(Status.internal("Column " + columnName + " is null", null));
      }
      return StatusOr.ofValue(timestamp.toInstant());
    } catch (SQLException e) {
      return StatusOr.ofStatus(Status.internal("Failed to get Instant", e));
    }
  }

  /**
   * Reads a PostgreSQL {@code TEXT[]} column, returning Optional.empty() if the column is null.
   */
  @Nonnull
  public static StatusOr<Optional<List<String>>> getOptionalStringList(
      ResultSet rs, String columnName) {
    try {
      Array array = rs.getArray(columnName);
      if (rs.wasNull() || array == null) {
        return StatusOr.ofValue(Optional.empty());
      }
      try {
        Object[] values = (Object[]) array.getArray();
        ImmutableList.Builder<String> builder = ImmutableList.builder();
        for (Object value : values) {
          builder.add((String) value);
        }
        return StatusOr.ofValue(Optional.of(builder.build()));
      } finally {
        array.free();
      }
    } catch (SQLException | ClassCastException | NullPointerException e) {
      return StatusOr.ofStatus(Status.internal("Failed to get text array " + columnName, e));
    }
  }

  /** Gets an optional numeric value, returning Optional.empty() if the column is null. */
  @Nonnull
  public static StatusOr<Optional<BigDecimal>> getOptionalDecimal(
      ResultSet rs, String columnName) {
    try {
      BigDecimal value = rs.getBigDecimal(columnName);
      if (rs.wasNull() || value == null) {
        return StatusOr.ofValue(Optional.empty());
      }
      return StatusOr.ofValue(Optional.of(value));
    } catch (SQLException e) {
      return StatusOr.ofStatus(Status.internal("Failed to get decimal " + columnName, e));
    }
  }

  /**
   * Binds a list of strings as a {@code TEXT[]} parameter, or SQL NULL when the list is null.
   */
  public static void setStringList(
      Connection conn, PreparedStatement stmt, int parameterIndex, @Nullable List<String> values)
      throws SQLException {
    if (values == null) {
      stmt.setNull(parameterIndex, Types.ARRAY);
      return;
    }
    stmt.setArray(parameterIndex, conn.createArrayOf("text", values.toArray()));
  }

  /** Returns true if the exception reports a unique constraint violation. */
  public static boolean isUniqueViolation(SQLException e) {
    return UNIQUE_VIOLATION.equals(e.getSQLState());
  }

  /** Returns true if the exception reports a foreign key violation. */
  public static boolean isForeignKeyViolation(SQLException e) {
    return FOREIGN_KEY_VIOLATION.equals(e.getSQLState());
  }
}
