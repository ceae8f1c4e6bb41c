package com.bluecollar.db;

import com.bluecollar.common.status.StatusOr;
import com.bluecollar.db.util.DbUtil;

import javax.annotation.Nonnull;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.Optional;
import java.util.UUID;

/**
 * DAO helper class for the 'user' table.
 */
public final class Users {

    private Users() {
        // Utility class
    }

    /**
     * Loads a single user by ID.
     *
     * @param conn an open JDBC connection
     * @param userId the UUID of the user to load
     * @return StatusOr containing an Optional User or an error
     */
    @Nonnull
    public static StatusOr<Optional<User>> loadById(Connection conn, UUID userId) {
        String sql = """
                SELECT user_id, phone_number, created_at
                  FROM "user"
                 WHERE user_id = ?
                """;
        try (PreparedStatement stmt = conn.prepareStatement(sql)) {
            stmt.setObject(1, userId); // Use setObject for UUID
            return loadOne(stmt);
        } catch (SQLException e) {
            return StatusOr.ofException(e);
        }
    }

    /**
     * Loads a single user by phone number.
     *
     * @param conn an open JDBC connection
     * @param phoneNumber the phone number, compared exactly
     * @return StatusOr containing an Optional User or an error
     */
    @Nonnull
    public static StatusOr<Optional<User>> loadByPhoneNumber(Connection conn, String phoneNumber) {
        String sql = """
                SELECT user_id, phone_number, created_at
                  FROM "user"
                 WHERE phone_number = ?
                """;
        try (PreparedStatement stmt = conn.prepareStatement(sql)) {
            stmt.setString(1, phoneNumber);
            return loadOne(stmt);
        } catch (SQLException e) {
            return StatusOr.ofException(e);
        }
    }

    /**
     * Inserts or updates a user row (upsert).
     *
     * <p>Users are provisioned by another system; this is used to seed the system user and test
     * fixtures.
     *
     * @param conn an open JDBC connection
     * @param user the User object to save
     * @return StatusOr containing the number of affected rows or an error
     */
    @Nonnull
    public static StatusOr<Integer> save(Connection conn, User user) {
        String sql = """
                INSERT INTO "user"
                       (user_id, phone_number, created_at)
                VALUES (?, ?, ?)
                ON CONFLICT(user_id)
                DO UPDATE SET phone_number = excluded.phone_number
                """;
        try (PreparedStatement stmt = conn.prepareStatement(sql)) {
            stmt.setObject(1, user.userId()); // Use setObject for UUID
            stmt.setString(2, user.phoneNumber());
            stmt.setTimestamp(3, DbUtil.toSqlTimestamp(user.createdAt()));

            int rowsAffected = stmt.executeUpdate();
            return StatusOr.ofValue(rowsAffected);
        } catch (SQLException e) {
            return StatusOr.ofException(e);
        }
    }

    private static StatusOr<Optional<User>> loadOne(PreparedStatement stmt) throws SQLException {
        try (ResultSet rs = stmt.executeQuery()) {
            if (rs.next()) {
                StatusOr<User> userOr = extractUser(rs);
                if (userOr.isNotOk()) {
                    return StatusOr.ofStatus(userOr.getStatus());
                }
                return StatusOr.ofValue(Optional.of(userOr.getValue()));
            }
            return StatusOr.ofValue(Optional.empty());
        }
    }

    /**
     * Extracts a User from the current row of a ResultSet.
     */
    @Nonnull
    private static StatusOr<User> extractUser(ResultSet rs) throws SQLException {
        StatusOr<UUID> userIdOr = DbUtil.getUuid(rs, "user_id");
        if (userIdOr.isNotOk()) {
            return StatusOr.ofStatus(userIdOr.getStatus());
        }

        String phoneNumber = rs.getString("phone_number");

        StatusOr<Instant> createdAtOr = DbUtil.getInstant(rs, "created_at");
        if (createdAtOr.isNotOk()) {
            return StatusOr.ofStatus(createdAtOr.getStatus());
        }

        return StatusOr.ofValue(new User(
                userIdOr.getValue(),
                phoneNumber,
                createdAtOr.getValue()
        ));
    }
}
