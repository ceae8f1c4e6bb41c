package com.bluecollar.db;

import com.bluecollar.common.status.ErrorReason;
import com.bluecollar.common.status.Status;
import com.bluecollar.common.status.StatusOr;
import com.bluecollar.db.util.DbUtil;
import java.math.BigDecimal;
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

/** DAO helper class for the 'profile' table. */
public final class Profiles {

  private static final String PROFILE_COLUMNS =
      """
      p.user_id, p.headline, p.summary, p.skills, p.certifications, p.languages,
      p.score, p.share_url, p.created_at
      """;

  private Profiles() {
    // Utility class
  }

  /**
   * Loads the profile owned by a user.
   *
   * @param conn an open JDBC connection
   * @param userId the owning user
   * @return StatusOr containing an Optional Profile or an error
   */
  @Nonnull
  public static StatusOr<Optional<Profile>> loadByUserId(Connection conn, UUID userId) {
    String sql = "SELECT " + PROFILE_COLUMNS + "  FROM profile p WHERE p.user_id = ?";
    try (PreparedStatement stmt = conn.prepareStatement(sql)) {
      stmt.setObject(1, userId);
      return loadOne(stmt);
    } catch (SQLException e) {
      return StatusOr.ofException(e);
    }
  }

  /**
   * Loads the profile of the user with the given phone number. The join on "user" only filters;
   * no user columns are selected.
   *
   * @param conn an open JDBC connection
   * @param phoneNumber the owner's phone number
   * @return StatusOr containing an Optional Profile or an error
   */
  @Nonnull
  public static StatusOr<Optional<Profile>> loadByPhoneNumber(Connection conn, String phoneNumber) {
    String sql =
        "SELECT "
            + PROFILE_COLUMNS
            + """
              FROM profile p
              JOIN "user" u ON u.user_id = p.user_id
             WHERE u.phone_number = ?
            """;
    try (PreparedStatement stmt = conn.prepareStatement(sql)) {
      stmt.setString(1, phoneNumber);
      return loadOne(stmt);
    } catch (SQLException e) {
      return StatusOr.ofException(e);
    }
  }

  /**
   * Checks whether a user already has a profile.
   *
   * @param conn an open JDBC connection
   * @param userId the owning user
   * @return StatusOr containing true if a profile row exists, or an error
   */
  @Nonnull
  public static StatusOr<Boolean> existsForUser(Connection conn, UUID userId) {
    String sql = "SELECT 1 FROM profile WHERE user_id = ?";
    try (PreparedStatement stmt = conn.prepareStatement(sql)) {
      stmt.setObject(1, userId);
      try (ResultSet rs = stmt.executeQuery()) {
        return StatusOr.ofValue(rs.next());
      }
    } catch (SQLException e) {
      return StatusOr.ofException(e);
    }
  }

  /**
   * Inserts a profile and returns the stored row.
   *
   * <p>The primary key on user_id is what actually keeps a user to one profile. A concurrent
   * insert that loses the race comes back as DUPLICATE_PROFILE, the same outcome a caller gets
   * from checking {@link #existsForUser} first.
   *
   * @param conn an open JDBC connection
   * @param profile the profile to insert; its createdAt is ignored in favor of the database clock
   * @return StatusOr containing the stored Profile or an error
   */
  @Nonnull
  public static StatusOr<Profile> insert(Connection conn, Profile profile) {
    String sql =
        """
        INSERT INTO profile AS p
               (user_id, headline, summary, skills, certifications, languages, score, share_url)
        VALUES (?, ?, ?, ?, ?, ?, ?, ?)
        RETURNING
        """
            + PROFILE_COLUMNS;
    try (PreparedStatement stmt = conn.prepareStatement(sql)) {
      stmt.setObject(1, profile.userId());
      stmt.setString(2, profile.headline());
      stmt.setString(3, profile.summary());
      DbUtil.setStringList(conn, stmt, 4, profile.skills());
      DbUtil.setStringList(conn, stmt, 5, profile.certifications());
      DbUtil.setStringList(conn, stmt, 6, profile.languages());
      if (profile.score() == null) {
        stmt.setNull(7, Types.NUMERIC);
      } else {
        stmt.setBigDecimal(7, profile.score());
      }
      stmt.setString(8, profile.shareUrl());

      try (ResultSet rs = stmt.executeQuery()) {
        if (!rs.next()) {
          return StatusOr.ofStatus(Status.internal("Insert returned no row", null));
        }
        return extractProfile(rs);
      }
    } catch (SQLException e) {
      if (DbUtil.isUniqueViolation(e)) {
        return StatusOr.ofStatus(
            Status.alreadyExists(
                    ErrorReason.DUPLICATE_PROFILE, "Profile already exists for this user")
                .withIdentifier(profile.userId().toString()));
      }
      return StatusOr.ofException(e);
    }
  }

  private static StatusOr<Optional<Profile>> loadOne(PreparedStatement stmt) throws SQLException {
    try (ResultSet rs = stmt.executeQuery()) {
      if (rs.next()) {
        StatusOr<Profile> profileOr = extractProfile(rs);
        if (profileOr.isNotOk()) {
          return StatusOr.ofStatus(profileOr.getStatus());
        }
        return StatusOr.ofValue(Optional.of(profileOr.getValue()));
      }
      return StatusOr.ofValue(Optional.empty());
    }
  }

  /** Extracts a Profile from the current row of a ResultSet. */
  @Nonnull
  private static StatusOr<Profile> extractProfile(ResultSet rs) throws SQLException {
    StatusOr<UUID> userIdOr = DbUtil.getUuid(rs, "user_id");
    if (userIdOr.isNotOk()) {
      return StatusOr.ofStatus(userIdOr.getStatus());
    }

    String headline = rs.getString("headline");
    String summary = rs.getString("summary");

    StatusOr<Optional<List<String>>> skillsOr = DbUtil.getOptionalStringList(rs, "skills");
    if (skillsOr.isNotOk()) {
      return StatusOr.ofStatus(skillsOr.getStatus());
    }

    StatusOr<Optional<List<String>>> certificationsOr =
        DbUtil.getOptionalStringList(rs, "certifications");
    if (certificationsOr.isNotOk()) {
      return StatusOr.ofStatus(certificationsOr.getStatus());
    }

    StatusOr<Optional<List<String>>> languagesOr = DbUtil.getOptionalStringList(rs, "languages");
    if (languagesOr.isNotOk()) {
      return StatusOr.ofStatus(languagesOr.getStatus());
    }

    StatusOr<Optional<BigDecimal>> scoreOr = DbUtil.getOptionalDecimal(rs, "score");
    if (scoreOr.isNotOk()) {
      return StatusOr.ofStatus(scoreOr.getStatus());
    }

    String shareUrl = rs.getString("share_url");

    StatusOr<Instant> createdAtOr = DbUtil.getInstant(rs, "created_at");
    if (createdAtOr.isNotOk()) {
      return StatusOr.ofStatus(createdAtOr.getStatus());
    }

    return StatusOr.ofValue(
        new Profile(
            userIdOr.getValue(),
            headline,
            summary,
            skillsOr.getValue().orElse(null),
            certificationsOr.getValue().orElse(null),
            languagesOr.getValue().orElse(null),
            scoreOr.getValue().orElse(null),
            shareUrl,
            createdAtOr.getValue()));
  }
}
