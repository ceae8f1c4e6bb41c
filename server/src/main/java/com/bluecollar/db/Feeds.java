package com.bluecollar.db;

import com.bluecollar.common.status.ErrorReason;
import com.bluecollar.common.status.Status;
import com.bluecollar.common.status.StatusOr;
import com.bluecollar.db.util.DbUtil;
import com.google.common.collect.ImmutableList;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import javax.annotation.Nonnull;

/** DAO helper class for the 'feed' table. */
public final class Feeds {

  private Feeds() {
    // Utility class
  }

  /**
   * Counts the feeds matching a filter and loads one page of them, newest first.
   *
   * <p>Both statements are built from the same WHERE clause and parameter list, so the total
   * always describes the rows being paged over. Ties on timestamp are broken by feed_id so that
   * consecutive pages neither repeat nor skip rows.
   *
   * @param conn An open JDBC connection
   * @param filter Restricts the rows counted and returned
   * @param limit Maximum number of results to return
   * @param offset Number of matching rows to skip
   * @return StatusOr containing the page of feeds and the total count, or an error
   */
  @Nonnull
  public static StatusOr<QueryResult> query(
      Connection conn, FeedFilter filter, int limit, long offset) {
    StringBuilder where = new StringBuilder(" WHERE 1=1");
    List<Object> params = new ArrayList<>();

    if (filter.ownerId() != null) {
      where.append(" AND user_id = ?");
      params.add(filter.ownerId());
    }

    String countSql = "SELECT COUNT(*) FROM feed" + where;
    String dataSql =
        """
        SELECT feed_id, user_id, source, title, url, content, image_firebase_url, "timestamp"
          FROM feed
        """
            + where
            + " ORDER BY \"timestamp\" DESC, feed_id DESC LIMIT ? OFFSET ?";

    try {
      long totalCount = 0;
      try (PreparedStatement countStmt = conn.prepareStatement(countSql)) {
        for (int i = 0; i < params.size(); i++) {
          countStmt.setObject(i + 1, params.get(i));
        }
        try (ResultSet countRs = countStmt.executeQuery()) {
          if (countRs.next()) {
            totalCount = countRs.getLong(1);
          }
        }
      }

      List<Feed> feeds = new ArrayList<>();
      try (PreparedStatement dataStmt = conn.prepareStatement(dataSql)) {
        int index = 1;
        for (Object param : params) {
          dataStmt.setObject(index++, param);
        }
        dataStmt.setInt(index++, limit);
        dataStmt.setLong(index, offset);

        try (ResultSet rs = dataStmt.executeQuery()) {
          while (rs.next()) {
            StatusOr<Feed> feedOr = extractFeed(rs);
            if (feedOr.isNotOk()) {
              return StatusOr.ofStatus(feedOr.getStatus());
            }
            feeds.add(feedOr.getValue());
          }
        }
      }

      return StatusOr.ofValue(new QueryResult(feeds, totalCount));
    } catch (SQLException e) {
      return StatusOr.ofException(e);
    }
  }

  /**
   * Inserts a feed row.
   *
   * @param conn an open JDBC connection
   * @param feed the feed to insert
   * @return StatusOr containing the number of affected rows, INVALID_USER_REFERENCE if the owner
   *     does not exist, or an error
   */
  @Nonnull
  public static StatusOr<Integer> insert(Connection conn, Feed feed) {
    String sql =
        """
        INSERT INTO feed
               (feed_id, user_id, source, title, url, content, image_firebase_url, "timestamp")
        VALUES (?, ?, ?, ?, ?, ?, ?, ?)
        """;
    try (PreparedStatement stmt = conn.prepareStatement(sql)) {
      stmt.setObject(1, feed.feedId());
      stmt.setObject(2, feed.userId());
      stmt.setString(3, feed.source());
      stmt.setString(4, feed.title());
      stmt.setString(5, feed.url());
      stmt.setString(6, feed.content());
      stmt.setString(7, feed.imageFirebaseUrl());
      stmt.setTimestamp(8, DbUtil.toSqlTimestamp(feed.timestamp()));

      return StatusOr.ofValue(stmt.executeUpdate());
    } catch (SQLException e) {
      if (DbUtil.isForeignKeyViolation(e)) {
        return StatusOr.ofStatus(
            Status.of(ErrorReason.INVALID_USER_REFERENCE, "Invalid user reference", e)
                .withIdentifier(feed.userId().toString())
                .withDetails("User ID " + feed.userId() + " does not exist in the users table"));
      }
      return StatusOr.ofException(e);
    }
  }

  /** Extracts a Feed from the current row of a ResultSet. */
  @Nonnull
  private static StatusOr<Feed> extractFeed(ResultSet rs) throws SQLException {
    StatusOr<UUID> feedIdOr = DbUtil.getUuid(rs, "feed_id");
    if (feedIdOr.isNotOk()) {
      return StatusOr.ofStatus(feedIdOr.getStatus());
    }

    StatusOr<UUID> userIdOr = DbUtil.getUuid(rs, "user_id");
    if (userIdOr.isNotOk()) {
      return StatusOr.ofStatus(userIdOr.getStatus());
    }

    String source = rs.getString("source");
    String title = rs.getString("title");
    String url = rs.getString("url");
    String content = rs.getString("content");
    String imageFirebaseUrl = rs.getString("image_firebase_url");

    StatusOr<Instant> timestampOr = DbUtil.getInstant(rs, "timestamp");
    if (timestampOr.isNotOk()) {
      return StatusOr.ofStatus(timestampOr.getStatus());
    }

    return StatusOr.ofValue(
        new Feed(
            feedIdOr.getValue(),
            userIdOr.getValue(),
            source,
            title,
            url,
            content,
            imageFirebaseUrl,
            timestampOr.getValue()));
  }

  /**
   * One page of a feed listing together with the number of rows matching the filter.
   *
   * @param feeds the rows on this page, newest first
   * @param totalCount the number of rows matching the filter across all pages
   */
  public record QueryResult(List<Feed> feeds, long totalCount) {

    public QueryResult {
      feeds = ImmutableList.copyOf(feeds);
    }
  }
}
