package com.bluecollar.operations;

import static org.junit.jupiter.api.Assertions.*;

import com.bluecollar.common.status.ErrorReason;
import com.bluecollar.common.status.StatusOr;
import com.bluecollar.db.Feed;
import com.bluecollar.db.FeedFilter;
import com.bluecollar.db.Feeds;
import com.bluecollar.db.util.PostgresTestHelper;
import com.bluecollar.operations.ListFeedsOperation.FeedPage;
import com.bluecollar.pagination.PageRequest;
import com.bluecollar.pagination.PaginationMetadata;
import com.bluecollar.pagination.PaginationResolver;
import java.sql.SQLException;
import java.time.Instant;
import java.util.UUID;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.testcontainers.junit.jupiter.Testcontainers;

@Testcontainers
class ListFeedsOperationTest {

    private static PostgresTestHelper.PostgresContext postgres;

    @BeforeAll
    static void setUp() throws SQLException {
        postgres = PostgresTestHelper.setupPostgres("bluecollar_list_feeds_test");
    }

    @AfterAll
    static void tearDown() {
        if (postgres != null) {
            postgres.close();
        }
    }

    @BeforeEach
    void clearDatabase() throws SQLException {
        PostgresTestHelper.clearTables(postgres.getConnection());
    }

    private static void insertFeeds(UUID owner, int count) {
        Instant base = Instant.parse("2024-06-01T00:00:00Z");
        for (int i = 0; i < count; i++) {
            Feed feed = new Feed(UUID.randomUUID(), owner, "example.com", "Feed " + i,
                    "https://example.com/" + i, "Content " + i, null, base.plusSeconds(i));
            assertTrue(Feeds.insert(postgres.getConnection(), feed).isOk());
        }
    }

    private static StatusOr<FeedPage> list(FeedFilter filter, String page, String limit) {
        StatusOr<PageRequest> requestOr = PaginationResolver.resolve(page, limit);
        if (requestOr.isNotOk()) {
            return StatusOr.ofStatus(requestOr.getStatus());
        }
        return new ListFeedsOperation(postgres.getConnection()).execute(filter, requestOr.getValue());
    }

    @Test
    void testEmptyListing() {
        // When: Nothing has been ingested
        StatusOr<FeedPage> result = list(FeedFilter.all(), null, null);

        // Then: An empty first page
        assertTrue(result.isOk());
        assertTrue(result.getValue().feeds().isEmpty());
        assertEquals(new PaginationMetadata(1, 0, 0, false, false, 20), result.getValue().pagination());
    }

    @Test
    void testMiddlePage() {
        // Given: 45 feeds
        UUID owner = PostgresTestHelper.insertUser(postgres.getConnection(), null).userId();
        insertFeeds(owner, 45);

        // When: We ask for the second page of 20
        StatusOr<FeedPage> result = list(FeedFilter.ownedBy(owner), "2", "20");

        // Then: Feeds 24 down to 5, with pages on either side
        assertTrue(result.isOk());
        assertEquals(20, result.getValue().feeds().size());
        assertEquals("Feed 24", result.getValue().feeds().get(0).title());
        assertEquals(new PaginationMetadata(2, 3, 45, true, true, 20), result.getValue().pagination());
    }

    @Test
    void testPagePastEndIsEmptyNotError() {
        // Given: A few feeds
        UUID owner = PostgresTestHelper.insertUser(postgres.getConnection(), null).userId();
        insertFeeds(owner, 3);

        // When: We ask for page 9999
        StatusOr<FeedPage> result = list(FeedFilter.all(), "9999", null);

        // Then: The page is empty and says there is a previous page
        assertTrue(result.isOk());
        assertTrue(result.getValue().feeds().isEmpty());
        assertEquals(new PaginationMetadata(9999, 1, 3, false, true, 20), result.getValue().pagination());
    }

    @Test
    void testOutOfRangeLimit() {
        StatusOr<FeedPage> result = list(FeedFilter.all(), "1", "101");

        assertTrue(result.isNotOk());
        assertEquals(ErrorReason.VALIDATION_ERROR, result.getStatus().getReason());
        assertEquals("Limit must be between 1 and 100", result.getStatus().getMessage());
    }

    @Test
    void testOtherOwnersFeedsAreExcluded() {
        UUID owner = PostgresTestHelper.insertUser(postgres.getConnection(), null).userId();
        UUID stranger = PostgresTestHelper.insertUser(postgres.getConnection(), null).userId();
        insertFeeds(stranger, 2);

        StatusOr<FeedPage> result = list(FeedFilter.ownedBy(owner), null, null);

        assertTrue(result.isOk());
        assertEquals(0, result.getValue().pagination().totalCount());
    }
}
