package com.bluecollar.operations;

import com.bluecollar.common.status.Status;
import com.bluecollar.common.status.StatusOr;
import com.bluecollar.db.Feed;
import com.bluecollar.db.FeedFilter;
import com.bluecollar.db.Feeds;
import com.bluecollar.pagination.PageRequest;
import com.bluecollar.pagination.PaginationMetadata;
import com.bluecollar.pagination.PaginationResolver;
import org.tinylog.Logger;

import java.sql.Connection;
import java.util.List;

/**
 * Lists one page of feeds, newest first. Used by the public, per-user and all-feeds listings,
 * which differ only in their {@link FeedFilter}.
 */
public class ListFeedsOperation {
    private final Connection dbConnection;

    public ListFeedsOperation(Connection dbConnection) {
        this.dbConnection = dbConnection;
    }

    /**
     * A page of feeds with its pagination metadata. A page past the end is empty, not an error.
     */
    public record FeedPage(List<Feed> feeds, PaginationMetadata pagination) {}

    /**
     * Lists one page of feeds.
     *
     * @param filter which feeds to list
     * @param page the resolved page, see {@link PaginationResolver#resolve}
     * @return the page, or INTERNAL_ERROR if the datastore fails
     */
    public StatusOr<FeedPage> execute(FeedFilter filter, PageRequest page) {
        StatusOr<Feeds.QueryResult> resultOr =
                Feeds.query(dbConnection, filter, page.limit(), page.offset());
        if (resultOr.isNotOk()) {
            String message = "Database error occurred while fetching feeds";
            Logger.error(resultOr.getStatus().getCause(), "{} for {}", message, filter);
            return StatusOr.ofStatus(Status.internal(message, resultOr.getStatus().getCause()));
        }

        Feeds.QueryResult result = resultOr.getValue();
        PaginationMetadata metadata =
                PaginationResolver.describe(result.totalCount(), page.page(), page.limit());
        return StatusOr.ofValue(new FeedPage(result.feeds(), metadata));
    }
}
