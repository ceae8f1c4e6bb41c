package com.bluecollar.operations;

import com.bluecollar.common.status.ErrorReason;
import com.bluecollar.common.status.Status;
import com.bluecollar.common.status.StatusOr;
import com.bluecollar.common.status.Violation;
import com.bluecollar.db.Feed;
import com.bluecollar.db.Feeds;
import com.bluecollar.rest.dto.CreateFeedRequest;
import com.bluecollar.util.UrlUtils;
import com.bluecollar.validation.RequestValidator;
import com.bluecollar.validation.RequiredChecks;
import com.google.common.base.Joiner;
import org.tinylog.Logger;

import java.sql.Connection;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.UUID;

/**
 * Stores an article pushed by the ingestion pipeline as a public feed owned by the system user.
 *
 * <p>Missing fields are reported before malformed ones: a request lacking a title is answered
 * with the list of missing fields only, never with a length complaint about another field.
 */
public class IngestFeedOperation {
    static final String REQUIRED_FIELDS = "Required fields: title, summary, category, url";

    private final Connection dbConnection;
    private final RequestValidator validator;
    private final UUID systemUserId;

    /**
     * Creates a new IngestFeedOperation.
     *
     * @param dbConnection the database connection to use
     * @param validator validates the request body
     * @param systemUserId owner of every ingested feed
     */
    public IngestFeedOperation(Connection dbConnection, RequestValidator validator, UUID systemUserId) {
        this.dbConnection = dbConnection;
        this.validator = validator;
        this.systemUserId = systemUserId;
    }

    public StatusOr<Feed> execute(CreateFeedRequest request) {
        Status valid = validate(validator, request);
        if (!valid.isOk()) {
            return StatusOr.ofStatus(valid);
        }

        // Postgres keeps microseconds; truncating keeps the returned feed equal to the stored one.
        Feed feed = new Feed(
                UUID.randomUUID(),
                systemUserId,
                UrlUtils.extractSource(request.url()),
                request.title().trim(),
                request.url(),
                request.summary().trim(),
                null,
                Instant.now().truncatedTo(ChronoUnit.MICROS)
        );

        StatusOr<Integer> insertOr = Feeds.insert(dbConnection, feed);
        if (insertOr.isNotOk()) {
            Status status = insertOr.getStatus();
            Logger.error(status.getCause(), "Feed insertion failed: {}", status.getMessage());
            if (status.getReason() == ErrorReason.INVALID_USER_REFERENCE) {
                return StatusOr.ofStatus(status);
            }
            return StatusOr.ofStatus(Status.internal(
                    "Database error occurred while inserting the feed", status.getCause()));
        }

        Logger.info("Feed {} created from {}", feed.feedId(), feed.source());
        return StatusOr.ofValue(feed);
    }

    /**
     * Checks the request without touching the datastore. Missing fields are reported on their
     * own; length limits are only checked once every field is present.
     */
    public static Status validate(RequestValidator validator, CreateFeedRequest request) {
        List<Violation> missing = validator.validate(request, RequiredChecks.class);
        if (!missing.isEmpty()) {
            return Status.invalid("Missing required fields", missing).withDetails(REQUIRED_FIELDS);
        }
        List<Violation> malformed = validator.validate(request);
        if (!malformed.isEmpty()) {
            String message = Joiner.on("; ").join(malformed.stream().map(Violation::message).iterator());
            return Status.invalid(message, malformed);
        }
        return Status.ok();
    }
}
