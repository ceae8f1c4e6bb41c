package com.bluecollar.rest;

import com.bluecollar.common.status.Status;
import com.bluecollar.common.status.StatusOr;
import com.bluecollar.common.status.Violation;
import com.bluecollar.db.Feed;
import com.bluecollar.db.FeedFilter;
import com.bluecollar.db.util.UuidUtil;
import com.bluecollar.operations.IngestFeedOperation;
import com.bluecollar.operations.ListFeedsOperation;
import com.bluecollar.operations.ListFeedsOperation.FeedPage;
import com.bluecollar.pagination.PageRequest;
import com.bluecollar.pagination.PaginationResolver;
import com.bluecollar.rest.dto.CreateFeedRequest;
import com.bluecollar.rest.dto.CreateFeedResponse;
import com.bluecollar.rest.dto.ErrorResponse;
import com.bluecollar.rest.dto.FeedResponse;
import com.bluecollar.rest.dto.ListAllFeedsResponse;
import com.bluecollar.rest.dto.ListPublicFeedsResponse;
import com.bluecollar.rest.dto.ListUserFeedsResponse;
import com.bluecollar.rest.dto.PaginationInfo;
import com.bluecollar.rest.dto.PublicFeedResponse;
import com.bluecollar.security.BearerTokenAuthenticator;
import com.bluecollar.validation.RequestValidator;
import com.google.common.collect.ImmutableList;
import io.javalin.http.Context;
import io.javalin.openapi.HttpMethod;
import io.javalin.openapi.OpenApi;
import io.javalin.openapi.OpenApiContent;
import io.javalin.openapi.OpenApiParam;
import io.javalin.openapi.OpenApiRequestBody;
import io.javalin.openapi.OpenApiResponse;
import io.javalin.openapi.OpenApiSecurity;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.List;
import java.util.UUID;
import java.util.function.Function;
import javax.sql.DataSource;
import org.tinylog.Logger;

/**
 * REST adapter for the feed endpoints: three paginated listings, open to everyone, and the
 * token-protected ingestion endpoint.
 */
public class FeedRestAdapter implements RestAdapter {

  private final DataSource dataSource;
  private final BearerTokenAuthenticator authenticator;
  private final RequestValidator validator;
  private final UUID systemUserId;

  /**
   * Creates a new FeedRestAdapter.
   *
   * @param dataSource Data source for database connections
   * @param authenticator Checks the bearer token of ingestion requests
   * @param validator Validates ingestion request bodies
   * @param systemUserId Owner of the public feed set
   */
  public FeedRestAdapter(
      DataSource dataSource,
      BearerTokenAuthenticator authenticator,
      RequestValidator validator,
      UUID systemUserId) {
    this.dataSource = dataSource;
    this.authenticator = authenticator;
    this.validator = validator;
    this.systemUserId = systemUserId;
  }

  @OpenApi(
      path = "/api/feeds/public",
      methods = {HttpMethod.GET},
      summary = "List public feeds",
      description = "Lists the feeds published by the platform, newest first.",
      operationId = "listPublicFeeds",
      tags = "Feeds",
      queryParams = {
        @OpenApiParam(name = "page", type = Integer.class, description = "Page number, from 1"),
        @OpenApiParam(name = "limit", type = Integer.class, description = "Page size, 1 to 100")
      },
      responses = {
        @OpenApiResponse(
            status = "200",
            description = "One page of public feeds",
            content = @OpenApiContent(from = ListPublicFeedsResponse.class)),
        @OpenApiResponse(
            status = "400",
            description = "Invalid pagination parameters",
            content = @OpenApiContent(from = ErrorResponse.class)),
        @OpenApiResponse(status = "500", description = "Internal server error")
      })
  public void handleListPublicFeeds(Context ctx) {
    Logger.info("REST ListPublicFeeds request");
    listFeeds(
        ctx,
        FeedFilter.ownedBy(systemUserId),
        page ->
            new ListPublicFeedsResponse(
                true,
                page.feeds().stream()
                    .map(PublicFeedResponse::from)
                    .collect(ImmutableList.toImmutableList()),
                PaginationInfo.from(page.pagination())));
  }

  @OpenApi(
      path = "/api/feeds/{userId}",
      methods = {HttpMethod.GET},
      summary = "List a user's feeds",
      description = "Lists the feeds owned by one user, newest first. An unknown user has none.",
      operationId = "listUserFeeds",
      tags = "Feeds",
      pathParams = {
        @OpenApiParam(
            name = "userId",
            required = true,
            description = "UUID of the user",
            example = "123e4567-e89b-12d3-a456-426614174000")
      },
      queryParams = {
        @OpenApiParam(name = "page", type = Integer.class, description = "Page number, from 1"),
        @OpenApiParam(name = "limit", type = Integer.class, description = "Page size, 1 to 100")
      },
      responses = {
        @OpenApiResponse(
            status = "200",
            description = "One page of the user's feeds",
            content = @OpenApiContent(from = ListUserFeedsResponse.class)),
        @OpenApiResponse(
            status = "400",
            description = "Invalid user id or pagination parameters",
            content = @OpenApiContent(from = ErrorResponse.class)),
        @OpenApiResponse(status = "500", description = "Internal server error")
      })
  public void handleListUserFeeds(Context ctx) {
    String rawUserId = ctx.pathParam("userId");
    Logger.info("REST ListUserFeeds request for user: {}", rawUserId);

    StatusOr<UUID> userIdOr = UuidUtil.fromString(rawUserId);
    if (userIdOr.isNotOk()) {
      setError(
          ctx,
          Status.invalid(
                  "Invalid user ID", List.of(new Violation("userId", "Invalid UUID format")))
              .withIdentifier(rawUserId));
      return;
    }

    listFeeds(
        ctx,
        FeedFilter.ownedBy(userIdOr.getValue()),
        page ->
            new ListUserFeedsResponse(
                true, rawUserId, toFeedResponses(page), PaginationInfo.from(page.pagination())));
  }

  /**
   * Lists every user's feeds. Documented as administrative, yet served without authentication.
   */
  @OpenApi(
      path = "/api/feeds",
      methods = {HttpMethod.GET},
      summary = "List all feeds",
      description = "Lists the feeds of every user, newest first.",
      operationId = "listAllFeeds",
      tags = "Feeds",
      queryParams = {
        @OpenApiParam(name = "page", type = Integer.class, description = "Page number, from 1"),
        @OpenApiParam(name = "limit", type = Integer.class, description = "Page size, 1 to 100")
      },
      responses = {
        @OpenApiResponse(
            status = "200",
            description = "One page of feeds",
            content = @OpenApiContent(from = ListAllFeedsResponse.class)),
        @OpenApiResponse(
            status = "400",
            description = "Invalid pagination parameters",
            content = @OpenApiContent(from = ErrorResponse.class)),
        @OpenApiResponse(status = "500", description = "Internal server error")
      })
  public void handleListAllFeeds(Context ctx) {
    Logger.info("REST ListAllFeeds request");
    listFeeds(
        ctx,
        FeedFilter.all(),
        page ->
            new ListAllFeedsResponse(
                true,
                toFeedResponses(page),
                PaginationInfo.from(page.pagination()),
                ListAllFeedsResponse.MESSAGE));
  }

  @OpenApi(
      path = "/api/internal/feeds",
      methods = {HttpMethod.POST},
      summary = "Ingest a feed",
      description =
          "Stores an article as a public feed. The source is derived from the url's host name.",
      operationId = "createFeed",
      tags = "Internal",
      security = {@OpenApiSecurity(name = "BearerAuth")},
      requestBody =
          @OpenApiRequestBody(
              required = true,
              content = @OpenApiContent(from = CreateFeedRequest.class)),
      responses = {
        @OpenApiResponse(
            status = "201",
            description = "Feed created",
            content = @OpenApiContent(from = CreateFeedResponse.class)),
        @OpenApiResponse(
            status = "400",
            description = "Missing or too long fields, or the system user does not exist",
            content = @OpenApiContent(from = ErrorResponse.class)),
        @OpenApiResponse(status = "401", description = "Missing or malformed Authorization header"),
        @OpenApiResponse(status = "403", description = "Invalid token"),
        @OpenApiResponse(status = "500", description = "Internal server error")
      })
  public void handleCreateFeed(Context ctx) {
    Logger.info("REST CreateFeed request");
    if (!authorize(ctx, authenticator)) {
      return;
    }

    StatusOr<CreateFeedRequest> requestOr =
        parseBody(ctx, CreateFeedRequest.class, "Missing required fields");
    if (requestOr.isNotOk()) {
      setError(ctx, requestOr.getStatus());
      return;
    }
    Status valid = IngestFeedOperation.validate(validator, requestOr.getValue());
    if (!valid.isOk()) {
      setError(ctx, valid);
      return;
    }

    try (Connection connection = dataSource.getConnection()) {
      var operation = new IngestFeedOperation(connection, validator, systemUserId);
      StatusOr<Feed> feedOr = operation.execute(requestOr.getValue());
      if (feedOr.isNotOk()) {
        setError(ctx, feedOr.getStatus());
        return;
      }
      ctx.status(201).json(CreateFeedResponse.from(feedOr.getValue()));
    } catch (SQLException e) {
      setError(ctx, Status.internal("Failed to create feed entry", e));
    }
  }

  private void listFeeds(Context ctx, FeedFilter filter, Function<FeedPage, Object> toResponse) {
    StatusOr<PageRequest> requestOr =
        PaginationResolver.resolve(ctx.queryParam("page"), ctx.queryParam("limit"));
    if (requestOr.isNotOk()) {
      setError(ctx, requestOr.getStatus());
      return;
    }

    try (Connection connection = dataSource.getConnection()) {
      var operation = new ListFeedsOperation(connection);
      StatusOr<FeedPage> pageOr = operation.execute(filter, requestOr.getValue());
      if (pageOr.isNotOk()) {
        setError(ctx, pageOr.getStatus());
        return;
      }
      ctx.status(200).json(toResponse.apply(pageOr.getValue()));
    } catch (SQLException e) {
      setError(ctx, Status.internal("Database error occurred while fetching feeds", e));
    }
  }

  private static List<FeedResponse> toFeedResponses(FeedPage page) {
    return page.feeds().stream().map(FeedResponse::from).collect(ImmutableList.toImmutableList());
  }
}
