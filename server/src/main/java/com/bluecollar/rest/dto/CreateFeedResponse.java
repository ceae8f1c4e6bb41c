package com.bluecollar.rest.dto;

import com.bluecollar.db.Feed;
import io.javalin.openapi.OpenApiByFields;
import io.javalin.openapi.OpenApiDescription;
import io.javalin.openapi.OpenApiExample;
import io.javalin.openapi.OpenApiName;
import io.javalin.openapi.OpenApiRequired;
import io.javalin.openapi.OpenApiStringValidation;
import io.javalin.openapi.Visibility;

/** Response of {@code POST /api/internal/feeds}: just enough for the caller to log the result. */
@OpenApiDescription("Acknowledgement of an ingested feed")
@OpenApiName("FeedCreationResponse")
@OpenApiByFields(Visibility.PUBLIC)
public record CreateFeedResponse(
    @OpenApiRequired boolean success,
    @OpenApiExample("Feed created successfully") @OpenApiRequired String message,
    @OpenApiRequired Data data
) {

  public static CreateFeedResponse from(Feed feed) {
    return new CreateFeedResponse(
        true,
        "Feed created successfully",
        new Data(
            feed.feedId().toString(), feed.title(), feed.source(), feed.timestamp().toString()));
  }

  /** The stored identity of the new feed. */
  @OpenApiName("CreatedFeed")
  @OpenApiByFields(Visibility.PUBLIC)
  public record Data(
      @OpenApiRequired @OpenApiStringValidation(format = "uuid") String feedId,
      @OpenApiRequired String title,
      @OpenApiExample("tmz.com") @OpenApiRequired String source,
      @OpenApiRequired @OpenApiStringValidation(format = "date-time") String timestamp
  ) {}
}
