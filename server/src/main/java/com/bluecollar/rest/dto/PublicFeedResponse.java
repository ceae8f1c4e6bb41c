package com.bluecollar.rest.dto;

import com.bluecollar.db.Feed;
import io.javalin.openapi.OpenApiByFields;
import io.javalin.openapi.OpenApiDescription;
import io.javalin.openapi.OpenApiName;
import io.javalin.openapi.OpenApiRequired;
import io.javalin.openapi.OpenApiStringValidation;
import io.javalin.openapi.Visibility;

/** A public feed item. The owner and image columns are not exposed on the public listing. */
@OpenApiDescription("A public feed item")
@OpenApiName("PublicFeed")
@OpenApiByFields(Visibility.PUBLIC)
public record PublicFeedResponse(
    @OpenApiRequired @OpenApiStringValidation(format = "uuid") String feedId,
    @OpenApiRequired String source,
    @OpenApiRequired String title,
    @OpenApiRequired String url,
    @OpenApiRequired String content,
    @OpenApiRequired @OpenApiStringValidation(format = "date-time") String timestamp
) {

  public static PublicFeedResponse from(Feed feed) {
    return new PublicFeedResponse(
        feed.feedId().toString(),
        feed.source(),
        feed.title(),
        feed.url(),
        feed.content(),
        feed.timestamp().toString());
  }
}
