package com.bluecollar.rest.dto;

import com.bluecollar.db.Feed;
import io.javalin.openapi.OpenApiByFields;
import io.javalin.openapi.OpenApiDescription;
import io.javalin.openapi.OpenApiExample;
import io.javalin.openapi.OpenApiName;
import io.javalin.openapi.OpenApiNullable;
import io.javalin.openapi.OpenApiRequired;
import io.javalin.openapi.OpenApiStringValidation;
import io.javalin.openapi.Visibility;

/** A feed item with every stored column, as returned by the per-user and all-feeds listings. */
@OpenApiDescription("A feed item")
@OpenApiName("Feed")
@OpenApiByFields(Visibility.PUBLIC)
public record FeedResponse(
    @OpenApiRequired
    @OpenApiStringValidation(format = "uuid")
    String feedId,

    @OpenApiRequired
    @OpenApiStringValidation(format = "uuid")
    String userId,

    @OpenApiDescription("Host name of the article without a leading www.")
    @OpenApiExample("tmz.com")
    @OpenApiRequired
    String source,

    @OpenApiRequired
    String title,

    @OpenApiRequired
    String url,

    @OpenApiDescription("Article summary")
    @OpenApiRequired
    String content,

    @OpenApiNullable
    String imageFirebaseUrl,

    @OpenApiDescription("Creation time, ISO-8601")
    @OpenApiExample("2025-01-26T10:15:30Z")
    @OpenApiRequired
    @OpenApiStringValidation(format = "date-time")
    String timestamp
) {

  public static FeedResponse from(Feed feed) {
    return new FeedResponse(
        feed.feedId().toString(),
        feed.userId().toString(),
        feed.source(),
        feed.title(),
        feed.url(),
        feed.content(),
        feed.imageFirebaseUrl(),
        feed.timestamp().toString());
  }
}
