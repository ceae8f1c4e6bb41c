package com.bluecollar.rest.dto;

import com.bluecollar.validation.Inputs;
import com.bluecollar.validation.RequiredChecks;
import io.javalin.openapi.OpenApiByFields;
import io.javalin.openapi.OpenApiDescription;
import io.javalin.openapi.OpenApiExample;
import io.javalin.openapi.OpenApiName;
import io.javalin.openapi.OpenApiRequired;
import io.javalin.openapi.OpenApiStringValidation;
import io.javalin.openapi.Visibility;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

/**
 * Request body for {@code POST /api/internal/feeds}, sent by the content ingestion pipeline.
 *
 * <p>Title and summary are kept as sent, so their length limits count surrounding whitespace;
 * they are trimmed when the feed is stored.
 */
@OpenApiDescription("An article to publish in the public feed.")
@OpenApiName("FeedCreationRequest")
@OpenApiByFields(Visibility.PUBLIC)
public record CreateFeedRequest(
    @OpenApiDescription("Article title.")
    @OpenApiExample("New safety rules for construction sites")
    @OpenApiRequired
    @OpenApiStringValidation(maxLength = "500")
    @NotBlank(groups = RequiredChecks.class, message = "title is required")
    @Size(max = 500, message = "Title too long (max 500 characters)")
    String title,

    @OpenApiDescription("Article summary; stored as the feed content.")
    @OpenApiRequired
    @OpenApiStringValidation(maxLength = "10000")
    @NotBlank(groups = RequiredChecks.class, message = "summary is required")
    @Size(max = 10_000, message = "Summary too long (max 10,000 characters)")
    String summary,

    @OpenApiDescription("Article category. Required, but not stored.")
    @OpenApiExample("safety")
    @OpenApiRequired
    @NotBlank(groups = RequiredChecks.class, message = "category is required")
    String category,

    @OpenApiDescription("Article link. Its host name becomes the feed source.")
    @OpenApiExample("https://www.example.com/articles/42")
    @OpenApiRequired
    @NotBlank(groups = RequiredChecks.class, message = "url is required")
    String url
) {

  public CreateFeedRequest {
    category = Inputs.trimToNull(category);
    url = Inputs.trimToNull(url);
  }
}
