package com.bluecollar.rest.dto;

import io.javalin.openapi.OpenApiByFields;
import io.javalin.openapi.OpenApiDescription;
import io.javalin.openapi.OpenApiExample;
import io.javalin.openapi.OpenApiName;
import io.javalin.openapi.OpenApiRequired;
import io.javalin.openapi.Visibility;
import java.util.List;

/** Response of {@code GET /api/feeds}. */
@OpenApiDescription("One page of every user's feeds, newest first")
@OpenApiName("AllFeedsPage")
@OpenApiByFields(Visibility.PUBLIC)
public record ListAllFeedsResponse(
    @OpenApiRequired boolean success,
    @OpenApiRequired List<FeedResponse> feeds,
    @OpenApiRequired PaginationInfo pagination,
    @OpenApiExample("All feeds retrieved successfully") @OpenApiRequired String message
) {

  public static final String MESSAGE = "All feeds retrieved successfully";
}
