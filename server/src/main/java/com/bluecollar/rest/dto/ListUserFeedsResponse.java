package com.bluecollar.rest.dto;

import io.javalin.openapi.OpenApiByFields;
import io.javalin.openapi.OpenApiDescription;
import io.javalin.openapi.OpenApiName;
import io.javalin.openapi.OpenApiRequired;
import io.javalin.openapi.Visibility;
import java.util.List;

/** Response of {@code GET /api/feeds/{userId}}. The user id is echoed back as given. */
@OpenApiDescription("One page of a user's feeds, newest first")
@OpenApiName("UserFeedsPage")
@OpenApiByFields(Visibility.PUBLIC)
public record ListUserFeedsResponse(
    @OpenApiRequired boolean success,
    @OpenApiRequired String userId,
    @OpenApiRequired List<FeedResponse> feeds,
    @OpenApiRequired PaginationInfo pagination
) {}
