package com.bluecollar.rest.dto;

import io.javalin.openapi.OpenApiByFields;
import io.javalin.openapi.OpenApiDescription;
import io.javalin.openapi.OpenApiName;
import io.javalin.openapi.OpenApiRequired;
import io.javalin.openapi.Visibility;
import java.util.List;

/** Response of {@code GET /api/feeds/public}. */
@OpenApiDescription("One page of the public feed, newest first")
@OpenApiName("PublicFeedsPage")
@OpenApiByFields(Visibility.PUBLIC)
public record ListPublicFeedsResponse(
    @OpenApiRequired boolean success,
    @OpenApiRequired List<PublicFeedResponse> data,
    @OpenApiRequired PaginationInfo pagination
) {}
