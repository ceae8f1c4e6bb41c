package com.bluecollar.rest.dto;

import com.bluecollar.pagination.PaginationMetadata;
import io.javalin.openapi.OpenApiByFields;
import io.javalin.openapi.OpenApiDescription;
import io.javalin.openapi.OpenApiExample;
import io.javalin.openapi.OpenApiName;
import io.javalin.openapi.OpenApiRequired;
import io.javalin.openapi.Visibility;

/** Pagination block attached to every listing response. */
@OpenApiDescription("Position of this page within the listing")
@OpenApiName("Pagination")
@OpenApiByFields(Visibility.PUBLIC)
public record PaginationInfo(
    @OpenApiExample("2") @OpenApiRequired int page,
    @OpenApiExample("8") @OpenApiRequired long totalPages,
    @OpenApiExample("150") @OpenApiRequired long totalCount,
    @OpenApiExample("true") @OpenApiRequired boolean hasNextPage,
    @OpenApiExample("true") @OpenApiRequired boolean hasPreviousPage,
    @OpenApiExample("20") @OpenApiRequired int limit
) {

  public static PaginationInfo from(PaginationMetadata metadata) {
    return new PaginationInfo(
        metadata.page(),
        metadata.totalPages(),
        metadata.totalCount(),
        metadata.hasNextPage(),
        metadata.hasPreviousPage(),
        metadata.limit());
  }
}
