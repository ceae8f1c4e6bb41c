package com.bluecollar.pagination;

/**
 * Page description returned alongside every listing.
 *
 * @param page the requested page
 * @param totalPages {@code ceil(totalCount / limit)}, zero when nothing matches
 * @param totalCount number of rows matching the listing's filter
 * @param hasNextPage true if {@code page < totalPages}
 * @param hasPreviousPage true if {@code page > 1}
 * @param limit the requested page size
 */
public record PaginationMetadata(
    int page,
    long totalPages,
    long totalCount,
    boolean hasNextPage,
    boolean hasPreviousPage,
    int limit) {}
