package com.bluecollar.pagination;

/**
 * A validated page request.
 *
 * @param page one-based page number, at least 1
 * @param limit page size, between 1 and 100
 * @param offset number of rows to skip, {@code (page - 1) * limit}
 */
public record PageRequest(int page, int limit, long offset) {}
