/**
 * Record types for the rows of the {@code "user"}, {@code profile} and {@code feed} tables,
 * and static DAO helpers that read and write them over a caller-supplied JDBC connection.
 *
 * <p>Every helper returns a {@link com.bluecollar.common.status.StatusOr}. A missing row is an
 * empty {@link java.util.Optional}, never an error. {@link java.sql.SQLException}s are turned into
 * statuses here, so nothing above this package handles SQL exceptions directly.
 */
package com.bluecollar.db;
