/**
 * Contains classes for error handling and status reporting.
 *
 * <p>This package provides a consistent way to represent operation outcomes without relying on
 * exceptions for expected control flow such as a missing row or a rejected request. The central
 * classes are:
 *
 * <ul>
 *   <li>{@link com.bluecollar.common.status.StatusCode} - Enum of status codes, each mapped to an
 *       HTTP status</li>
 *   <li>{@link com.bluecollar.common.status.ErrorReason} - The error code shown to API clients</li>
 *   <li>{@link com.bluecollar.common.status.Status} - A reason with a stable message, optional
 *       field violations and an optional server-side cause</li>
 *   <li>{@link com.bluecollar.common.status.StatusOr} - Container that holds either a successful
 *       value or an error status</li>
 * </ul>
 *
 * <p>Example usage:
 * <pre>
 * StatusOr&lt;Optional&lt;User&gt;&gt; userOr = Users.loadById(connection, userId);
 * if (userOr.isNotOk()) {
 *     return StatusOr.ofStatus(userOr.getStatus());
 * }
 * if (userOr.getValue().isEmpty()) {
 *     return StatusOr.ofStatus(
 *         Status.notFound(ErrorReason.USER_NOT_FOUND, "User not found", userId.toString()));
 * }
 * </pre>
 */
package com.bluecollar.common.status;
