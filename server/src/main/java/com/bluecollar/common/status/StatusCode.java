package com.bluecollar.common.status;

/**
 * Status codes for operation outcomes, each tied to the HTTP status the REST layer answers with.
 */
public enum StatusCode {
    OK(200),                  // 200 OK
    INVALID_ARGUMENT(400),    // 400 Bad Request
    FAILED_PRECONDITION(400), // 400 Bad Request (a referenced row is missing)
    UNAUTHENTICATED(401),     // 401 Unauthorized
    PERMISSION_DENIED(403),   // 403 Forbidden
    NOT_FOUND(404),           // 404 Not Found
    ALREADY_EXISTS(409),      // 409 Conflict
    INTERNAL(500);            // 500 Internal Server Error

    private final int httpCode;

    StatusCode(int httpCode) {
        this.httpCode = httpCode;
    }

    /**
     * Returns the corresponding HTTP status code.
     */
    public int getHttpCode() {
        return httpCode;
    }

    /**
     * Returns whether the caller, rather than the server, is responsible for this outcome.
     */
    public boolean isClientError() {
        return httpCode >= 400 && httpCode < 500;
    }
}
