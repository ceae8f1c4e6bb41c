package com.bluecollar.db;

import java.time.Instant;
import java.util.UUID;
import javax.annotation.Nullable;

/**
 * Represents a row in the 'user' table.
 *
 * <p>Users are provisioned outside this service; it only reads them to confirm existence and to
 * resolve a phone number to the canonical user id.
 *
 * @param userId The unique identifier of the user
 * @param phoneNumber The phone number in international format (optional)
 * @param createdAt Timestamp when the record was created
 */
public record User(
        UUID userId,
        @Nullable String phoneNumber,
        Instant createdAt
) {
}
