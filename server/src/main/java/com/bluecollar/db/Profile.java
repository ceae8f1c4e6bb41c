package com.bluecollar.db;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import javax.annotation.Nullable;

/**
 * Represents a row in the 'profile' table. Every attribute except the owner is optional.
 *
 * @param userId The owning user; also the primary key, so a user has at most one profile
 * @param headline Short headline, up to 200 characters
 * @param summary Free-text summary, up to 3000 characters
 * @param skills Distinct skills
 * @param certifications Distinct certifications
 * @param languages Distinct spoken languages
 * @param score Score between 0 and 100 with at most two decimal places
 * @param shareUrl Public link to the profile
 * @param createdAt Timestamp when the record was created
 */
public record Profile(
        UUID userId,
        @Nullable String headline,
        @Nullable String summary,
        @Nullable List<String> skills,
        @Nullable List<String> certifications,
        @Nullable List<String> languages,
        @Nullable BigDecimal score,
        @Nullable String shareUrl,
        Instant createdAt
) {
}
