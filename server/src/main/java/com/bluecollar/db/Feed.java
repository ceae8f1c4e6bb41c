package com.bluecollar.db;

import java.time.Instant;
import java.util.UUID;
import javax.annotation.Nullable;

/**
 * Represents a row in the 'feed' table.
 *
 * @param feedId The unique identifier of the feed item
 * @param userId The owning user; feeds owned by the system user form the public set
 * @param source Host name of the article, without a leading "www."
 * @param title Article title
 * @param url Article link
 * @param content Article summary text
 * @param imageFirebaseUrl Image link, currently never populated
 * @param timestamp Creation time, the sort key for every listing
 */
public record Feed(
        UUID feedId,
        UUID userId,
        String source,
        String title,
        String url,
        String content,
        @Nullable String imageFirebaseUrl,
        Instant timestamp
) {
}
