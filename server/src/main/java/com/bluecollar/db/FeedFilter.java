package com.bluecollar.db;

import java.util.Objects;
import java.util.UUID;
import javax.annotation.Nullable;

/**
 * Row filter shared by the count query and the page query of a feed listing.
 *
 * @param ownerId restricts the listing to one owner, or null for every feed
 */
public record FeedFilter(@Nullable UUID ownerId) {

    public static FeedFilter all() {
        return new FeedFilter(null);
    }

    public static FeedFilter ownedBy(UUID ownerId) {
        return new FeedFilter(Objects.requireNonNull(ownerId));
    }
}
