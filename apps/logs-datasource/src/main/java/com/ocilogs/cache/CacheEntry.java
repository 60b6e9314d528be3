package com.ocilogs.cache;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * A cached value with the weight it counts against the cache budget and the time it was
 * written.
 */
public record CacheEntry(
        String key,
        Object value,
        long cost,
        Instant insertedAt
) {
    public CacheEntry {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(insertedAt, "insertedAt");
        if (cost < 0) {
            throw new IllegalArgumentException("cost must not be negative: " + cost);
        }
    }

    public boolean olderThan(Duration age, Instant now) {
        return now.isAfter(insertedAt.plus(age));
    }
}
