package com.hotlistdigest.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

public record CacheEntry(
        @JsonProperty("published_at") Instant publishedAt,
        @JsonProperty("fetched_at") Instant fetchedAt,
        @JsonProperty("is_miss") boolean miss
) {
    public CacheEntry {
        Objects.requireNonNull(fetchedAt, "fetchedAt is required");
        if (!miss && publishedAt == null) {
            throw new IllegalArgumentException("A cache hit needs a publishedAt value");
        }
        if (miss) {
            publishedAt = null;
        }
    }

    public static CacheEntry found(Instant publishedAt, Instant fetchedAt) {
        return new CacheEntry(publishedAt, fetchedAt, false);
    }

    public static CacheEntry notFound(Instant fetchedAt) {
        return new CacheEntry(null, fetchedAt, true);
    }

    @JsonIgnore
    public boolean isHit() {
        return !miss;
    }

    public boolean isExpired(Instant now, Duration missTtl) {
        return miss && Duration.between(fetchedAt, now).compareTo(missTtl) > 0;
    }
}
