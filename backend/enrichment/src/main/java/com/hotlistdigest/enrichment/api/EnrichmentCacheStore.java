package com.hotlistdigest.enrichment.api;

import com.hotlistdigest.core.model.CacheEntry;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

public interface EnrichmentCacheStore {
    Optional<CacheEntry> get(String signature);

    void put(String signature, CacheEntry entry);

    int size();

    default boolean isExpired(CacheEntry entry, Instant now, double missTtlHours) {
        return entry.isExpired(now, Duration.ofMillis(Math.round(missTtlHours * 3_600_000d)));
    }
}
