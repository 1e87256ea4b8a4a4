package com.hotlistdigest.core.events;

import java.time.Instant;
import java.util.Map;

public record AlertRaised(
        Instant timestamp,
        String category,
        String message,
        Map<String, Object> details
) implements Event {
    public static final String CATEGORY_CACHE = "enrichment_cache";
    public static final String CATEGORY_ENRICHMENT = "enrichment";

    @Override
    public String type() {
        return "AlertRaised";
    }
}
