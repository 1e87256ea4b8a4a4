package com.hotlistdigest.core.events;

import com.hotlistdigest.core.model.EnrichmentSummary;

import java.time.Instant;

public record PublishTimesEnriched(Instant timestamp, EnrichmentSummary summary) implements Event {
    @Override
    public String type() {
        return "PublishTimesEnriched";
    }
}
