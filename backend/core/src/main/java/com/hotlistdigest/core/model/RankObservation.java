package com.hotlistdigest.core.model;

import java.time.Instant;

public record RankObservation(
        String source,
        int rank,
        Instant observedAt
) {
}
