package com.hotlistdigest.core.events;

import java.time.Instant;

public record DuplicatesMerged(Instant timestamp, int inputCount, int outputCount, int mergeCount) implements Event {
    @Override
    public String type() {
        return "DuplicatesMerged";
    }
}
