package com.hotlistdigest.service.runtime;

import com.hotlistdigest.core.model.EnrichmentSummary;
import com.hotlistdigest.core.model.NewsRecord;

import java.util.List;
import java.util.Optional;

public record DigestResult(
        List<NewsRecord> records,
        int mergeCount,
        EnrichmentSummary enrichment,
        boolean enrichmentSkipped
) {
    public DigestResult {
        records = List.copyOf(records);
    }

    public Optional<EnrichmentSummary> enrichmentSummary() {
        return Optional.ofNullable(enrichment);
    }
}
