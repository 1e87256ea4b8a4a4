package com.hotlistdigest.core.model;

public record EnrichmentSummary(
        int recordsTotal,
        int alreadyPublished,
        int cacheHits,
        int cacheRecentMisses,
        int noUrl,
        int pendingFetches,
        int fetchedSuccess,
        int fetchedFailure,
        int skippedByBudget,
        int abandoned,
        int recordsEnriched
) {
    public static EnrichmentSummary disabled(int recordsTotal) {
        return new EnrichmentSummary(recordsTotal, 0, 0, 0, 0, 0, 0, 0, 0, 0, 0);
    }

    public int networkFetches() {
        return fetchedSuccess + fetchedFailure + abandoned;
    }
}
