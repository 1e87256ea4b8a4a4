package com.hotlistdigest.service.runtime;

import com.hotlistdigest.core.bus.EventBus;
import com.hotlistdigest.core.events.AlertRaised;
import com.hotlistdigest.core.events.DuplicatesMerged;
import com.hotlistdigest.core.events.PublishTimesEnriched;
import com.hotlistdigest.core.merge.DedupMergeEngine;
import com.hotlistdigest.core.merge.MergeResult;
import com.hotlistdigest.core.model.EnrichmentSummary;
import com.hotlistdigest.core.model.NewsRecord;
import com.hotlistdigest.enrichment.api.CacheStoreException;
import com.hotlistdigest.enrichment.config.EnrichmentConfig;
import com.hotlistdigest.enrichment.publish.EnrichmentRun;
import com.hotlistdigest.enrichment.publish.PublishTimeEnrichmentService;

import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.logging.Level;
import java.util.logging.Logger;

public class DigestPipeline {
    private static final Logger LOGGER = Logger.getLogger(DigestPipeline.class.getName());

    private final DedupMergeEngine mergeEngine;
    private final PublishTimeEnrichmentService enrichmentService;
    private final EnrichmentConfig config;
    private final EventBus eventBus;
    private final Clock clock;

    public DigestPipeline(
            DedupMergeEngine mergeEngine,
            PublishTimeEnrichmentService enrichmentService,
            EnrichmentConfig config,
            EventBus eventBus,
            Clock clock
    ) {
        this.mergeEngine = mergeEngine;
        this.enrichmentService = enrichmentService;
        this.config = config;
        this.eventBus = eventBus;
        this.clock = clock;
    }

    public DigestResult run(List<NewsRecord> rawRecords) {
        MergeResult merged = mergeEngine.dedupeAndMerge(rawRecords);
        if (merged.mergeCount() > 0) {
            LOGGER.info("Merged " + merged.mergeCount() + " duplicate news items across sources");
        }
        eventBus.publish(new DuplicatesMerged(
                clock.instant(),
                merged.inputCount(),
                merged.merged().size(),
                merged.mergeCount()
        ));

        EnrichmentRun run;
        try {
            run = enrichmentService.run(merged.merged(), config);
        } catch (CacheStoreException e) {
            LOGGER.log(Level.WARNING, "Skipping publish-time enrichment: " + e.getMessage(), e);
            eventBus.publish(new AlertRaised(
                    clock.instant(),
                    AlertRaised.CATEGORY_ENRICHMENT,
                    "Publish-time enrichment skipped: " + e.getMessage(),
                    Map.of("records", merged.merged().size())
            ));
            return new DigestResult(merged.merged(), merged.mergeCount(), null, true);
        }

        if (config.enabled()) {
            EnrichmentSummary summary = run.summary();
            LOGGER.info(() -> "Publish times: " + summary.recordsEnriched() + " enriched, "
                    + summary.cacheHits() + " from cache, "
                    + summary.fetchedSuccess() + "/" + summary.networkFetches() + " fetches succeeded, "
                    + summary.skippedByBudget() + " skipped by budget, "
                    + summary.abandoned() + " abandoned");
            eventBus.publish(new PublishTimesEnriched(clock.instant(), summary));
        }
        return new DigestResult(run.records(), merged.mergeCount(), run.summary(), false);
    }
}
