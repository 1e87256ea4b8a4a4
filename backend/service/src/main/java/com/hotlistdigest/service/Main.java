package com.hotlistdigest.service;

import com.hotlistdigest.core.bus.EventBus;
import com.hotlistdigest.core.events.AlertRaised;
import com.hotlistdigest.core.merge.DedupMergeEngine;
import com.hotlistdigest.core.model.NewsRecord;
import com.hotlistdigest.core.util.JsonUtils;
import com.hotlistdigest.enrichment.config.EnrichmentConfig;
import com.hotlistdigest.enrichment.page.HttpPublishTimeFetcher;
import com.hotlistdigest.enrichment.publish.PublishTimeEnrichmentService;
import com.hotlistdigest.service.config.ConfigLoader;
import com.hotlistdigest.service.http.HttpClientFactory;
import com.hotlistdigest.service.runtime.DigestPipeline;
import com.hotlistdigest.service.runtime.DigestResult;
import com.hotlistdigest.service.store.JsonFileEnrichmentCacheStore;

import java.io.IOException;
import java.io.OutputStream;
import java.net.http.HttpClient;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;

public final class Main {
    private static final Logger LOGGER = Logger.getLogger(Main.class.getName());

    private Main() {
    }

    public static void main(String[] args) {
        if (args.length < 2) {
            LOGGER.severe("Usage: Main <records.json> <digest.json> [configDir] [cacheFile]");
            System.exit(2);
            return;
        }
        Path recordsFile = Path.of(args[0]);
        Path digestFile = Path.of(args[1]);
        Path configDir = Path.of(args.length > 2 ? args[2] : "config");
        Path cacheFile = Path.of(args.length > 3 ? args[3] : "state/publish_time_cache.json");

        Clock clock = Clock.systemUTC();
        EventBus eventBus = new EventBus();
        eventBus.subscribeAll(event -> LOGGER.fine(() -> "event " + event.type() + " at " + event.timestamp()));
        eventBus.subscribe(AlertRaised.class, alert -> LOGGER.warning(alert.category() + ": " + alert.message()));

        EnrichmentConfig config = ConfigLoader.loadEnrichmentOrDefaults(configDir);
        List<NewsRecord> records = ConfigLoader.loadRecords(recordsFile);

        JsonFileEnrichmentCacheStore cacheStore = new JsonFileEnrichmentCacheStore(cacheFile);
        if (cacheStore.recoveredFromCorruption()) {
            eventBus.publish(new AlertRaised(
                    clock.instant(),
                    AlertRaised.CATEGORY_CACHE,
                    "Enrichment cache was unreadable and has been reset",
                    Map.of("file", cacheFile.toString())
            ));
        }

        HttpClient httpClient = HttpClientFactory.create(config.requestTimeout());
        PublishTimeEnrichmentService enrichmentService = new PublishTimeEnrichmentService(
                cacheStore,
                new HttpPublishTimeFetcher(httpClient, config.zoneId()),
                clock
        );
        DigestPipeline pipeline = new DigestPipeline(new DedupMergeEngine(), enrichmentService, config, eventBus, clock);

        DigestResult result = pipeline.run(records);
        writeDigest(digestFile, new DigestDocument(clock.instant(), result.mergeCount(), result.enrichmentSkipped(), result.records()));
        LOGGER.info("Wrote " + result.records().size() + " records to " + digestFile);
    }

    static void writeDigest(Path file, DigestDocument document) {
        try {
            Path parent = file.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            try (OutputStream out = Files.newOutputStream(file)) {
                JsonUtils.objectMapper().writerWithDefaultPrettyPrinter().writeValue(out, document);
            }
        } catch (IOException e) {
            throw new IllegalStateException("Failed writing digest to " + file, e);
        }
    }

    record DigestDocument(Instant generatedAt, int mergeCount, boolean enrichmentSkipped, List<NewsRecord> records) {
    }
}
