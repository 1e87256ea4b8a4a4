package com.hotlistdigest.enrichment.publish;

import com.hotlistdigest.core.model.CacheEntry;
import com.hotlistdigest.core.model.EnrichmentSummary;
import com.hotlistdigest.core.model.NewsRecord;
import com.hotlistdigest.core.signature.SignatureExtractor;
import com.hotlistdigest.core.signature.TitleSignatureStrategy;
import com.hotlistdigest.enrichment.api.EnrichmentCacheStore;
import com.hotlistdigest.enrichment.api.PublishTimeFetcher;
import com.hotlistdigest.enrichment.config.EnrichmentConfig;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.logging.Logger;

public class PublishTimeEnrichmentService {
    private static final Logger LOGGER = Logger.getLogger(PublishTimeEnrichmentService.class.getName());

    private final EnrichmentCacheStore cacheStore;
    private final PublishTimeFetcher fetcher;
    private final Clock clock;
    private final SignatureExtractor signatureExtractor;

    public PublishTimeEnrichmentService(EnrichmentCacheStore cacheStore, PublishTimeFetcher fetcher, Clock clock) {
        this(cacheStore, fetcher, clock, SignatureExtractor.standard());
    }

    public PublishTimeEnrichmentService(
            EnrichmentCacheStore cacheStore,
            PublishTimeFetcher fetcher,
            Clock clock,
            SignatureExtractor signatureExtractor
    ) {
        this.cacheStore = cacheStore;
        this.fetcher = fetcher;
        this.clock = clock;
        this.signatureExtractor = signatureExtractor;
    }

    public List<NewsRecord> enrich(List<NewsRecord> records, EnrichmentConfig config) {
        return run(records, config).records();
    }

    public EnrichmentRun run(List<NewsRecord> records, EnrichmentConfig config) {
        if (!config.enabled()) {
            return new EnrichmentRun(Collections.unmodifiableList(new ArrayList<>(records)), EnrichmentSummary.disabled(records.size()));
        }

        List<NewsRecord> output = new ArrayList<>(records);
        Tally tally = new Tally(records.size());
        Map<String, PendingFetch> pending = new LinkedHashMap<>();
        Instant now = clock.instant();

        for (int i = 0; i < records.size(); i++) {
            NewsRecord record = records.get(i);
            if (record == null) {
                continue;
            }
            if (record.publishedAt() != null) {
                tally.alreadyPublished++;
                continue;
            }
            Optional<String> url = fetchUrlOf(record);
            if (url.isEmpty()) {
                tally.noUrl++;
                continue;
            }
            String signature = signatureExtractor.signatureOf(record);
            if (!isCacheable(signature)) {
                // Bare fallback key is shared by unrelated stories: fetch alone, never cache.
                List<Integer> indices = new ArrayList<>();
                indices.add(i);
                pending.put("#" + i, new PendingFetch(signature, url.get(), indices, false));
                continue;
            }
            PendingFetch queued = pending.get(signature);
            if (queued != null) {
                queued.indices().add(i);
                continue;
            }
            Optional<CacheEntry> cached = cacheStore.get(signature);
            if (cached.isPresent() && !cacheStore.isExpired(cached.get(), now, config.missTtlHours())) {
                CacheEntry entry = cached.get();
                if (entry.isHit()) {
                    output.set(i, record.withPublishedAt(entry.publishedAt()));
                    tally.cacheHits++;
                    tally.enriched++;
                } else {
                    tally.cacheRecentMisses++;
                }
                continue;
            }
            List<Integer> indices = new ArrayList<>();
            indices.add(i);
            pending.put(signature, new PendingFetch(signature, url.get(), indices, true));
        }

        tally.pendingFetches = pending.size();
        if (!pending.isEmpty()) {
            fetchAll(new ArrayList<>(pending.values()), output, config, tally);
        }
        return new EnrichmentRun(Collections.unmodifiableList(output), tally.toSummary());
    }

    private void fetchAll(List<PendingFetch> pending, List<NewsRecord> output, EnrichmentConfig config, Tally tally) {
        FetchBudget budget = new FetchBudget(config.maxFetchPerRun());
        List<PendingFetch> scheduled = new ArrayList<>();
        for (PendingFetch fetch : pending) {
            if (budget.tryAcquire()) {
                scheduled.add(fetch);
            } else {
                tally.skippedByBudget++;
            }
        }
        if (scheduled.isEmpty()) {
            return;
        }

        int workers = Math.min(config.maxWorkers(), scheduled.size());
        ExecutorService pool = Executors.newFixedThreadPool(workers, fetchThreadFactory());
        CompletionService<FetchOutcome> completion = new ExecutorCompletionService<>(pool);
        Map<Future<FetchOutcome>, PendingFetch> inFlight = new HashMap<>();
        try {
            for (PendingFetch fetch : scheduled) {
                inFlight.put(completion.submit(() -> fetchOne(fetch, config.requestTimeout())), fetch);
            }
            drain(completion, inFlight, output, config.phaseTimeout(), tally);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } finally {
            for (Future<FetchOutcome> abandoned : inFlight.keySet()) {
                abandoned.cancel(true);
            }
            tally.abandoned += inFlight.size();
            pool.shutdownNow();
        }
    }

    private void drain(
            CompletionService<FetchOutcome> completion,
            Map<Future<FetchOutcome>, PendingFetch> inFlight,
            List<NewsRecord> output,
            Duration phaseTimeout,
            Tally tally
    ) throws InterruptedException {
        long deadline = phaseTimeout == null ? 0 : System.nanoTime() + phaseTimeout.toNanos();
        while (!inFlight.isEmpty()) {
            Future<FetchOutcome> done;
            if (phaseTimeout == null) {
                done = completion.take();
            } else {
                long remaining = deadline - System.nanoTime();
                done = remaining <= 0 ? null : completion.poll(remaining, TimeUnit.NANOSECONDS);
                if (done == null) {
                    applyCompleted(completion, inFlight, output, tally);
                    if (!inFlight.isEmpty()) {
                        LOGGER.info(() -> "Publish-time phase deadline reached; abandoning " + inFlight.size() + " fetches");
                    }
                    return;
                }
            }
            PendingFetch fetch = inFlight.remove(done);
            apply(fetch, outcomeOf(done), output, tally);
        }
    }

    // Fetches that finished before the deadline are kept even if their turn to be applied comes late.
    private void applyCompleted(
            CompletionService<FetchOutcome> completion,
            Map<Future<FetchOutcome>, PendingFetch> inFlight,
            List<NewsRecord> output,
            Tally tally
    ) {
        Future<FetchOutcome> ready;
        while ((ready = completion.poll()) != null) {
            PendingFetch fetch = inFlight.remove(ready);
            apply(fetch, outcomeOf(ready), output, tally);
        }
    }

    private void apply(PendingFetch fetch, FetchOutcome outcome, List<NewsRecord> output, Tally tally) {
        Instant fetchedAt = clock.instant();
        if (outcome.publishedAt() == null) {
            if (fetch.cacheable()) {
                cacheStore.put(fetch.signature(), CacheEntry.notFound(fetchedAt));
            }
            tally.fetchedFailure++;
            LOGGER.fine(() -> "No publish time for " + fetch.url() + ": " + outcome.reason());
            return;
        }
        if (fetch.cacheable()) {
            cacheStore.put(fetch.signature(), CacheEntry.found(outcome.publishedAt(), fetchedAt));
        }
        tally.fetchedSuccess++;
        for (int index : fetch.indices()) {
            output.set(index, output.get(index).withPublishedAt(outcome.publishedAt()));
            tally.enriched++;
        }
    }

    private FetchOutcome fetchOne(PendingFetch fetch, Duration timeout) {
        try {
            return fetcher.fetch(fetch.url(), timeout)
                    .map(FetchOutcome::found)
                    .orElseGet(() -> FetchOutcome.missed("no publish time on page"));
        } catch (RuntimeException e) {
            return FetchOutcome.missed(e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage());
        }
    }

    private static FetchOutcome outcomeOf(Future<FetchOutcome> done) {
        try {
            return done.get();
        } catch (ExecutionException e) {
            return FetchOutcome.missed(String.valueOf(e.getCause()));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return FetchOutcome.missed("interrupted");
        }
    }

    private static boolean isCacheable(String signature) {
        return !TitleSignatureStrategy.PREFIX.equals(signature);
    }

    private static Optional<String> fetchUrlOf(NewsRecord record) {
        if (record.hasUrl()) {
            return Optional.of(record.url().trim());
        }
        if (record.hasMobileUrl()) {
            return Optional.of(record.mobileUrl().trim());
        }
        return Optional.empty();
    }

    private static ThreadFactory fetchThreadFactory() {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, "publish-time-fetch-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }

    private record PendingFetch(String signature, String url, List<Integer> indices, boolean cacheable) {
    }

    private record FetchOutcome(Instant publishedAt, String reason) {
        static FetchOutcome found(Instant publishedAt) {
            return new FetchOutcome(publishedAt, null);
        }

        static FetchOutcome missed(String reason) {
            return new FetchOutcome(null, reason);
        }
    }

    private static final class Tally {
        private final int recordsTotal;
        private int alreadyPublished;
        private int cacheHits;
        private int cacheRecentMisses;
        private int noUrl;
        private int pendingFetches;
        private int fetchedSuccess;
        private int fetchedFailure;
        private int skippedByBudget;
        private int abandoned;
        private int enriched;

        private Tally(int recordsTotal) {
            this.recordsTotal = recordsTotal;
        }

        private EnrichmentSummary toSummary() {
            return new EnrichmentSummary(
                    recordsTotal,
                    alreadyPublished,
                    cacheHits,
                    cacheRecentMisses,
                    noUrl,
                    pendingFetches,
                    fetchedSuccess,
                    fetchedFailure,
                    skippedByBudget,
                    abandoned,
                    enriched
            );
        }
    }
}
