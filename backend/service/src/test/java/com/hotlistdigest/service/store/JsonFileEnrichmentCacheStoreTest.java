package com.hotlistdigest.service.store;

import com.fasterxml.jackson.databind.JsonNode;
import com.hotlistdigest.core.model.CacheEntry;
import com.hotlistdigest.core.util.JsonUtils;
import com.hotlistdigest.enrichment.api.CacheStoreException;
import org.junit.jupiter.api.Test;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class JsonFileEnrichmentCacheStoreTest {
    private static final Instant FETCHED = Instant.parse("2026-03-01T12:00:00Z");
    private static final Instant PUBLISHED = Instant.parse("2026-03-01T08:00:00Z");

    @Test
    void roundTripPersistsAndReloadsEntries() throws Exception {
        Path file = Files.createTempDirectory("cache-roundtrip-").resolve("state/publish_time_cache.json");

        JsonFileEnrichmentCacheStore first = new JsonFileEnrichmentCacheStore(file);
        first.put("u:https://a.example/1", CacheEntry.found(PUBLISHED, FETCHED));
        first.put("t:quiet story", CacheEntry.notFound(FETCHED));

        JsonFileEnrichmentCacheStore second = new JsonFileEnrichmentCacheStore(file);
        assertEquals(CacheEntry.found(PUBLISHED, FETCHED), second.get("u:https://a.example/1").orElseThrow());
        assertEquals(CacheEntry.notFound(FETCHED), second.get("t:quiet story").orElseThrow());
        assertEquals(2, second.size());
        assertFalse(second.recoveredFromCorruption());
    }

    @Test
    void fileUsesVersionedSnakeCaseLayout() throws Exception {
        Path file = Files.createTempDirectory("cache-layout-").resolve("cache.json");
        JsonFileEnrichmentCacheStore store = new JsonFileEnrichmentCacheStore(file);
        store.put("u:https://a.example/1", CacheEntry.found(PUBLISHED, FETCHED));

        JsonNode root = JsonUtils.objectMapper().readTree(Files.readString(file));
        JsonNode entry = root.path("entries").path("u:https://a.example/1");

        assertEquals(1, root.path("version").asInt());
        assertEquals("2026-03-01T08:00:00Z", entry.path("published_at").asText());
        assertEquals("2026-03-01T12:00:00Z", entry.path("fetched_at").asText());
        assertFalse(entry.path("is_miss").asBoolean());
        assertFalse(entry.has("hit"));
        assertFalse(Files.exists(file.resolveSibling("cache.json.tmp")));
    }

    @Test
    void missingFileStartsEmpty() throws Exception {
        Path file = Files.createTempDirectory("cache-missing-").resolve("state/missing.json");

        JsonFileEnrichmentCacheStore store = new JsonFileEnrichmentCacheStore(file);

        assertEquals(0, store.size());
        assertFalse(store.recoveredFromCorruption());
        assertFalse(Files.exists(file));
    }

    @Test
    void emptyFileRecoversAsEmptyCache() throws Exception {
        Path file = Files.createTempDirectory("cache-empty-").resolve("cache.json");
        Files.writeString(file, "");

        JsonFileEnrichmentCacheStore store = new JsonFileEnrichmentCacheStore(file);

        assertEquals(0, store.size());
        assertTrue(store.recoveredFromCorruption());
    }

    @Test
    void corruptFileRecoversAndIsReplacedOnNextWrite() throws Exception {
        Path file = Files.createTempDirectory("cache-corrupt-").resolve("cache.json");
        Files.writeString(file, "{ this is not valid json }");

        JsonFileEnrichmentCacheStore store = new JsonFileEnrichmentCacheStore(file);
        assertTrue(store.recoveredFromCorruption());
        assertEquals(0, store.size());

        store.put("u:https://a.example/1", CacheEntry.found(PUBLISHED, FETCHED));

        JsonFileEnrichmentCacheStore reloaded = new JsonFileEnrichmentCacheStore(file);
        assertFalse(reloaded.recoveredFromCorruption());
        assertEquals(1, reloaded.size());
    }

    @Test
    void fileWithoutEntriesSectionIsTreatedAsCorrupt() throws Exception {
        Path file = Files.createTempDirectory("cache-no-entries-").resolve("cache.json");
        Files.writeString(file, "{\"version\":1}");

        JsonFileEnrichmentCacheStore store = new JsonFileEnrichmentCacheStore(file);

        assertTrue(store.recoveredFromCorruption());
        assertEquals(0, store.size());
    }

    @Test
    void putOverwritesSameSignatureAndKeepsOthers() throws Exception {
        Path file = Files.createTempDirectory("cache-overwrite-").resolve("cache.json");
        JsonFileEnrichmentCacheStore store = new JsonFileEnrichmentCacheStore(file);

        store.put("u:https://a.example/1", CacheEntry.notFound(FETCHED));
        store.put("u:https://b.example/2", CacheEntry.found(PUBLISHED, FETCHED));
        store.put("u:https://a.example/1", CacheEntry.found(PUBLISHED, FETCHED.plusSeconds(60)));

        JsonFileEnrichmentCacheStore reloaded = new JsonFileEnrichmentCacheStore(file);
        assertEquals(CacheEntry.found(PUBLISHED, FETCHED.plusSeconds(60)), reloaded.get("u:https://a.example/1").orElseThrow());
        assertEquals(CacheEntry.found(PUBLISHED, FETCHED), reloaded.get("u:https://b.example/2").orElseThrow());
        assertEquals(2, reloaded.size());
    }

    @Test
    void concurrentPutsProduceValidFileWithAllSignatures() throws Exception {
        Path file = Files.createTempDirectory("cache-concurrent-").resolve("cache.json");
        JsonFileEnrichmentCacheStore store = new JsonFileEnrichmentCacheStore(file);

        int total = 50;
        ExecutorService executor = Executors.newFixedThreadPool(8);
        try {
            Future<?>[] futures = new Future<?>[total];
            for (int i = 0; i < total; i++) {
                int idx = i;
                futures[i] = executor.submit(() -> store.put(
                        "u:https://example.com/" + idx,
                        CacheEntry.found(PUBLISHED.plusSeconds(idx), FETCHED)
                ));
            }
            for (Future<?> future : futures) {
                future.get();
            }
        } finally {
            executor.shutdown();
            executor.awaitTermination(5, TimeUnit.SECONDS);
        }

        JsonNode parsed = JsonUtils.objectMapper().readTree(Files.readString(file));
        assertEquals(total, parsed.path("entries").size());

        JsonFileEnrichmentCacheStore reloaded = new JsonFileEnrichmentCacheStore(file);
        for (int i = 0; i < total; i++) {
            assertEquals(PUBLISHED.plusSeconds(i), reloaded.get("u:https://example.com/" + i).orElseThrow().publishedAt());
        }
    }

    @Test
    void unwritableTargetFailsAndLeavesMemoryUnchanged() throws Exception {
        Path tempDir = Files.createTempDirectory("cache-unwritable-");
        Path blocker = tempDir.resolve("not-a-dir");
        Files.writeString(blocker, "blocker");

        JsonFileEnrichmentCacheStore store = new JsonFileEnrichmentCacheStore(blocker.resolve("cache.json"));

        CacheStoreException ex = assertThrows(
                CacheStoreException.class,
                () -> store.put("u:https://a.example/1", CacheEntry.notFound(FETCHED))
        );
        assertTrue(ex.getMessage().contains("Failed writing enrichment cache"));
        assertEquals(0, store.size());
        assertTrue(store.get("u:https://a.example/1").isEmpty());
    }
}
