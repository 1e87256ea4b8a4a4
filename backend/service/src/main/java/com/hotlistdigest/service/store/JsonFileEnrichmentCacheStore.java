package com.hotlistdigest.service.store;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.hotlistdigest.core.model.CacheEntry;
import com.hotlistdigest.core.util.JsonUtils;
import com.hotlistdigest.enrichment.api.CacheStoreException;
import com.hotlistdigest.enrichment.api.EnrichmentCacheStore;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.logging.Level;
import java.util.logging.Logger;

public final class JsonFileEnrichmentCacheStore implements EnrichmentCacheStore {
    private static final Logger LOGGER = Logger.getLogger(JsonFileEnrichmentCacheStore.class.getName());
    private static final ObjectMapper MAPPER = JsonUtils.objectMapper();
    private static final int FORMAT_VERSION = 1;

    private final Path file;
    private final ReentrantLock lock = new ReentrantLock();
    private final Map<String, CacheEntry> bySignature = new HashMap<>();
    private final boolean recoveredFromCorruption;

    public JsonFileEnrichmentCacheStore(Path file) {
        this.file = file;
        this.recoveredFromCorruption = !load();
    }

    @Override
    public Optional<CacheEntry> get(String signature) {
        lock.lock();
        try {
            return Optional.ofNullable(bySignature.get(signature));
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void put(String signature, CacheEntry entry) {
        lock.lock();
        try {
            CacheEntry previous = bySignature.put(signature, entry);
            try {
                persist();
            } catch (CacheStoreException e) {
                if (previous == null) {
                    bySignature.remove(signature);
                } else {
                    bySignature.put(signature, previous);
                }
                throw e;
            }
        } finally {
            lock.unlock();
        }
    }

    @Override
    public int size() {
        lock.lock();
        try {
            return bySignature.size();
        } finally {
            lock.unlock();
        }
    }

    public boolean recoveredFromCorruption() {
        return recoveredFromCorruption;
    }

    public Path file() {
        return file;
    }

    private boolean load() {
        lock.lock();
        try {
            if (!Files.exists(file)) {
                return true;
            }
            try (InputStream in = Files.newInputStream(file)) {
                CacheFile loaded = MAPPER.readValue(in, CacheFile.class);
                if (loaded == null || loaded.entries() == null) {
                    throw new IOException("Cache file has no entries section");
                }
                loaded.entries().forEach((signature, entry) -> {
                    if (signature != null && entry != null) {
                        bySignature.put(signature, entry);
                    }
                });
                return true;
            }
        } catch (IOException | RuntimeException e) {
            bySignature.clear();
            LOGGER.log(Level.WARNING, "Enrichment cache at " + file + " is unreadable; starting empty", e);
            return false;
        } finally {
            lock.unlock();
        }
    }

    private void persist() {
        try {
            Path parent = file.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Path tmp = file.resolveSibling(file.getFileName() + ".tmp");
            MAPPER.writerWithDefaultPrettyPrinter().writeValue(tmp.toFile(), new CacheFile(FORMAT_VERSION, new TreeMap<>(bySignature)));
            Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (IOException e) {
            throw new CacheStoreException("Failed writing enrichment cache to " + file, e);
        }
    }

    private record CacheFile(int version, Map<String, CacheEntry> entries) {
    }
}
