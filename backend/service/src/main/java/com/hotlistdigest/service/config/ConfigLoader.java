package com.hotlistdigest.service.config;

import com.fasterxml.jackson.core.type.TypeReference;
import com.hotlistdigest.core.model.NewsRecord;
import com.hotlistdigest.core.util.JsonUtils;
import com.hotlistdigest.enrichment.config.EnrichmentConfig;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

public final class ConfigLoader {
    public static final String ENRICHMENT_FILE = "enrichment.json";

    private ConfigLoader() {
    }

    public static EnrichmentConfig loadEnrichment(Path configDir) {
        return read(configDir.resolve(ENRICHMENT_FILE), "config", new TypeReference<>() {
        });
    }

    public static EnrichmentConfig loadEnrichmentOrDefaults(Path configDir) {
        if (!Files.exists(configDir.resolve(ENRICHMENT_FILE))) {
            return EnrichmentConfig.defaults();
        }
        return loadEnrichment(configDir);
    }

    public static List<NewsRecord> loadRecords(Path recordsFile) {
        return read(recordsFile, "records", new TypeReference<>() {
        });
    }

    private static <T> T read(Path path, String what, TypeReference<T> ref) {
        try (InputStream in = Files.newInputStream(path)) {
            return JsonUtils.objectMapper().readValue(in, ref);
        } catch (IOException | IllegalArgumentException e) {
            throw new IllegalStateException("Failed loading " + what + " from " + path, e);
        }
    }
}
