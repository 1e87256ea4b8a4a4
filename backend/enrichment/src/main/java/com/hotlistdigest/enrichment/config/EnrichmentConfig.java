package com.hotlistdigest.enrichment.config;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Duration;
import java.time.ZoneId;
import java.time.ZoneOffset;

public record EnrichmentConfig(
        boolean enabled,
        int maxFetchPerRun,
        Duration requestTimeout,
        int maxWorkers,
        double missTtlHours,
        Duration phaseTimeout,
        ZoneId zoneId
) {
    public static final int DEFAULT_MAX_FETCH_PER_RUN = 200;
    public static final Duration DEFAULT_REQUEST_TIMEOUT = Duration.ofSeconds(8);
    public static final int DEFAULT_MAX_WORKERS = 8;
    public static final double DEFAULT_MISS_TTL_HOURS = 24;

    public EnrichmentConfig {
        if (maxFetchPerRun < 0) {
            throw new IllegalArgumentException("maxFetchPerRun must be >= 0");
        }
        if (requestTimeout == null || requestTimeout.isZero() || requestTimeout.isNegative()) {
            throw new IllegalArgumentException("requestTimeout must be > 0");
        }
        if (maxWorkers < 1) {
            throw new IllegalArgumentException("maxWorkers must be >= 1");
        }
        if (Double.isNaN(missTtlHours) || Double.isInfinite(missTtlHours) || missTtlHours < 0) {
            throw new IllegalArgumentException("missTtlHours must be a finite number >= 0");
        }
        if (phaseTimeout != null && (phaseTimeout.isZero() || phaseTimeout.isNegative())) {
            throw new IllegalArgumentException("phaseTimeout must be > 0 when set");
        }
        zoneId = zoneId == null ? ZoneOffset.UTC : zoneId;
    }

    public static EnrichmentConfig defaults() {
        return new EnrichmentConfig(
                true,
                DEFAULT_MAX_FETCH_PER_RUN,
                DEFAULT_REQUEST_TIMEOUT,
                DEFAULT_MAX_WORKERS,
                DEFAULT_MISS_TTL_HOURS,
                null,
                ZoneOffset.UTC
        );
    }

    @JsonCreator
    static EnrichmentConfig fromJson(
            @JsonProperty("enabled") Boolean enabled,
            @JsonProperty("maxFetchPerRun") Integer maxFetchPerRun,
            @JsonProperty("requestTimeout") Duration requestTimeout,
            @JsonProperty("maxWorkers") Integer maxWorkers,
            @JsonProperty("missTtlHours") Double missTtlHours,
            @JsonProperty("phaseTimeout") Duration phaseTimeout,
            @JsonProperty("zoneId") ZoneId zoneId
    ) {
        return new EnrichmentConfig(
                enabled == null || enabled,
                maxFetchPerRun == null ? DEFAULT_MAX_FETCH_PER_RUN : maxFetchPerRun,
                requestTimeout == null ? DEFAULT_REQUEST_TIMEOUT : requestTimeout,
                maxWorkers == null ? DEFAULT_MAX_WORKERS : maxWorkers,
                missTtlHours == null ? DEFAULT_MISS_TTL_HOURS : missTtlHours,
                phaseTimeout,
                zoneId
        );
    }

    public EnrichmentConfig withEnabled(boolean value) {
        return new EnrichmentConfig(value, maxFetchPerRun, requestTimeout, maxWorkers, missTtlHours, phaseTimeout, zoneId);
    }

    public EnrichmentConfig withMaxFetchPerRun(int value) {
        return new EnrichmentConfig(enabled, value, requestTimeout, maxWorkers, missTtlHours, phaseTimeout, zoneId);
    }

    public EnrichmentConfig withMaxWorkers(int value) {
        return new EnrichmentConfig(enabled, maxFetchPerRun, requestTimeout, value, missTtlHours, phaseTimeout, zoneId);
    }

    public EnrichmentConfig withMissTtlHours(double value) {
        return new EnrichmentConfig(enabled, maxFetchPerRun, requestTimeout, maxWorkers, value, phaseTimeout, zoneId);
    }

    public EnrichmentConfig withRequestTimeout(Duration value) {
        return new EnrichmentConfig(enabled, maxFetchPerRun, value, maxWorkers, missTtlHours, phaseTimeout, zoneId);
    }

    public EnrichmentConfig withPhaseTimeout(Duration value) {
        return new EnrichmentConfig(enabled, maxFetchPerRun, requestTimeout, maxWorkers, missTtlHours, value, zoneId);
    }
}
