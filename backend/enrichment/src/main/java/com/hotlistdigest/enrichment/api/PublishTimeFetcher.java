package com.hotlistdigest.enrichment.api;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

public interface PublishTimeFetcher {
    Optional<Instant> fetch(String url, Duration timeout);
}
