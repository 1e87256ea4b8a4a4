package com.hotlistdigest.enrichment.publish;

import com.hotlistdigest.core.model.EnrichmentSummary;
import com.hotlistdigest.core.model.NewsRecord;

import java.util.List;

public record EnrichmentRun(List<NewsRecord> records, EnrichmentSummary summary) {
}
