package com.hotlistdigest.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.hotlistdigest.core.signature.SignatureExtractor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

public record NewsRecord(
        String title,
        String url,
        String mobileUrl,
        List<String> sourceNames,
        List<RankObservation> rankTimeline,
        int bestRank,
        int observedCount,
        @JsonProperty("isNew") boolean isNew,
        Instant publishedAt
) {
    public NewsRecord {
        title = title == null ? "" : title;
        sourceNames = sourceNames == null ? List.of() : List.copyOf(sourceNames);
        rankTimeline = rankTimeline == null ? List.of() : List.copyOf(rankTimeline);
        if (bestRank <= 0 && !rankTimeline.isEmpty()) {
            bestRank = rankTimeline.stream().mapToInt(RankObservation::rank).min().orElse(bestRank);
        }
        if (observedCount <= 0) {
            observedCount = Math.max(1, rankTimeline.size());
        }
    }

    public static NewsRecord observed(
            String title,
            String url,
            String mobileUrl,
            String source,
            int rank,
            Instant observedAt,
            boolean isNew,
            Instant publishedAt
    ) {
        return new NewsRecord(
                title,
                url,
                mobileUrl,
                List.of(source),
                List.of(new RankObservation(source, rank, observedAt)),
                rank,
                1,
                isNew,
                publishedAt
        );
    }

    public String signature() {
        return SignatureExtractor.standard().signatureOf(this);
    }

    public boolean hasUrl() {
        return isPresent(url);
    }

    public boolean hasMobileUrl() {
        return isPresent(mobileUrl);
    }

    public NewsRecord withPublishedAt(Instant value) {
        return new NewsRecord(title, url, mobileUrl, sourceNames, rankTimeline, bestRank, observedCount, isNew, value);
    }

    public NewsRecord absorb(NewsRecord loser) {
        List<String> sources = new ArrayList<>(sourceNames);
        for (String source : loser.sourceNames()) {
            if (!sources.contains(source)) {
                sources.add(source);
            }
        }
        List<RankObservation> timeline = new ArrayList<>(rankTimeline);
        timeline.addAll(loser.rankTimeline());
        timeline.sort(Comparator.comparing(RankObservation::observedAt, Comparator.nullsLast(Comparator.naturalOrder())));

        return new NewsRecord(
                title,
                hasUrl() ? url : loser.url(),
                hasMobileUrl() ? mobileUrl : loser.mobileUrl(),
                sources,
                timeline,
                Math.min(bestRank, loser.bestRank()),
                observedCount + loser.observedCount(),
                isNew || loser.isNew(),
                publishedAt != null ? publishedAt : loser.publishedAt()
        );
    }

    private static boolean isPresent(String value) {
        return value != null && !value.isBlank();
    }
}
