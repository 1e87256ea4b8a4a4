package com.hotlistdigest.core.merge;

import com.hotlistdigest.core.model.NewsRecord;

import java.util.Comparator;

public final class ReplacementPriority {
    static final Comparator<NewsRecord> ORDER = Comparator
            .comparingInt(NewsRecord::bestRank)
            .thenComparing(Comparator.comparingInt(NewsRecord::observedCount).reversed())
            .thenComparing(Comparator.comparingInt(ReplacementPriority::titleLength).reversed());

    private ReplacementPriority() {
    }

    public static boolean replaces(NewsRecord challenger, NewsRecord incumbent) {
        return ORDER.compare(challenger, incumbent) < 0;
    }

    public static NewsRecord fold(NewsRecord incumbent, NewsRecord challenger) {
        if (replaces(challenger, incumbent)) {
            return challenger.absorb(incumbent);
        }
        return incumbent.absorb(challenger);
    }

    private static int titleLength(NewsRecord record) {
        String title = record.title();
        return title.codePointCount(0, title.length());
    }
}
