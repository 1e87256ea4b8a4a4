package com.hotlistdigest.core.merge;

import com.hotlistdigest.core.model.NewsRecord;

import java.util.List;

public record MergeResult(List<NewsRecord> merged, int mergeCount) {
    public MergeResult {
        merged = List.copyOf(merged);
    }

    // Non-null records that went in; mergeCount is always inputCount - merged.size().
    public int inputCount() {
        return merged.size() + mergeCount;
    }
}
