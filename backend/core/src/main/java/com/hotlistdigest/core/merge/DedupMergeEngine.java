package com.hotlistdigest.core.merge;

import com.hotlistdigest.core.model.NewsRecord;
import com.hotlistdigest.core.signature.SignatureExtractor;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public class DedupMergeEngine {
    private final SignatureExtractor signatureExtractor;

    public DedupMergeEngine() {
        this(SignatureExtractor.standard());
    }

    public DedupMergeEngine(SignatureExtractor signatureExtractor) {
        this.signatureExtractor = signatureExtractor;
    }

    public MergeResult dedupeAndMerge(List<NewsRecord> records) {
        Map<String, NewsRecord> bySignature = new LinkedHashMap<>();
        int folded = 0;
        for (NewsRecord record : records) {
            // Nulls are dropped before counting, so they never show up in mergeCount.
            if (record == null) {
                continue;
            }
            String signature = signatureExtractor.signatureOf(record);
            NewsRecord incumbent = bySignature.get(signature);
            if (incumbent == null) {
                bySignature.put(signature, record);
                continue;
            }
            bySignature.put(signature, ReplacementPriority.fold(incumbent, record));
            folded++;
        }
        return new MergeResult(new ArrayList<>(bySignature.values()), folded);
    }
}
