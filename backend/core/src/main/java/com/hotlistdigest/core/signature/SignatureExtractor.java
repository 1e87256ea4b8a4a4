package com.hotlistdigest.core.signature;

import com.hotlistdigest.core.model.NewsRecord;

import java.util.List;
import java.util.Optional;

public final class SignatureExtractor {
    private static final SignatureExtractor STANDARD = new SignatureExtractor(List.of(
            new UrlSignatureStrategy(),
            new TitleSignatureStrategy()
    ));

    private final List<SignatureStrategy> strategies;

    public SignatureExtractor(List<SignatureStrategy> strategies) {
        if (strategies == null || strategies.isEmpty()) {
            throw new IllegalArgumentException("At least one signature strategy is required");
        }
        this.strategies = List.copyOf(strategies);
    }

    public static SignatureExtractor standard() {
        return STANDARD;
    }

    public String signatureOf(NewsRecord record) {
        for (SignatureStrategy strategy : strategies) {
            Optional<String> signature = strategy.signatureOf(record);
            if (signature.isPresent()) {
                return signature.get();
            }
        }
        return TitleSignatureStrategy.PREFIX;
    }
}
