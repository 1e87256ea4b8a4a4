package com.hotlistdigest.core.signature;

import com.hotlistdigest.core.model.NewsRecord;

import java.util.Optional;

public final class UrlSignatureStrategy implements SignatureStrategy {
    public static final String PREFIX = "u:";

    @Override
    public Optional<String> signatureOf(NewsRecord record) {
        String normalized = UrlNormalizer.normalize(record.url());
        return normalized.isEmpty() ? Optional.empty() : Optional.of(PREFIX + normalized);
    }
}
