package com.hotlistdigest.core.signature;

import com.hotlistdigest.core.model.NewsRecord;

import java.util.Optional;

public interface SignatureStrategy {
    Optional<String> signatureOf(NewsRecord record);
}
