package com.hotlistdigest.enrichment.api;

public class CacheStoreException extends IllegalStateException {
    public CacheStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
