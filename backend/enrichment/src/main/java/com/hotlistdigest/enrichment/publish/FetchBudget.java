package com.hotlistdigest.enrichment.publish;

import java.util.concurrent.atomic.AtomicInteger;

public final class FetchBudget {
    private final AtomicInteger remaining;

    public FetchBudget(int limit) {
        if (limit < 0) {
            throw new IllegalArgumentException("Fetch budget must be >= 0");
        }
        this.remaining = new AtomicInteger(limit);
    }

    public boolean tryAcquire() {
        while (true) {
            int current = remaining.get();
            if (current <= 0) {
                return false;
            }
            if (remaining.compareAndSet(current, current - 1)) {
                return true;
            }
        }
    }

    public int remaining() {
        return remaining.get();
    }
}
