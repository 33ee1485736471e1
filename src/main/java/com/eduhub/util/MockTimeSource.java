package com.eduhub.util;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Controllable time source for tests of date-relative queries.
 */
public final class MockTimeSource implements TimeSource {
    private final AtomicLong nanoTime;
    private final AtomicReference<Instant> instant;

    public MockTimeSource(long initialNanos, Instant initialInstant) {
        this.nanoTime = new AtomicLong(initialNanos);
        this.instant = new AtomicReference<>(initialInstant);
    }

    @Override
    public long nanoTime() {
        return nanoTime.get();
    }

    @Override
    public Instant now() {
        return instant.get();
    }

    /**
     * Moves both clocks forward by the specified duration.
     */
    public void advance(Duration duration) {
        nanoTime.addAndGet(duration.toNanos());
        instant.updateAndGet(i -> i.plus(duration));
    }
}
