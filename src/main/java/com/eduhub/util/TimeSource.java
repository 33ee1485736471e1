package com.eduhub.util;

import java.time.Duration;
import java.time.Instant;
import java.util.Date;
import java.util.Objects;

/**
 * Abstraction over time for testability.
 * Queries relative to "now" and seeding timings read time only through this interface.
 */
public sealed interface TimeSource permits SystemTimeSource, MockTimeSource {

    /**
     * Returns the current value of the running JVM's high-resolution time source, in nanoseconds.
     */
    long nanoTime();

    /**
     * Returns the current instant.
     */
    Instant now();

    /**
     * Returns the current instant as a BSON-compatible date.
     */
    default Date currentDate() {
        return Date.from(now());
    }

    /**
     * Returns the date lying {@code amount} before now.
     */
    default Date dateBefore(Duration amount) {
        return Date.from(now().minus(amount));
    }

    /**
     * Returns the date lying {@code amount} after now.
     */
    default Date dateAfter(Duration amount) {
        return Date.from(now().plus(amount));
    }

    /**
     * Starts a stopwatch backed by this time source.
     */
    default Stopwatch startStopwatch() {
        return new Stopwatch(this);
    }

    static TimeSource system() {
        return SystemTimeSource.INSTANCE;
    }

    /**
     * Returns a mock time source frozen at the specified instant.
     */
    static MockTimeSource mockAt(Instant instant) {
        return new MockTimeSource(0L, instant);
    }

    /**
     * Measures the time spent in a unit of work.
     */
    final class Stopwatch {
        private final TimeSource timeSource;
        private final long startNanos;

        Stopwatch(TimeSource timeSource) {
            this.timeSource = Objects.requireNonNull(timeSource);
            this.startNanos = timeSource.nanoTime();
        }

        public Duration elapsed() {
            return Duration.ofNanos(timeSource.nanoTime() - startNanos);
        }

        public long elapsedMillis() {
            return elapsed().toMillis();
        }
    }
}
