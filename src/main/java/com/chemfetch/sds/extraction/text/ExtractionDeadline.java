package com.chemfetch.sds.extraction.text;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Wall-clock budget shared by all stages of one extraction run. Checked
 * between pages and between stages; an interrupted thread counts as expired.
 */
public final class ExtractionDeadline {

    private final Clock clock;

    private final Instant end;

    private ExtractionDeadline(final Clock clock, final Instant end) {
        this.clock = clock;
        this.end = end;
    }

    public static ExtractionDeadline after(final Clock clock, final Duration budget) {
        return new ExtractionDeadline(clock, clock.instant().plus(budget));
    }

    public static ExtractionDeadline none() {
        return new ExtractionDeadline(Clock.systemUTC(), Instant.MAX);
    }

    public boolean expired() {
        return Thread.currentThread().isInterrupted() || clock.instant().isAfter(end);
    }
}
