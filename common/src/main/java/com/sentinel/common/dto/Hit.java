package com.sentinel.common.dto;

import java.time.Instant;

/**
 * Aggregate state for one (source, fingerprint) pair. Immutable: every
 * observation replaces the instance, so readers never see a half-applied update.
 */
public record Hit(Instant firstSeen, Instant lastSeen, long count, String sample) {

    public static Hit first(Instant now, String sample) {
        return new Hit(now, now, 1, sample);
    }

    /** The sample stays fixed at the first observation. */
    public Hit observedAgain(Instant now) {
        return new Hit(firstSeen, now, count + 1, sample);
    }
}
