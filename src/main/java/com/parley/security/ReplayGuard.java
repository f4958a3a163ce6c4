package com.parley.security;

import java.time.Clock;
import java.time.Duration;

/**
 * Rejects webhook timestamps outside the accepted age window.
 * Timestamps may be Unix seconds or milliseconds.
 */
public class ReplayGuard {

    private static final long MILLIS_THRESHOLD = 1_000_000_000_000L;

    private final Duration maxAge;
    private final Clock clock;

    public ReplayGuard(Duration maxAge, Clock clock) {
        this.maxAge = maxAge;
        this.clock = clock;
    }

    public boolean isEnabled() {
        return maxAge != null && !maxAge.isZero() && !maxAge.isNegative();
    }

    public boolean isFresh(String timestamp) {
        if (!isEnabled()) return true;
        if (timestamp == null) return false;
        long value;
        try {
            value = Long.parseLong(timestamp.trim());
        } catch (NumberFormatException e) {
            return false;
        }
        long millis = value < MILLIS_THRESHOLD ? value * 1000 : value;
        long age = clock.millis() - millis;
        return age >= 0 && age <= maxAge.toMillis();
    }
}
