package com.dubbi.hostmaster.portal.session;

import com.dubbi.hostmaster.portal.error.PortalTimeoutException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Caller-supplied time budget for one workflow, checked at every request and rate-limit wait.
 */
public final class Deadline {
    private static final Deadline NONE = new Deadline(null, Clock.systemUTC());

    private final Instant expiresAt;
    private final Clock clock;

    private Deadline(Instant expiresAt, Clock clock) {
        this.expiresAt = expiresAt;
        this.clock = clock;
    }

    public static Deadline none() {
        return NONE;
    }

    public static Deadline after(Duration budget) {
        return after(budget, Clock.systemUTC());
    }

    public static Deadline after(Duration budget, Clock clock) {
        return new Deadline(clock.instant().plus(budget), clock);
    }

    public boolean isBounded() {
        return expiresAt != null;
    }

    /**
     * Remaining time, never negative. Unbounded deadlines report {@code Duration.ofMillis(Long.MAX_VALUE)},
     * which does not fit in nanoseconds; check {@link #isBounded()} before converting.
     */
    public Duration remaining() {
        if (expiresAt == null) return Duration.ofMillis(Long.MAX_VALUE);
        Duration left = Duration.between(clock.instant(), expiresAt);
        return left.isNegative() ? Duration.ZERO : left;
    }

    public void check(String stage) {
        if (expiresAt != null && !clock.instant().isBefore(expiresAt)) {
            throw new PortalTimeoutException("deadline expired before " + stage);
        }
    }
}
