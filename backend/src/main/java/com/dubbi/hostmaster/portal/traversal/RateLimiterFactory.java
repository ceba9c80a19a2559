package com.dubbi.hostmaster.portal.traversal;

import com.dubbi.hostmaster.portal.session.Deadline;
import java.time.Duration;

/**
 * Creates one limiter per listing traversal.
 */
@FunctionalInterface
public interface RateLimiterFactory {
    RateLimiter forTraversal(Deadline deadline);

    static RateLimiterFactory system(Duration interval) {
        return deadline -> new IntervalRateLimiter(interval, System::nanoTime, Sleeper.SYSTEM, deadline);
    }
}
