package com.dubbi.hostmaster.portal.traversal;

import com.dubbi.hostmaster.portal.error.PortalTimeoutException;
import com.dubbi.hostmaster.portal.error.TransportException;
import com.dubbi.hostmaster.portal.session.Deadline;
import java.time.Duration;
import java.util.function.LongSupplier;

/**
 * 최소 요청 간격 보장.
 * 생성 시점(목록 요청 직후)을 기준으로, 매 호출은 직전 차례로부터 interval이 지날 때까지 대기한다.
 */
public class IntervalRateLimiter implements RateLimiter {
    private final long intervalNanos;
    private final LongSupplier nanoClock;
    private final Sleeper sleeper;
    private final Deadline deadline;
    private long lastTurn;

    public IntervalRateLimiter(Duration interval, LongSupplier nanoClock, Sleeper sleeper, Deadline deadline) {
        this.intervalNanos = interval.toNanos();
        this.nanoClock = nanoClock;
        this.sleeper = sleeper;
        this.deadline = deadline == null ? Deadline.none() : deadline;
        this.lastTurn = nanoClock.getAsLong();
    }

    @Override
    public void waitTurn() {
        long wait = lastTurn + intervalNanos - nanoClock.getAsLong();
        if (wait > 0) {
            if (deadline.isBounded() && deadline.remaining().compareTo(Duration.ofNanos(wait)) < 0) {
                throw new PortalTimeoutException("deadline expires during the courtesy wait");
            }
            try {
                sleeper.sleepNanos(wait);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new TransportException("interrupted while waiting between portal requests", e);
            }
        }
        deadline.check("follow-up request");
        lastTurn = nanoClock.getAsLong();
    }
}
