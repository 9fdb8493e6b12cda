package com.jreinhal.norma.pipeline;

import java.time.Clock;

/**
 * Overall time budget of one request. Stages ask for the remaining time and short-circuit
 * to their cheaper path when it cannot cover their own timeout.
 */
public final class RequestDeadline {
    private final Clock clock;
    private final long startedAtMs;
    private final long deadlineMs;

    private RequestDeadline(Clock clock, long budgetMs) {
        this.clock = clock;
        this.startedAtMs = clock.millis();
        this.deadlineMs = this.startedAtMs + budgetMs;
    }

    public static RequestDeadline start(Clock clock, long budgetMs) {
        return new RequestDeadline(clock, budgetMs);
    }

    public static RequestDeadline unbounded() {
        return new RequestDeadline(Clock.systemUTC(), Long.MAX_VALUE / 2);
    }

    public long remainingMs() {
        return Math.max(0L, this.deadlineMs - this.clock.millis());
    }

    public long elapsedMs() {
        return this.clock.millis() - this.startedAtMs;
    }

    public boolean isExpired() {
        return this.remainingMs() <= 0L;
    }

    public boolean canAfford(long durationMs) {
        return this.remainingMs() >= durationMs;
    }
}
