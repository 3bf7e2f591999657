package com.example.guildmusic.commands;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashMap;
import java.util.Iterator;
import java.util.Map;

/**
 * Sliding window limit on how many commands one user may run.
 */
public class RateLimiter {
    private final int maxCalls;
    private final Duration period;
    private final Clock clock;
    private final Map<Long, Deque<Instant>> calls = new HashMap<>();
    private Instant lastSweep;

    public RateLimiter(int maxCalls, Duration period) {
        this(maxCalls, period, Clock.systemUTC());
    }

    public RateLimiter(int maxCalls, Duration period, Clock clock) {
        if (maxCalls < 1) {
            throw new IllegalArgumentException("maxCalls must be at least 1");
        }
        this.maxCalls = maxCalls;
        this.period = period;
        this.clock = clock;
        this.lastSweep = clock.instant();
    }

    /**
     * Records a call unless the user is over the limit.
     *
     * @return true if the user has to wait; the call is not recorded then
     */
    public synchronized boolean isLimited(long userId) {
        Instant now = clock.instant();
        sweep(now);
        Deque<Instant> userCalls = calls.computeIfAbsent(userId, id -> new ArrayDeque<>());
        evictExpired(userCalls, now);
        if (userCalls.size() >= maxCalls) {
            return true;
        }
        userCalls.addLast(now);
        return false;
    }

    /**
     * @return whole seconds until the oldest recorded call leaves the window, 0 if none
     */
    public synchronized long getRetryAfterSeconds(long userId) {
        Deque<Instant> userCalls = calls.get(userId);
        if (userCalls == null) {
            return 0;
        }
        Instant now = clock.instant();
        evictExpired(userCalls, now);
        if (userCalls.isEmpty()) {
            calls.remove(userId);
            return 0;
        }
        Duration remaining = Duration.between(now, userCalls.peekFirst().plus(period));
        // Round up so "retry in 0s" is never shown while still limited
        long seconds = remaining.getSeconds() + (remaining.getNano() > 0 ? 1 : 0);
        return Math.max(0, seconds);
    }

    synchronized int getTrackedUsers() {
        return calls.size();
    }

    /**
     * Forgets users with no call left in the window. Runs at most once per period.
     */
    private void sweep(Instant now) {
        if (Duration.between(lastSweep, now).compareTo(period) < 0) {
            return;
        }
        lastSweep = now;
        Iterator<Deque<Instant>> it = calls.values().iterator();
        while (it.hasNext()) {
            Deque<Instant> userCalls = it.next();
            evictExpired(userCalls, now);
            if (userCalls.isEmpty()) {
                it.remove();
            }
        }
    }

    private void evictExpired(Deque<Instant> userCalls, Instant now) {
        Instant cutoff = now.minus(period);
        while (!userCalls.isEmpty() && !userCalls.peekFirst().isAfter(cutoff)) {
            userCalls.removeFirst();
        }
    }
}
