package com.drivekb.runtime;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Absolute point in time by which a request must complete. Created once per caller request and
 * handed to the embedding call and both index sub-queries.
 */
public final class Deadline {
    private final Clock clock;
    private final Duration budget;
    private final Instant expiresAt;

    private Deadline(Clock clock, Duration budget) {
        this.clock = clock;
        this.budget = budget;
        this.expiresAt = clock.instant().plus(budget);
    }

    public static Deadline after(Duration budget) {
        return after(budget, Clock.systemUTC());
    }

    public static Deadline after(Duration budget, Clock clock) {
        if (budget.isNegative()) {
            throw new IllegalArgumentException("deadline budget must not be negative: " + budget);
        }
        return new Deadline(clock, budget);
    }

    public Duration budget() {
        return budget;
    }

    public Duration remaining() {
        Duration remaining = Duration.between(clock.instant(), expiresAt);
        return remaining.isNegative() ? Duration.ZERO : remaining;
    }

    public boolean isExpired() {
        return !clock.instant().isBefore(expiresAt);
    }

    /**
     * The shorter of {@code limit} and the remaining budget.
     */
    public Duration cap(Duration limit) {
        Duration remaining = remaining();
        return limit.compareTo(remaining) < 0 ? limit : remaining;
    }

    @Override
    public String toString() {
        return "Deadline{" +
                "budget=" + budget +
                ", expiresAt=" + expiresAt +
                '}';
    }
}
