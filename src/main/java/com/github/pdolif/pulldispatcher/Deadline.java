package com.github.pdolif.pulldispatcher;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Point in time by which a handler invocation has to finish.
 */
public final class Deadline {

    private final Clock clock;
    private final Instant expiresAt;

    private Deadline(Clock clock, Instant expiresAt) {
        this.clock = clock;
        this.expiresAt = expiresAt;
    }

    public static Deadline after(Duration timeout) {
        return after(timeout, Clock.systemUTC());
    }

    static Deadline after(Duration timeout, Clock clock) {
        if (timeout == null) throw new IllegalArgumentException("Timeout cannot be null");
        if (clock == null) throw new IllegalArgumentException("Clock cannot be null");
        return new Deadline(clock, clock.instant().plus(timeout));
    }

    public Instant expiresAt() {
        return expiresAt;
    }

    /**
     * @return Time left until the deadline, {@link Duration#ZERO} if it has passed
     */
    public Duration remaining() {
        var remaining = Duration.between(clock.instant(), expiresAt);
        return remaining.isNegative() ? Duration.ZERO : remaining;
    }

    public boolean isExpired() {
        return !clock.instant().isBefore(expiresAt);
    }

    @Override
    public String toString() {
        return "Deadline{" +
                "expiresAt=" + expiresAt +
                '}';
    }
}
