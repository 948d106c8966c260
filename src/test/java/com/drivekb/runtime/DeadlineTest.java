package com.drivekb.runtime;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Duration;
import java.time.Instant;

import org.junit.jupiter.api.Test;

class DeadlineTest {

    @Test
    void shouldCountDownAgainstClock() {
        MutableClock clock = new MutableClock(Instant.parse("2024-05-01T00:00:00Z"));
        Deadline deadline = Deadline.after(Duration.ofSeconds(2), clock);

        clock.advance(Duration.ofMillis(500));

        assertFalse(deadline.isExpired());
        assertEquals(Duration.ofMillis(1500), deadline.remaining());
        assertEquals(Duration.ofMillis(100), deadline.cap(Duration.ofMillis(100)));
        assertEquals(Duration.ofMillis(1500), deadline.cap(Duration.ofSeconds(5)));

        clock.advance(Duration.ofMillis(1500));

        assertTrue(deadline.isExpired());
        assertEquals(Duration.ZERO, deadline.remaining());
    }

    @Test
    void shouldRejectNegativeBudget() {
        assertThrows(IllegalArgumentException.class, () -> Deadline.after(Duration.ofMillis(-1)));
    }
}
