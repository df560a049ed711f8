package com.example.compliance.service;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

class ResilientCallerTest {

    private final List<Duration> sleeps = new ArrayList<>();
    private final ResilientCaller caller = new ResilientCaller(3, Duration.ofMillis(100), sleeps::add);

    @Test
    @DisplayName("Fails twice then succeeds: returns the result after backoff of base*1 then base*2")
    void failsTwiceThenSucceeds() {
        // Given
        AtomicInteger attempts = new AtomicInteger();

        // When
        String result = caller.call("test", () -> {
            if (attempts.incrementAndGet() < 3) {
                throw new IllegalStateException("transient failure " + attempts.get());
            }
            return "ok";
        });

        // Then
        assertEquals("ok", result);
        assertEquals(3, attempts.get());
        assertThat(sleeps).containsExactly(Duration.ofMillis(100), Duration.ofMillis(200));
    }

    @Test
    @DisplayName("Exhausted retries rethrow the last failure unchanged")
    void rethrowsLastFailureUnchanged() {
        // Given
        AtomicInteger attempts = new AtomicInteger();
        List<RuntimeException> thrown = new ArrayList<>();

        // When
        RuntimeException error = assertThrows(RuntimeException.class, () -> caller.call("test", () -> {
            RuntimeException e = new IllegalArgumentException("failure " + attempts.incrementAndGet());
            thrown.add(e);
            throw e;
        }));

        // Then
        assertSame(thrown.get(2), error);
        assertEquals(3, attempts.get());
        assertThat(sleeps).hasSize(2);
    }

    @Test
    @DisplayName("First-attempt success does not sleep")
    void successWithoutRetry() {
        assertEquals(42, caller.call("test", () -> 42));
        assertTrue(sleeps.isEmpty());
    }

    @Test
    @DisplayName("Delay doubles with each 0-based attempt index")
    void delayIsExponential() {
        assertEquals(Duration.ofMillis(100), caller.delayFor(0));
        assertEquals(Duration.ofMillis(200), caller.delayFor(1));
        assertEquals(Duration.ofMillis(400), caller.delayFor(2));
    }

    @Test
    @DisplayName("Interrupted backoff stops retrying and keeps the interrupt flag")
    void interruptedBackoffStops() {
        // Given
        ResilientCaller interrupting = new ResilientCaller(5, Duration.ofMillis(10), d -> {
            throw new InterruptedException("stop");
        });
        AtomicInteger attempts = new AtomicInteger();

        // When
        assertThrows(IllegalStateException.class, () -> interrupting.call("test", () -> {
            attempts.incrementAndGet();
            throw new IllegalStateException("down");
        }));

        // Then
        assertEquals(1, attempts.get());
        assertTrue(Thread.interrupted());
    }

    @Test
    @DisplayName("At least one attempt is required")
    void rejectsZeroAttempts() {
        assertThrows(IllegalArgumentException.class, () -> new ResilientCaller(0, Duration.ZERO));
    }
}
