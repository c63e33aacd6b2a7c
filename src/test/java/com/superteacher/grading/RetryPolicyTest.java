package com.superteacher.grading;

import com.typesafe.config.ConfigFactory;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

public class RetryPolicyTest {

    private final List<Long> sleeps = new ArrayList<>();
    private final RetryPolicy policy = new RetryPolicy(4, Duration.ofMillis(2000), Duration.ofMillis(5000), sleeps::add);

    @Test
    void testBackoffDoublesAndIsCapped() {
        assertEquals(2000, policy.delayBefore(2));
        assertEquals(4000, policy.delayBefore(3));
        assertEquals(5000, policy.delayBefore(4));
        assertEquals(5000, policy.delayBefore(40));
    }

    @Test
    void testSucceedsWithoutSleepingOnFirstAttempt() throws Exception {
        String value = policy.execute("op", (attempt, last) -> "done");

        assertEquals("done", value);
        assertTrue(sleeps.isEmpty());
    }

    @Test
    void testRetriesUntilSuccess() throws Exception {
        AtomicInteger calls = new AtomicInteger();
        int value = policy.execute("op", (attempt, last) -> {
            if (calls.incrementAndGet() < 3) {
                throw new IOException("transient");
            }
            return attempt;
        });

        assertEquals(3, value);
        assertEquals(List.of(2000L, 4000L), sleeps);
    }

    @Test
    void testExhaustionReportsAttemptsAndLastFailure() {
        List<Boolean> lastFlags = new ArrayList<>();
        RetryExhaustedException e = assertThrows(RetryExhaustedException.class,
                () -> policy.execute("op", (attempt, last) -> {
                    lastFlags.add(last);
                    throw new IOException("down " + attempt);
                }));

        assertEquals(4, e.getAttempts());
        assertEquals("down 4", e.getCause().getMessage());
        assertEquals(List.of(false, false, false, true), lastFlags);
        // no sleep after the final attempt
        assertEquals(List.of(2000L, 4000L, 5000L), sleeps);
    }

    @Test
    void testInterruptedBackoffAbortsAndKeepsFlag() {
        RetryPolicy interrupting = new RetryPolicy(3, Duration.ofMillis(10), Duration.ofMillis(10), millis -> {
            throw new InterruptedException("stop");
        });
        AtomicInteger calls = new AtomicInteger();
        try {
            assertThrows(RetryExhaustedException.class, () -> interrupting.execute("op", (attempt, last) -> {
                calls.incrementAndGet();
                throw new IOException("fail");
            }));
            assertEquals(1, calls.get());
            assertTrue(Thread.currentThread().isInterrupted());
        } finally {
            Thread.interrupted();
        }
    }

    @Test
    void testFromConfig() {
        RetryPolicy fromConfig = RetryPolicy.fromConfig(ConfigFactory.parseString(
                "max-attempts = 5\nbase-delay = 100ms\nmax-delay = 1s"));

        assertEquals(5, fromConfig.getMaxAttempts());
        assertEquals(100, fromConfig.delayBefore(2));
        assertEquals(800, fromConfig.delayBefore(5));
    }

    @Test
    void testRejectsInvalidSettings() {
        assertThrows(IllegalArgumentException.class,
                () -> new RetryPolicy(0, Duration.ofMillis(1), Duration.ofMillis(1), millis -> { }));
    }
}
