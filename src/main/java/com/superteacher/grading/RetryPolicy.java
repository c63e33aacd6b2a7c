package com.superteacher.grading;

import com.typesafe.config.Config;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;

/**
 * Retry with exponential backoff for calls to external collaborators.
 *
 * <p>The delay before attempt {@code n + 1} is
 * {@code baseDelay * 2^(n - 1)}, capped at {@code maxDelay}. There is no
 * delay after the last attempt.
 */
public class RetryPolicy {
    private static final Logger logger = LoggerFactory.getLogger(RetryPolicy.class);

    public static final int DEFAULT_MAX_ATTEMPTS = 3;
    public static final Duration DEFAULT_BASE_DELAY = Duration.ofMillis(2000);
    public static final Duration DEFAULT_MAX_DELAY = Duration.ofSeconds(30);

    /**
     * Blocks between attempts. Tests substitute one that records the delays.
     */
    @FunctionalInterface
    public interface Sleeper {
        void sleep(long millis) throws InterruptedException;
    }

    /**
     * One attempt of the guarded call.
     */
    @FunctionalInterface
    public interface Attempt<T> {
        T run(int attemptNumber, boolean lastAttempt) throws Exception;
    }

    private final int maxAttempts;
    private final long baseDelayMillis;
    private final long maxDelayMillis;
    private final Sleeper sleeper;

    public RetryPolicy(int maxAttempts, Duration baseDelay, Duration maxDelay, Sleeper sleeper) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1, was " + maxAttempts);
        }
        if (baseDelay.isNegative() || maxDelay.isNegative()) {
            throw new IllegalArgumentException("delays must not be negative");
        }
        this.maxAttempts = maxAttempts;
        this.baseDelayMillis = baseDelay.toMillis();
        this.maxDelayMillis = maxDelay.toMillis();
        this.sleeper = sleeper;
    }

    public RetryPolicy(int maxAttempts, Duration baseDelay, Duration maxDelay) {
        this(maxAttempts, baseDelay, maxDelay, Thread::sleep);
    }

    public static RetryPolicy defaults() {
        return new RetryPolicy(DEFAULT_MAX_ATTEMPTS, DEFAULT_BASE_DELAY, DEFAULT_MAX_DELAY);
    }

    /**
     * Reads {@code max-attempts}, {@code base-delay} and {@code max-delay}
     * from the given config section.
     */
    public static RetryPolicy fromConfig(Config retry) {
        return new RetryPolicy(
                retry.getInt("max-attempts"),
                retry.getDuration("base-delay"),
                retry.getDuration("max-delay"));
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }

    /**
     * Backoff slept before the given attempt; attempt 2 waits the base delay.
     */
    public long delayBefore(int nextAttempt) {
        int exponent = Math.min(nextAttempt - 2, 30);
        long delay = baseDelayMillis << Math.max(exponent, 0);
        if (delay < 0 || delay > maxDelayMillis) {
            return maxDelayMillis;
        }
        return delay;
    }

    public <T> T execute(String operation, Attempt<T> attempt) throws RetryExhaustedException {
        Exception lastFailure = null;
        for (int attemptNumber = 1; attemptNumber <= maxAttempts; attemptNumber++) {
            boolean last = attemptNumber == maxAttempts;
            try {
                return attempt.run(attemptNumber, last);
            } catch (Exception e) {
                lastFailure = e;
                logger.warn("{} failed on attempt {}/{}: {}", operation, attemptNumber, maxAttempts, e.toString());
            }
            if (!last) {
                long delay = delayBefore(attemptNumber + 1);
                try {
                    sleeper.sleep(delay);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    throw new RetryExhaustedException(operation + " interrupted while backing off", attemptNumber, e);
                }
            }
        }
        throw new RetryExhaustedException(operation + " failed after " + maxAttempts + " attempt(s)",
                maxAttempts, lastFailure);
    }

    @Override
    public String toString() {
        return "RetryPolicy{maxAttempts=" + maxAttempts
                + ", baseDelay=" + baseDelayMillis + "ms"
                + ", maxDelay=" + maxDelayMillis + "ms}";
    }
}
