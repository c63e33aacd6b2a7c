package com.superteacher.grading;

/**
 * Thrown by {@link RetryPolicy} once every attempt has failed. The cause is
 * the failure of the last attempt.
 */
public class RetryExhaustedException extends Exception {
    private final int attempts;

    public RetryExhaustedException(String message, int attempts, Throwable cause) {
        super(message, cause);
        this.attempts = attempts;
    }

    public int getAttempts() {
        return attempts;
    }
}
