package com.superteacher.session;

import com.superteacher.models.Session;

import java.util.Optional;
import java.util.function.UnaryOperator;

/**
 * Keyed container of conversation state.
 *
 * Every operation is atomic per user id. Callers always receive copies, so the
 * only way to change stored state is through {@link #update},
 * {@link #compareAndUpdate} or {@link #reset}.
 */
public interface SessionStore {

    /**
     * Current session for the user, created on first contact.
     */
    Session get(String userId);

    /**
     * Apply a read-modify-write to the user's session inside one critical
     * section and return the stored result.
     */
    Session update(String userId, UnaryOperator<Session> mutation);

    /**
     * Like {@link #update} but only if nobody has written the session since
     * {@code expectedVersion} was read. Empty when the write was refused.
     */
    Optional<Session> compareAndUpdate(String userId, long expectedVersion, UnaryOperator<Session> mutation);

    /**
     * Return the session to its initial state. The grading history survives
     * when {@code keepHistory} is set. Resetting twice equals resetting once.
     */
    Session reset(String userId, boolean keepHistory);

    boolean contains(String userId);
}
