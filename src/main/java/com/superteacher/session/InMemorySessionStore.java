package com.superteacher.session;

import com.superteacher.models.Session;
import com.superteacher.models.WorkflowKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.function.UnaryOperator;

/**
 * Session store backed by a {@link ConcurrentHashMap}. Each mutation runs in
 * {@code compute}, which holds the bin lock of its key for the duration, so
 * writes to one user are serialised while different users proceed in parallel.
 */
public class InMemorySessionStore implements SessionStore {
    private static final Logger logger = LoggerFactory.getLogger(InMemorySessionStore.class);

    private final ConcurrentMap<String, Session> sessions = new ConcurrentHashMap<>();
    private final WorkflowKind workflowKind;

    public InMemorySessionStore(WorkflowKind workflowKind) {
        this.workflowKind = Objects.requireNonNull(workflowKind, "workflowKind");
    }

    public WorkflowKind getWorkflowKind() {
        return workflowKind;
    }

    @Override
    public Session get(String userId) {
        Session stored = sessions.computeIfAbsent(userId, this::newSession);
        return new Session(stored);
    }

    @Override
    public Session update(String userId, UnaryOperator<Session> mutation) {
        Session stored = sessions.compute(userId, (id, current) -> apply(id, current, mutation));
        return new Session(stored);
    }

    @Override
    public Optional<Session> compareAndUpdate(String userId, long expectedVersion, UnaryOperator<Session> mutation) {
        boolean[] applied = new boolean[1];
        Session stored = sessions.compute(userId, (id, current) -> {
            long currentVersion = current == null ? 0 : current.getVersion();
            if (currentVersion != expectedVersion) {
                logger.warn("Refusing stale write for user {}: expected version {}, found {}",
                        id, expectedVersion, currentVersion);
                return current;
            }
            applied[0] = true;
            return apply(id, current, mutation);
        });
        return applied[0] ? Optional.of(new Session(stored)) : Optional.empty();
    }

    @Override
    public Session reset(String userId, boolean keepHistory) {
        return update(userId, current -> current.resetCopy(keepHistory));
    }

    @Override
    public boolean contains(String userId) {
        return sessions.containsKey(userId);
    }

    private Session apply(String userId, Session current, UnaryOperator<Session> mutation) {
        Session base = current == null ? newSession(userId) : current;
        Session next = mutation.apply(new Session(base));
        if (next == null) {
            throw new IllegalStateException("session mutation returned null for user " + userId);
        }
        if (!userId.equals(next.getUserId())) {
            throw new IllegalStateException("session mutation changed the user id of " + userId);
        }
        Session committed = new Session(next);
        committed.setVersion(base.getVersion() + 1);
        return committed;
    }

    private Session newSession(String userId) {
        logger.info("Creating {} session for user {}", workflowKind, userId);
        return new Session(userId, workflowKind);
    }
}
