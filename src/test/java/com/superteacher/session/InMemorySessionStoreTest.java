package com.superteacher.session;

import com.superteacher.models.ClassLevel;
import com.superteacher.models.ConversationStep;
import com.superteacher.models.GradingApproach;
import com.superteacher.models.GradingResult;
import com.superteacher.models.Session;
import com.superteacher.models.WorkflowKind;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

public class InMemorySessionStoreTest {

    private final InMemorySessionStore store = new InMemorySessionStore(WorkflowKind.CBSE);

    @Test
    void testGetCreatesSessionLazily() {
        assertFalse(store.contains("u1"));

        Session session = store.get("u1");

        assertTrue(store.contains("u1"));
        assertEquals(ConversationStep.INITIAL, session.getStep());
        assertEquals(WorkflowKind.CBSE, session.getWorkflowKind());
        assertEquals(0, session.getVersion());
    }

    @Test
    void testSessionsHandedOutAreCopies() {
        Session copy = store.get("u1");
        copy.setStep(ConversationStep.WAITING_FOR_SUBJECT);
        copy.updateDraftMark(1, 3);

        Session stored = store.get("u1");
        assertEquals(ConversationStep.INITIAL, stored.getStep());
        assertTrue(stored.getDraftMarks().isEmpty());
    }

    @Test
    void testConcurrentUpdatesAreNotLost() throws Exception {
        int threads = 16;
        int updatesPerThread = 250;
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<?>> futures = new ArrayList<>();
        for (int t = 0; t < threads; t++) {
            futures.add(pool.submit(() -> {
                start.await();
                for (int i = 0; i < updatesPerThread; i++) {
                    store.update("shared", session -> {
                        session.setTurnCount(session.getTurnCount() + 1);
                        return session;
                    });
                }
                return null;
            }));
        }
        start.countDown();
        for (Future<?> future : futures) {
            future.get(30, TimeUnit.SECONDS);
        }
        pool.shutdown();

        Session result = store.get("shared");
        assertEquals(threads * updatesPerThread, result.getTurnCount());
        assertEquals(threads * updatesPerThread, result.getVersion());
    }

    @Test
    void testStaleCompareAndUpdateIsRefused() {
        Session snapshot = store.get("u1");
        store.update("u1", session -> {
            session.setStep(ConversationStep.WAITING_FOR_CLASS);
            return session;
        });

        Optional<Session> stale = store.compareAndUpdate("u1", snapshot.getVersion(), session -> {
            session.setStep(ConversationStep.INITIAL);
            return session;
        });

        assertTrue(stale.isEmpty());
        assertEquals(ConversationStep.WAITING_FOR_CLASS, store.get("u1").getStep());
    }

    @Test
    void testCompareAndUpdateWithCurrentVersionCommits() {
        Session snapshot = store.get("u1");

        Optional<Session> committed = store.compareAndUpdate("u1", snapshot.getVersion(), session -> {
            session.setClassLevel(ClassLevel.CLASS_10);
            return session;
        });

        assertTrue(committed.isPresent());
        assertEquals(1, committed.get().getVersion());
        assertEquals(ClassLevel.CLASS_10, store.get("u1").getClassLevel());
    }

    @Test
    void testResetIsIdempotentAndKeepsHistoryOnRequest() {
        GradingResult result = new GradingResult(4, 5, "ok", List.of(), List.of(), List.of(), true,
                GradingApproach.BALANCED, null, false, Instant.parse("2024-03-01T10:00:00Z"));
        store.update("u1", session -> {
            session.setStep(ConversationStep.COMPLETE);
            session.setClassLevel(ClassLevel.CLASS_12);
            session.updateDraftMark(1, 2);
            session.confirmMarks();
            session.appendGradingResult(result);
            return session;
        });

        Session once = store.reset("u1", true);
        Session twice = store.reset("u1", true);

        for (Session reset : List.of(once, twice)) {
            assertEquals(ConversationStep.INITIAL, reset.getStep());
            assertNull(reset.getClassLevel());
            assertTrue(reset.getDraftMarks().isEmpty());
            assertFalse(reset.isMarkingConfirmed());
            assertEquals(List.of(result), reset.getGradingHistory());
        }

        assertTrue(store.reset("u1", false).getGradingHistory().isEmpty());
    }
}
