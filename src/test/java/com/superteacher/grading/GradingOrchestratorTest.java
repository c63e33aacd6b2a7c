package com.superteacher.grading;

import com.superteacher.models.ClassLevel;
import com.superteacher.models.GradingApproach;
import com.superteacher.models.GradingResult;
import com.superteacher.models.SubjectArea;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class GradingOrchestratorTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2024-03-01T10:00:00Z"), ZoneOffset.UTC);
    private static final String ANSWER = "Demand is the quantity of a good that consumers are willing and able to buy "
            + "at each price in a given period. The law of demand says that quantity demanded falls as price rises.";

    private final List<Long> sleeps = new ArrayList<>();
    private final RetryPolicy retry = new RetryPolicy(3, Duration.ofMillis(2000), Duration.ofSeconds(30), sleeps::add);

    /**
     * Replays canned responses and records every call.
     */
    static class ScriptedCollaborator implements GradingCollaborator {
        private final String name;
        private final List<Object> script;
        final List<GradingRequest> calls = new ArrayList<>();

        ScriptedCollaborator(String name, Object... script) {
            this.name = name;
            this.script = List.of(script);
        }

        @Override
        public String requestGrading(GradingRequest request) throws IOException {
            calls.add(request);
            Object next = script.get(Math.min(calls.size() - 1, script.size() - 1));
            if (next instanceof IOException) {
                throw (IOException) next;
            }
            return (String) next;
        }

        @Override
        public String name() {
            return name;
        }
    }

    private static String json(double score, boolean relevant) {
        return "{\"score\": " + score + ", \"feedback\": \"Clear answer\", "
                + "\"strengths\": [\"Correct definition\"], \"areas_for_improvement\": [\"Add a diagram\"], "
                + "\"suggested_points\": [\"Draw the demand curve\"], \"is_relevant\": " + relevant + "}";
    }

    private static GradingRequest request(int maxMarks) {
        return new GradingRequest("Q1. Define demand.", ANSWER, "grade it", maxMarks, GradingApproach.BALANCED, null, null);
    }

    private GradingOrchestrator orchestrator(GradingCollaborator primary, GradingCollaborator backup) {
        return new GradingOrchestrator(primary, backup, retry, new GradingResponseParser(), CLOCK);
    }

    @Test
    void testRemoteResultIsUsed() {
        ScriptedCollaborator primary = new ScriptedCollaborator("primary", json(7, true));

        GradingResult result = orchestrator(primary, null).grade(request(10));

        assertEquals(7.0, result.score());
        assertEquals(10, result.outOf());
        assertFalse(result.fallback());
        assertEquals("Clear answer", result.feedback());
        assertEquals(CLOCK.instant(), result.gradedAt());
        assertEquals(1, primary.calls.size());
        assertTrue(sleeps.isEmpty());
    }

    @Test
    void testAlwaysFailingCollaboratorFallsBack() {
        ScriptedCollaborator primary = new ScriptedCollaborator("primary", new IOException("unreachable"));

        GradingResult result = orchestrator(primary, null).grade(request(10));

        assertTrue(result.fallback());
        assertTrue(result.score() >= 0 && result.score() <= 10);
        assertEquals(result.score() / 10 * 100.0, result.percentage(), 1e-9);
        assertEquals(3, primary.calls.size());
        assertEquals(List.of(2000L, 4000L), sleeps);
    }

    @Test
    void testOffTopicAnswerScoresZero() {
        ScriptedCollaborator primary = new ScriptedCollaborator("primary", json(8, false));

        GradingResult result = orchestrator(primary, null).grade(request(10));

        assertEquals(0.0, result.score());
        assertFalse(result.relevant());
        assertTrue(result.feedback().startsWith(GradingOrchestrator.OFF_TOPIC_FEEDBACK));
    }

    @Test
    void testBackupOnlyOnLastAttempt() {
        ScriptedCollaborator primary = new ScriptedCollaborator("primary", new IOException("down"));
        ScriptedCollaborator backup = new ScriptedCollaborator("backup", json(6, true));

        GradingResult result = orchestrator(primary, backup).grade(request(10));

        assertEquals(3, primary.calls.size());
        assertEquals(1, backup.calls.size());
        assertEquals(6.0, result.score());
        assertFalse(result.fallback());
    }

    @Test
    void testBackupNotCalledWhenPrimaryRecovers() {
        ScriptedCollaborator primary = new ScriptedCollaborator("primary", new IOException("blip"), json(5, true));
        ScriptedCollaborator backup = new ScriptedCollaborator("backup", json(9, true));

        GradingResult result = orchestrator(primary, backup).grade(request(10));

        assertEquals(5.0, result.score());
        assertEquals(2, primary.calls.size());
        assertTrue(backup.calls.isEmpty());
    }

    @Test
    void testMalformedPayloadCountsAsFailedAttempt() {
        ScriptedCollaborator primary = new ScriptedCollaborator("primary", "I think it deserves a 7", json(7, true));

        GradingResult result = orchestrator(primary, null).grade(request(10));

        assertEquals(2, primary.calls.size());
        assertEquals(7.0, result.score());
    }

    @Test
    void testPersistentlyMalformedPayloadFallsBack() {
        ScriptedCollaborator primary = new ScriptedCollaborator("primary", "{\"score\": \"lots\"}");

        GradingResult result = orchestrator(primary, null).grade(request(10));

        assertTrue(result.fallback());
        assertEquals(3, primary.calls.size());
    }

    @Test
    void testScoreAndCriteriaAreClamped() {
        String payload = "{\"score\": 14, \"feedback\": \"ok\", \"strengths\": [], \"areas_for_improvement\": [], "
                + "\"suggested_points\": [], \"conceptsScore\": 12, \"diagramScore\": -1}";
        ScriptedCollaborator primary = new ScriptedCollaborator("primary", payload);
        GradingRequest cbse = new GradingRequest("Q1. Define demand. (2 marks)", ANSWER, "",
                10, GradingApproach.CBSE_STANDARD, SubjectArea.ECONOMICS, ClassLevel.CLASS_12);

        GradingResult result = orchestrator(primary, null).grade(cbse);

        assertEquals(10.0, result.score());
        assertEquals(10.0, result.criterionScores().get("Economic Concepts"));
        assertEquals(0.0, result.criterionScores().get("Diagram Accuracy"));
        assertEquals(GradingApproach.CBSE_STANDARD, result.approach());
    }

    @Test
    void testBlankAnswerFallsBackToZero() {
        ScriptedCollaborator primary = new ScriptedCollaborator("primary", new IOException("down"));
        GradingRequest blank = new GradingRequest("Q1", "   ", "", 5, null, null, null);

        GradingResult result = orchestrator(primary, null).grade(blank);

        assertEquals(0.0, result.score());
        assertEquals(5, result.outOf());
        assertTrue(result.fallback());
    }
}
