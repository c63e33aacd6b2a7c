package com.superteacher.engine;

import com.superteacher.models.GradingApproach;
import com.superteacher.models.GradingResult;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class FollowUpResponderTest {

    private final FollowUpResponder responder = new FollowUpResponder();

    private static GradingResult graded(boolean relevant, double score) {
        return new GradingResult(score, 10, "Solid answer overall.",
                List.of("Correct definition"),
                List.of("No real-world example"),
                List.of("Add an example from the Indian economy"),
                relevant, GradingApproach.CBSE_STANDARD, Map.of("concepts", 7.0, "terminology", 6.0), false,
                Instant.EPOCH);
    }

    @Test
    void testNothingGradedYet() {
        assertTrue(responder.answer("why?", null).contains("haven't graded"));
    }

    @Test
    void testWhyMarksWereLost() {
        String reply = responder.answer("Why did they lose marks?", graded(true, 7));

        assertTrue(reply.startsWith("The answer scored 7/10. Marks were lost"));
        assertTrue(reply.contains("- No real-world example"));
    }

    @Test
    void testHowToImprove() {
        String reply = responder.answer("How can the student improve?", graded(true, 7));

        assertTrue(reply.contains("- Add an example from the Indian economy"));
    }

    @Test
    void testStrengths() {
        assertTrue(responder.answer("What did they do well", graded(true, 7)).contains("- Correct definition"));
    }

    @Test
    void testCriteriaBreakdown() {
        assertTrue(responder.answer("show the breakdown", graded(true, 7)).startsWith("Criterion scores"));
    }

    @Test
    void testOffTopicAnswerExplained() {
        String reply = responder.answer("how can they improve?", graded(false, 0));

        assertTrue(reply.contains("did not address the question"));
    }
}
