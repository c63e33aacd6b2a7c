package com.superteacher.grading;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class GradingResponseParserTest {

    private final GradingResponseParser parser = new GradingResponseParser();

    @Test
    void testParsesJsonWrappedInProse() throws Exception {
        String content = "Here is the grade:\n```json\n{\"score\": \"6.5\", \"feedback\": \"Good\", "
                + "\"strengths\": [\"Accurate\", \"\"], \"areas_for_improvement\": [\"Length\"], "
                + "\"suggested_points\": [], \"conceptsScore\": 7}\n```";

        GradingResponseParser.RemoteGrade grade = parser.parse(content);

        assertEquals(6.5, grade.score());
        assertEquals("Good", grade.feedback());
        assertEquals(List.of("Accurate"), grade.strengths());
        assertTrue(grade.relevant());
        assertEquals(7.0, grade.criterionScores().get("Economic Concepts"));
        assertEquals(1, grade.criterionScores().size());
    }

    @Test
    void testReadsRelevanceFlag() throws Exception {
        GradingResponseParser.RemoteGrade grade = parser.parse("{\"score\": 3, \"feedback\": \"\", \"strengths\": [], "
                + "\"areas_for_improvement\": [], \"suggested_points\": [], \"is_relevant\": false}");

        assertFalse(grade.relevant());
    }

    @Test
    void testRejectsStructurallyInvalidResponses() {
        assertThrows(GradingResponseParser.InvalidGradingResponseException.class, () -> parser.parse(""));
        assertThrows(GradingResponseParser.InvalidGradingResponseException.class, () -> parser.parse("no json here"));
        assertThrows(GradingResponseParser.InvalidGradingResponseException.class, () -> parser.parse("{\"score\": 4,}"));
        assertThrows(GradingResponseParser.InvalidGradingResponseException.class,
                () -> parser.parse("{\"feedback\": \"x\", \"strengths\": [], \"areas_for_improvement\": [], "
                        + "\"suggested_points\": []}"));
        assertThrows(GradingResponseParser.InvalidGradingResponseException.class,
                () -> parser.parse("{\"score\": 4, \"feedback\": \"x\", \"strengths\": \"none\", "
                        + "\"areas_for_improvement\": [], \"suggested_points\": []}"));
    }
}
