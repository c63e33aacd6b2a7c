package com.superteacher.engine;

import com.superteacher.grading.GradingResponseFormatter;
import com.superteacher.models.GradingResult;

import java.util.List;
import java.util.Locale;

/**
 * Answers questions about the most recent grade from the stored result,
 * without another call to the grader.
 */
public class FollowUpResponder {

    public String answer(String question, GradingResult last) {
        if (last == null) {
            return "I haven't graded an answer in this session yet, so there is nothing to explain.";
        }
        String text = question == null ? "" : question.toLowerCase(Locale.ROOT);
        String score = GradingResult.formatScore(last.score()) + "/" + last.outOf();

        if (!last.relevant()) {
            return "The answer scored " + score + " because it did not address the question that was asked. "
                    + last.feedback();
        }
        if (containsAny(text, "improve", "better", "next time", "suggest", "tips")) {
            return bulleted("To improve on " + score + ", the student could:", last.suggestedPoints().isEmpty()
                    ? last.areasForImprovement() : last.suggestedPoints());
        }
        if (containsAny(text, "why", "lose", "lost", "deduct", "cut", "low", "wrong", "mistake")) {
            return bulleted("The answer scored " + score + ". Marks were lost mainly because of these gaps:",
                    last.areasForImprovement());
        }
        if (containsAny(text, "strength", "good", "well", "right", "correct")) {
            return bulleted("What the answer did well:", last.strengths());
        }
        if (!last.criterionScores().isEmpty() && containsAny(text, "criteria", "criterion", "breakdown", "diagram",
                "concept", "terminology", "application")) {
            return "Criterion scores for this answer:\n"
                    + GradingResponseFormatter.criteriaSummary(last.criterionScores()).trim();
        }
        return "The answer scored " + score + " (" + Math.round(last.percentage()) + "%). " + last.feedback()
                + "\n\nYou can ask why marks were lost, how the student can improve, or what they did well.";
    }

    private static boolean containsAny(String text, String... words) {
        for (String word : words) {
            if (text.contains(word)) {
                return true;
            }
        }
        return false;
    }

    private static String bulleted(String heading, List<String> items) {
        if (items.isEmpty()) {
            return heading + "\n- No specific points were recorded for this grade.";
        }
        StringBuilder out = new StringBuilder(heading);
        for (String item : items) {
            out.append("\n- ").append(item);
        }
        return out.toString();
    }
}
