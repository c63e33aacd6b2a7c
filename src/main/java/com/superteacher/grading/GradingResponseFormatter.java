package com.superteacher.grading;

import com.superteacher.models.ClassLevel;
import com.superteacher.models.GradingResult;
import com.superteacher.models.SubjectArea;

import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Renders a {@link GradingResult} as the chat reply shown to the teacher.
 */
public class GradingResponseFormatter {

    public String formatCbse(GradingResult result, ClassLevel classLevel, SubjectArea subject) {
        String className = classLevel == null ? "" : classLevel.getDisplayName().toUpperCase(Locale.ROOT) + " ";
        String subjectName = subject == null ? "GENERAL" : subject.getDisplayName().toUpperCase(Locale.ROOT);

        StringBuilder reply = new StringBuilder();
        reply.append("## CBSE ").append(className).append(subjectName).append(" ASSESSMENT\n\n");
        reply.append("🏆 **TOTAL SCORE: ").append(GradingResult.formatScore(result.score()))
                .append('/').append(result.outOf()).append("** (")
                .append(Math.round(result.percentage())).append("%) - ").append(remark(result.percentage()))
                .append("\n\n");
        reply.append("📝 **EXAMINER'S REMARKS:**\n").append(result.feedback()).append("\n");
        appendList(reply, "💪 **STRENGTHS:**", result.strengths());
        appendList(reply, "🔍 **AREAS FOR IMPROVEMENT:**", result.areasForImprovement());
        appendList(reply, "💡 **SUGGESTIONS TO IMPROVE:**", result.suggestedPoints());

        if (subject == SubjectArea.ECONOMICS) {
            reply.append("\n📊 **ECONOMICS-SPECIFIC FEEDBACK:**\n");
            for (String criterion : GradingResponseParser.CRITERIA.values()) {
                Double value = result.criterionScores().get(criterion);
                reply.append("- ").append(criterion).append(": ")
                        .append(value == null ? "Not explicitly evaluated" : GradingResult.formatScore(value))
                        .append("/10\n");
            }
        }
        appendFallbackNote(reply, result);
        reply.append("\nYou can ask me follow-up questions about this grade, upload another answer, or say \"start over\".");
        return reply.toString().trim();
    }

    public String formatSimple(GradingResult result) {
        StringBuilder reply = new StringBuilder();
        reply.append("✅ Score: ").append(GradingResult.formatScore(result.score()))
                .append('/').append(result.outOf())
                .append(" (").append(Math.round(result.percentage())).append("%)\n");
        reply.append("📝 Feedback: ").append(result.feedback()).append("\n");
        appendList(reply, "👍 Strengths:", result.strengths());
        appendList(reply, "❌ To improve:", result.areasForImprovement());
        appendFallbackNote(reply, result);
        reply.append("\nDo you want to grade another answer? If so, please send me the new question.");
        return reply.toString().trim();
    }

    static String remark(double percentage) {
        if (percentage >= 90) {
            return "Outstanding";
        }
        if (percentage >= 75) {
            return "Very good";
        }
        if (percentage >= 60) {
            return "Good";
        }
        if (percentage >= 40) {
            return "Satisfactory";
        }
        return "Needs improvement";
    }

    private static void appendList(StringBuilder reply, String heading, List<String> items) {
        if (items.isEmpty()) {
            return;
        }
        reply.append('\n').append(heading).append('\n');
        for (String item : items) {
            reply.append("- ").append(item).append('\n');
        }
    }

    private static void appendFallbackNote(StringBuilder reply, GradingResult result) {
        if (result.fallback()) {
            reply.append("\n_Note: this grade is an automatic estimate because the grading service was unavailable._\n");
        }
    }

    /**
     * One line per criterion, for follow-up answers.
     */
    public static String criteriaSummary(Map<String, Double> criteria) {
        StringBuilder summary = new StringBuilder();
        criteria.forEach((name, value) ->
                summary.append("- ").append(name).append(": ").append(GradingResult.formatScore(value)).append("/10\n"));
        return summary.toString();
    }
}
