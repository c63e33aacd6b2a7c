package com.superteacher.grading;

import com.superteacher.models.GradingApproach;
import com.superteacher.models.GradingResult;
import com.superteacher.models.SubjectArea;
import com.superteacher.utils.TextStats;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Local grading used when the remote collaborator cannot produce a usable
 * result. The score depends only on the answer length:
 * {@code round(length / 300 * maxMarks)} capped at {@code maxMarks}, and
 * for answers of at least {@value #SUBSTANTIAL_LENGTH} characters held
 * between 40% and 80% of {@code maxMarks}. A blank answer scores 0.
 */
public class FallbackGrader {
    private static final Logger logger = LoggerFactory.getLogger(FallbackGrader.class);

    static final int CHARACTERS_FOR_FULL_MARKS = 300;
    static final int SUBSTANTIAL_LENGTH = 100;
    static final double LOWER_BAND = 0.4;
    static final double UPPER_BAND = 0.8;

    private final Clock clock;

    public FallbackGrader(Clock clock) {
        this.clock = clock;
    }

    public GradingResult grade(GradingRequest request) {
        int maxMarks = request.maxMarks();
        String answer = request.studentAnswerText().trim();
        GradingApproach approach = request.approach();

        if (answer.isEmpty()) {
            return new GradingResult(0, maxMarks,
                    "No answer text could be read, so no marks were awarded. Please upload a clearer image of the answer.",
                    List.of(), List.of("Provide a legible answer to the question"),
                    List.of("Upload the answer again with better lighting"),
                    true, approach, Map.of(), true, clock.instant());
        }

        double score = score(answer.length(), maxMarks);
        double percentage = score / maxMarks * 100.0;
        logger.info("Fallback grade {}/{} for an answer of {} characters", score, maxMarks, answer.length());

        SubjectArea subject = request.subject();
        return new GradingResult(
                score,
                maxMarks,
                feedback(request),
                strengths(answer, subject),
                areasForImprovement(subject),
                suggestions(request),
                true,
                approach,
                subject == SubjectArea.ECONOMICS ? economicsCriteria(percentage) : Map.of(),
                true,
                clock.instant());
    }

    static double score(int length, int maxMarks) {
        long score = Math.min(Math.round((double) length / CHARACTERS_FOR_FULL_MARKS * maxMarks), maxMarks);
        if (length >= SUBSTANTIAL_LENGTH) {
            long lower = Math.round(maxMarks * LOWER_BAND);
            long upper = Math.round(maxMarks * UPPER_BAND);
            score = Math.min(Math.max(score, lower), upper);
        }
        return score;
    }

    private static String feedback(GradingRequest request) {
        if (request.isCbse()) {
            return "This answer shows a basic understanding of the concepts covered in the question. "
                    + "It addresses some key points but would benefit from more complete and detailed explanations. "
                    + "By CBSE standards the answer demonstrates partial mastery of the required knowledge. "
                    + "(Automatic estimate: the detailed grader was unavailable, please review manually.)";
        }
        return "This is an automatic estimate based on the length and structure of the answer, "
                + "because the detailed grader was unavailable. Please review the answer manually.";
    }

    private static List<String> strengths(String answer, SubjectArea subject) {
        List<String> strengths = new ArrayList<>();
        if (TextStats.wordCount(answer) > 100) {
            strengths.add("Provides a substantive response with reasonable detail");
        }
        if (TextStats.sentenceCount(answer) > 5) {
            strengths.add("Organizes thoughts in a structured manner");
        }
        strengths.add("Makes an effort to address the key points in the question");
        if (subject == SubjectArea.ECONOMICS) {
            strengths.add("Shows understanding of fundamental economic concepts");
            strengths.add("Attempts to connect economic theory to real-world examples");
        } else if (subject == SubjectArea.MATH) {
            strengths.add("Demonstrates basic mathematical problem-solving skills");
            strengths.add("Shows work in an organized manner");
        } else if (subject == SubjectArea.SCIENCE) {
            strengths.add("Demonstrates basic understanding of scientific concepts");
            strengths.add("Attempts to use scientific terminology appropriately");
        }
        return strengths.subList(0, Math.min(4, strengths.size()));
    }

    private static List<String> areasForImprovement(SubjectArea subject) {
        List<String> areas = new ArrayList<>(List.of(
                "Could benefit from more detailed explanations",
                "Additional specific examples would strengthen the answer"));
        if (subject == SubjectArea.ECONOMICS) {
            areas.add("Economic terminology could be used more precisely");
            areas.add("Economic diagrams would benefit from clearer labelling");
        } else if (subject == SubjectArea.MATH) {
            areas.add("Step-by-step workings could be presented more clearly");
            areas.add("Mathematical notation could be more precise");
        } else if (subject == SubjectArea.SCIENCE) {
            areas.add("Scientific explanations could be more thorough");
            areas.add("Could better connect theory to experimental evidence");
        } else {
            areas.add("More explicit connections to the core question would improve clarity");
        }
        return areas;
    }

    private static List<String> suggestions(GradingRequest request) {
        if (request.isCbse()) {
            return List.of(
                    "Review the NCERT textbook to strengthen conceptual understanding",
                    "Practise detailed explanations with specific examples",
                    "Make clearer connections between concepts and their applications");
        }
        return List.of(
                "Review the answer manually for accuracy",
                "Compare the answer against the key points of the question");
    }

    private static Map<String, Double> economicsCriteria(double percentage) {
        Map<String, Double> criteria = new LinkedHashMap<>();
        criteria.put("Economic Concepts", (double) Math.round(percentage * 0.6 / 10));
        criteria.put("Diagram Accuracy", (double) Math.round(percentage * 0.5 / 10));
        criteria.put("Application of Theories", (double) Math.round(percentage * 0.55 / 10));
        criteria.put("Use of Terminology", (double) Math.round(percentage * 0.65 / 10));
        return criteria;
    }
}
