package com.superteacher.grading;

import com.superteacher.models.GradingResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Produces a {@link GradingResult} for every request.
 *
 * <p>The primary collaborator gets one call per retry iteration. The backup
 * collaborator, if any, is called only in the final iteration and only after
 * the primary failed in it. A malformed payload counts as a failed attempt.
 * Once the retries are exhausted the {@link FallbackGrader} answers instead,
 * so {@link #grade} never throws.
 */
public class GradingOrchestrator {
    private static final Logger logger = LoggerFactory.getLogger(GradingOrchestrator.class);

    static final String OFF_TOPIC_FEEDBACK =
            "The submitted answer does not address the question that was asked, so it receives 0 marks.";

    private final GradingCollaborator primary;
    private final GradingCollaborator backup;
    private final RetryPolicy retryPolicy;
    private final GradingResponseParser parser;
    private final FallbackGrader fallbackGrader;
    private final Clock clock;

    /**
     * @param backup may be null when no secondary endpoint is configured
     */
    public GradingOrchestrator(GradingCollaborator primary,
                               GradingCollaborator backup,
                               RetryPolicy retryPolicy,
                               GradingResponseParser parser,
                               Clock clock) {
        this.primary = primary;
        this.backup = backup;
        this.retryPolicy = retryPolicy;
        this.parser = parser;
        this.fallbackGrader = new FallbackGrader(clock);
        this.clock = clock;
    }

    public GradingResult grade(GradingRequest request) {
        try {
            GradingResponseParser.RemoteGrade remote = retryPolicy.execute("grading", (attempt, last) -> {
                try {
                    return callAndParse(primary, request);
                } catch (IOException e) {
                    if (last && backup != null) {
                        logger.warn("Primary grader failed on the final attempt ({}), trying backup {}",
                                e.getMessage(), backup.name());
                        return callAndParse(backup, request);
                    }
                    throw e;
                }
            });
            return toResult(remote, request);
        } catch (RetryExhaustedException e) {
            logger.warn("Grading collaborators unavailable, using fallback grading: {}", e.getMessage());
        } catch (RuntimeException e) {
            logger.error("Unexpected error while grading, using fallback grading", e);
        }
        return fallbackGrader.grade(request);
    }

    private GradingResponseParser.RemoteGrade callAndParse(GradingCollaborator collaborator, GradingRequest request)
            throws IOException {
        String content = collaborator.requestGrading(request);
        return parser.parse(content);
    }

    GradingResult toResult(GradingResponseParser.RemoteGrade remote, GradingRequest request) {
        int maxMarks = request.maxMarks();
        double score = clamp(remote.score(), 0, maxMarks);
        String feedback = remote.feedback();

        if (!remote.relevant()) {
            logger.info("Grader judged the answer off-topic, forcing score 0 (reported {})", remote.score());
            score = 0;
            feedback = feedback == null || feedback.isBlank()
                    ? OFF_TOPIC_FEEDBACK
                    : OFF_TOPIC_FEEDBACK + " " + feedback;
        }

        Map<String, Double> criteria = new LinkedHashMap<>();
        remote.criterionScores().forEach((name, value) -> criteria.put(name, clamp(value, 0, 10)));

        return new GradingResult(
                score,
                maxMarks,
                feedback,
                remote.strengths(),
                remote.areasForImprovement(),
                remote.suggestedPoints(),
                remote.relevant(),
                request.approach(),
                criteria,
                false,
                clock.instant());
    }

    private static double clamp(double value, double min, double max) {
        if (Double.isNaN(value)) {
            return min;
        }
        return Math.max(min, Math.min(max, value));
    }
}
