package com.superteacher.models;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable outcome of grading one student answer.
 *
 * The percentage is always derived from score and outOf; it cannot be
 * supplied independently.
 */
public record GradingResult(
        double score,
        int outOf,
        String feedback,
        List<String> strengths,
        List<String> areasForImprovement,
        List<String> suggestedPoints,
        boolean relevant,
        GradingApproach approach,
        Map<String, Double> criterionScores,
        boolean fallback,
        Instant gradedAt
) {
    public GradingResult {
        if (outOf <= 0) {
            throw new IllegalArgumentException("outOf must be positive, was " + outOf);
        }
        if (Double.isNaN(score) || score < 0 || score > outOf) {
            throw new IllegalArgumentException("score " + score + " outside [0, " + outOf + "]");
        }
        if (!relevant && score != 0) {
            throw new IllegalArgumentException("an off-topic answer must score 0");
        }
        Objects.requireNonNull(approach, "approach");
        Objects.requireNonNull(gradedAt, "gradedAt");
        feedback = feedback == null ? "" : feedback;
        strengths = strengths == null ? List.of() : List.copyOf(strengths);
        areasForImprovement = areasForImprovement == null ? List.of() : List.copyOf(areasForImprovement);
        suggestedPoints = suggestedPoints == null ? List.of() : List.copyOf(suggestedPoints);
        criterionScores = criterionScores == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(criterionScores));
    }

    public double percentage() {
        return score / outOf * 100.0;
    }

    @Override
    public String toString() {
        return String.format(Locale.ROOT, "GradingResult{%s/%d (%.1f%%), approach=%s, relevant=%s, fallback=%s}",
                formatScore(score), outOf, percentage(), approach.getTag(), relevant, fallback);
    }

    /**
     * Render a score without a trailing ".0" for whole numbers.
     */
    public static String formatScore(double score) {
        if (score == Math.rint(score)) {
            return String.valueOf((long) score);
        }
        return String.format(Locale.ROOT, "%.1f", score);
    }
}
