package com.superteacher.utils;

import com.superteacher.models.GradingResult;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVPrinter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.StringWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;

/**
 * CSV export of a user's grading history
 */
public class CsvUtils {
    private static final Logger logger = LoggerFactory.getLogger(CsvUtils.class);

    static final String[] HEADERS = {
            "UserId", "GradedAt", "Score", "OutOf", "Percentage", "Approach", "Relevant", "Fallback",
            "Feedback", "Strengths", "AreasForImprovement", "SuggestedPoints"
    };

    public static String gradingHistoryToCsv(String userId, List<GradingResult> results) throws IOException {
        StringWriter out = new StringWriter();
        writeGradingHistory(out, userId, results);
        return out.toString();
    }

    public static void writeGradingHistoryToFile(Path file, String userId, List<GradingResult> results)
            throws IOException {
        try (Writer writer = Files.newBufferedWriter(file, StandardCharsets.UTF_8)) {
            writeGradingHistory(writer, userId, results);
        }
        logger.info("Wrote {} grading result(s) for {} to {}", results.size(), userId, file);
    }

    private static void writeGradingHistory(Writer writer, String userId, List<GradingResult> results)
            throws IOException {
        CSVFormat format = CSVFormat.DEFAULT.builder().setHeader(HEADERS).build();
        try (CSVPrinter printer = new CSVPrinter(writer, format)) {
            for (GradingResult result : results) {
                printer.printRecord(
                        userId,
                        result.gradedAt().toString(),
                        GradingResult.formatScore(result.score()),
                        result.outOf(),
                        String.format(Locale.ROOT, "%.1f", result.percentage()),
                        result.approach().getTag(),
                        result.relevant(),
                        result.fallback(),
                        result.feedback(),
                        String.join("; ", result.strengths()),
                        String.join("; ", result.areasForImprovement()),
                        String.join("; ", result.suggestedPoints()));
            }
            printer.flush();
        }
    }
}
