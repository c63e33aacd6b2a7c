package com.superteacher.utils;

import com.superteacher.models.GradingApproach;
import com.superteacher.models.GradingResult;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class CsvUtilsTest {

    @TempDir
    Path tempDir;

    private static GradingResult result(double score, String feedback) {
        return new GradingResult(score, 10, feedback,
                List.of("Clear definition", "Good example"),
                List.of("Add a diagram"),
                List.of("Label the axes"),
                true, GradingApproach.CBSE_STANDARD, Map.of("concepts", 7.0), false,
                Instant.parse("2024-03-01T10:00:00Z"));
    }

    private static List<CSVRecord> parse(String csv) throws Exception {
        CSVFormat format = CSVFormat.DEFAULT.builder().setHeader().setSkipHeaderRecord(true).build();
        try (CSVParser parser = CSVParser.parse(new StringReader(csv), format)) {
            return parser.getRecords();
        }
    }

    @Test
    void testHistoryToCsv() throws Exception {
        String csv = CsvUtils.gradingHistoryToCsv("teacher-1",
                List.of(result(7.5, "Good, but \"incomplete\""), result(4, "Needs work")));

        List<CSVRecord> records = parse(csv);
        assertEquals(2, records.size());
        CSVRecord first = records.get(0);
        assertEquals("teacher-1", first.get("UserId"));
        assertEquals("2024-03-01T10:00:00Z", first.get("GradedAt"));
        assertEquals("7.5", first.get("Score"));
        assertEquals("75.0", first.get("Percentage"));
        assertEquals("Good, but \"incomplete\"", first.get("Feedback"));
        assertEquals("Clear definition; Good example", first.get("Strengths"));
        assertEquals("false", first.get("Fallback"));
        assertEquals("4", records.get(1).get("Score"));
    }

    @Test
    void testEmptyHistoryHasHeaderOnly() throws Exception {
        String csv = CsvUtils.gradingHistoryToCsv("teacher-1", List.of());

        assertTrue(csv.startsWith("UserId,GradedAt,Score"));
        assertTrue(parse(csv).isEmpty());
    }

    @Test
    void testWriteToFile() throws Exception {
        Path file = tempDir.resolve("history.csv");

        CsvUtils.writeGradingHistoryToFile(file, "teacher-2", List.of(result(9, "Excellent")));

        String written = Files.readString(file, StandardCharsets.UTF_8);
        assertEquals("teacher-2", parse(written).get(0).get("UserId"));
    }
}
