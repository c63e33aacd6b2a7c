package com.superteacher.extraction;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Papers laid out as a table with a "Questions ... Marks" header row. The
 * marks of each row are the number printed closest to the column offset of
 * the "Marks" label. OCR rarely keeps columns perfectly aligned, so the match
 * tolerates some drift and otherwise uses the row's trailing number.
 */
final class TabularLayoutLayer implements ExtractionLayer {
    private static final Logger logger = LoggerFactory.getLogger(TabularLayoutLayer.class);

    static final int HEADER_SEARCH_LINES = 40;
    static final int COLUMN_SLACK = 8;

    private static final Pattern NUMBER = Pattern.compile("(?<![\\d.])(\\d{1,2})(?![\\d.])");

    @Override
    public String name() {
        return "tabular";
    }

    @Override
    public void apply(ExtractionDraft draft) {
        List<String> lines = draft.lines();
        int headerIndex = -1;
        int marksColumn = -1;
        for (int i = 0; i < Math.min(HEADER_SEARCH_LINES, lines.size()); i++) {
            String upper = lines.get(i).toUpperCase(Locale.ROOT);
            if (upper.contains("QUESTION") && upper.contains("MARK")
                    && !HeaderTotalScanner.isHeaderLine(upper)
                    && !DistributionPhraseLayer.isDistributionLine(upper)
                    && QuestionLines.parseQuestionLine(lines.get(i)).isEmpty()) {
                headerIndex = i;
                marksColumn = upper.indexOf("MARK");
                break;
            }
        }
        if (headerIndex < 0) {
            return;
        }
        logger.debug("Table header on line {}, marks column at offset {}", headerIndex + 1, marksColumn);

        Integer current = null;
        for (int i = headerIndex + 1; i < lines.size(); i++) {
            String line = lines.get(i);
            if (line.isBlank()) {
                continue;
            }
            Optional<QuestionLines.QuestionLine> questionLine = QuestionLines.parseQuestionLine(line);
            if (questionLine.isPresent()) {
                current = questionLine.get().number();
                int bodyStart = line.indexOf(questionLine.get().rest());
                OptionalInt marks = marksInRow(line, Math.max(bodyStart, 0), marksColumn);
                if (marks.isPresent()) {
                    draft.putMarks(current, marks.getAsInt());
                }
                draft.putText(current, bodyText(line, bodyStart, marks.isPresent()));
            } else if (current != null) {
                if (!draft.hasMarks(current)) {
                    OptionalInt marks = marksInRow(line, 0, marksColumn);
                    if (marks.isPresent()) {
                        draft.putMarks(current, marks.getAsInt());
                    }
                    draft.appendText(current, bodyText(line, 0, marks.isPresent()));
                } else {
                    draft.appendText(current, line);
                }
            }
        }
    }

    private static OptionalInt marksInRow(String line, int from, int marksColumn) {
        Matcher matcher = NUMBER.matcher(line);
        int best = -1;
        int bestDistance = Integer.MAX_VALUE;
        int trailing = -1;
        while (matcher.find()) {
            if (matcher.start() < from) {
                continue;
            }
            OptionalInt value = QuestionLines.plausibleMarks(matcher.group(1));
            if (value.isEmpty()) {
                continue;
            }
            int distance = Math.abs(matcher.start() - marksColumn);
            if (distance <= COLUMN_SLACK && distance < bestDistance) {
                best = value.getAsInt();
                bestDistance = distance;
            }
            if (line.substring(matcher.end()).isBlank()) {
                trailing = value.getAsInt();
            }
        }
        if (best > 0) {
            return OptionalInt.of(best);
        }
        return trailing > 0 ? OptionalInt.of(trailing) : OptionalInt.empty();
    }

    private static String bodyText(String line, int bodyStart, boolean hasMarks) {
        String body = line.substring(Math.max(bodyStart, 0)).trim();
        if (hasMarks) {
            body = body.replaceFirst("\\s*\\d{1,2}\\s*$", "");
        }
        return body.replace("|", " ").trim();
    }
}
