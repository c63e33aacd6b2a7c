package com.superteacher.extraction;

import java.util.Optional;
import java.util.OptionalInt;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Line-level patterns shared by the layers: question-number prefixes and
 * marks annotations.
 */
final class QuestionLines {
    static final int MIN_PLAUSIBLE_MARKS = 1;
    static final int MAX_PLAUSIBLE_MARKS = 20;

    private static final Pattern LABELLED_PREFIX = Pattern.compile(
            "^\\s*(?:q\\.?\\s*no\\.?|ques(?:tion)?\\.?|q\\.?)\\s*(\\d{1,2})\\s*[.):\\-]?\\s*(.*)$",
            Pattern.CASE_INSENSITIVE);
    private static final Pattern NUMBERED_PREFIX = Pattern.compile("^\\s*(\\d{1,2})\\s*[.)]\\s*(.*)$");
    private static final Pattern BARE_PREFIX = Pattern.compile("^\\s*(\\d{1,2})\\s+(\\D.*)$");

    private static final Pattern BRACKETED_MARKS = Pattern.compile(
            "[\\[(]\\s*(\\d{1,2})\\s*(?:marks?|m)\\s*[\\])]", Pattern.CASE_INSENSITIVE);
    private static final Pattern TRAILING_MARKS = Pattern.compile(
            "(\\d{1,2})\\s*marks?\\s*\\.?\\s*$", Pattern.CASE_INSENSITIVE);
    private static final Pattern TRAILING_NUMBER = Pattern.compile("(?:^|\\s)(\\d{1,2})\\s*$");
    private static final Pattern NOT_A_QUESTION = Pattern.compile(
            "^(?:marks?|m\\.?m\\.?|hours?|hrs?|minutes?|mins?)\\b.*", Pattern.CASE_INSENSITIVE);

    record QuestionLine(int number, String rest) {
    }

    record MarksMatch(int marks, int start) {
    }

    private QuestionLines() {
    }

    static Optional<QuestionLine> parseQuestionLine(String line) {
        for (Pattern pattern : new Pattern[]{LABELLED_PREFIX, NUMBERED_PREFIX, BARE_PREFIX}) {
            Matcher matcher = pattern.matcher(line);
            if (matcher.matches()) {
                int number = Integer.parseInt(matcher.group(1));
                String rest = matcher.group(2).trim();
                if (number > 0 && !NOT_A_QUESTION.matcher(rest).matches()) {
                    return Optional.of(new QuestionLine(number, rest));
                }
            }
        }
        return Optional.empty();
    }

    /**
     * Marks written as "[N marks]", "(N marks)", "N marks" at the end, or a
     * bare trailing number, in that order of preference.
     */
    static Optional<MarksMatch> findMarks(String text) {
        Optional<MarksMatch> match = plausible(BRACKETED_MARKS.matcher(text));
        if (match.isEmpty()) {
            match = plausible(TRAILING_MARKS.matcher(text));
        }
        if (match.isEmpty()) {
            match = plausible(TRAILING_NUMBER.matcher(text));
        }
        return match;
    }

    static String stripMarks(String text, MarksMatch match) {
        return text.substring(0, match.start()).trim();
    }

    static OptionalInt plausibleMarks(String digits) {
        int value = Integer.parseInt(digits);
        if (value < MIN_PLAUSIBLE_MARKS || value > MAX_PLAUSIBLE_MARKS) {
            return OptionalInt.empty();
        }
        return OptionalInt.of(value);
    }

    private static Optional<MarksMatch> plausible(Matcher matcher) {
        MarksMatch last = null;
        while (matcher.find()) {
            OptionalInt value = plausibleMarks(matcher.group(1));
            if (value.isPresent()) {
                last = new MarksMatch(value.getAsInt(), matcher.start());
            }
        }
        return Optional.ofNullable(last);
    }
}
