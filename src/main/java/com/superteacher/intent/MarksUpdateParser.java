package com.superteacher.intent;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses marks corrections such as "Question 3 should be 5 marks",
 * "Q4 is 2 marks", "q.7 to 3" or "change question 2 to 4 marks".
 */
public final class MarksUpdateParser {
    static final int MAX_MARKS_PER_QUESTION = 100;

    private static final Pattern QUESTION_FIRST = Pattern.compile(
            "\\b(?:question|ques|q)\\s*\\.?\\s*(?:no\\.?\\s*)?(\\d{1,3})[a-z]?\\s*"
                    + "(?:should\\s+be|should\\s+have|should\\s+carry|carries|is\\s+worth|is|has|to|=|:|-)\\s*"
                    + "(\\d{1,3})\\s*(?:marks?)?\\b",
            Pattern.CASE_INSENSITIVE);
    private static final Pattern VERB_FIRST = Pattern.compile(
            "\\b(?:change|set|update|make)\\s+(?:question|ques|q)\\s*\\.?\\s*(\\d{1,3})[a-z]?\\s+(?:to|as|=)\\s*"
                    + "(\\d{1,3})\\s*(?:marks?)?\\b",
            Pattern.CASE_INSENSITIVE);

    public record MarksUpdate(int questionNumber, int marks) {
    }

    private MarksUpdateParser() {
    }

    public static Optional<MarksUpdate> parse(String message) {
        if (message == null || message.isBlank()) {
            return Optional.empty();
        }
        Optional<MarksUpdate> update = match(VERB_FIRST.matcher(message));
        return update.isPresent() ? update : match(QUESTION_FIRST.matcher(message));
    }

    private static Optional<MarksUpdate> match(Matcher matcher) {
        if (!matcher.find()) {
            return Optional.empty();
        }
        int question = Integer.parseInt(matcher.group(1));
        int marks = Integer.parseInt(matcher.group(2));
        if (question <= 0 || marks <= 0 || marks > MAX_MARKS_PER_QUESTION) {
            return Optional.empty();
        }
        return Optional.of(new MarksUpdate(question, marks));
    }
}
