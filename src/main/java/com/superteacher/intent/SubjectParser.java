package com.superteacher.intent;

import com.superteacher.models.SubjectArea;

import java.util.Locale;
import java.util.Optional;

/**
 * Maps subject names and common abbreviations in a message to a
 * {@link SubjectArea}. Checks run in a fixed order so "social science" is not
 * read as science and "political science" is not read as either.
 */
public final class SubjectParser {

    private SubjectParser() {
    }

    public static Optional<SubjectArea> parse(String message) {
        if (message == null || message.isBlank()) {
            return Optional.empty();
        }
        String text = message.toLowerCase(Locale.ROOT);

        if (text.contains("math")) {
            return Optional.of(SubjectArea.MATH);
        }
        if (text.contains("econ")) {
            return Optional.of(SubjectArea.ECONOMICS);
        }
        if (text.contains("politi")) {
            return Optional.of(SubjectArea.POLITICAL_SCIENCE);
        }
        if (text.contains("computer") || text.matches(".*\\bcs\\b.*")) {
            return Optional.of(SubjectArea.COMPUTER_SCIENCE);
        }
        if (text.contains("social")) {
            return Optional.of(SubjectArea.SOCIAL_STUDIES);
        }
        if (text.contains("science")) {
            return Optional.of(SubjectArea.SCIENCE);
        }
        if (text.contains("english")) {
            return Optional.of(SubjectArea.ENGLISH);
        }
        if (text.contains("history")) {
            return Optional.of(SubjectArea.HISTORY);
        }
        if (text.contains("business")) {
            return Optional.of(SubjectArea.BUSINESS_STUDIES);
        }
        if (text.contains("account")) {
            return Optional.of(SubjectArea.ACCOUNTANCY);
        }
        if (text.contains("geo")) {
            return Optional.of(SubjectArea.GEOGRAPHY);
        }
        if (text.contains("physics")) {
            return Optional.of(SubjectArea.PHYSICS);
        }
        if (text.contains("chem")) {
            return Optional.of(SubjectArea.CHEMISTRY);
        }
        if (text.contains("bio")) {
            return Optional.of(SubjectArea.BIOLOGY);
        }
        return Optional.empty();
    }
}
