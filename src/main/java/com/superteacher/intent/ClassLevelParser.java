package com.superteacher.intent;

import com.superteacher.models.ClassLevel;

import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads a CBSE class level (6 to 12) out of free text such as "Class 10",
 * "grade 12th", "std XI" or a bare "9".
 */
public final class ClassLevelParser {
    private static final Pattern KEYWORD_NUMBER = Pattern.compile(
            "\\b(?:class|grade|std\\.?|standard)\\s*-?\\s*(\\d{1,2})(?:st|nd|rd|th)?\\b");
    private static final Pattern KEYWORD_ROMAN = Pattern.compile(
            "\\b(?:class|grade|std\\.?|standard)\\s*-?\\s*(vi|vii|viii|ix|x|xi|xii)\\b");
    private static final Pattern BARE_NUMBER = Pattern.compile("(?<![\\d.])(\\d{1,2})(?:st|nd|rd|th)?(?![\\d.])");

    private static final Map<String, Integer> ROMAN = Map.of(
            "vi", 6, "vii", 7, "viii", 8, "ix", 9, "x", 10, "xi", 11, "xii", 12);

    private ClassLevelParser() {
    }

    /**
     * @param requireKeyword when set, a number only counts if it follows
     *                       "class", "grade" or "std"
     */
    public static Optional<ClassLevel> parse(String message, boolean requireKeyword) {
        if (message == null || message.isBlank()) {
            return Optional.empty();
        }
        String text = message.toLowerCase(Locale.ROOT);

        Matcher keyword = KEYWORD_NUMBER.matcher(text);
        while (keyword.find()) {
            Optional<ClassLevel> level = ClassLevel.fromNumber(Integer.parseInt(keyword.group(1)));
            if (level.isPresent()) {
                return level;
            }
        }
        Matcher roman = KEYWORD_ROMAN.matcher(text);
        if (roman.find()) {
            return ClassLevel.fromNumber(ROMAN.get(roman.group(1)));
        }
        if (requireKeyword) {
            return Optional.empty();
        }
        Matcher bare = BARE_NUMBER.matcher(text);
        while (bare.find()) {
            Optional<ClassLevel> level = ClassLevel.fromNumber(Integer.parseInt(bare.group(1)));
            if (level.isPresent()) {
                return level;
            }
        }
        return Optional.empty();
    }
}
