package com.superteacher.intent;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Classifies a reply to "do these marks look correct?".
 *
 * Negative phrases are checked first because several contain an affirmative
 * word ("not right", "incorrect"). An affirmative word that comes after a
 * negator ("I don't think these are right") counts as negative.
 */
public final class ConfirmationParser {

    public enum Answer {
        AFFIRMATIVE,
        NEGATIVE,
        NONE
    }

    private static final List<Pattern> NEGATIVE = compile(
            "no", "nope", "nah", "incorrect", "wrong", "not right", "not correct", "not ok", "mistake", "don't confirm");
    private static final List<Pattern> AFFIRMATIVE = compile(
            "yes", "yeah", "yep", "yup", "correct", "right", "good", "ok", "okay", "confirm", "confirmed",
            "looks fine", "fine", "perfect", "sure", "proceed", "go ahead");
    private static final Pattern NEGATOR = Pattern.compile(
            "(?<![a-z'])(not|never|don't|dont|do not|doesn't|does not|isn't|aren't|can't|cannot)(?![a-z])");

    private ConfirmationParser() {
    }

    public static Answer parse(String message) {
        if (message == null || message.isBlank()) {
            return Answer.NONE;
        }
        String text = message.toLowerCase(Locale.ROOT).replace('\u2019', '\'').trim();
        if (firstMatch(NEGATIVE, text) >= 0) {
            return Answer.NEGATIVE;
        }
        int affirmative = firstMatch(AFFIRMATIVE, text);
        if (affirmative < 0) {
            return Answer.NONE;
        }
        if (NEGATOR.matcher(text.substring(0, affirmative)).find()) {
            return Answer.NEGATIVE;
        }
        return Answer.AFFIRMATIVE;
    }

    /**
     * Start of the earliest match of any pattern, or -1.
     */
    private static int firstMatch(List<Pattern> patterns, String text) {
        int first = -1;
        for (Pattern pattern : patterns) {
            Matcher matcher = pattern.matcher(text);
            if (matcher.find() && (first < 0 || matcher.start() < first)) {
                first = matcher.start();
            }
        }
        return first;
    }

    private static List<Pattern> compile(String... phrases) {
        return Arrays.stream(phrases)
                .map(phrase -> Pattern.compile("(?<![a-z'])" + Pattern.quote(phrase) + "(?![a-z])"))
                .toList();
    }
}
