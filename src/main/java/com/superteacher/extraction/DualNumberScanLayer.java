package com.superteacher.extraction;

import java.util.OptionalInt;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Last resort over the whole text run together: any "N . short text M"
 * where M is a plausible mark value.
 */
final class DualNumberScanLayer implements ExtractionLayer {
    private static final Pattern DUAL_NUMBER = Pattern.compile(
            "(?<!\\d)(\\d{1,2})\\s*\\.\\s+([^\\d]{3,80}?)\\s+(\\d{1,2})(?!\\d)");

    @Override
    public String name() {
        return "dual-number";
    }

    @Override
    public void apply(ExtractionDraft draft) {
        if (draft.hasAnyMarks()) {
            return;
        }
        Matcher matcher = DUAL_NUMBER.matcher(draft.joinedText());
        while (matcher.find()) {
            int question = Integer.parseInt(matcher.group(1));
            OptionalInt marks = QuestionLines.plausibleMarks(matcher.group(3));
            if (question > 0 && marks.isPresent()) {
                draft.putMarks(question, marks.getAsInt());
                draft.putText(question, matcher.group(2));
            }
        }
    }
}
