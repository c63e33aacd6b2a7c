package com.superteacher.extraction;

import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads the maximum-marks declaration ("MM: 40", "Maximum Marks: 80",
 * "Total Marks - 40") from the top of the paper. The total is only used to
 * judge whether the later layers found everything.
 */
final class HeaderTotalScanner implements ExtractionLayer {
    static final int HEADER_LINES = 15;

    private static final Pattern TOTAL = Pattern.compile(
            "\\b(?:m\\.?\\s*m\\.?|max(?:imum)?\\.?\\s*marks?|total\\s*marks?|full\\s*marks?)\\s*[:=\\-]?\\s*(\\d{1,3})\\b",
            Pattern.CASE_INSENSITIVE);

    @Override
    public String name() {
        return "header-total";
    }

    @Override
    public void apply(ExtractionDraft draft) {
        List<String> lines = draft.lines();
        for (int i = 0; i < Math.min(HEADER_LINES, lines.size()); i++) {
            Matcher matcher = TOTAL.matcher(lines.get(i));
            if (matcher.find()) {
                int total = Integer.parseInt(matcher.group(1));
                if (total > 0) {
                    draft.setHeaderTotal(total);
                    return;
                }
            }
        }
    }

    static boolean isHeaderLine(String line) {
        return TOTAL.matcher(line).find();
    }
}
