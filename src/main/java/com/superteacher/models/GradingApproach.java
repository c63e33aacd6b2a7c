package com.superteacher.models;

import java.util.Locale;

/**
 * How a grade was arrived at. The tag is the lowercase form used in prompts
 * and exports.
 */
public enum GradingApproach {
    STRICT("strict"),
    BALANCED("balanced"),
    LENIENT("lenient"),
    DETAILED("detailed"),
    QUICK("quick"),
    CONCEPTUAL("conceptual"),
    TECHNICAL("technical"),
    CBSE_STANDARD("cbse-standard");

    private final String tag;

    GradingApproach(String tag) {
        this.tag = tag;
    }

    public String getTag() {
        return tag;
    }

    /**
     * Pick the approach named in a free-text grading instruction, BALANCED when
     * none is named. Earlier entries win when several keywords appear.
     */
    public static GradingApproach fromInstruction(String instruction) {
        if (instruction == null) {
            return BALANCED;
        }
        String text = instruction.toLowerCase(Locale.ROOT);
        if (text.contains("strict") || text.contains("harsh") || text.contains("tough")) {
            return STRICT;
        }
        if (text.contains("lenient") || text.contains("generous") || text.contains("easy on")) {
            return LENIENT;
        }
        if (text.contains("detail") || text.contains("thorough")) {
            return DETAILED;
        }
        if (text.contains("quick") || text.contains("brief") || text.contains("short feedback")) {
            return QUICK;
        }
        if (text.contains("concept") || text.contains("understanding")) {
            return CONCEPTUAL;
        }
        if (text.contains("technical") || text.contains("accuracy") || text.contains("precise")) {
            return TECHNICAL;
        }
        return BALANCED;
    }
}
