package com.superteacher.utils;

/**
 * Simple counts over a block of answer text, used by the local fallback
 * grader.
 */
public class TextStats {

    public static int wordCount(String text) {
        if (text == null || text.isBlank()) {
            return 0;
        }
        return text.trim().split("\\s+").length;
    }

    /**
     * Sentences are runs of text ended by '.', '!' or '?' followed by space,
     * plus the trailing run.
     */
    public static int sentenceCount(String text) {
        if (text == null || text.isBlank()) {
            return 0;
        }
        return text.trim().split("[.!?]+\\s+").length;
    }
}
