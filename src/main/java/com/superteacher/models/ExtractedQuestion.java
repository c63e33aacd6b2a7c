package com.superteacher.models;

/**
 * One question recovered from a question paper, with the marks it carries
 */
public record ExtractedQuestion(int number, String text, int marks) {

    public ExtractedQuestion {
        if (number <= 0) {
            throw new IllegalArgumentException("question number must be positive, was " + number);
        }
        if (marks <= 0) {
            throw new IllegalArgumentException("marks must be positive, was " + marks);
        }
        text = text == null ? "" : text;
    }
}
