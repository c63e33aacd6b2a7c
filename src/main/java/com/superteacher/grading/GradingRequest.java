package com.superteacher.grading;

import com.superteacher.models.ClassLevel;
import com.superteacher.models.GradingApproach;
import com.superteacher.models.SubjectArea;

/**
 * Everything the grading collaborator needs to score one answer. Class level
 * and subject are null in the simple workflow.
 */
public record GradingRequest(
        String questionContext,
        String studentAnswerText,
        String instruction,
        int maxMarks,
        GradingApproach approach,
        SubjectArea subject,
        ClassLevel classLevel
) {
    public GradingRequest {
        if (maxMarks <= 0) {
            throw new IllegalArgumentException("maxMarks must be positive, was " + maxMarks);
        }
        questionContext = questionContext == null ? "" : questionContext;
        studentAnswerText = studentAnswerText == null ? "" : studentAnswerText;
        instruction = instruction == null ? "" : instruction;
        approach = approach == null ? GradingApproach.BALANCED : approach;
    }

    public boolean isCbse() {
        return classLevel != null || approach == GradingApproach.CBSE_STANDARD;
    }
}
