package com.superteacher.engine;

import com.superteacher.extraction.MarkExtractor;
import com.superteacher.grading.GradingOrchestrator;
import com.superteacher.grading.GradingResponseFormatter;
import com.superteacher.utils.ImageTextExtractor;

/**
 * Services the step handlers call into.
 */
public record StepCollaborators(
        MarkExtractor markExtractor,
        GradingOrchestrator gradingOrchestrator,
        ImageTextExtractor imageTextExtractor,
        GradingResponseFormatter formatter,
        FollowUpResponder followUpResponder
) {
}
