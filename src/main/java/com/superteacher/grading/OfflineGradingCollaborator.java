package com.superteacher.grading;

import java.io.IOException;

/**
 * Stands in for the remote grader when none is configured. Every call fails,
 * so the orchestrator always resolves through local fallback grading.
 */
public class OfflineGradingCollaborator implements GradingCollaborator {

    @Override
    public String requestGrading(GradingRequest request) throws IOException {
        throw new IOException("no grading service is configured");
    }

    @Override
    public String name() {
        return "offline";
    }
}
