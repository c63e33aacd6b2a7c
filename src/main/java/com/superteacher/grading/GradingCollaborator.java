package com.superteacher.grading;

import java.io.IOException;

/**
 * External service that scores an answer. Implementations make exactly one
 * call per invocation and return the raw JSON content of the reply.
 */
public interface GradingCollaborator {

    String requestGrading(GradingRequest request) throws IOException;

    default String name() {
        return getClass().getSimpleName();
    }
}
