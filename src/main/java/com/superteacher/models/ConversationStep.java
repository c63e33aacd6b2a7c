package com.superteacher.models;

/**
 * Every state a grading conversation can be in.
 *
 * The CBSE workflow walks WAITING_FOR_CLASS through WAITING_FOR_STUDENT_ANSWER,
 * the simple workflow uses WAITING_FOR_QUESTION, WAITING_FOR_ANSWER and
 * WAITING_FOR_INSTRUCTION. Both share the grading and completion states.
 */
public enum ConversationStep {
    INITIAL,
    WAITING_FOR_CLASS,
    WAITING_FOR_SUBJECT,
    WAITING_FOR_QUESTION_PAPER,
    PROCESSING_QUESTION_PAPER,
    EXTRACTING_MARKS,
    WAITING_FOR_MARKS_CONFIRMATION,
    WAITING_FOR_MARKS_UPDATE,
    WAITING_FOR_STUDENT_ANSWER,
    WAITING_FOR_QUESTION,
    WAITING_FOR_ANSWER,
    WAITING_FOR_INSTRUCTION,
    GRADING_IN_PROGRESS,
    COMPLETE,
    FOLLOW_UP;

    /**
     * Steps that only exist for the duration of a single turn. Finding a
     * session parked in one of them means an earlier turn died midway.
     */
    public boolean isTransient() {
        return this == PROCESSING_QUESTION_PAPER
                || this == EXTRACTING_MARKS
                || this == GRADING_IN_PROGRESS;
    }
}
