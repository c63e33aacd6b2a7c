package com.superteacher.models;

/**
 * Symbolic purpose of a single teacher message
 */
public enum UserIntent {
    GREETING,
    HELP,
    NEW_SESSION,
    SET_CLASS,
    SET_SUBJECT,
    CONFIRM_MARKS,
    REJECT_MARKS,
    UPDATE_MARKS,
    PROVIDE_QUESTION,
    GRADING_INSTRUCTION,
    FOLLOW_UP_QUESTION,
    UNKNOWN
}
