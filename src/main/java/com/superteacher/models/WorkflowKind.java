package com.superteacher.models;

/**
 * Discriminant telling which conversation workflow a session follows
 */
public enum WorkflowKind {
    /** Class, subject, question paper, confirmed marks, student answer. */
    CBSE,
    /** Typed question, answer image, grading instruction. */
    SIMPLE
}
