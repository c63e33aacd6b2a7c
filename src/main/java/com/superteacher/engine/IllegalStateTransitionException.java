package com.superteacher.engine;

import com.superteacher.models.ConversationStep;
import com.superteacher.models.WorkflowKind;

/**
 * A step handler tried to move along an edge its workflow does not declare.
 */
public class IllegalStateTransitionException extends RuntimeException {
    private final ConversationStep from;
    private final ConversationStep to;

    public IllegalStateTransitionException(WorkflowKind workflow, ConversationStep from, ConversationStep to) {
        super(workflow + " workflow has no transition " + from + " -> " + to);
        this.from = from;
        this.to = to;
    }

    public ConversationStep getFrom() {
        return from;
    }

    public ConversationStep getTo() {
        return to;
    }
}
