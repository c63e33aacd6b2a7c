package com.superteacher.engine;

import com.superteacher.models.ConversationStep;
import com.superteacher.models.ImageSource;
import com.superteacher.models.Session;
import com.superteacher.models.UserIntent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * One inbound message being processed against a private working copy of the
 * session. Steps change only through {@link #moveTo}, which enforces the
 * workflow's edges; nothing is stored until the engine commits the turn.
 */
public final class Turn {
    private static final Logger logger = LoggerFactory.getLogger(Turn.class);

    private final WorkflowDescriptor workflow;
    private final String text;
    private final ImageSource image;
    private Session session;
    private UserIntent intent = UserIntent.UNKNOWN;
    private final StringBuilder reply = new StringBuilder();

    Turn(WorkflowDescriptor workflow, Session session, String text, ImageSource image) {
        this.workflow = workflow;
        this.session = session;
        this.text = text;
        this.image = image;
    }

    public Session session() {
        return session;
    }

    public WorkflowDescriptor workflow() {
        return workflow;
    }

    public ConversationStep step() {
        return session.getStep();
    }

    /**
     * Trimmed message text, empty for image turns.
     */
    public String text() {
        return text == null ? "" : text.trim();
    }

    public ImageSource image() {
        return image;
    }

    public boolean hasImage() {
        return image != null;
    }

    public UserIntent intent() {
        return intent;
    }

    void setIntent(UserIntent intent) {
        this.intent = intent;
    }

    /**
     * @throws IllegalStateTransitionException if the workflow has no such edge
     */
    public void moveTo(ConversationStep next) {
        ConversationStep current = session.getStep();
        if (!workflow.isAllowed(current, next)) {
            throw new IllegalStateTransitionException(workflow.getKind(), current, next);
        }
        if (current != next) {
            logger.info("User {}: {} -> {}", session.getUserId(), current, next);
        }
        session.setStep(next);
    }

    /**
     * Fresh session for the same user, keeping the grading history, placed at
     * the workflow's reset step.
     */
    public void resetSession() {
        Session fresh = session.resetCopy(true);
        fresh.setStep(workflow.getResetStep());
        logger.info("User {}: session reset to {}", session.getUserId(), workflow.getResetStep());
        this.session = fresh;
    }

    /**
     * Force the recovery step without an edge check. Only the engine uses
     * this, to get out of an undeclared or inconsistent state.
     */
    void coerceToRecovery() {
        session.setStep(workflow.getRecoveryStep());
    }

    public void reply(String message) {
        if (message == null || message.isBlank()) {
            return;
        }
        if (reply.length() > 0) {
            reply.append("\n\n");
        }
        reply.append(message.trim());
    }

    void clearReply() {
        reply.setLength(0);
    }

    String replyText() {
        return reply.toString();
    }
}
