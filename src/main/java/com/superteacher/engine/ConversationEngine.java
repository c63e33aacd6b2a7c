package com.superteacher.engine;

import com.superteacher.intent.IntentClassifier;
import com.superteacher.models.ConversationStep;
import com.superteacher.models.ImageSource;
import com.superteacher.models.Session;
import com.superteacher.models.UserIntent;
import com.superteacher.session.SessionStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.Objects;
import java.util.Optional;

/**
 * Runs one conversation turn per inbound message.
 *
 * <p>A turn reads a snapshot of the user's session, works on a private copy,
 * and commits once at the end with an optimistic version check, so a slow
 * turn can never overwrite a newer state. The methods never throw: every
 * failure ends in a reply telling the user what to do next.
 *
 * <p>Intent handling that applies in every step (reset, help, greeting) lives
 * here; everything else is delegated to the workflow's step handlers.
 */
public class ConversationEngine {
    private static final Logger logger = LoggerFactory.getLogger(ConversationEngine.class);

    private final SessionStore store;
    private final WorkflowDescriptor workflow;
    private final IntentClassifier classifier;
    private final Clock clock;

    public ConversationEngine(SessionStore store, WorkflowDescriptor workflow, IntentClassifier classifier, Clock clock) {
        this.store = Objects.requireNonNull(store, "store");
        this.workflow = Objects.requireNonNull(workflow, "workflow");
        this.classifier = Objects.requireNonNull(classifier, "classifier");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public String handleText(String userId, String text) {
        return processText(userId, text).reply();
    }

    public String handleImage(String userId, ImageSource image) {
        return processImage(userId, image).reply();
    }

    public TurnResult processText(String userId, String text) {
        return process(userId, text, null);
    }

    public TurnResult processImage(String userId, ImageSource image) {
        return process(userId, null, Objects.requireNonNull(image, "image"));
    }

    public WorkflowDescriptor getWorkflow() {
        return workflow;
    }

    public SessionStore getStore() {
        return store;
    }

    private TurnResult process(String userId, String text, ImageSource image) {
        Session snapshot = store.get(userId);
        Turn turn = new Turn(workflow, new Session(snapshot), text, image);

        try {
            if (!workflow.declares(turn.step())) {
                logger.warn("User {} is in step {} which the {} workflow does not declare, recovering",
                        userId, turn.step(), workflow.getKind());
                turn.coerceToRecovery();
                turn.reply(Replies.recovery(turn.session()));
            } else if (turn.hasImage()) {
                handleImageTurn(turn);
            } else {
                handleTextTurn(turn);
            }
            verifyFinalStep(turn);
        } catch (RuntimeException e) {
            logger.error("Turn failed for user {} in step {}", userId, snapshot.getStep(), e);
            turn.clearReply();
            turn.coerceToRecovery();
            turn.reply(Replies.failure(turn.session()));
        }
        return commit(userId, snapshot, turn);
    }

    private void handleTextTurn(Turn turn) {
        UserIntent intent = classifier.classify(turn.text(), turn.session());
        turn.setIntent(intent);
        logger.info("User {} in {}: intent {}", turn.session().getUserId(), turn.step(), intent);

        switch (intent) {
            case NEW_SESSION:
                turn.resetSession();
                turn.reply("Let's start a new grading session. " + Replies.promptFor(turn.session()));
                return;
            case HELP:
                turn.reply(Replies.help(turn.session()));
                return;
            case GREETING:
                if (turn.step() == workflow.getStartStep()) {
                    turn.moveTo(workflow.getResetStep());
                    turn.reply(workflow.getGreeting());
                } else {
                    turn.reply("Hello again! " + Replies.promptFor(turn.session()));
                }
                return;
            default:
                break;
        }

        if (turn.text().isEmpty()) {
            turn.reply(Replies.promptFor(turn.session()));
            return;
        }
        StepHandler handler = workflow.textHandler(turn.step());
        if (handler == null) {
            logger.warn("No text handler for step {} in the {} workflow", turn.step(), workflow.getKind());
            turn.coerceToRecovery();
            turn.reply(Replies.recovery(turn.session()));
            return;
        }
        handler.handle(turn);
        if (turn.replyText().isEmpty()) {
            turn.reply(Replies.promptFor(turn.session()));
        }
    }

    private void handleImageTurn(Turn turn) {
        logger.info("User {} in {}: image {}", turn.session().getUserId(), turn.step(), turn.image());
        StepHandler handler = workflow.imageHandler(turn.step());
        if (handler == null) {
            turn.reply("I received an image, but I wasn't expecting one just now. " + Replies.promptFor(turn.session()));
            return;
        }
        handler.handle(turn);
        if (turn.replyText().isEmpty()) {
            turn.reply(Replies.promptFor(turn.session()));
        }
    }

    /**
     * A turn must end in a declared, non-transient step.
     */
    private void verifyFinalStep(Turn turn) {
        ConversationStep step = turn.step();
        if (!workflow.declares(step) || step.isTransient()) {
            logger.warn("Turn for user {} ended in step {}, recovering", turn.session().getUserId(), step);
            turn.coerceToRecovery();
            turn.reply(Replies.recovery(turn.session()));
        }
    }

    private TurnResult commit(String userId, Session snapshot, Turn turn) {
        Session next = turn.session();
        next.setTurnCount(snapshot.getTurnCount() + 1);
        next.setLastInteraction(clock.instant());

        Optional<Session> committed = store.compareAndUpdate(userId, snapshot.getVersion(), current -> next);
        if (committed.isPresent()) {
            return new TurnResult(turn.replyText(), committed.get().getStep(), turn.intent(), true);
        }
        Session current = store.get(userId);
        return new TurnResult(Replies.movedOn(current), current.getStep(), turn.intent(), false);
    }
}
