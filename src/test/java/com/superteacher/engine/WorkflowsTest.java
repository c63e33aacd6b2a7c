package com.superteacher.engine;

import com.superteacher.models.ConversationStep;
import com.superteacher.models.Session;
import com.superteacher.models.WorkflowKind;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class WorkflowsTest {

    private static final StepCollaborators NONE = new StepCollaborators(null, null, null, null, null);

    @Test
    void testCbseDescriptor() {
        WorkflowDescriptor cbse = Workflows.cbse(NONE);

        assertEquals(ConversationStep.INITIAL, cbse.getStartStep());
        assertEquals(ConversationStep.WAITING_FOR_CLASS, cbse.getResetStep());
        assertFalse(cbse.declares(ConversationStep.WAITING_FOR_INSTRUCTION));
        assertTrue(cbse.isAllowed(ConversationStep.WAITING_FOR_MARKS_CONFIRMATION,
                ConversationStep.WAITING_FOR_STUDENT_ANSWER));
        assertFalse(cbse.isAllowed(ConversationStep.WAITING_FOR_QUESTION_PAPER,
                ConversationStep.WAITING_FOR_STUDENT_ANSWER));
        assertTrue(cbse.isAllowed(ConversationStep.COMPLETE, ConversationStep.WAITING_FOR_CLASS));
        assertTrue(cbse.isAllowed(ConversationStep.WAITING_FOR_SUBJECT, ConversationStep.WAITING_FOR_SUBJECT));
    }

    @Test
    void testSimpleDescriptor() {
        WorkflowDescriptor simple = Workflows.forKind(WorkflowKind.SIMPLE, NONE);

        assertEquals(WorkflowKind.SIMPLE, simple.getKind());
        assertEquals(ConversationStep.WAITING_FOR_QUESTION, simple.getRecoveryStep());
        assertFalse(simple.declares(ConversationStep.WAITING_FOR_CLASS));
        assertNotNull(simple.textHandler(ConversationStep.WAITING_FOR_INSTRUCTION));
        assertNull(simple.imageHandler(ConversationStep.GRADING_IN_PROGRESS));
    }

    @Test
    void testEveryNonTransientStepHasATextHandler() {
        for (WorkflowKind kind : WorkflowKind.values()) {
            WorkflowDescriptor workflow = Workflows.forKind(kind, NONE);
            for (ConversationStep step : workflow.getSteps()) {
                if (!step.isTransient()) {
                    assertNotNull(workflow.textHandler(step), kind + " has no text handler for " + step);
                }
            }
        }
    }

    @Test
    void testMoveToChecksEdges() {
        WorkflowDescriptor cbse = Workflows.cbse(NONE);
        Session session = new Session("u", WorkflowKind.CBSE);
        session.setStep(ConversationStep.WAITING_FOR_CLASS);
        Turn turn = new Turn(cbse, session, "Class 10", null);

        turn.moveTo(ConversationStep.WAITING_FOR_SUBJECT);
        assertEquals(ConversationStep.WAITING_FOR_SUBJECT, turn.step());

        IllegalStateTransitionException error = assertThrows(IllegalStateTransitionException.class,
                () -> turn.moveTo(ConversationStep.COMPLETE));
        assertEquals(ConversationStep.WAITING_FOR_SUBJECT, turn.step());
        assertTrue(error.getMessage().contains("COMPLETE"));
    }

    @Test
    void testUndeclaredStepsRejectedByBuilder() {
        WorkflowDescriptor.Builder builder = WorkflowDescriptor.builder(WorkflowKind.SIMPLE)
                .steps(ConversationStep.INITIAL)
                .startStep(ConversationStep.INITIAL)
                .resetStep(ConversationStep.WAITING_FOR_QUESTION)
                .recoveryStep(ConversationStep.INITIAL)
                .greeting("hi");

        assertThrows(IllegalStateException.class, builder::build);
    }
}
