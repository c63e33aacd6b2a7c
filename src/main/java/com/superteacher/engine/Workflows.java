package com.superteacher.engine;

import com.superteacher.models.WorkflowKind;

import static com.superteacher.models.ConversationStep.COMPLETE;
import static com.superteacher.models.ConversationStep.EXTRACTING_MARKS;
import static com.superteacher.models.ConversationStep.FOLLOW_UP;
import static com.superteacher.models.ConversationStep.GRADING_IN_PROGRESS;
import static com.superteacher.models.ConversationStep.INITIAL;
import static com.superteacher.models.ConversationStep.PROCESSING_QUESTION_PAPER;
import static com.superteacher.models.ConversationStep.WAITING_FOR_ANSWER;
import static com.superteacher.models.ConversationStep.WAITING_FOR_CLASS;
import static com.superteacher.models.ConversationStep.WAITING_FOR_INSTRUCTION;
import static com.superteacher.models.ConversationStep.WAITING_FOR_MARKS_CONFIRMATION;
import static com.superteacher.models.ConversationStep.WAITING_FOR_MARKS_UPDATE;
import static com.superteacher.models.ConversationStep.WAITING_FOR_QUESTION;
import static com.superteacher.models.ConversationStep.WAITING_FOR_QUESTION_PAPER;
import static com.superteacher.models.ConversationStep.WAITING_FOR_STUDENT_ANSWER;
import static com.superteacher.models.ConversationStep.WAITING_FOR_SUBJECT;

/**
 * The two workflows the assistant runs. Steps and edges are declared here;
 * the handlers come from {@link CbseSteps} and {@link SimpleSteps}.
 */
public final class Workflows {

    private Workflows() {
    }

    public static WorkflowDescriptor forKind(WorkflowKind kind, StepCollaborators collaborators) {
        return kind == WorkflowKind.CBSE ? cbse(collaborators) : simple(collaborators);
    }

    public static WorkflowDescriptor cbse(StepCollaborators collaborators) {
        WorkflowDescriptor.Builder builder = WorkflowDescriptor.builder(WorkflowKind.CBSE)
                .steps(INITIAL, WAITING_FOR_CLASS, WAITING_FOR_SUBJECT, WAITING_FOR_QUESTION_PAPER,
                        PROCESSING_QUESTION_PAPER, EXTRACTING_MARKS, WAITING_FOR_MARKS_CONFIRMATION,
                        WAITING_FOR_MARKS_UPDATE, WAITING_FOR_STUDENT_ANSWER, GRADING_IN_PROGRESS, COMPLETE, FOLLOW_UP)
                .edge(INITIAL, WAITING_FOR_CLASS, WAITING_FOR_SUBJECT, WAITING_FOR_QUESTION_PAPER)
                .edge(WAITING_FOR_CLASS, WAITING_FOR_SUBJECT, WAITING_FOR_QUESTION_PAPER)
                .edge(WAITING_FOR_SUBJECT, WAITING_FOR_QUESTION_PAPER)
                .edge(WAITING_FOR_QUESTION_PAPER, PROCESSING_QUESTION_PAPER)
                .edge(PROCESSING_QUESTION_PAPER, EXTRACTING_MARKS, WAITING_FOR_QUESTION_PAPER)
                .edge(EXTRACTING_MARKS, WAITING_FOR_MARKS_CONFIRMATION, WAITING_FOR_MARKS_UPDATE, WAITING_FOR_QUESTION_PAPER)
                .edge(WAITING_FOR_MARKS_CONFIRMATION, WAITING_FOR_MARKS_UPDATE, WAITING_FOR_STUDENT_ANSWER)
                .edge(WAITING_FOR_MARKS_UPDATE, WAITING_FOR_MARKS_CONFIRMATION)
                .edge(WAITING_FOR_STUDENT_ANSWER, GRADING_IN_PROGRESS, WAITING_FOR_MARKS_CONFIRMATION,
                        WAITING_FOR_QUESTION_PAPER)
                .edge(GRADING_IN_PROGRESS, COMPLETE, WAITING_FOR_STUDENT_ANSWER)
                .edge(COMPLETE, FOLLOW_UP)
                .startStep(INITIAL)
                .resetStep(WAITING_FOR_CLASS)
                .recoveryStep(WAITING_FOR_CLASS)
                .greeting(Replies.CBSE_GREETING);
        new CbseSteps(collaborators).register(builder);
        return builder.build();
    }

    public static WorkflowDescriptor simple(StepCollaborators collaborators) {
        WorkflowDescriptor.Builder builder = WorkflowDescriptor.builder(WorkflowKind.SIMPLE)
                .steps(INITIAL, WAITING_FOR_QUESTION, WAITING_FOR_ANSWER, WAITING_FOR_INSTRUCTION,
                        GRADING_IN_PROGRESS, COMPLETE, FOLLOW_UP)
                .edge(INITIAL, WAITING_FOR_QUESTION)
                .edge(WAITING_FOR_QUESTION, WAITING_FOR_ANSWER)
                .edge(WAITING_FOR_ANSWER, WAITING_FOR_INSTRUCTION)
                .edge(WAITING_FOR_INSTRUCTION, GRADING_IN_PROGRESS, WAITING_FOR_ANSWER)
                .edge(GRADING_IN_PROGRESS, COMPLETE, WAITING_FOR_ANSWER, WAITING_FOR_INSTRUCTION)
                .edge(COMPLETE, FOLLOW_UP)
                .startStep(INITIAL)
                .resetStep(WAITING_FOR_QUESTION)
                .recoveryStep(WAITING_FOR_QUESTION)
                .greeting(Replies.SIMPLE_GREETING);
        new SimpleSteps(collaborators).register(builder);
        return builder.build();
    }
}
