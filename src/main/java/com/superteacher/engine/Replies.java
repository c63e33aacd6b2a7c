package com.superteacher.engine;

import com.superteacher.models.ConversationStep;
import com.superteacher.models.ExtractedQuestion;
import com.superteacher.models.Session;
import com.superteacher.models.WorkflowKind;

import java.util.List;

/**
 * User-facing texts: step prompts, help and recovery messages.
 */
public final class Replies {
    public static final String CBSE_GREETING = "Welcome to the CBSE Grading Assistant! I'm here to help you grade papers. "
            + "Could you tell me which class you're grading for?";
    public static final String SIMPLE_GREETING = "Hi! I'm SuperTeacher. Please send me the question you'd like to grade.";

    static final String CLASS_PROMPT = "Which class are you grading for? Please reply with a class from 6 to 12, "
            + "for example \"Class 10\".";
    static final String SUBJECT_PROMPT = "Which subject is this paper for? For example Mathematics, Science, "
            + "Economics or English.";
    static final String PAPER_PROMPT = "Please upload a clear image of the question paper, or paste its text here.";
    static final String MARKS_UPDATE_PROMPT = "Please tell me the correct marks in this format: "
            + "\"Question 3 should be 5 marks\". Send one correction per message.";
    static final String ANSWER_SHEET_PROMPT = "Please upload the student's answer sheet, or paste the answer text.";
    static final String FINISHED_PROMPT = "You can ask me questions about this grade, or send a new image or say "
            + "\"start over\" to grade another one.";
    static final String QUESTION_PROMPT = "Please send me the question you'd like to grade.";
    static final String ANSWER_IMAGE_PROMPT = "Please upload an image of the student's answer.";
    static final String INSTRUCTION_PROMPT = "How should I grade it? For example \"Grade it for 6 marks, be strict\". "
            + "If you don't mention marks I'll grade out of 10.";
    static final String REUPLOAD = "I couldn't read that image. Please try uploading it again with better lighting "
            + "and the whole page in view.";

    private Replies() {
    }

    /**
     * What the user should do next in the session's current step.
     */
    public static String promptFor(Session session) {
        ConversationStep step = session.getStep();
        if (step == null) {
            return CLASS_PROMPT;
        }
        switch (step) {
            case INITIAL:
                return session.getWorkflowKind() == WorkflowKind.CBSE ? CBSE_GREETING : SIMPLE_GREETING;
            case WAITING_FOR_CLASS:
                return CLASS_PROMPT;
            case WAITING_FOR_SUBJECT:
                return SUBJECT_PROMPT;
            case WAITING_FOR_QUESTION_PAPER:
            case PROCESSING_QUESTION_PAPER:
            case EXTRACTING_MARKS:
                return PAPER_PROMPT;
            case WAITING_FOR_MARKS_CONFIRMATION:
                return marksTable(session.getDraftQuestions()) + "\n\n" + confirmPrompt();
            case WAITING_FOR_MARKS_UPDATE:
                return MARKS_UPDATE_PROMPT;
            case WAITING_FOR_STUDENT_ANSWER:
                return ANSWER_SHEET_PROMPT;
            case WAITING_FOR_QUESTION:
                return QUESTION_PROMPT;
            case WAITING_FOR_ANSWER:
                return ANSWER_IMAGE_PROMPT;
            case WAITING_FOR_INSTRUCTION:
                return INSTRUCTION_PROMPT;
            case GRADING_IN_PROGRESS:
                return "I'm still grading the previous answer. Please wait a moment.";
            case COMPLETE:
            case FOLLOW_UP:
                return FINISHED_PROMPT;
            default:
                return CLASS_PROMPT;
        }
    }

    static String confirmPrompt() {
        return "Are these marks correct? Reply \"yes\" to confirm or \"no\" to correct them.";
    }

    static String marksTable(List<ExtractedQuestion> questions) {
        if (questions.isEmpty()) {
            return "I haven't recorded any marks yet.";
        }
        StringBuilder table = new StringBuilder("Here is the marks distribution I found:\n");
        int total = 0;
        for (ExtractedQuestion question : questions) {
            table.append("- Question ").append(question.number()).append(": ").append(question.marks())
                    .append(question.marks() == 1 ? " mark" : " marks");
            if (!question.text().isBlank()) {
                table.append(" (").append(abbreviate(question.text(), 60)).append(')');
            }
            table.append('\n');
            total += question.marks();
        }
        table.append("Total: ").append(total).append(" marks");
        return table.toString();
    }

    static String help(Session session) {
        String overview = session.getWorkflowKind() == WorkflowKind.CBSE
                ? "I grade CBSE answer sheets in a few steps: tell me the class and subject, upload the question "
                + "paper so I can read the marks for each question, confirm or correct those marks, then upload "
                + "the student's answer sheet and I'll grade it."
                : "I grade one answer at a time: send me the question, upload the student's answer, then tell me "
                + "how to grade it, for example \"Grade it for 6 marks, be strict\".";
        return overview + "\nSay \"start over\" at any time to begin again.\n\nRight now: " + promptFor(session);
    }

    static String recovery(Session session) {
        return "Sorry, I lost track of where we were. Let's pick up from here. " + promptFor(session);
    }

    static String failure(Session session) {
        return "Sorry, something went wrong while handling that message. " + promptFor(session);
    }

    static String movedOn(Session current) {
        return "Your session moved on while I was working on that message, so I've discarded it. "
                + promptFor(current);
    }

    static String abbreviate(String text, int max) {
        String single = text.replaceAll("\\s+", " ").trim();
        return single.length() <= max ? single : single.substring(0, max - 3) + "...";
    }
}
