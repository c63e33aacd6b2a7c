package com.superteacher.engine;

import com.superteacher.grading.GradingRequest;
import com.superteacher.models.GradingApproach;
import com.superteacher.models.GradingResult;
import com.superteacher.models.Session;
import com.superteacher.models.UserIntent;
import com.superteacher.utils.ImageTextExtractor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import static com.superteacher.models.ConversationStep.COMPLETE;
import static com.superteacher.models.ConversationStep.FOLLOW_UP;
import static com.superteacher.models.ConversationStep.GRADING_IN_PROGRESS;
import static com.superteacher.models.ConversationStep.INITIAL;
import static com.superteacher.models.ConversationStep.WAITING_FOR_ANSWER;
import static com.superteacher.models.ConversationStep.WAITING_FOR_INSTRUCTION;
import static com.superteacher.models.ConversationStep.WAITING_FOR_QUESTION;

/**
 * Step handlers of the simple workflow: question, answer, grading
 * instruction, grade.
 */
final class SimpleSteps {
    private static final Logger logger = LoggerFactory.getLogger(SimpleSteps.class);

    static final int DEFAULT_MAX_MARKS = 10;
    static final int MAX_MARKS_LIMIT = 100;
    static final int MIN_TYPED_ANSWER_LENGTH = 20;
    static final String PLACEHOLDER_QUESTION = "Grading a student answer";
    static final String UNKNOWN_QUESTION = "Unknown question";

    private static final Pattern MARKS = Pattern.compile("(\\d+)\\s*marks?", Pattern.CASE_INSENSITIVE);
    private static final int SHORT_INSTRUCTION_LENGTH = 25;

    private final StepCollaborators collaborators;

    SimpleSteps(StepCollaborators collaborators) {
        this.collaborators = collaborators;
    }

    void register(WorkflowDescriptor.Builder builder) {
        builder.onText(INITIAL, this::initialText)
                .onText(WAITING_FOR_QUESTION, this::questionText)
                .onText(WAITING_FOR_ANSWER, this::answerText)
                .onText(WAITING_FOR_INSTRUCTION, this::instructionText)
                .onText(COMPLETE, this::finishedText)
                .onText(FOLLOW_UP, this::finishedText)
                .onImage(INITIAL, this::imageBeforeQuestion)
                .onImage(WAITING_FOR_QUESTION, this::imageBeforeQuestion)
                .onImage(WAITING_FOR_ANSWER, this::answerImage)
                .onImage(WAITING_FOR_INSTRUCTION, this::replacementAnswerImage)
                .onImage(COMPLETE, this::imageAfterGrading)
                .onImage(FOLLOW_UP, this::imageAfterGrading);
    }

    private void initialText(Turn turn) {
        turn.moveTo(WAITING_FOR_QUESTION);
        questionText(turn);
    }

    private void questionText(Turn turn) {
        String text = turn.text();
        if (turn.intent() == UserIntent.GRADING_INSTRUCTION && !text.contains("?")
                && text.length() < SHORT_INSTRUCTION_LENGTH) {
            turn.reply("I need the question before the grading instructions. " + Replies.QUESTION_PROMPT);
            return;
        }
        acceptQuestion(turn, text);
    }

    private void acceptQuestion(Turn turn, String question) {
        turn.session().setQuestion(question);
        turn.moveTo(WAITING_FOR_ANSWER);
        turn.reply("Got the question. " + Replies.ANSWER_IMAGE_PROMPT + " You can also paste the answer as text.");
    }

    private void answerText(Turn turn) {
        if (turn.text().length() < MIN_TYPED_ANSWER_LENGTH) {
            turn.reply(Replies.ANSWER_IMAGE_PROMPT);
            return;
        }
        turn.session().setStudentAnswerText(turn.text());
        turn.moveTo(WAITING_FOR_INSTRUCTION);
        turn.reply("Thanks, I have the answer. " + Replies.INSTRUCTION_PROMPT);
    }

    private void answerImage(Turn turn) {
        String text = readAnswer(turn);
        if (text == null) {
            return;
        }
        turn.session().setStudentAnswerText(text);
        turn.moveTo(WAITING_FOR_INSTRUCTION);
        turn.reply("I've read the student's answer:\n\n\"" + Replies.abbreviate(text, 300) + "\"\n\n"
                + Replies.INSTRUCTION_PROMPT);
    }

    private void replacementAnswerImage(Turn turn) {
        String text = readAnswer(turn);
        if (text == null) {
            return;
        }
        turn.session().setStudentAnswerText(text);
        turn.reply("I've replaced the answer with the one in this image. " + Replies.INSTRUCTION_PROMPT);
    }

    private String readAnswer(Turn turn) {
        try {
            ImageTextExtractor.ExtractedText extracted = collaborators.imageTextExtractor()
                    .extract(turn.image(), ImageTextExtractor.ImageKind.STUDENT_ANSWER);
            if (extracted.storedAt() != null) {
                turn.session().setOriginalImage(extracted.storedAt().toString());
            }
            return extracted.text();
        } catch (IOException e) {
            logger.warn("Could not read answer image for user {}: {}", turn.session().getUserId(), e.getMessage());
            turn.reply(Replies.REUPLOAD);
            return null;
        }
    }

    private void instructionText(Turn turn) {
        Session session = turn.session();
        String instruction = turn.text();
        session.setGradingInstruction(instruction);
        session.setGradingApproach(GradingApproach.fromInstruction(instruction));
        session.setMaxMarks(maxMarksFrom(instruction));
        grade(turn);
    }

    private void grade(Turn turn) {
        Session session = turn.session();
        String answer = session.getStudentAnswerText();
        if (answer == null || answer.isBlank()) {
            turn.moveTo(WAITING_FOR_ANSWER);
            turn.reply("I don't have the student's answer yet. " + Replies.ANSWER_IMAGE_PROMPT);
            return;
        }
        String question = session.getQuestion() == null || session.getQuestion().isBlank()
                ? UNKNOWN_QUESTION : session.getQuestion();

        turn.moveTo(GRADING_IN_PROGRESS);
        GradingRequest request = new GradingRequest(
                question,
                answer,
                session.getGradingInstruction(),
                session.getMaxMarks() == null ? DEFAULT_MAX_MARKS : session.getMaxMarks(),
                session.getGradingApproach(),
                null,
                null);
        GradingResult result = collaborators.gradingOrchestrator().grade(request);
        session.appendGradingResult(result);

        turn.moveTo(COMPLETE);
        turn.reply(collaborators.formatter().formatSimple(result));
    }

    private void finishedText(Turn turn) {
        switch (turn.intent()) {
            case FOLLOW_UP_QUESTION:
                turn.moveTo(FOLLOW_UP);
                turn.reply(collaborators.followUpResponder().answer(turn.text(), turn.session().getLastGradingResult()));
                return;
            case PROVIDE_QUESTION:
                turn.resetSession();
                acceptQuestion(turn, turn.text());
                return;
            default:
                turn.reply(Replies.FINISHED_PROMPT);
        }
    }

    private void imageBeforeQuestion(Turn turn) {
        if (turn.step() == INITIAL) {
            turn.moveTo(WAITING_FOR_QUESTION);
        }
        turn.reply("Thanks for the image! Please send me the question as text first, then upload the answer again.");
    }

    private void imageAfterGrading(Turn turn) {
        turn.resetSession();
        turn.session().setQuestion(PLACEHOLDER_QUESTION);
        turn.moveTo(WAITING_FOR_ANSWER);
        answerImage(turn);
    }

    static int maxMarksFrom(String instruction) {
        if (instruction == null) {
            return DEFAULT_MAX_MARKS;
        }
        Matcher matcher = MARKS.matcher(instruction);
        if (matcher.find()) {
            try {
                int marks = Integer.parseInt(matcher.group(1));
                if (marks > 0 && marks <= MAX_MARKS_LIMIT) {
                    return marks;
                }
            } catch (NumberFormatException e) {
                logger.debug("Ignoring marks value {} in instruction", matcher.group(1));
            }
        }
        return DEFAULT_MAX_MARKS;
    }
}
