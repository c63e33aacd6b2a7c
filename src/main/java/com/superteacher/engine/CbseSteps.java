package com.superteacher.engine;

import com.superteacher.grading.GradingRequest;
import com.superteacher.grading.SubjectGuidelines;
import com.superteacher.intent.ClassLevelParser;
import com.superteacher.intent.MarksUpdateParser;
import com.superteacher.intent.SubjectParser;
import com.superteacher.models.ClassLevel;
import com.superteacher.models.ExtractionResult;
import com.superteacher.models.GradingApproach;
import com.superteacher.models.GradingResult;
import com.superteacher.models.Session;
import com.superteacher.models.SubjectArea;
import com.superteacher.models.UserIntent;
import com.superteacher.utils.ImageTextExtractor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.Map;
import java.util.Optional;

import static com.superteacher.models.ConversationStep.COMPLETE;
import static com.superteacher.models.ConversationStep.EXTRACTING_MARKS;
import static com.superteacher.models.ConversationStep.FOLLOW_UP;
import static com.superteacher.models.ConversationStep.GRADING_IN_PROGRESS;
import static com.superteacher.models.ConversationStep.INITIAL;
import static com.superteacher.models.ConversationStep.PROCESSING_QUESTION_PAPER;
import static com.superteacher.models.ConversationStep.WAITING_FOR_CLASS;
import static com.superteacher.models.ConversationStep.WAITING_FOR_MARKS_CONFIRMATION;
import static com.superteacher.models.ConversationStep.WAITING_FOR_MARKS_UPDATE;
import static com.superteacher.models.ConversationStep.WAITING_FOR_QUESTION_PAPER;
import static com.superteacher.models.ConversationStep.WAITING_FOR_STUDENT_ANSWER;
import static com.superteacher.models.ConversationStep.WAITING_FOR_SUBJECT;

/**
 * Step handlers of the CBSE workflow: class, subject, question paper, marks
 * confirmation, answer sheet, grade, follow-up.
 */
final class CbseSteps {
    private static final Logger logger = LoggerFactory.getLogger(CbseSteps.class);

    static final int MIN_PASTED_PAPER_LENGTH = 40;
    static final int MIN_TYPED_ANSWER_LENGTH = 20;

    private final StepCollaborators collaborators;

    CbseSteps(StepCollaborators collaborators) {
        this.collaborators = collaborators;
    }

    void register(WorkflowDescriptor.Builder builder) {
        builder.onText(INITIAL, this::initialText)
                .onText(WAITING_FOR_CLASS, this::classText)
                .onText(WAITING_FOR_SUBJECT, this::subjectText)
                .onText(WAITING_FOR_QUESTION_PAPER, this::paperText)
                .onText(WAITING_FOR_MARKS_CONFIRMATION, this::confirmationText)
                .onText(WAITING_FOR_MARKS_UPDATE, this::marksUpdateText)
                .onText(WAITING_FOR_STUDENT_ANSWER, this::answerText)
                .onText(COMPLETE, this::followUpText)
                .onText(FOLLOW_UP, this::followUpText)
                .onImage(INITIAL, this::imageBeforeContext)
                .onImage(WAITING_FOR_CLASS, this::imageBeforeContext)
                .onImage(WAITING_FOR_SUBJECT, this::imageBeforeContext)
                .onImage(WAITING_FOR_QUESTION_PAPER, this::paperImage)
                .onImage(WAITING_FOR_MARKS_CONFIRMATION, this::imageDuringMarksCheck)
                .onImage(WAITING_FOR_MARKS_UPDATE, this::imageDuringMarksCheck)
                .onImage(WAITING_FOR_STUDENT_ANSWER, this::answerImage)
                .onImage(COMPLETE, this::imageAfterGrading)
                .onImage(FOLLOW_UP, this::imageAfterGrading);
    }

    private void initialText(Turn turn) {
        Optional<ClassLevel> level = ClassLevelParser.parse(turn.text(), true);
        if (level.isPresent()) {
            applyClass(turn, level.get());
            return;
        }
        turn.moveTo(WAITING_FOR_CLASS);
        turn.reply(Replies.CBSE_GREETING);
    }

    private void classText(Turn turn) {
        Optional<ClassLevel> level = ClassLevelParser.parse(turn.text(), false);
        if (level.isEmpty()) {
            turn.reply("I couldn't find a class between 6 and 12 in that. " + Replies.CLASS_PROMPT);
            return;
        }
        applyClass(turn, level.get());
    }

    private void applyClass(Turn turn, ClassLevel level) {
        Session session = turn.session();
        session.setClassLevel(level);
        Optional<SubjectArea> subject = SubjectParser.parse(turn.text());
        if (subject.isPresent()) {
            session.setSubjectArea(subject.get());
            turn.moveTo(WAITING_FOR_QUESTION_PAPER);
            turn.reply("Great, " + level.getDisplayName() + " " + subject.get().getDisplayName() + ". "
                    + Replies.PAPER_PROMPT);
            return;
        }
        turn.moveTo(WAITING_FOR_SUBJECT);
        turn.reply("Got it, " + level.getDisplayName() + ". " + Replies.SUBJECT_PROMPT);
    }

    private void subjectText(Turn turn) {
        Optional<SubjectArea> subject = SubjectParser.parse(turn.text());
        if (subject.isEmpty()) {
            turn.reply("I didn't recognise that subject. " + Replies.SUBJECT_PROMPT);
            return;
        }
        turn.session().setSubjectArea(subject.get());
        turn.moveTo(WAITING_FOR_QUESTION_PAPER);
        turn.reply(subject.get().getDisplayName() + " it is. " + Replies.PAPER_PROMPT);
    }

    private void paperText(Turn turn) {
        if (turn.text().length() < MIN_PASTED_PAPER_LENGTH) {
            turn.reply(Replies.PAPER_PROMPT);
            return;
        }
        turn.moveTo(PROCESSING_QUESTION_PAPER);
        processPaper(turn, turn.text());
    }

    private void paperImage(Turn turn) {
        turn.moveTo(PROCESSING_QUESTION_PAPER);
        ImageTextExtractor.ExtractedText extracted;
        try {
            extracted = collaborators.imageTextExtractor()
                    .extract(turn.image(), ImageTextExtractor.ImageKind.QUESTION_PAPER);
        } catch (IOException e) {
            logger.warn("Could not read question paper for user {}: {}", turn.session().getUserId(), e.getMessage());
            turn.moveTo(WAITING_FOR_QUESTION_PAPER);
            turn.reply(Replies.REUPLOAD);
            return;
        }
        if (extracted.storedAt() != null) {
            turn.session().setOriginalImage(extracted.storedAt().toString());
        }
        processPaper(turn, extracted.text());
    }

    private void processPaper(Turn turn, String paperText) {
        Session session = turn.session();
        session.setQuestionPaperText(paperText);
        turn.moveTo(EXTRACTING_MARKS);

        ExtractionResult result = collaborators.markExtractor().extract(paperText, session.getSubjectArea());
        session.setDraftQuestions(result.questions());

        if (result.isEmpty()) {
            turn.moveTo(WAITING_FOR_MARKS_UPDATE);
            turn.reply("I read the question paper but couldn't work out the marks for each question. "
                    + Replies.MARKS_UPDATE_PROMPT);
            return;
        }
        turn.moveTo(WAITING_FOR_MARKS_CONFIRMATION);
        StringBuilder reply = new StringBuilder(Replies.marksTable(session.getDraftQuestions()));
        if (result.getHeaderTotal().isPresent() && !result.looksComplete()) {
            reply.append("\n\nNote: the paper says the maximum marks are ").append(result.getHeaderTotal().getAsInt())
                    .append(", but the marks I found add up to ").append(result.total()).append('.');
        }
        reply.append("\n\n").append(Replies.confirmPrompt());
        turn.reply(reply.toString());
    }

    private void confirmationText(Turn turn) {
        Session session = turn.session();
        switch (turn.intent()) {
            case CONFIRM_MARKS:
                if (session.getDraftMarks().isEmpty()) {
                    turn.moveTo(WAITING_FOR_MARKS_UPDATE);
                    turn.reply("There are no marks to confirm yet. " + Replies.MARKS_UPDATE_PROMPT);
                    return;
                }
                session.confirmMarks();
                turn.moveTo(WAITING_FOR_STUDENT_ANSWER);
                turn.reply("Marks confirmed. The paper is worth " + session.getTotalMarks() + " marks in total. "
                        + Replies.ANSWER_SHEET_PROMPT);
                return;
            case REJECT_MARKS:
                turn.moveTo(WAITING_FOR_MARKS_UPDATE);
                turn.reply("No problem. " + Replies.MARKS_UPDATE_PROMPT);
                return;
            case UPDATE_MARKS:
                MarksUpdateParser.parse(turn.text()).ifPresent(update -> applyUpdate(turn, update));
                return;
            default:
                turn.reply("I just need a yes or no here.\n\n"
                        + Replies.marksTable(session.getDraftQuestions())
                        + "\n\n" + Replies.confirmPrompt());
        }
    }

    private void marksUpdateText(Turn turn) {
        Optional<MarksUpdateParser.MarksUpdate> update = MarksUpdateParser.parse(turn.text());
        if (update.isEmpty()) {
            turn.reply("I couldn't understand that correction. " + Replies.MARKS_UPDATE_PROMPT);
            return;
        }
        applyUpdate(turn, update.get());
    }

    private void applyUpdate(Turn turn, MarksUpdateParser.MarksUpdate update) {
        Session session = turn.session();
        session.updateDraftMark(update.questionNumber(), update.marks());
        turn.moveTo(WAITING_FOR_MARKS_CONFIRMATION);
        turn.reply("Updated question " + update.questionNumber() + " to " + update.marks()
                + (update.marks() == 1 ? " mark." : " marks.") + "\n\n"
                + Replies.marksTable(session.getDraftQuestions())
                + "\n\n" + Replies.confirmPrompt());
    }

    private void answerText(Turn turn) {
        if (!requireConfirmedMarks(turn)) {
            return;
        }
        if (turn.text().length() < MIN_TYPED_ANSWER_LENGTH) {
            turn.reply(Replies.ANSWER_SHEET_PROMPT);
            return;
        }
        grade(turn, turn.text());
    }

    private void answerImage(Turn turn) {
        if (!requireConfirmedMarks(turn)) {
            return;
        }
        ImageTextExtractor.ExtractedText extracted;
        try {
            extracted = collaborators.imageTextExtractor()
                    .extract(turn.image(), ImageTextExtractor.ImageKind.STUDENT_ANSWER);
        } catch (IOException e) {
            logger.warn("Could not read answer sheet for user {}: {}", turn.session().getUserId(), e.getMessage());
            turn.reply(Replies.REUPLOAD);
            return;
        }
        if (extracted.storedAt() != null) {
            turn.session().setOriginalImage(extracted.storedAt().toString());
        }
        grade(turn, extracted.text());
    }

    /**
     * Grading needs confirmed marks with a positive total. Otherwise send the
     * user back to whichever step can supply them.
     */
    private boolean requireConfirmedMarks(Turn turn) {
        Session session = turn.session();
        if (session.isMarkingConfirmed() && session.getTotalMarks() > 0) {
            return true;
        }
        logger.warn("User {} reached the answer step without confirmed marks", session.getUserId());
        if (!session.getDraftMarks().isEmpty()) {
            turn.moveTo(WAITING_FOR_MARKS_CONFIRMATION);
            turn.reply("Before I grade, the marks need to be confirmed.\n\n"
                    + Replies.marksTable(session.getDraftQuestions())
                    + "\n\n" + Replies.confirmPrompt());
        } else {
            turn.moveTo(WAITING_FOR_QUESTION_PAPER);
            turn.reply("Before I grade, I need the question paper so I know the marks. " + Replies.PAPER_PROMPT);
        }
        return false;
    }

    private void grade(Turn turn, String answer) {
        Session session = turn.session();
        turn.moveTo(GRADING_IN_PROGRESS);
        session.setStudentAnswerText(answer);
        session.setGradingApproach(GradingApproach.CBSE_STANDARD);
        session.setMaxMarks(session.getTotalMarks());

        GradingRequest request = new GradingRequest(
                questionContext(session),
                answer,
                instruction(session.getSubjectArea()),
                session.getTotalMarks(),
                GradingApproach.CBSE_STANDARD,
                session.getSubjectArea(),
                session.getClassLevel());
        GradingResult result = collaborators.gradingOrchestrator().grade(request);
        session.appendGradingResult(result);

        turn.moveTo(COMPLETE);
        turn.reply(collaborators.formatter().formatCbse(result, session.getClassLevel(), session.getSubjectArea()));
    }

    private void followUpText(Turn turn) {
        if (turn.intent() == UserIntent.FOLLOW_UP_QUESTION) {
            turn.moveTo(FOLLOW_UP);
            turn.reply(collaborators.followUpResponder().answer(turn.text(), turn.session().getLastGradingResult()));
            return;
        }
        turn.reply(Replies.FINISHED_PROMPT);
    }

    private void imageBeforeContext(Turn turn) {
        if (turn.step() == INITIAL) {
            turn.moveTo(WAITING_FOR_CLASS);
        }
        String needed = turn.step() == WAITING_FOR_SUBJECT ? Replies.SUBJECT_PROMPT : Replies.CLASS_PROMPT;
        turn.reply("Thanks for the image! Before I can read it I need a little context. " + needed
                + " Then send the image again.");
    }

    private void imageDuringMarksCheck(Turn turn) {
        turn.reply("I got an image, but let's finish checking the marks first. If this is a different question "
                + "paper, say \"start over\".\n\n" + Replies.promptFor(turn.session()));
    }

    private void imageAfterGrading(Turn turn) {
        turn.resetSession();
        turn.reply("Starting a new grading session. " + Replies.CLASS_PROMPT);
    }

    static String questionContext(Session session) {
        StringBuilder context = new StringBuilder();
        if (session.getQuestionPaperText() != null) {
            context.append(session.getQuestionPaperText().trim()).append("\n\n");
        }
        context.append("CONFIRMED MARKS PER QUESTION:\n");
        for (Map.Entry<Integer, Integer> entry : session.getConfirmedMarks().entrySet()) {
            context.append("Q").append(entry.getKey()).append(": ").append(entry.getValue()).append(" marks\n");
        }
        return context.toString().trim();
    }

    static String instruction(SubjectArea subject) {
        String guidelines = SubjectGuidelines.forSubject(subject);
        String common = String.join("\n",
                "- Grade according to CBSE marking scheme standards",
                "- Allocate marks per question according to the confirmed marks distribution",
                "- Be fair and consistent in your evaluation");
        return guidelines.isEmpty() ? common : guidelines + "\n" + common;
    }
}
