package com.superteacher.intent;

import com.superteacher.models.ConversationStep;
import com.superteacher.models.GradingApproach;
import com.superteacher.models.GradingResult;
import com.superteacher.models.Session;
import com.superteacher.models.UserIntent;
import com.superteacher.models.WorkflowKind;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class IntentClassifierTest {

    private final IntentClassifier classifier = new IntentClassifier();

    private static Session cbse(ConversationStep step) {
        Session session = new Session("teacher-1", WorkflowKind.CBSE);
        session.setStep(step);
        return session;
    }

    private static Session simple(ConversationStep step) {
        Session session = new Session("teacher-2", WorkflowKind.SIMPLE);
        session.setStep(step);
        return session;
    }

    @Test
    void testResetPhraseWinsInEveryStep() {
        for (ConversationStep step : ConversationStep.values()) {
            assertEquals(UserIntent.NEW_SESSION, classifier.classify("Let's start over", cbse(step)), step.name());
        }
        assertEquals(UserIntent.NEW_SESSION, classifier.classify("reset, class 10", cbse(ConversationStep.INITIAL)));
    }

    @Test
    void testHelpBeatsGradingVerbs() {
        assertEquals(UserIntent.HELP,
                classifier.classify("help me grade this", cbse(ConversationStep.WAITING_FOR_QUESTION_PAPER)));
    }

    @Test
    void testClassNumberBeatsGreetingInClassStep() {
        assertEquals(UserIntent.SET_CLASS, classifier.classify("hi, class 10", cbse(ConversationStep.WAITING_FOR_CLASS)));
        assertEquals(UserIntent.SET_CLASS, classifier.classify("10", cbse(ConversationStep.WAITING_FOR_CLASS)));
    }

    @Test
    void testGreetingAndClassInInitialStep() {
        assertEquals(UserIntent.GREETING, classifier.classify("Hello there", cbse(ConversationStep.INITIAL)));
        assertEquals(UserIntent.SET_CLASS, classifier.classify("Class 12 Economics", cbse(ConversationStep.INITIAL)));
        // a bare number needs the class step
        assertEquals(UserIntent.GREETING, classifier.classify("12", cbse(ConversationStep.INITIAL)));
    }

    @Test
    void testGradingInstructionInSimpleWorkflow() {
        assertEquals(UserIntent.GRADING_INSTRUCTION,
                classifier.classify("grade it for 6 marks", simple(ConversationStep.WAITING_FOR_INSTRUCTION)));
        assertEquals(UserIntent.GRADING_INSTRUCTION,
                classifier.classify("please be lenient", simple(ConversationStep.WAITING_FOR_INSTRUCTION)));
    }

    @Test
    void testQuestionAfterCbseResultIsFollowUp() {
        assertEquals(UserIntent.FOLLOW_UP_QUESTION, classifier.classify("Is this right?", cbse(ConversationStep.COMPLETE)));
        assertEquals(UserIntent.FOLLOW_UP_QUESTION,
                classifier.classify("why did they lose marks", cbse(ConversationStep.FOLLOW_UP)));
    }

    @Test
    void testMarksConfirmationStep() {
        Session session = cbse(ConversationStep.WAITING_FOR_MARKS_CONFIRMATION);
        assertEquals(UserIntent.CONFIRM_MARKS, classifier.classify("Yes, looks fine", session));
        assertEquals(UserIntent.REJECT_MARKS, classifier.classify("No", session));
        assertEquals(UserIntent.REJECT_MARKS, classifier.classify("that is not right", session));
        assertEquals(UserIntent.UPDATE_MARKS, classifier.classify("Question 3 should be 5 marks", session));
    }

    @Test
    void testFreeTextDefaultsToStepInput() {
        assertEquals(UserIntent.SET_SUBJECT, classifier.classify("the usual one", cbse(ConversationStep.WAITING_FOR_SUBJECT)));
        assertEquals(UserIntent.UPDATE_MARKS, classifier.classify("hmm", cbse(ConversationStep.WAITING_FOR_MARKS_UPDATE)));
        assertEquals(UserIntent.PROVIDE_QUESTION, classifier.classify("photosynthesis", simple(ConversationStep.WAITING_FOR_QUESTION)));
        assertEquals(UserIntent.PROVIDE_QUESTION,
                classifier.classify("What is the law of demand?", simple(ConversationStep.COMPLETE)));
    }

    @Test
    void testQuestionStepTakesKeywordsAsQuestion() {
        Session session = simple(ConversationStep.WAITING_FOR_QUESTION);
        assertEquals(UserIntent.PROVIDE_QUESTION,
                classifier.classify("How does chlorophyll help plants make food?", session));
        assertEquals(UserIntent.PROVIDE_QUESTION, classifier.classify("Evaluate 3x+2 when x=4", session));
        assertEquals(UserIntent.PROVIDE_QUESTION, classifier.classify("Hello world program in Java?", session));
    }

    @Test
    void testAnswerStepsTakeKeywordsAsAnswer() {
        assertEquals(UserIntent.UNKNOWN, classifier.classify(
                "Chlorophyll can help the leaf trap sunlight", simple(ConversationStep.WAITING_FOR_ANSWER)));
        assertEquals(UserIntent.UNKNOWN, classifier.classify(
                "Subsidies help farmers, we evaluate them by cost", cbse(ConversationStep.WAITING_FOR_STUDENT_ANSWER)));
    }

    @Test
    void testInstructionStepTakesKeywordsAsInstruction() {
        assertEquals(UserIntent.GRADING_INSTRUCTION, classifier.classify(
                "Grade it out of 5 and help the student improve", simple(ConversationStep.WAITING_FOR_INSTRUCTION)));
        assertEquals(UserIntent.GRADING_INSTRUCTION, classifier.classify(
                "Hi, grade it for 6 marks", simple(ConversationStep.WAITING_FOR_INSTRUCTION)));
    }

    @Test
    void testBareHelpAndGreetingStillWorkInFreeTextSteps() {
        for (ConversationStep step : List.of(ConversationStep.WAITING_FOR_QUESTION, ConversationStep.WAITING_FOR_ANSWER,
                ConversationStep.WAITING_FOR_INSTRUCTION)) {
            assertEquals(UserIntent.HELP, classifier.classify("help", simple(step)), step.name());
            assertEquals(UserIntent.HELP, classifier.classify("What can you do?", simple(step)), step.name());
            assertEquals(UserIntent.GREETING, classifier.classify("Hello!", simple(step)), step.name());
        }
        assertEquals(UserIntent.HELP, classifier.classify("help", cbse(ConversationStep.WAITING_FOR_STUDENT_ANSWER)));
        assertEquals(UserIntent.PROVIDE_QUESTION,
                classifier.classify("How does chlorophyll help plants make food?", simple(ConversationStep.INITIAL)));
    }

    @Test
    void testQuestionAboutSimpleResultIsFollowUp() {
        Session session = simple(ConversationStep.COMPLETE);
        session.appendGradingResult(new GradingResult(4, 6, null, null, null, null, true,
                GradingApproach.BALANCED, null, true, Instant.EPOCH));

        assertEquals(UserIntent.FOLLOW_UP_QUESTION, classifier.classify("Why did the answer lose marks?", session));
        assertEquals(UserIntent.FOLLOW_UP_QUESTION, classifier.classify("How can they improve their grade?", session));
        assertEquals(UserIntent.PROVIDE_QUESTION, classifier.classify("What is the law of demand?", session));
        // without a result there is nothing to ask about
        assertEquals(UserIntent.PROVIDE_QUESTION,
                classifier.classify("Why did the answer lose marks?", simple(ConversationStep.COMPLETE)));
    }

    @Test
    void testBlankMessageIsUnknown() {
        assertEquals(UserIntent.UNKNOWN, classifier.classify("   ", cbse(ConversationStep.WAITING_FOR_CLASS)));
        assertEquals(UserIntent.UNKNOWN, classifier.classify(null, cbse(ConversationStep.WAITING_FOR_CLASS)));
    }

    @Test
    void testClassificationIsDeterministic() {
        Session session = cbse(ConversationStep.WAITING_FOR_MARKS_CONFIRMATION);
        UserIntent first = classifier.classify("ok but change question 2 to 4", session);
        for (int i = 0; i < 50; i++) {
            assertEquals(first, classifier.classify("ok but change question 2 to 4", session));
        }
        assertEquals(UserIntent.UPDATE_MARKS, first);
    }

    @Test
    void testCustomRulesAreEvaluatedInOrder() {
        IntentClassifier custom = new IntentClassifier(List.of(
                new IntentRule("always-help", UserIntent.HELP, (text, session) -> true),
                new IntentRule("never-reached", UserIntent.GREETING, (text, session) -> true)));
        assertEquals(UserIntent.HELP, custom.classify("hello", cbse(ConversationStep.INITIAL)));
        assertEquals(2, custom.getRules().size());
    }
}
