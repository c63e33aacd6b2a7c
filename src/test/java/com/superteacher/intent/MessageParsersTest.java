package com.superteacher.intent;

import com.superteacher.models.ClassLevel;
import com.superteacher.models.SubjectArea;
import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

public class MessageParsersTest {

    @Test
    void testClassLevelForms() {
        assertEquals(Optional.of(ClassLevel.CLASS_10), ClassLevelParser.parse("Class 10", true));
        assertEquals(Optional.of(ClassLevel.CLASS_12), ClassLevelParser.parse("grade 12th please", true));
        assertEquals(Optional.of(ClassLevel.CLASS_11), ClassLevelParser.parse("std XI", true));
        assertEquals(Optional.of(ClassLevel.CLASS_9), ClassLevelParser.parse("9", false));
        assertTrue(ClassLevelParser.parse("9", true).isEmpty());
    }

    @Test
    void testClassLevelOutOfRange() {
        assertTrue(ClassLevelParser.parse("class 5", false).isEmpty());
        assertTrue(ClassLevelParser.parse("class 13", false).isEmpty());
        assertTrue(ClassLevelParser.parse("", false).isEmpty());
    }

    @Test
    void testSubjectOrdering() {
        assertEquals(Optional.of(SubjectArea.SOCIAL_STUDIES), SubjectParser.parse("Social Science"));
        assertEquals(Optional.of(SubjectArea.POLITICAL_SCIENCE), SubjectParser.parse("political science"));
        assertEquals(Optional.of(SubjectArea.COMPUTER_SCIENCE), SubjectParser.parse("CS"));
        assertEquals(Optional.of(SubjectArea.ECONOMICS), SubjectParser.parse("Class 12 Economics"));
        assertEquals(Optional.of(SubjectArea.MATH), SubjectParser.parse("maths"));
        assertTrue(SubjectParser.parse("something else").isEmpty());
    }

    @Test
    void testMarksUpdateForms() {
        assertEquals(Optional.of(new MarksUpdateParser.MarksUpdate(3, 5)),
                MarksUpdateParser.parse("Question 3 should be 5 marks"));
        assertEquals(Optional.of(new MarksUpdateParser.MarksUpdate(4, 2)), MarksUpdateParser.parse("Q4 is 2 marks"));
        assertEquals(Optional.of(new MarksUpdateParser.MarksUpdate(2, 4)),
                MarksUpdateParser.parse("change question 2 to 4 marks"));
        assertTrue(MarksUpdateParser.parse("question 3 should be 0 marks").isEmpty());
        assertTrue(MarksUpdateParser.parse("question 3 should be 500 marks").isEmpty());
        assertTrue(MarksUpdateParser.parse("looks good").isEmpty());
    }

    @Test
    void testConfirmationNegativesWin() {
        assertEquals(ConfirmationParser.Answer.NEGATIVE, ConfirmationParser.parse("No"));
        assertEquals(ConfirmationParser.Answer.NEGATIVE, ConfirmationParser.parse("this is incorrect"));
        assertEquals(ConfirmationParser.Answer.NEGATIVE, ConfirmationParser.parse("not right"));
        assertEquals(ConfirmationParser.Answer.AFFIRMATIVE, ConfirmationParser.parse("Yes"));
        assertEquals(ConfirmationParser.Answer.AFFIRMATIVE, ConfirmationParser.parse("looks fine, go ahead"));
        assertEquals(ConfirmationParser.Answer.NONE, ConfirmationParser.parse("knowledge"));
    }

    @Test
    void testNegatedAffirmativeIsNegative() {
        assertEquals(ConfirmationParser.Answer.NEGATIVE, ConfirmationParser.parse("I don't think these are right"));
        assertEquals(ConfirmationParser.Answer.NEGATIVE, ConfirmationParser.parse("I don\u2019t think that's correct"));
        assertEquals(ConfirmationParser.Answer.NEGATIVE, ConfirmationParser.parse("this doesn't look good"));
        assertEquals(ConfirmationParser.Answer.NEGATIVE, ConfirmationParser.parse("I'm not sure"));
        assertEquals(ConfirmationParser.Answer.AFFIRMATIVE, ConfirmationParser.parse("yes, nothing to change"));
    }
}
