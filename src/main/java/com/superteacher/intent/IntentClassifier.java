package com.superteacher.intent;

import com.superteacher.models.ConversationStep;
import com.superteacher.models.Session;
import com.superteacher.models.UserIntent;
import com.superteacher.models.WorkflowKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Maps a message and the current session to a {@link UserIntent}.
 *
 * <p>Rules are evaluated in declaration order and the first match wins. The
 * order encodes the precedence between overlapping keyword sets:
 * <ol>
 *   <li>reset phrases, which must work from any state;</li>
 *   <li>structural matches that only make sense in the current step
 *   (class number, subject, marks update, yes/no);</li>
 *   <li>free text in a step that collects a question, an answer or a grading
 *   instruction, which is taken as that input unless the whole message is a
 *   bare greeting or help request;</li>
 *   <li>keyword bags (greeting, help, follow-up question, grading verbs);</li>
 *   <li>per-step defaults, so free text in a step that expects input is
 *   treated as that input.</li>
 * </ol>
 * Classification is a pure function of its inputs.
 */
public class IntentClassifier {
    private static final Logger logger = LoggerFactory.getLogger(IntentClassifier.class);

    private static final List<String> RESET_PHRASES = List.of(
            "start over", "restart", "reset", "new session", "another paper", "new paper", "start again", "begin again");
    private static final Pattern GREETING = Pattern.compile(
            "^(hi|hello|hey|hii+|namaste|good (morning|afternoon|evening))\\b.*");
    private static final Pattern HELP = Pattern.compile("\\b(help|how does this work|what can you do|guide me)\\b");
    private static final Pattern GRADING_VERBS = Pattern.compile(
            "\\b(grade|evaluate|assess|mark it|check it|score it|strict|lenient|out of \\d+|\\d+\\s*marks?)\\b");
    private static final Pattern BARE_GREETING = Pattern.compile(
            "^(hi|hello|hey|hii+|namaste|good (morning|afternoon|evening))[!.]*$");
    private static final Pattern BARE_HELP = Pattern.compile(
            "^(help|help me|help please|how does this work|what can you do|guide me)[?!.]*$");
    private static final Pattern RESULT_WORDS = Pattern.compile(
            "\\b(marks?|score[sd]?|grade[sd]?|feedback|improve|lose|lost|wrong|mistakes?)\\b");
    private static final Pattern QUESTION_OPENER = Pattern.compile("^(why|how|what|explain|can you|could you)\\b.*");
    private static final int LONG_QUESTION_LENGTH = 20;

    private static final Set<ConversationStep> SIMPLE_QUESTION_STEPS = EnumSet.of(
            ConversationStep.INITIAL, ConversationStep.COMPLETE, ConversationStep.FOLLOW_UP);
    private static final Set<ConversationStep> FREE_TEXT_STEPS = EnumSet.of(
            ConversationStep.WAITING_FOR_QUESTION, ConversationStep.WAITING_FOR_ANSWER,
            ConversationStep.WAITING_FOR_INSTRUCTION, ConversationStep.WAITING_FOR_STUDENT_ANSWER);
    private static final Set<ConversationStep> FINISHED_STEPS = EnumSet.of(
            ConversationStep.COMPLETE, ConversationStep.FOLLOW_UP);

    private final List<IntentRule> rules;

    public IntentClassifier() {
        this.rules = Collections.unmodifiableList(defaultRules());
    }

    public IntentClassifier(List<IntentRule> rules) {
        this.rules = List.copyOf(rules);
    }

    public UserIntent classify(String message, Session session) {
        if (message == null || message.isBlank()) {
            return UserIntent.UNKNOWN;
        }
        String normalized = message.trim().toLowerCase(Locale.ROOT);
        for (IntentRule rule : rules) {
            if (rule.matches(normalized, session)) {
                logger.debug("Rule '{}' matched in step {}", rule.getName(), session.getStep());
                return rule.getIntent();
            }
        }
        return UserIntent.UNKNOWN;
    }

    public List<IntentRule> getRules() {
        return rules;
    }

    static List<IntentRule> defaultRules() {
        List<IntentRule> rules = new ArrayList<>();

        rules.add(new IntentRule("reset-phrase", UserIntent.NEW_SESSION,
                (text, session) -> RESET_PHRASES.stream().anyMatch(text::contains)));

        rules.add(new IntentRule("class-with-keyword", UserIntent.SET_CLASS,
                (text, session) -> isCbse(session)
                        && in(session, ConversationStep.INITIAL)
                        && ClassLevelParser.parse(text, true).isPresent()));
        rules.add(new IntentRule("class-in-class-step", UserIntent.SET_CLASS,
                (text, session) -> in(session, ConversationStep.WAITING_FOR_CLASS)
                        && ClassLevelParser.parse(text, false).isPresent()));
        rules.add(new IntentRule("subject-in-subject-step", UserIntent.SET_SUBJECT,
                (text, session) -> in(session, ConversationStep.WAITING_FOR_SUBJECT)
                        && SubjectParser.parse(text).isPresent()));
        rules.add(new IntentRule("marks-update", UserIntent.UPDATE_MARKS,
                (text, session) -> in(session, ConversationStep.WAITING_FOR_MARKS_UPDATE,
                        ConversationStep.WAITING_FOR_MARKS_CONFIRMATION)
                        && MarksUpdateParser.parse(text).isPresent()));
        rules.add(new IntentRule("marks-rejected", UserIntent.REJECT_MARKS,
                (text, session) -> in(session, ConversationStep.WAITING_FOR_MARKS_CONFIRMATION)
                        && ConfirmationParser.parse(text) == ConfirmationParser.Answer.NEGATIVE));
        rules.add(new IntentRule("marks-confirmed", UserIntent.CONFIRM_MARKS,
                (text, session) -> in(session, ConversationStep.WAITING_FOR_MARKS_CONFIRMATION)
                        && ConfirmationParser.parse(text) == ConfirmationParser.Answer.AFFIRMATIVE));

        rules.add(new IntentRule("bare-greeting", UserIntent.GREETING,
                (text, session) -> expectsContent(session) && BARE_GREETING.matcher(text).matches()));
        rules.add(new IntentRule("bare-help", UserIntent.HELP,
                (text, session) -> expectsContent(session) && BARE_HELP.matcher(text).matches()));
        rules.add(new IntentRule("question-text", UserIntent.PROVIDE_QUESTION,
                (text, session) -> in(session, ConversationStep.WAITING_FOR_QUESTION)));
        rules.add(new IntentRule("instruction-text", UserIntent.GRADING_INSTRUCTION,
                (text, session) -> in(session, ConversationStep.WAITING_FOR_INSTRUCTION)));
        // answers carry no command, the step handler takes the text as is
        rules.add(new IntentRule("answer-text", UserIntent.UNKNOWN,
                (text, session) -> in(session, ConversationStep.WAITING_FOR_ANSWER,
                        ConversationStep.WAITING_FOR_STUDENT_ANSWER)));

        rules.add(new IntentRule("greeting", UserIntent.GREETING,
                (text, session) -> GREETING.matcher(text).matches()));
        rules.add(new IntentRule("help", UserIntent.HELP,
                (text, session) -> !expectsContent(session) && HELP.matcher(text).find()));
        rules.add(new IntentRule("follow-up-question", UserIntent.FOLLOW_UP_QUESTION,
                (text, session) -> isCbse(session)
                        && FINISHED_STEPS.contains(session.getStep())
                        && (text.contains("?") || QUESTION_OPENER.matcher(text).matches())));
        rules.add(new IntentRule("follow-up-on-simple-result", UserIntent.FOLLOW_UP_QUESTION,
                (text, session) -> !isCbse(session)
                        && FINISHED_STEPS.contains(session.getStep())
                        && session.getLastGradingResult() != null
                        && QUESTION_OPENER.matcher(text).matches()
                        && RESULT_WORDS.matcher(text).find()));
        rules.add(new IntentRule("grading-verbs", UserIntent.GRADING_INSTRUCTION,
                (text, session) -> GRADING_VERBS.matcher(text).find()));
        rules.add(new IntentRule("simple-question", UserIntent.PROVIDE_QUESTION,
                (text, session) -> !isCbse(session)
                        && SIMPLE_QUESTION_STEPS.contains(session.getStep())
                        && (text.endsWith("?") || text.length() >= LONG_QUESTION_LENGTH)));

        rules.add(new IntentRule("default-class", UserIntent.SET_CLASS,
                (text, session) -> in(session, ConversationStep.WAITING_FOR_CLASS)));
        rules.add(new IntentRule("default-subject", UserIntent.SET_SUBJECT,
                (text, session) -> in(session, ConversationStep.WAITING_FOR_SUBJECT)));
        rules.add(new IntentRule("default-marks-update", UserIntent.UPDATE_MARKS,
                (text, session) -> in(session, ConversationStep.WAITING_FOR_MARKS_UPDATE)));
        rules.add(new IntentRule("default-after-result", UserIntent.FOLLOW_UP_QUESTION,
                (text, session) -> isCbse(session) && FINISHED_STEPS.contains(session.getStep())));
        rules.add(new IntentRule("default-simple-after-result", UserIntent.PROVIDE_QUESTION,
                (text, session) -> !isCbse(session) && FINISHED_STEPS.contains(session.getStep())));
        rules.add(new IntentRule("default-cbse-initial", UserIntent.GREETING,
                (text, session) -> isCbse(session) && in(session, ConversationStep.INITIAL)));
        rules.add(new IntentRule("default-simple-initial", UserIntent.PROVIDE_QUESTION,
                (text, session) -> !isCbse(session) && in(session, ConversationStep.INITIAL)));
        return rules;
    }

    /**
     * Steps where the next message is itself the input: the free-text steps,
     * and the opening of the simple workflow, which takes a question.
     */
    private static boolean expectsContent(Session session) {
        return FREE_TEXT_STEPS.contains(session.getStep())
                || (!isCbse(session) && in(session, ConversationStep.INITIAL));
    }

    private static boolean isCbse(Session session) {
        return session.getWorkflowKind() == WorkflowKind.CBSE;
    }

    private static boolean in(Session session, ConversationStep first, ConversationStep... rest) {
        ConversationStep step = session.getStep();
        if (step == first) {
            return true;
        }
        for (ConversationStep other : rest) {
            if (step == other) {
                return true;
            }
        }
        return false;
    }
}
