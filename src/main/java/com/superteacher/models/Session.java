package com.superteacher.models;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Conversation state of one user.
 *
 * A single class serves both workflows; {@link #getWorkflowKind()} says which
 * one the session follows and the workflow-specific fields stay null for the
 * other. Sessions handed out by a store are private copies: mutating one has no
 * effect until it is written back.
 */
public class Session {
    private final String userId;
    private final WorkflowKind workflowKind;

    private ConversationStep step;
    private ClassLevel classLevel;
    private SubjectArea subjectArea;
    private String question;
    private String questionPaperText;
    private String studentAnswerText;
    private String originalImage;
    private String gradingInstruction;
    private GradingApproach gradingApproach;
    private Integer maxMarks;
    private SortedMap<Integer, Integer> draftMarks;
    private SortedMap<Integer, String> questionTexts;
    private SortedMap<Integer, Integer> confirmedMarks;
    private boolean markingConfirmed;
    private List<GradingResult> gradingHistory;
    private Instant lastInteraction;
    private long turnCount;
    private long version;

    public Session(String userId, WorkflowKind workflowKind) {
        if (userId == null || userId.isBlank()) {
            throw new IllegalArgumentException("userId is required");
        }
        this.userId = userId;
        this.workflowKind = Objects.requireNonNull(workflowKind, "workflowKind");
        this.step = ConversationStep.INITIAL;
        this.draftMarks = new TreeMap<>();
        this.questionTexts = new TreeMap<>();
        this.gradingHistory = new ArrayList<>();
    }

    /**
     * Deep copy. Grading results are immutable and shared.
     */
    public Session(Session other) {
        this.userId = other.userId;
        this.workflowKind = other.workflowKind;
        this.step = other.step;
        this.classLevel = other.classLevel;
        this.subjectArea = other.subjectArea;
        this.question = other.question;
        this.questionPaperText = other.questionPaperText;
        this.studentAnswerText = other.studentAnswerText;
        this.originalImage = other.originalImage;
        this.gradingInstruction = other.gradingInstruction;
        this.gradingApproach = other.gradingApproach;
        this.maxMarks = other.maxMarks;
        this.draftMarks = new TreeMap<>(other.draftMarks);
        this.questionTexts = new TreeMap<>(other.questionTexts);
        this.confirmedMarks = other.confirmedMarks == null ? null : new TreeMap<>(other.confirmedMarks);
        this.markingConfirmed = other.markingConfirmed;
        this.gradingHistory = new ArrayList<>(other.gradingHistory);
        this.lastInteraction = other.lastInteraction;
        this.turnCount = other.turnCount;
        this.version = other.version;
    }

    /**
     * Fresh session for the same user and workflow, optionally carrying the
     * grading history over. Bookkeeping counters are carried as well so a
     * reset is an ordinary committed write.
     */
    public Session resetCopy(boolean keepHistory) {
        Session fresh = new Session(userId, workflowKind);
        if (keepHistory) {
            fresh.gradingHistory = new ArrayList<>(gradingHistory);
        }
        fresh.lastInteraction = lastInteraction;
        fresh.turnCount = turnCount;
        fresh.version = version;
        return fresh;
    }

    public String getUserId() {
        return userId;
    }

    public WorkflowKind getWorkflowKind() {
        return workflowKind;
    }

    public ConversationStep getStep() {
        return step;
    }

    public void setStep(ConversationStep step) {
        this.step = step;
    }

    public ClassLevel getClassLevel() {
        return classLevel;
    }

    public void setClassLevel(ClassLevel classLevel) {
        this.classLevel = classLevel;
    }

    public SubjectArea getSubjectArea() {
        return subjectArea;
    }

    public void setSubjectArea(SubjectArea subjectArea) {
        this.subjectArea = subjectArea;
    }

    public String getQuestion() {
        return question;
    }

    public void setQuestion(String question) {
        this.question = question;
    }

    public String getQuestionPaperText() {
        return questionPaperText;
    }

    public void setQuestionPaperText(String questionPaperText) {
        this.questionPaperText = questionPaperText;
    }

    public String getStudentAnswerText() {
        return studentAnswerText;
    }

    public void setStudentAnswerText(String studentAnswerText) {
        this.studentAnswerText = studentAnswerText;
    }

    public String getOriginalImage() {
        return originalImage;
    }

    public void setOriginalImage(String originalImage) {
        this.originalImage = originalImage;
    }

    public String getGradingInstruction() {
        return gradingInstruction;
    }

    public void setGradingInstruction(String gradingInstruction) {
        this.gradingInstruction = gradingInstruction;
    }

    public GradingApproach getGradingApproach() {
        return gradingApproach;
    }

    public void setGradingApproach(GradingApproach gradingApproach) {
        this.gradingApproach = gradingApproach;
    }

    public Integer getMaxMarks() {
        return maxMarks;
    }

    public void setMaxMarks(Integer maxMarks) {
        this.maxMarks = maxMarks;
    }

    public SortedMap<Integer, Integer> getDraftMarks() {
        return Collections.unmodifiableSortedMap(draftMarks);
    }

    /**
     * The draft marks in question order, each with its text where the paper
     * gave one.
     */
    public List<ExtractedQuestion> getDraftQuestions() {
        List<ExtractedQuestion> questions = new ArrayList<>();
        draftMarks.forEach((number, marks) -> questions.add(new ExtractedQuestion(number, questionTexts.get(number), marks)));
        return questions;
    }

    /**
     * Replace the draft marks and question texts, e.g. with a fresh
     * extraction. Any earlier confirmation no longer applies.
     */
    public void setDraftQuestions(List<ExtractedQuestion> questions) {
        SortedMap<Integer, Integer> marks = new TreeMap<>();
        SortedMap<Integer, String> texts = new TreeMap<>();
        for (ExtractedQuestion question : questions) {
            marks.put(question.number(), question.marks());
            if (!question.text().isBlank()) {
                texts.put(question.number(), question.text());
            }
        }
        this.draftMarks = marks;
        this.questionTexts = texts;
        clearConfirmation();
    }

    /**
     * Set the marks of exactly one question in the draft.
     */
    public void updateDraftMark(int questionNumber, int marks) {
        if (questionNumber <= 0 || marks <= 0) {
            throw new IllegalArgumentException("question " + questionNumber + " cannot carry " + marks + " marks");
        }
        draftMarks.put(questionNumber, marks);
        clearConfirmation();
    }

    public SortedMap<Integer, String> getQuestionTexts() {
        return Collections.unmodifiableSortedMap(questionTexts);
    }

    /**
     * Null unless {@link #isMarkingConfirmed()}.
     */
    public SortedMap<Integer, Integer> getConfirmedMarks() {
        return confirmedMarks == null ? null : Collections.unmodifiableSortedMap(confirmedMarks);
    }

    public boolean isMarkingConfirmed() {
        return markingConfirmed;
    }

    /**
     * Freeze the current draft as the confirmed marks distribution.
     */
    public void confirmMarks() {
        if (draftMarks.isEmpty()) {
            throw new IllegalStateException("there are no marks to confirm");
        }
        this.confirmedMarks = new TreeMap<>(draftMarks);
        this.markingConfirmed = true;
    }

    public void clearConfirmation() {
        this.confirmedMarks = null;
        this.markingConfirmed = false;
    }

    /**
     * Sum of the confirmed marks, 0 while nothing is confirmed.
     */
    public int getTotalMarks() {
        if (!markingConfirmed || confirmedMarks == null) {
            return 0;
        }
        return confirmedMarks.values().stream().mapToInt(Integer::intValue).sum();
    }

    public int getDraftTotal() {
        return draftMarks.values().stream().mapToInt(Integer::intValue).sum();
    }

    public List<GradingResult> getGradingHistory() {
        return Collections.unmodifiableList(gradingHistory);
    }

    public void appendGradingResult(GradingResult result) {
        gradingHistory.add(Objects.requireNonNull(result, "result"));
    }

    public GradingResult getLastGradingResult() {
        return gradingHistory.isEmpty() ? null : gradingHistory.get(gradingHistory.size() - 1);
    }

    public Instant getLastInteraction() {
        return lastInteraction;
    }

    public void setLastInteraction(Instant lastInteraction) {
        this.lastInteraction = lastInteraction;
    }

    public long getTurnCount() {
        return turnCount;
    }

    public void setTurnCount(long turnCount) {
        this.turnCount = turnCount;
    }

    /**
     * Number of writes committed for this session. Maintained by the store.
     */
    public long getVersion() {
        return version;
    }

    public void setVersion(long version) {
        this.version = version;
    }

    @Override
    public String toString() {
        return "Session{" +
                "userId='" + userId + '\'' +
                ", workflow=" + workflowKind +
                ", step=" + step +
                ", classLevel=" + classLevel +
                ", subject=" + subjectArea +
                ", draftMarks=" + draftMarks +
                ", markingConfirmed=" + markingConfirmed +
                ", results=" + gradingHistory.size() +
                ", version=" + version +
                '}';
    }
}
