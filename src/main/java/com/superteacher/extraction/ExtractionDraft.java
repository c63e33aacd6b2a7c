package com.superteacher.extraction;

import com.superteacher.models.ExtractionResult;
import com.superteacher.models.SubjectArea;

import java.util.ArrayList;
import java.util.List;
import java.util.OptionalInt;
import java.util.SortedMap;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Mutable working state shared by the layers of one extraction run.
 */
final class ExtractionDraft {
    private final List<String> lines;
    private final SubjectArea subjectHint;
    private final SortedMap<Integer, Integer> marks = new TreeMap<>();
    private final SortedMap<Integer, String> texts = new TreeMap<>();
    private final List<String> layersApplied = new ArrayList<>();
    private OptionalInt headerTotal = OptionalInt.empty();

    ExtractionDraft(String ocrText, SubjectArea subjectHint) {
        this.lines = List.of(ocrText.replace("\r\n", "\n").replace('\r', '\n').split("\n", -1));
        this.subjectHint = subjectHint;
    }

    List<String> lines() {
        return lines;
    }

    String joinedText() {
        return String.join(" ", lines);
    }

    SubjectArea subjectHint() {
        return subjectHint;
    }

    OptionalInt headerTotal() {
        return headerTotal;
    }

    void setHeaderTotal(int total) {
        this.headerTotal = OptionalInt.of(total);
    }

    boolean hasMarks(int question) {
        return marks.containsKey(question);
    }

    boolean hasAnyMarks() {
        return !marks.isEmpty();
    }

    /**
     * @return true if the entry was new
     */
    boolean putMarks(int question, int value) {
        if (question <= 0 || value <= 0) {
            return false;
        }
        return marks.putIfAbsent(question, value) == null;
    }

    void putText(int question, String text) {
        if (question > 0 && text != null && !text.isBlank()) {
            texts.putIfAbsent(question, text.trim());
        }
    }

    void appendText(int question, String more) {
        if (more == null || more.isBlank()) {
            return;
        }
        texts.merge(question, more.trim(), (existing, extra) -> existing + " " + extra);
    }

    void noteQuestion(int question) {
        texts.putIfAbsent(question, "");
    }

    /**
     * Question numbers seen by any layer, with or without marks.
     */
    SortedSet<Integer> knownQuestions() {
        SortedSet<Integer> known = new TreeSet<>(texts.keySet());
        known.addAll(marks.keySet());
        return known;
    }

    List<Integer> questionsWithoutMarks() {
        List<Integer> missing = new ArrayList<>();
        for (Integer question : knownQuestions()) {
            if (!marks.containsKey(question)) {
                missing.add(question);
            }
        }
        return missing;
    }

    int marksTotal() {
        return marks.values().stream().mapToInt(Integer::intValue).sum();
    }

    /**
     * No marks yet, a known question still lacks marks, or the marks fall
     * short of the header total.
     */
    boolean isInsufficient() {
        if (marks.isEmpty()) {
            return true;
        }
        if (!questionsWithoutMarks().isEmpty()) {
            return true;
        }
        return headerTotal.isPresent() && marksTotal() < headerTotal.getAsInt();
    }

    void recordLayer(String name) {
        layersApplied.add(name);
    }

    ExtractionResult toResult() {
        SortedMap<Integer, String> textsWithMarks = new TreeMap<>();
        texts.forEach((question, text) -> {
            if (!text.isEmpty()) {
                textsWithMarks.put(question, text);
            }
        });
        return new ExtractionResult(marks, textsWithMarks, headerTotal, layersApplied);
    }
}
