package com.superteacher.models;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.OptionalInt;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Output of the mark extractor: question number to marks, the raw text of
 * each question where it was recovered, the maximum-marks declaration from the
 * paper header if any, and the names of the layers that contributed.
 */
public final class ExtractionResult {
    private static final ExtractionResult EMPTY =
            new ExtractionResult(new TreeMap<>(), new TreeMap<>(), OptionalInt.empty(), List.of());

    private final SortedMap<Integer, Integer> marks;
    private final SortedMap<Integer, String> questionTexts;
    private final OptionalInt headerTotal;
    private final List<String> layersApplied;

    public ExtractionResult(SortedMap<Integer, Integer> marks,
                            SortedMap<Integer, String> questionTexts,
                            OptionalInt headerTotal,
                            List<String> layersApplied) {
        this.marks = Collections.unmodifiableSortedMap(new TreeMap<>(marks));
        this.questionTexts = Collections.unmodifiableSortedMap(new TreeMap<>(questionTexts));
        this.headerTotal = headerTotal;
        this.layersApplied = List.copyOf(layersApplied);
    }

    public static ExtractionResult empty() {
        return EMPTY;
    }

    public SortedMap<Integer, Integer> getMarks() {
        return marks;
    }

    public SortedMap<Integer, String> getQuestionTexts() {
        return questionTexts;
    }

    public OptionalInt getHeaderTotal() {
        return headerTotal;
    }

    public List<String> getLayersApplied() {
        return layersApplied;
    }

    public boolean isEmpty() {
        return marks.isEmpty();
    }

    public int total() {
        return marks.values().stream().mapToInt(Integer::intValue).sum();
    }

    /**
     * True when the marks add up to the declared maximum. Without a header
     * declaration there is nothing to check against and any non-empty result
     * counts as complete.
     */
    public boolean looksComplete() {
        if (marks.isEmpty()) {
            return false;
        }
        return headerTotal.isEmpty() || headerTotal.getAsInt() == total();
    }

    public List<ExtractedQuestion> questions() {
        List<ExtractedQuestion> questions = new ArrayList<>();
        for (Map.Entry<Integer, Integer> entry : marks.entrySet()) {
            String text = questionTexts.getOrDefault(entry.getKey(), "");
            questions.add(new ExtractedQuestion(entry.getKey(), text, entry.getValue()));
        }
        return questions;
    }

    @Override
    public String toString() {
        return "ExtractionResult{marks=" + marks + ", headerTotal=" + headerTotal + ", layers=" + layersApplied + '}';
    }
}
