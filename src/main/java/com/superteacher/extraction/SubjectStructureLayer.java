package com.superteacher.extraction;

import com.superteacher.models.SubjectArea;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Known fixed CBSE paper layouts. Used only when the subject and the header
 * total both match a layout and nothing else yielded marks.
 */
final class SubjectStructureLayer implements ExtractionLayer {
    private static final Logger logger = LoggerFactory.getLogger(SubjectStructureLayer.class);

    record Block(int count, int marks) {
    }

    record KnownLayout(SubjectArea subject, int total, List<Block> blocks) {

        List<Integer> marksInOrder() {
            List<Integer> marks = new ArrayList<>();
            for (Block block : blocks) {
                for (int i = 0; i < block.count(); i++) {
                    marks.add(block.marks());
                }
            }
            return marks;
        }
    }

    static final List<KnownLayout> KNOWN_LAYOUTS = List.of(
            new KnownLayout(SubjectArea.ECONOMICS, 40,
                    List.of(new Block(5, 2), new Block(5, 3), new Block(3, 5))));

    @Override
    public String name() {
        return "subject-structure";
    }

    @Override
    public void apply(ExtractionDraft draft) {
        if (draft.hasAnyMarks() || draft.subjectHint() == null || draft.headerTotal().isEmpty()) {
            return;
        }
        for (KnownLayout layout : KNOWN_LAYOUTS) {
            if (layout.subject() == draft.subjectHint() && layout.total() == draft.headerTotal().getAsInt()) {
                applyLayout(draft, layout);
                return;
            }
        }
    }

    private static void applyLayout(ExtractionDraft draft, KnownLayout layout) {
        List<Integer> marks = layout.marksInOrder();
        List<Integer> detected = new ArrayList<>(draft.knownQuestions());
        boolean hasSections = draft.lines().stream().anyMatch(DistributionPhraseLayer::isSectionLine);

        if (detected.isEmpty() || (hasSections && detected.size() < marks.size())) {
            if (detected.isEmpty() && !hasSections) {
                return;
            }
            for (int i = 0; i < marks.size(); i++) {
                draft.putMarks(i + 1, marks.get(i));
            }
        } else {
            for (int i = 0; i < detected.size() && i < marks.size(); i++) {
                draft.putMarks(detected.get(i), marks.get(i));
            }
        }
        logger.debug("Applied known {} layout of {} marks", layout.subject(), layout.total());
    }
}
