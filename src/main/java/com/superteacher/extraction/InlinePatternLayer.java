package com.superteacher.extraction;

import java.util.List;
import java.util.Optional;

/**
 * Papers without a table: each question line starts with a number
 * ("Q.No. 4", "Question 4", "4.", "4)") and states its marks at the end of
 * the line or, failing that, on the line right after it.
 */
final class InlinePatternLayer implements ExtractionLayer {

    @Override
    public String name() {
        return "inline";
    }

    @Override
    public void apply(ExtractionDraft draft) {
        List<String> lines = draft.lines();
        for (int i = 0; i < lines.size(); i++) {
            String line = lines.get(i);
            if (line.isBlank() || skip(line)) {
                continue;
            }
            Optional<QuestionLines.QuestionLine> parsed = QuestionLines.parseQuestionLine(line);
            if (parsed.isEmpty()) {
                continue;
            }
            int number = parsed.get().number();
            String rest = parsed.get().rest();

            Optional<QuestionLines.MarksMatch> marks = QuestionLines.findMarks(rest);
            if (marks.isPresent()) {
                draft.putMarks(number, marks.get().marks());
                draft.putText(number, QuestionLines.stripMarks(rest, marks.get()));
                continue;
            }
            draft.putText(number, rest);
            draft.noteQuestion(number);

            if (i + 1 < lines.size()) {
                String next = lines.get(i + 1);
                if (!next.isBlank() && !skip(next) && QuestionLines.parseQuestionLine(next).isEmpty()) {
                    QuestionLines.findMarks(next).ifPresent(found -> {
                        draft.putMarks(number, found.marks());
                        draft.appendText(number, QuestionLines.stripMarks(next, found));
                    });
                }
            }
        }
    }

    private static boolean skip(String line) {
        return HeaderTotalScanner.isHeaderLine(line) || DistributionPhraseLayer.isDistributionLine(line);
    }
}
