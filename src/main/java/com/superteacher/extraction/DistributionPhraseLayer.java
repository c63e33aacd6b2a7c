package com.superteacher.extraction;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Applies statements about how marks are distributed:
 * <ul>
 *   <li>"Q1 to Q5 carry 2 marks each" sets the named range;</li>
 *   <li>"5 questions of 2 marks each" is applied in declaration order to the
 *   questions that still lack marks, numbering them from 1 when the paper
 *   yielded no question numbers at all;</li>
 *   <li>a section header such as "Section B (3 marks each)" applies to the
 *   question lines below it until the next section header.</li>
 * </ul>
 */
final class DistributionPhraseLayer implements ExtractionLayer {
    private static final Logger logger = LoggerFactory.getLogger(DistributionPhraseLayer.class);

    private static final Pattern RANGE = Pattern.compile(
            "\\bq(?:uestions?)?\\.?\\s*(?:no\\.?\\s*)?(\\d{1,2})\\s*(?:to|-|–)\\s*(?:q\\.?\\s*)?(\\d{1,2})\\s+"
                    + "(?:carry|carries|are of|are|of|have|=)\\s*(\\d{1,2})\\s*marks?",
            Pattern.CASE_INSENSITIVE);
    private static final Pattern COUNT = Pattern.compile(
            "\\b(\\d{1,2})\\s+(?:\\w+\\s+)?questions?\\s+(?:of|carrying|each\\s+carrying|worth|with)\\s+(\\d{1,2})\\s*marks?",
            Pattern.CASE_INSENSITIVE);
    private static final Pattern EACH = Pattern.compile("\\b(\\d{1,2})\\s*marks?\\s+each\\b", Pattern.CASE_INSENSITIVE);
    private static final Pattern SECTION = Pattern.compile("^\\s*(?:section|part)\\s+[a-e1-5]\\b", Pattern.CASE_INSENSITIVE);

    private record Block(int count, int marks) {
    }

    @Override
    public String name() {
        return "distribution-phrase";
    }

    static boolean isDistributionLine(String line) {
        return RANGE.matcher(line).find() || COUNT.matcher(line).find() || EACH.matcher(line).find();
    }

    static boolean isSectionLine(String line) {
        return SECTION.matcher(line).find();
    }

    @Override
    public void apply(ExtractionDraft draft) {
        List<Block> blocks = new ArrayList<>();
        for (String line : draft.lines()) {
            Matcher range = RANGE.matcher(line);
            while (range.find()) {
                int from = Integer.parseInt(range.group(1));
                int to = Integer.parseInt(range.group(2));
                int marks = Integer.parseInt(range.group(3));
                for (int question = from; question <= to && question - from < 50; question++) {
                    draft.putMarks(question, marks);
                }
            }
            Matcher count = COUNT.matcher(line);
            while (count.find()) {
                blocks.add(new Block(Integer.parseInt(count.group(1)), Integer.parseInt(count.group(2))));
            }
        }
        applyBlocks(draft, blocks);
        applySectionHeaders(draft);
    }

    private static void applyBlocks(ExtractionDraft draft, List<Block> blocks) {
        if (blocks.isEmpty()) {
            return;
        }
        boolean synthesize = draft.knownQuestions().isEmpty();
        List<Integer> targets = draft.questionsWithoutMarks();
        int next = 1;
        int position = 0;
        for (Block block : blocks) {
            for (int k = 0; k < block.count(); k++) {
                if (synthesize) {
                    draft.putMarks(next++, block.marks());
                } else if (position < targets.size()) {
                    draft.putMarks(targets.get(position++), block.marks());
                }
            }
        }
        logger.debug("Applied {} distribution statement(s), synthesized numbering: {}", blocks.size(), synthesize);
    }

    private static void applySectionHeaders(ExtractionDraft draft) {
        Integer sectionMarks = null;
        for (String line : draft.lines()) {
            if (isSectionLine(line) || (EACH.matcher(line).find() && !COUNT.matcher(line).find())) {
                Matcher each = EACH.matcher(line);
                sectionMarks = each.find() ? Integer.valueOf(each.group(1)) : null;
                continue;
            }
            if (sectionMarks == null) {
                continue;
            }
            Optional<QuestionLines.QuestionLine> question = QuestionLines.parseQuestionLine(line);
            if (question.isPresent()) {
                draft.putMarks(question.get().number(), sectionMarks);
            }
        }
    }
}
