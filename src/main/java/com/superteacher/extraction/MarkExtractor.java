package com.superteacher.extraction;

import com.superteacher.models.ExtractionResult;
import com.superteacher.models.SubjectArea;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Recovers question numbers and their marks from OCR text of a question paper.
 *
 * <p>The layers run in a fixed order. The header scan always runs; every
 * later layer runs only while the draft is still insufficient, and only fills
 * in what earlier layers left open. Extraction never throws: on unexpected
 * input it returns whatever was recovered so far, possibly nothing, and the
 * teacher corrects the marks by hand.
 */
public class MarkExtractor {
    private static final Logger logger = LoggerFactory.getLogger(MarkExtractor.class);

    private final ExtractionLayer headerScan = new HeaderTotalScanner();
    private final List<ExtractionLayer> layers = List.of(
            new TabularLayoutLayer(),
            new InlinePatternLayer(),
            new DistributionPhraseLayer(),
            new SubjectStructureLayer(),
            new DualNumberScanLayer());

    public ExtractionResult extract(String ocrText, SubjectArea subjectHint) {
        if (ocrText == null || ocrText.isBlank()) {
            return ExtractionResult.empty();
        }
        ExtractionDraft draft = new ExtractionDraft(ocrText, subjectHint);
        try {
            headerScan.apply(draft);
            for (ExtractionLayer layer : layers) {
                if (!draft.isInsufficient()) {
                    break;
                }
                int before = draft.marksTotal();
                layer.apply(draft);
                if (draft.marksTotal() != before) {
                    draft.recordLayer(layer.name());
                }
            }
        } catch (RuntimeException e) {
            logger.warn("Mark extraction stopped early: {}", e.toString());
        }
        ExtractionResult result = draft.toResult();
        logger.info("Extracted marks for {} question(s), total {}, header total {}, layers {}",
                result.getMarks().size(), result.total(), result.getHeaderTotal(), result.getLayersApplied());
        return result;
    }
}
