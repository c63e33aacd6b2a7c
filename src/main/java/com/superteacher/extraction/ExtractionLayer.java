package com.superteacher.extraction;

/**
 * One heuristic of the mark extractor. A layer only adds entries that are
 * still missing from the draft; it never overwrites an earlier layer.
 */
interface ExtractionLayer {

    String name();

    void apply(ExtractionDraft draft);
}
