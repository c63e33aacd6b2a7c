package com.superteacher.utils;

import com.superteacher.grading.RetryExhaustedException;
import com.superteacher.grading.RetryPolicy;
import com.superteacher.models.ImageSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;

/**
 * Turns an uploaded image into text: stores the bytes if needed, asks the
 * vision service under the retry policy, and falls back to the standard OCR
 * endpoint when vision keeps failing.
 */
public class ImageTextExtractor {
    private static final Logger logger = LoggerFactory.getLogger(ImageTextExtractor.class);

    public enum ImageKind {
        QUESTION_PAPER("This image is a printed exam question paper. Transcribe all of its text exactly, line by line, "
                + "keeping question numbers and the marks shown next to each question."),
        STUDENT_ANSWER("This image is a student's handwritten answer sheet. Transcribe the answer text exactly "
                + "as written, including any labels of diagrams. Do not correct mistakes.");

        private final String prompt;

        ImageKind(String prompt) {
            this.prompt = prompt;
        }

        public String getPrompt() {
            return prompt;
        }
    }

    public record ExtractedText(String text, URI storedAt) {
    }

    private final VisionClient vision;
    private final VisionClient fallbackOcr;
    private final ObjectStorage storage;
    private final RetryPolicy retryPolicy;

    /**
     * @param fallbackOcr may be null when no OCR endpoint is configured
     * @param storage     may be null, in which case only URI images are accepted by remote clients
     */
    public ImageTextExtractor(VisionClient vision, VisionClient fallbackOcr, ObjectStorage storage,
                              RetryPolicy retryPolicy) {
        this.vision = vision;
        this.fallbackOcr = fallbackOcr;
        this.storage = storage;
        this.retryPolicy = retryPolicy;
    }

    public ExtractedText extract(ImageSource image, ImageKind kind) throws IOException {
        ImageSource source = image;
        if (storage != null && image.hasBytes() && image.getUri() == null) {
            source = image.withUri(storage.store(image.getFileName(), image.getBytes()));
        }
        ImageSource stored = source;

        try {
            String text = retryPolicy.execute("vision", (attempt, last) -> requireText(vision.extractText(stored, kind.getPrompt())));
            return new ExtractedText(text, stored.getUri());
        } catch (RetryExhaustedException e) {
            if (fallbackOcr == null) {
                throw new IOException("could not read text from " + stored.hint(), e.getCause());
            }
            logger.warn("Vision extraction failed for {}, trying standard OCR", stored.hint());
        }

        try {
            return new ExtractedText(requireText(fallbackOcr.extractText(stored, kind.getPrompt())), stored.getUri());
        } catch (IOException e) {
            logger.error("Standard OCR also failed for {}: {}", stored.hint(), e.getMessage());
            throw e;
        }
    }

    private static String requireText(String text) throws IOException {
        if (text == null || text.isBlank()) {
            throw new IOException("no text found in the image");
        }
        return text.trim();
    }
}
