package com.superteacher.utils;

import com.superteacher.models.ImageSource;

import java.io.IOException;

/**
 * Reads the text on an image. Implementations throw instead of returning an
 * empty string when the service cannot be reached.
 */
public interface VisionClient {

    String extractText(ImageSource image, String prompt) throws IOException;
}
