package com.superteacher.utils;

import com.superteacher.models.ImageSource;

import java.io.IOException;
import java.util.Base64;
import java.util.Locale;

/**
 * Vision collaborator using an OpenAI vision-capable chat model. Remote
 * http(s) images are passed by URL; anything else is inlined as a base64
 * data URL.
 */
public class OpenAIVisionClient implements VisionClient {

    private final OpenAIClient openAIClient;

    public OpenAIVisionClient(OpenAIClient openAIClient) {
        this.openAIClient = openAIClient;
    }

    @Override
    public String extractText(ImageSource image, String prompt) throws IOException {
        String text = openAIClient.completeWithImage(prompt, imageUrl(image));
        if (text == null || text.isBlank()) {
            throw new IOException("vision model returned no text for " + image.hint());
        }
        return text;
    }

    static String imageUrl(ImageSource image) throws IOException {
        if (image.getUri() != null) {
            String scheme = image.getUri().getScheme();
            if ("http".equalsIgnoreCase(scheme) || "https".equalsIgnoreCase(scheme) || "data".equalsIgnoreCase(scheme)) {
                return image.getUri().toString();
            }
        }
        if (!image.hasBytes()) {
            throw new IOException("image " + image.hint() + " is neither reachable by URL nor available as bytes");
        }
        return "data:" + mediaType(image.getFileName()) + ";base64,"
                + Base64.getEncoder().encodeToString(image.getBytes());
    }

    private static String mediaType(String fileName) {
        String name = fileName == null ? "" : fileName.toLowerCase(Locale.ROOT);
        if (name.endsWith(".png")) {
            return "image/png";
        }
        if (name.endsWith(".webp")) {
            return "image/webp";
        }
        if (name.endsWith(".gif")) {
            return "image/gif";
        }
        return "image/jpeg";
    }
}
