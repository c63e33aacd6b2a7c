package com.superteacher.utils;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.superteacher.models.ImageSource;
import okhttp3.MediaType;
import okhttp3.MultipartBody;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Duration;

/**
 * Standard OCR endpoint used when the vision model fails. Posts the image as
 * multipart form data (or its URL as a form field) and reads
 * {@code extracted_text} from the JSON reply.
 */
public class RemoteOcrClient implements VisionClient {
    private static final Logger logger = LoggerFactory.getLogger(RemoteOcrClient.class);

    private final OkHttpClient httpClient;
    private final ObjectMapper objectMapper = new ObjectMapper();
    private final String endpoint;

    public RemoteOcrClient(String endpoint, Duration timeout) {
        this.endpoint = endpoint;
        this.httpClient = new OkHttpClient.Builder()
                .callTimeout(timeout)
                .readTimeout(timeout)
                .build();
    }

    @Override
    public String extractText(ImageSource image, String prompt) throws IOException {
        MultipartBody.Builder form = new MultipartBody.Builder().setType(MultipartBody.FORM);
        if (image.hasBytes()) {
            String fileName = image.getFileName() == null ? "upload.jpg" : image.getFileName();
            form.addFormDataPart("image", fileName,
                    RequestBody.create(image.getBytes(), MediaType.get("application/octet-stream")));
        } else {
            form.addFormDataPart("imageUrl", image.getUri().toString());
        }

        Request request = new Request.Builder().url(endpoint).post(form.build()).build();
        try (Response response = httpClient.newCall(request).execute()) {
            if (!response.isSuccessful()) {
                throw new IOException("OCR request failed: " + response.code() + " " + response.message());
            }
            ResponseBody body = response.body();
            if (body == null) {
                throw new IOException("OCR endpoint returned an empty body");
            }
            JsonNode text = objectMapper.readTree(body.string()).path("extracted_text");
            if (!text.isTextual() || text.asText().isBlank()) {
                throw new IOException("OCR endpoint found no text in " + image.hint());
            }
            logger.info("OCR endpoint returned {} characters for {}", text.asText().length(), image.hint());
            return text.asText();
        }
    }
}
