package com.superteacher.utils;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Minimal HTTP client for the OpenAI chat completions API
 */
public class OpenAIClient {
    private static final Logger logger = LoggerFactory.getLogger(OpenAIClient.class);
    private static final MediaType JSON = MediaType.get("application/json");

    private final OkHttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final String apiKey;
    private final String baseUrl;
    private final String model;

    public OpenAIClient(String apiKey, String baseUrl, String model, Duration timeout) {
        this.apiKey = apiKey;
        this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        this.model = model;
        this.objectMapper = new ObjectMapper();
        this.httpClient = new OkHttpClient.Builder()
                .connectTimeout(Duration.ofSeconds(30))
                .readTimeout(timeout)
                .writeTimeout(Duration.ofSeconds(30))
                .callTimeout(timeout.plusSeconds(30))
                .build();
    }

    public String getModel() {
        return model;
    }

    /**
     * Text-only completion. With {@code jsonMode} the model is asked for a
     * JSON object response.
     */
    public String complete(String systemPrompt, String userPrompt, boolean jsonMode) throws IOException {
        List<Map<String, Object>> messages = new ArrayList<>();
        if (systemPrompt != null && !systemPrompt.isBlank()) {
            messages.add(Map.of("role", "system", "content", systemPrompt));
        }
        messages.add(Map.of("role", "user", "content", userPrompt));

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("model", model);
        body.put("messages", messages);
        body.put("temperature", 0.2);
        body.put("max_tokens", 1500);
        if (jsonMode) {
            body.put("response_format", Map.of("type", "json_object"));
        }
        return makeOpenAIRequest(body);
    }

    /**
     * Completion over one image, given as an http(s) or data URL.
     */
    public String completeWithImage(String prompt, String imageUrl) throws IOException {
        List<Map<String, Object>> content = List.of(
                Map.of("type", "text", "text", prompt),
                Map.of("type", "image_url", "image_url", Map.of("url", imageUrl, "detail", "high")));

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("model", model);
        body.put("messages", List.of(Map.of("role", "user", "content", content)));
        body.put("temperature", 0.0);
        body.put("max_tokens", 2000);
        return makeOpenAIRequest(body);
    }

    private String makeOpenAIRequest(Map<String, Object> body) throws IOException {
        String requestBody = objectMapper.writeValueAsString(body);

        Request request = new Request.Builder()
                .url(baseUrl + "/chat/completions")
                .addHeader("Authorization", "Bearer " + apiKey)
                .post(RequestBody.create(requestBody, JSON))
                .build();

        try (Response response = httpClient.newCall(request).execute()) {
            if (!response.isSuccessful()) {
                throw new IOException("OpenAI API request failed: " + response.code() + " " + response.message());
            }
            ResponseBody responseBody = response.body();
            if (responseBody == null) {
                throw new IOException("OpenAI API returned an empty body");
            }
            JsonNode root = objectMapper.readTree(responseBody.string());
            JsonNode content = root.path("choices").path(0).path("message").path("content");
            if (content.isMissingNode() || content.isNull()) {
                throw new IOException("Invalid response format from OpenAI API");
            }
            logger.debug("OpenAI {} returned {} characters", model, content.asText().length());
            return content.asText();
        }
    }
}
