package com.superteacher.utils;

import com.superteacher.grading.RetryPolicy;
import com.superteacher.models.WorkflowKind;
import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.Locale;
import java.util.Optional;

/**
 * Typed view of the {@code superteacher} config section. Construction fails
 * with {@link ConfigurationException} on missing or invalid settings.
 */
public final class GraderSettings {

    public enum VisionMode {
        DEMO,
        OPENAI
    }

    private final WorkflowKind workflow;
    private final RetryPolicy retryPolicy;
    private final Optional<String> apiKey;
    private final String openAiBaseUrl;
    private final String gradingModel;
    private final String visionModel;
    private final Duration openAiTimeout;
    private final Optional<String> backupBaseUrl;
    private final String backupModel;
    private final VisionMode visionMode;
    private final Optional<String> ocrEndpoint;
    private final Path storageDirectory;
    private final String httpHost;
    private final int httpPort;

    private GraderSettings(Config root, Optional<String> apiKey) {
        Config config = root.getConfig("superteacher");
        this.workflow = parseEnum(WorkflowKind.class, config.getString("workflow"), "superteacher.workflow");
        this.retryPolicy = RetryPolicy.fromConfig(config.getConfig("grading.retry"));
        this.apiKey = apiKey;
        this.openAiBaseUrl = config.getString("openai.base-url");
        this.gradingModel = config.getString("openai.model");
        this.visionModel = config.getString("openai.vision-model");
        this.openAiTimeout = config.getDuration("openai.timeout");
        this.backupBaseUrl = optionalString(config, "grading.backup.base-url");
        this.backupModel = config.getString("grading.backup.model");
        this.visionMode = parseEnum(VisionMode.class, config.getString("vision.mode"), "superteacher.vision.mode");
        this.ocrEndpoint = optionalString(config, "ocr.endpoint");
        this.storageDirectory = Paths.get(config.getString("storage.directory"));
        this.httpHost = config.getString("http.host");
        this.httpPort = config.getInt("http.port");

        if (visionMode == VisionMode.OPENAI && apiKey.isEmpty()) {
            throw new ConfigurationException("superteacher.vision.mode is 'openai' but no OpenAI API key is configured; set "
                    + ApiKeyLoader.ENV_VARIABLE);
        }
    }

    public static GraderSettings load(Config root) {
        try {
            return new GraderSettings(root, ApiKeyLoader.loadOpenAIKey(root));
        } catch (ConfigException | IllegalArgumentException e) {
            throw new ConfigurationException("Invalid superteacher configuration: " + e.getMessage(), e);
        }
    }

    /**
     * Variant with an explicit API key, bypassing the environment lookup.
     */
    public static GraderSettings load(Config root, String apiKey) {
        try {
            return new GraderSettings(root, Optional.ofNullable(apiKey).filter(key -> !key.isBlank()));
        } catch (ConfigException | IllegalArgumentException e) {
            throw new ConfigurationException("Invalid superteacher configuration: " + e.getMessage(), e);
        }
    }

    private static Optional<String> optionalString(Config config, String path) {
        if (!config.hasPath(path)) {
            return Optional.empty();
        }
        String value = config.getString(path).trim();
        return value.isEmpty() ? Optional.empty() : Optional.of(value);
    }

    private static <E extends Enum<E>> E parseEnum(Class<E> type, String value, String path) {
        try {
            return Enum.valueOf(type, value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException("Unsupported value '" + value + "' for " + path, e);
        }
    }

    public WorkflowKind getWorkflow() {
        return workflow;
    }

    public RetryPolicy getRetryPolicy() {
        return retryPolicy;
    }

    public Optional<String> getApiKey() {
        return apiKey;
    }

    public boolean hasApiKey() {
        return apiKey.isPresent();
    }

    public String getOpenAiBaseUrl() {
        return openAiBaseUrl;
    }

    public String getGradingModel() {
        return gradingModel;
    }

    public String getVisionModel() {
        return visionModel;
    }

    public Duration getOpenAiTimeout() {
        return openAiTimeout;
    }

    public Optional<String> getBackupBaseUrl() {
        return backupBaseUrl;
    }

    public String getBackupModel() {
        return backupModel;
    }

    public VisionMode getVisionMode() {
        return visionMode;
    }

    public Optional<String> getOcrEndpoint() {
        return ocrEndpoint;
    }

    public Path getStorageDirectory() {
        return storageDirectory;
    }

    public String getHttpHost() {
        return httpHost;
    }

    public int getHttpPort() {
        return httpPort;
    }
}
