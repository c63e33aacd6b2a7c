package com.superteacher.utils;

import com.typesafe.config.Config;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Optional;

/**
 * Loads the OpenAI API key.
 * Priority: 1. environment variable, 2. .env file in the working directory,
 * 3. {@code superteacher.openai.api-key} in the application config.
 */
public class ApiKeyLoader {
    private static final Logger logger = LoggerFactory.getLogger(ApiKeyLoader.class);

    public static final String ENV_VARIABLE = "OPENAI_API_KEY";
    private static final String PLACEHOLDER = "your-openai-api-key-here";

    public static Optional<String> loadOpenAIKey(Config config) {
        return loadOpenAIKey(System.getenv(ENV_VARIABLE), Paths.get(".env"), config);
    }

    static Optional<String> loadOpenAIKey(String environmentValue, Path dotEnv, Config config) {
        if (isUsable(environmentValue)) {
            logger.info("Using OpenAI API key from environment variable");
            return Optional.of(environmentValue.trim());
        }
        String fromFile = loadFromDotEnv(dotEnv, ENV_VARIABLE);
        if (isUsable(fromFile)) {
            logger.info("Using OpenAI API key from .env file");
            return Optional.of(fromFile.trim());
        }
        if (config.hasPath("superteacher.openai.api-key")) {
            String fromConfig = config.getString("superteacher.openai.api-key");
            if (isUsable(fromConfig)) {
                logger.info("Using OpenAI API key from application config");
                return Optional.of(fromConfig.trim());
            }
        }
        logger.warn("No OpenAI API key found");
        return Optional.empty();
    }

    private static boolean isUsable(String key) {
        return key != null && !key.isBlank() && !key.trim().equals(PLACEHOLDER);
    }

    /**
     * Reads KEY=value pairs, ignoring comments, "export " prefixes and quotes.
     */
    static String loadFromDotEnv(Path envPath, String keyName) {
        if (envPath == null || !Files.exists(envPath)) {
            return null;
        }
        try {
            for (String rawLine : Files.readAllLines(envPath)) {
                String line = rawLine.trim();
                if (line.isEmpty() || line.startsWith("#")) {
                    continue;
                }
                if (line.startsWith("export ")) {
                    line = line.substring(7).trim();
                }
                int eq = line.indexOf('=');
                if (eq <= 0) {
                    continue;
                }
                String k = line.substring(0, eq).trim();
                String v = line.substring(eq + 1).trim();
                if (v.length() >= 2 && ((v.startsWith("\"") && v.endsWith("\"")) || (v.startsWith("'") && v.endsWith("'")))) {
                    v = v.substring(1, v.length() - 1);
                }
                if (k.equals(keyName)) {
                    return v;
                }
            }
        } catch (IOException e) {
            logger.warn("Failed to read .env file: {}", e.getMessage());
        }
        return null;
    }
}
