package com.superteacher.utils;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

public class ApiKeyLoaderTest {

    @TempDir
    Path tempDir;

    private static final Config EMPTY = ConfigFactory.empty();

    @Test
    void testEnvironmentWins() throws Exception {
        Path dotEnv = tempDir.resolve(".env");
        Files.writeString(dotEnv, "OPENAI_API_KEY=from-file\n");

        assertEquals(Optional.of("from-env"), ApiKeyLoader.loadOpenAIKey(" from-env ", dotEnv, EMPTY));
    }

    @Test
    void testDotEnvParsing() throws Exception {
        Path dotEnv = tempDir.resolve(".env");
        Files.writeString(dotEnv, String.join("\n",
                "# local secrets",
                "OTHER=1",
                "export OPENAI_API_KEY=\"sk-quoted\"",
                ""));

        assertEquals(Optional.of("sk-quoted"), ApiKeyLoader.loadOpenAIKey(null, dotEnv, EMPTY));
    }

    @Test
    void testConfigIsLastResort() {
        Config config = ConfigFactory.parseString("superteacher.openai.api-key = sk-config");

        assertEquals(Optional.of("sk-config"),
                ApiKeyLoader.loadOpenAIKey("", tempDir.resolve("missing.env"), config));
    }

    @Test
    void testPlaceholderIsIgnored() throws Exception {
        Path dotEnv = tempDir.resolve(".env");
        Files.writeString(dotEnv, "OPENAI_API_KEY=your-openai-api-key-here\n");

        assertTrue(ApiKeyLoader.loadOpenAIKey("your-openai-api-key-here", dotEnv, EMPTY).isEmpty());
    }
}
