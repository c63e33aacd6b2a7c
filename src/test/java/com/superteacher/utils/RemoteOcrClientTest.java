package com.superteacher.utils;

import com.superteacher.models.ImageSource;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

public class RemoteOcrClientTest {

    private MockWebServer server;
    private RemoteOcrClient client;

    @BeforeEach
    void setUp() throws IOException {
        server = new MockWebServer();
        server.start();
        client = new RemoteOcrClient(server.url("/ocr").toString(), Duration.ofSeconds(5));
    }

    @AfterEach
    void tearDown() throws IOException {
        server.shutdown();
    }

    @Test
    void testUploadsBytesAsMultipart() throws Exception {
        server.enqueue(new MockResponse().setBody("{\"extracted_text\": \"1. Define GDP (3 marks)\"}"));

        String text = client.extractText(
                ImageSource.ofBytes("paper.jpg", "fake image".getBytes(StandardCharsets.UTF_8)), "ignored");

        assertEquals("1. Define GDP (3 marks)", text);
        RecordedRequest recorded = server.takeRequest();
        assertEquals("/ocr", recorded.getPath());
        assertTrue(recorded.getHeader("Content-Type").startsWith("multipart/form-data"));
        String body = recorded.getBody().readUtf8();
        assertTrue(body.contains("name=\"image\"; filename=\"paper.jpg\""));
        assertTrue(body.contains("fake image"));
    }

    @Test
    void testSendsUrlWhenNoBytes() throws Exception {
        server.enqueue(new MockResponse().setBody("{\"extracted_text\": \"answer text\"}"));

        client.extractText(ImageSource.ofUri("https://example.org/answer.jpg"), "ignored");

        String body = server.takeRequest().getBody().readUtf8();
        assertTrue(body.contains("name=\"imageUrl\""));
        assertTrue(body.contains("https://example.org/answer.jpg"));
    }

    @Test
    void testEmptyTextIsAnError() {
        server.enqueue(new MockResponse().setBody("{\"extracted_text\": \"\"}"));

        assertThrows(IOException.class,
                () -> client.extractText(ImageSource.ofUri("https://example.org/a.jpg"), "ignored"));
    }

    @Test
    void testServerErrorIsAnError() {
        server.enqueue(new MockResponse().setResponseCode(500));

        assertThrows(IOException.class,
                () -> client.extractText(ImageSource.ofUri("https://example.org/a.jpg"), "ignored"));
    }
}
