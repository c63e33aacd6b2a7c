package com.superteacher.utils;

import com.superteacher.models.ImageSource;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

public class OpenAIVisionClientTest {

    @Test
    void testRemoteImagePassedByUrl() throws IOException {
        assertEquals("https://example.org/a.jpg",
                OpenAIVisionClient.imageUrl(ImageSource.ofUri("https://example.org/a.jpg")));
    }

    @Test
    void testBytesInlinedAsDataUrl() throws IOException {
        ImageSource image = ImageSource.ofBytes("scan.PNG", "abc".getBytes(StandardCharsets.UTF_8));

        assertEquals("data:image/png;base64,YWJj", OpenAIVisionClient.imageUrl(image));
    }

    @Test
    void testStoredFileUsesBytes() throws IOException {
        ImageSource image = ImageSource.ofBytes("scan.jpg", new byte[]{1, 2, 3})
                .withUri(Path.of("/tmp/scan.jpg").toUri());

        assertTrue(OpenAIVisionClient.imageUrl(image).startsWith("data:image/jpeg;base64,"));
    }

    @Test
    void testLocalFileWithoutBytesIsRejected() {
        ImageSource image = ImageSource.ofUri("file:///tmp/missing.jpg");

        assertThrows(IOException.class, () -> OpenAIVisionClient.imageUrl(image));
    }

    @Test
    void testBlankModelReplyIsAnError() throws Exception {
        try (MockWebServer server = new MockWebServer()) {
            server.enqueue(new MockResponse().setBody("{\"choices\":[{\"message\":{\"content\":\"  \"}}]}"));
            server.start();
            OpenAIVisionClient vision = new OpenAIVisionClient(
                    new OpenAIClient("key", server.url("/").toString(), "gpt-4o", Duration.ofSeconds(5)));

            assertThrows(IOException.class,
                    () -> vision.extractText(ImageSource.ofUri("https://example.org/a.jpg"), "Read it"));
        }
    }
}
