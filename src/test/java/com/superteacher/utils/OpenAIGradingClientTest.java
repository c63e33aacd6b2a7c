package com.superteacher.utils;

import com.superteacher.grading.GradingRequest;
import com.superteacher.models.ClassLevel;
import com.superteacher.models.GradingApproach;
import com.superteacher.models.SubjectArea;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

public class OpenAIGradingClientTest {

    @Test
    void testCbsePromptAsksForCriteria() {
        GradingRequest request = new GradingRequest("Q1: Define demand. (4 marks)", "Demand is desire backed by ability.",
                "Check definitions", 4, GradingApproach.CBSE_STANDARD, SubjectArea.ECONOMICS, ClassLevel.CLASS_12);

        String prompt = OpenAIGradingClient.buildPrompt(request);

        assertTrue(prompt.startsWith("You are a CBSE examiner grading a Class 12 Economics exam."));
        assertTrue(prompt.contains("QUESTION PAPER:\nQ1: Define demand. (4 marks)"));
        assertTrue(prompt.contains("- Maximum marks: 4"));
        assertTrue(prompt.contains("\"conceptsScore\""));
        assertTrue(prompt.contains("\"is_relevant\""));
    }

    @Test
    void testSimplePromptHasNoCriteria() {
        GradingRequest request = new GradingRequest("What is photosynthesis?", "Plants make food.",
                "be lenient", 6, GradingApproach.LENIENT, null, null);

        String prompt = OpenAIGradingClient.buildPrompt(request);

        assertTrue(prompt.contains("EXAM QUESTION:\nWhat is photosynthesis?"));
        assertTrue(prompt.contains("- Grading approach: " + GradingApproach.LENIENT.getTag()));
        assertFalse(prompt.contains("conceptsScore"));
    }

    @Test
    void testRequestGradingReturnsRawContent() throws Exception {
        try (MockWebServer server = new MockWebServer()) {
            server.enqueue(new MockResponse().setBody(
                    "{\"choices\":[{\"message\":{\"content\":\"{\\\"score\\\": 5, \\\"is_relevant\\\": true}\"}}]}"));
            server.start();
            OpenAIGradingClient client = new OpenAIGradingClient(
                    new OpenAIClient("key", server.url("/").toString(), "gpt-4o", Duration.ofSeconds(5)), "openai");

            String raw = client.requestGrading(new GradingRequest("Q", "A long enough answer", null, 10,
                    GradingApproach.BALANCED, null, null));

            assertEquals("{\"score\": 5, \"is_relevant\": true}", raw);
            assertEquals("openai", client.name());
        }
    }
}
