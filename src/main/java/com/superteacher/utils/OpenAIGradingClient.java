package com.superteacher.utils;

import com.superteacher.grading.GradingCollaborator;
import com.superteacher.grading.GradingRequest;

import java.io.IOException;

/**
 * Grading collaborator backed by an OpenAI-compatible chat completions
 * endpoint. Returns the model's raw JSON content; parsing and validation are
 * left to the orchestrator.
 */
public class OpenAIGradingClient implements GradingCollaborator {
    private static final String SYSTEM_PROMPT =
            "You are an experienced examiner. Grade fairly, only award marks supported by the answer, "
                    + "and reply with a single JSON object and nothing else.";

    private final OpenAIClient openAIClient;
    private final String name;

    public OpenAIGradingClient(OpenAIClient openAIClient, String name) {
        this.openAIClient = openAIClient;
        this.name = name;
    }

    @Override
    public String requestGrading(GradingRequest request) throws IOException {
        return openAIClient.complete(SYSTEM_PROMPT, buildPrompt(request), true);
    }

    @Override
    public String name() {
        return name;
    }

    static String buildPrompt(GradingRequest request) {
        StringBuilder prompt = new StringBuilder();
        if (request.isCbse()) {
            prompt.append("You are a CBSE examiner grading a ");
            if (request.classLevel() != null) {
                prompt.append(request.classLevel().getDisplayName()).append(' ');
            }
            prompt.append(request.subject() == null ? "general" : request.subject().getDisplayName())
                    .append(" exam.\n\n");
            prompt.append("QUESTION PAPER:\n");
        } else {
            prompt.append("You are an expert teacher grading an exam answer.\n\n");
            prompt.append("EXAM QUESTION:\n");
        }
        prompt.append(request.questionContext()).append("\n\n");
        prompt.append("STUDENT'S ANSWER:\n").append(request.studentAnswerText()).append("\n\n");

        prompt.append("GRADING INSTRUCTIONS:\n");
        if (!request.instruction().isBlank()) {
            prompt.append(request.instruction()).append('\n');
        }
        prompt.append("- Grading approach: ").append(request.approach().getTag()).append('\n');
        prompt.append("- Maximum marks: ").append(request.maxMarks()).append('\n');
        prompt.append("- First decide whether the answer actually addresses the question. ")
                .append("If it does not, set \"is_relevant\" to false and the score to 0.\n\n");

        prompt.append("Return your assessment as a JSON object with these fields:\n");
        prompt.append("{\n");
        prompt.append("  \"score\": <number from 0 to ").append(request.maxMarks()).append(">,\n");
        prompt.append("  \"is_relevant\": <true|false>,\n");
        prompt.append("  \"feedback\": \"<explanation of the grade with specific examples from the answer>\",\n");
        prompt.append("  \"strengths\": [\"<3-4 specific strengths>\"],\n");
        prompt.append("  \"areas_for_improvement\": [\"<3-4 specific areas>\"],\n");
        prompt.append("  \"suggested_points\": [\"<2-3 actionable suggestions>\"]");
        if (request.isCbse()) {
            prompt.append(",\n");
            prompt.append("  \"conceptsScore\": <0-10 conceptual understanding>,\n");
            prompt.append("  \"diagramScore\": <0-10 diagram accuracy if applicable>,\n");
            prompt.append("  \"applicationScore\": <0-10 application of theories>,\n");
            prompt.append("  \"terminologyScore\": <0-10 use of terminology>\n");
        } else {
            prompt.append('\n');
        }
        prompt.append("}\n");
        return prompt.toString();
    }
}
