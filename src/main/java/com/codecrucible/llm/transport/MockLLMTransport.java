package com.codecrucible.llm.transport;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import org.springframework.context.annotation.Profile;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Map;

/**
 * Offline transport for local runs and context tests. Answers every action
 * deterministically:
 *
 *   generate       a small add() module
 *   check_bugs     empty report (bug-free)
 *   fix            the code section of the fix prompt, unchanged
 *   apply_feature  the existing code with a marker comment for the feature
 */
@Component
@Profile("mock")
public class MockLLMTransport implements LLMTransport {

    static final String GENERATED_CODE = """
            def add(x, y):
                \"\"\"Return the sum of x and y.\"\"\"
                # plain addition
                return x + y
            """;

    private final ObjectMapper objectMapper;

    public MockLLMTransport(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    @Override
    public TransportResponse post(String endpoint, Map<String, String> headers, String jsonBody, Duration timeout)
            throws TransportException {
        try {
            JsonNode request = objectMapper.readTree(jsonBody);
            String action = request.path("action").asText("");
            String prompt = request.path("prompt").asText("");

            String result = switch (action) {
                case "generate"      -> GENERATED_CODE;
                case "check_bugs"    -> "";
                case "fix"           -> afterMarker(prompt, "Code:\n");
                case "apply_feature" -> applyFeature(prompt);
                default              -> throw new TransportException("Unsupported action: " + action);
            };

            return new TransportResponse(200, objectMapper.createObjectNode().put("result", result).toString());

        } catch (JsonProcessingException e) {
            throw new TransportException("Mock transport could not read request body", e);
        }
    }

    private String applyFeature(String prompt) {
        String feature = prompt.startsWith("Add feature: ")
                ? prompt.substring("Add feature: ".length(), Math.max(prompt.indexOf('\n'), "Add feature: ".length()))
                : "feature";
        return afterMarker(prompt, "Existing code:\n") + "\n# feature: " + feature.trim() + "\n";
    }

    private String afterMarker(String prompt, String marker) {
        int idx = prompt.indexOf(marker);
        return idx >= 0 ? prompt.substring(idx + marker.length()) : prompt;
    }
}
