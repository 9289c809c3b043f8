package com.wellbridge.ai.agent.node;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.wellbridge.ai.agent.state.Intent;
import java.util.Set;

public class IntentResultParser {

    private static final ObjectMapper mapper = new ObjectMapper();
    private static final Set<String> ALLOWED_FIELDS = Set.of("intent", "confidence", "reasoning");

    public static IntentResult parse(String json) {
        try {
            JsonNode node = mapper.readTree(json);
            if (node == null || !node.isObject()) {
                throw new IllegalArgumentException("Classifier JSON must be an object");
            }

            node.fieldNames().forEachRemaining(name -> {
                if (!ALLOWED_FIELDS.contains(name)) {
                    throw new IllegalArgumentException("Invalid classifier JSON: unknown field " + name);
                }
            });

            JsonNode intentNode = node.get("intent");
            JsonNode confidenceNode = node.get("confidence");
            JsonNode reasoningNode = node.get("reasoning");

            if (intentNode == null || !intentNode.isTextual()) {
                throw new IllegalArgumentException("Invalid classifier JSON: intent");
            }
            Intent intent = Intent.fromName(intentNode.asText())
                    .orElseThrow(() -> new IllegalArgumentException("Invalid classifier JSON: unknown intent"));

            if (confidenceNode == null || !confidenceNode.isNumber()) {
                throw new IllegalArgumentException("Invalid classifier JSON: confidence");
            }
            double confidence = confidenceNode.asDouble();
            if (confidence < 0.0 || confidence > 1.0) {
                throw new IllegalArgumentException("Invalid classifier JSON: confidence out of range");
            }

            if (reasoningNode != null && !(reasoningNode.isTextual() || reasoningNode.isNull())) {
                throw new IllegalArgumentException("Invalid classifier JSON: reasoning");
            }
            String reasoning = reasoningNode == null || reasoningNode.isNull() ? null : reasoningNode.asText();

            return new IntentResult(intent, confidence, reasoning);
        } catch (Exception e) {
            throw new IllegalArgumentException("Invalid classifier JSON", e);
        }
    }
}
