package com.reflow.core.diagnosis;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.reflow.core.model.FaultLayer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Turns raw collaborator text into a {@link DiagnosisResponse}, tolerating markdown fences
 * and surrounding prose. Anything that does not carry a known layer, a known action and a
 * confidence in [0, 1] becomes a confidence-0 response.
 */
@Component
public class DiagnosisResponseParser {

    private static final Logger log = LoggerFactory.getLogger(DiagnosisResponseParser.class);

    private final ObjectMapper objectMapper;

    public DiagnosisResponseParser(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public DiagnosisResponse parse(String raw) {
        if (raw == null || raw.isBlank()) {
            return DiagnosisResponse.malformed("empty response");
        }
        String json = extractJsonObject(raw);
        if (json == null) {
            return DiagnosisResponse.malformed("no JSON object");
        }
        JsonNode node;
        try {
            node = objectMapper.readTree(json);
        } catch (JsonProcessingException e) {
            log.debug("Unparsable diagnosis response: {}", e.getOriginalMessage());
            return DiagnosisResponse.malformed("invalid JSON");
        }

        FaultLayer layer;
        DiagnosisAction action;
        try {
            layer = FaultLayer.fromWire(node.path("layer").asText(null));
            action = DiagnosisAction.fromWire(node.path("action").asText(null));
        } catch (IllegalArgumentException e) {
            return DiagnosisResponse.malformed(e.getMessage());
        }

        JsonNode confidenceNode = node.get("confidence");
        if (confidenceNode == null || !confidenceNode.isNumber()) {
            return DiagnosisResponse.malformed("missing confidence");
        }
        double confidence = confidenceNode.asDouble();
        if (Double.isNaN(confidence) || confidence < 0.0 || confidence > 1.0) {
            return DiagnosisResponse.malformed("confidence out of range: " + confidence);
        }
        return new DiagnosisResponse(layer, action, confidence, node.path("reasoning").asText(""));
    }

    private static String extractJsonObject(String raw) {
        int start = raw.indexOf('{');
        int end = raw.lastIndexOf('}');
        if (start < 0 || end <= start) {
            return null;
        }
        return raw.substring(start, end + 1);
    }
}
